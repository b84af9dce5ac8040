package simgo.compiler;

import simgo.ast.Program;
import simgo.codegen.CodeGenerator;
import simgo.io.AstPrinter;
import simgo.lexer.Lexer;
import simgo.lexer.LexerException;
import simgo.parser.ParseException;
import simgo.parser.Parser;
import simgo.sema.Analyzer;
import simgo.sema.ValidationException;
import simgo.sema.Validator;
import simgo.types.TypeMapper;
import simgo.types.TypeMappingException;

import java.util.logging.Logger;

/**
 * Go to SimplicityHL pipeline: parse, validate, analyze, generate.
 *
 * Every failure is reported as one {@link CompilationException}; a call
 * either returns the complete output or throws. The instance only holds
 * configuration, so concurrent calls do not interfere.
 */
public final class Compiler {

    private static final Logger LOG = Logger.getLogger(Compiler.class.getName());

    private final CompilerConfig config;
    private final Validator validator = new Validator();
    private final Analyzer analyzer;
    private final CodeGenerator generator = new CodeGenerator();

    public Compiler(CompilerConfig config) {
        this.config = config;
        this.analyzer = new Analyzer(new TypeMapper(), config.evaluationMode(), config.entryFunction());
    }

    public CompilerConfig config() {
        return config;
    }

    /** Compiles Go source text; {@code filename} is only used in messages. */
    public String compile(String source, String filename) {
        LOG.fine(() -> "Parsing " + filename);
        Program program;
        try {
            program = new Parser(new Lexer(source).tokenize()).parseProgram();
        } catch (LexerException | ParseException e) {
            throw new CompilationException(CompilationException.Stage.PARSE,
                    "failed to parse Go source " + filename + ": " + e.getMessage(), e);
        }

        if (config.debug()) {
            LOG.info(() -> "Parsed AST for " + filename + "\n" + AstPrinter.print(program));
        }
        return translate(program);
    }

    /** Translates an already parsed program. */
    public String translate(Program program) {
        LOG.fine("Validating Go features");
        try {
            validator.validate(program);
        } catch (ValidationException e) {
            throw new CompilationException(CompilationException.Stage.VALIDATION,
                    "Go code validation failed: " + e.getMessage(), e);
        }

        if (config.target() == Target.SIMPLICITY) {
            throw new CompilationException(CompilationException.Stage.TARGET,
                    "direct Simplicity compilation not yet implemented");
        }

        LOG.fine("Analyzing witnesses, parameters and functions");
        Analyzer.Result result;
        try {
            result = analyzer.analyze(program);
        } catch (TypeMappingException e) {
            throw new CompilationException(CompilationException.Stage.ANALYSIS,
                    "code analysis failed: " + e.getMessage(), e);
        }

        LOG.fine(() -> "Generating SimplicityHL: " + result.witnesses().size() + " witnesses, "
                + result.constants().size() + " params, " + result.functions().size() + " functions");
        return generator.generate(result);
    }
}
