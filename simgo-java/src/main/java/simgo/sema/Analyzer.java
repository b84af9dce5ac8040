package simgo.sema;

import simgo.ast.Program;
import simgo.ast.decl.*;
import simgo.ast.expr.BinaryExpr;
import simgo.ast.expr.BoolLiteral;
import simgo.ast.expr.Expr;
import simgo.ast.expr.Ident;
import simgo.ast.stmt.AssignStmt;
import simgo.ast.stmt.BlockStmt;
import simgo.ast.stmt.DeclStmt;
import simgo.ast.stmt.ReturnStmt;
import simgo.ast.stmt.Stmt;
import simgo.types.TypeMapper;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Extracts what the generator needs from a validated program:
 * <ol>
 *   <li>witnesses from the entry function's top-level {@code var} and
 *       {@code :=} declarations, values folded at compile time</li>
 *   <li>one {@link Function} per other function, with a body translated
 *       from a few recognised return shapes</li>
 *   <li>parameters from top-level {@code const} declarations</li>
 * </ol>
 * Declarations are processed in source order. Instances hold no per-run
 * state and may be reused.
 */
public final class Analyzer {

    private static final Logger LOG = Logger.getLogger(Analyzer.class.getName());

    public static final String DEFAULT_ENTRY = "main";
    public static final String DEFAULT_TYPE = "u64";

    public record Result(
            List<WitnessValue> witnesses,
            List<Constant> constants,
            List<Function> functions
    ) {}

    private final TypeMapper typeMapper;
    private final EvaluationMode mode;
    private final String entryFunction;

    public Analyzer(TypeMapper typeMapper) {
        this(typeMapper, EvaluationMode.LITERAL, DEFAULT_ENTRY);
    }

    public Analyzer(TypeMapper typeMapper, EvaluationMode mode, String entryFunction) {
        this.typeMapper = typeMapper;
        this.mode = mode;
        this.entryFunction = entryFunction;
    }

    /** @throws simgo.types.TypeMappingException when a declared type cannot be mapped */
    public Result analyze(Program program) {
        Run run = new Run();
        for (Decl d : program.decls()) {
            if (d instanceof FuncDecl f) {
                if (f.name().equals(entryFunction)) run.analyzeEntry(f);
                else run.analyzeFunction(f);
            } else if (d instanceof ConstDecl c) {
                run.analyzeConstants(c);
            }
        }
        return new Result(List.copyOf(run.witnesses), List.copyOf(run.constants), List.copyOf(run.functions));
    }

    /** Translates a function body into SimplicityHL lines. Falls back to {@code true}. */
    static List<String> translateBody(BlockStmt body) {
        if (body != null) {
            for (Stmt s : body.statements()) {
                if (!(s instanceof ReturnStmt ret) || ret.results().size() != 1) continue;
                Expr e = ret.results().get(0);

                // only "x > ..." is recognised; the right operand is not inspected
                if (e instanceof BinaryExpr b && b.left() instanceof Ident id
                        && b.op() == BinaryExpr.Operator.GT) {
                    return List.of(
                            "match " + Names.toSnakeCase(id.name()) + " {",
                            "    0 => false,",
                            "    _ => true,",
                            "}");
                }
                if (e instanceof Ident id) return List.of(Names.toSnakeCase(id.name()));
                if (e instanceof BoolLiteral lit) return List.of(Boolean.toString(lit.value()));
            }
        }
        return List.of(ExpressionEvaluator.TRUE);
    }

    // per-call state
    private final class Run {
        private final List<WitnessValue> witnesses = new ArrayList<>();
        private final List<Constant> constants = new ArrayList<>();
        private final List<Function> functions = new ArrayList<>();
        private final Map<String, String> env = new HashMap<>();
        private final ExpressionEvaluator evaluator =
                new ExpressionEvaluator(mode == EvaluationMode.PROPAGATE ? env : null);

        void analyzeEntry(FuncDecl f) {
            if (f.body() == null) return;
            for (Stmt s : f.body().statements()) {
                if (s instanceof DeclStmt ds && ds.decl() instanceof VarDecl v) {
                    for (ValueSpec spec : v.specs()) recordWitnesses(spec);
                } else if (s instanceof AssignStmt a && a.op() == AssignStmt.Operator.DEFINE
                        && a.lhs().size() == 1 && a.rhs().size() == 1
                        && a.lhs().get(0) instanceof Ident id) {
                    String value = evaluator.evaluate(a.rhs().get(0));
                    addWitness(id.name(), WitnessValue.AUTO, value);
                }
            }
        }

        private void recordWitnesses(ValueSpec spec) {
            for (int i = 0; i < spec.names().size() && i < spec.values().size(); i++) {
                String value = evaluator.evaluate(spec.values().get(i));
                String type = spec.type() != null ? typeMapper.mapType(spec.type()) : DEFAULT_TYPE;
                addWitness(spec.names().get(i), type, value);
            }
        }

        private void addWitness(String sourceName, String type, String value) {
            witnesses.add(new WitnessValue(Names.toSnakeCase(sourceName), type, value));
            env.put(sourceName, value);
            LOG.log(Level.FINER, "witness {0}: {1} = {2}", new Object[]{sourceName, type, value});
        }

        void analyzeFunction(FuncDecl f) {
            List<Parameter> params = new ArrayList<>();
            for (Field field : f.params()) {
                String type = typeMapper.mapType(field.type());
                for (String name : field.names()) {
                    params.add(new Parameter(Names.toSnakeCase(name), type));
                }
            }

            String returnType = null;
            if (!f.results().isEmpty()) {
                returnType = typeMapper.mapType(f.results().get(0).type());
            }

            functions.add(new Function(Names.toSnakeCase(f.name()), List.copyOf(params), returnType,
                    translateBody(f.body())));
            LOG.log(Level.FINER, "function {0}/{1}", new Object[]{f.name(), params.size()});
        }

        void analyzeConstants(ConstDecl c) {
            for (ValueSpec spec : c.specs()) {
                for (int i = 0; i < spec.names().size() && i < spec.values().size(); i++) {
                    String name = spec.names().get(i);
                    String value = evaluator.evaluate(spec.values().get(i));
                    String type = spec.type() != null ? typeMapper.mapType(spec.type()) : DEFAULT_TYPE;
                    constants.add(new Constant(Names.toUpperSnakeCase(name), type, value));
                    env.put(name, value);
                }
            }
        }
    }
}
