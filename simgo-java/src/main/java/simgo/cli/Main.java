package simgo.cli;

import simgo.compiler.CompilationException;
import simgo.compiler.Compiler;
import simgo.compiler.CompilerConfig;
import simgo.compiler.Target;
import simgo.sema.EvaluationMode;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    // parent of every simgo logger; -debug lowers its level
    private static final Logger SIMGO = Logger.getLogger("simgo");

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private Main() {}

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        String input = null;
        String output = null;
        String target = Target.SIMPLICITY_HL.id();
        boolean debug = false;
        boolean propagate = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String name = arg.replaceFirst("^--?", "");
            String value = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                value = name.substring(eq + 1);
                name = name.substring(0, eq);
            }

            switch (name) {
                case "help", "h" -> {
                    printHelp(out);
                    return OK;
                }
                case "debug" -> debug = true;
                case "propagate" -> propagate = true;
                case "input", "output", "target" -> {
                    if (value == null) {
                        if (i + 1 >= args.length) {
                            err.println("Error: flag needs an argument: -" + name);
                            printUsage(err);
                            return USAGE;
                        }
                        value = args[++i];
                    }
                    if (name.equals("input")) input = value;
                    else if (name.equals("output")) output = value;
                    else target = value;
                }
                default -> {
                    err.println("Error: unknown flag: " + arg);
                    printUsage(err);
                    return USAGE;
                }
            }
        }

        if (input == null || input.isEmpty()) {
            err.println("Error: Input file is required");
            err.println();
            printUsage(err);
            return FAILED;
        }

        Level previous = SIMGO.getLevel();
        if (debug) SIMGO.setLevel(Level.FINE);
        try {
            return compile(input, output, target, debug, propagate, out, err);
        } finally {
            SIMGO.setLevel(previous);
        }
    }

    private static int compile(String input, String output, String target, boolean debug, boolean propagate,
                               PrintStream out, PrintStream err) {
        Path inputPath = Path.of(input);
        if (!Files.exists(inputPath)) {
            err.println("Input file does not exist: " + input);
            return FAILED;
        }

        CompilerConfig config;
        try {
            config = CompilerConfig.defaults()
                    .withTarget(Target.fromId(target))
                    .withDebug(debug)
                    .withEvaluationMode(propagate ? EvaluationMode.PROPAGATE : EvaluationMode.LITERAL);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return FAILED;
        }

        try {
            String source = Files.readString(inputPath);
            String result = new Compiler(config).compile(source, input);

            if (output == null || output.isEmpty()) {
                out.print(result);
            } else {
                Files.writeString(Path.of(output), result);
                if (debug) LOG.info("Successfully compiled " + input + " to " + output);
            }
            return OK;
        } catch (CompilationException e) {
            err.println("Compilation failed: " + e.getMessage());
            return FAILED;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return FAILED;
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/simgo-logging.properties")) {
            if (in != null) LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            System.err.println("Warning: could not load logging configuration: " + e.getMessage());
        }
    }

    private static void printUsage(PrintStream s) {
        s.println("Usage: simgo -input <go-file> [options]");
        s.println("  -input string    Input Go source file");
        s.println("  -output string   Output SimplicityHL file (default: stdout)");
        s.println("  -target string   Target format: simplicityhl, simplicity (default \"simplicityhl\")");
        s.println("  -propagate       Resolve identifiers to earlier witnesses and constants");
        s.println("  -debug           Enable debug output");
        s.println("  -help            Show help message");
    }

    private static void printHelp(PrintStream s) {
        s.println("simgo - Go to SimplicityHL transpiler");
        s.println();
        printUsage(s);
        s.println();
        s.println("EXAMPLES:");
        s.println("    # Compile to stdout");
        s.println("    simgo -input examples/basic_swap.go");
        s.println();
        s.println("    # Compile to file");
        s.println("    simgo -input examples/basic_swap.go -output basic_swap.shl");
    }
}
