package simgo.codegen;

import simgo.sema.Analyzer;
import simgo.sema.Constant;
import simgo.sema.ExpressionEvaluator;
import simgo.sema.Function;
import simgo.sema.Parameter;
import simgo.sema.WitnessValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Emits SimplicityHL source from analysis records: the witness module,
 * the param module, one declaration per function and a {@code main} with
 * a single assertion. Output depends only on the records, so equal input
 * gives byte-identical text.
 */
public final class CodeGenerator {

    public static final String INDENT = "    ";
    public static final String BOOL = "bool";
    public static final String U64 = "u64";
    public static final String FALLBACK_ASSERTION = "true";

    public String generate(Analyzer.Result result) {
        List<String> lines = new ArrayList<>();
        lines.addAll(witnessModule(result.witnesses()));
        lines.addAll(paramModule(result.constants()));
        lines.add("");
        for (Function f : result.functions()) {
            lines.addAll(function(f));
            lines.add("");
        }
        lines.addAll(mainFunction(result));
        return String.join("\n", lines) + "\n";
    }

    List<String> witnessModule(List<WitnessValue> witnesses) {
        List<String> lines = new ArrayList<>();
        lines.add("mod witness {");
        for (WitnessValue w : witnesses) {
            lines.add(INDENT + constant(witnessName(w), resolvedType(w), w.value()));
        }
        lines.add("}");
        return lines;
    }

    List<String> paramModule(List<Constant> constants) {
        List<String> lines = new ArrayList<>();
        lines.add("mod param {");
        for (Constant c : constants) {
            lines.add(INDENT + constant(c.name(), c.type(), c.value()));
        }
        lines.add("}");
        return lines;
    }

    List<String> function(Function f) {
        List<String> params = new ArrayList<>();
        for (Parameter p : f.parameters()) {
            params.add(p.name() + ": " + p.type());
        }

        String signature = "(" + String.join(", ", params) + ")";
        if (f.hasReturnType()) signature += " -> " + f.returnType();

        List<String> lines = new ArrayList<>();
        lines.add("fn " + f.name() + signature + " {");
        for (String line : f.body()) {
            lines.add(INDENT + line);
        }
        lines.add("}");
        return lines;
    }

    List<String> mainFunction(Analyzer.Result result) {
        return List.of(
                "fn main() {",
                INDENT + "assert!(" + entryAssertion(result) + ");",
                "}");
    }

    /**
     * Chooses what {@code main} asserts:
     * <ol>
     *   <li>the first witness whose name contains "result"</li>
     *   <li>otherwise a call of the last function, fed with the boolean
     *       witnesses in order, if there are exactly as many as it has
     *       parameters</li>
     *   <li>otherwise {@code true}</li>
     * </ol>
     * Both heuristics guess intent from naming and declaration order.
     */
    String entryAssertion(Analyzer.Result result) {
        for (WitnessValue w : result.witnesses()) {
            if (w.name().toLowerCase(Locale.ROOT).contains("result")) {
                return witnessRef(w);
            }
        }

        List<Function> functions = result.functions();
        if (functions.isEmpty()) return FALLBACK_ASSERTION;

        Function mainLogic = functions.get(functions.size() - 1);
        int paramCount = mainLogic.parameters().size();
        List<String> args = new ArrayList<>();
        for (WitnessValue w : result.witnesses()) {
            if (args.size() == paramCount) break;
            if (isBoolean(w)) args.add(witnessRef(w));
        }

        if (args.size() != paramCount) return FALLBACK_ASSERTION;
        return mainLogic.name() + "(" + String.join(", ", args) + ")";
    }

    /** Declared type, or for {@code :=} witnesses the type implied by the folded value. */
    static String resolvedType(WitnessValue w) {
        if (!w.isDeferred()) return w.type();
        String v = w.value();
        if (ExpressionEvaluator.TRUE.equals(v) || ExpressionEvaluator.FALSE.equals(v)) return BOOL;
        if (isInteger(v)) return U64;
        return BOOL;
    }

    // a deferred witness only counts when its value is a boolean literal, not by the bool default
    private static boolean isBoolean(WitnessValue w) {
        if (!w.isDeferred()) return BOOL.equals(w.type());
        return ExpressionEvaluator.TRUE.equals(w.value()) || ExpressionEvaluator.FALSE.equals(w.value());
    }

    private static boolean isInteger(String v) {
        try {
            Long.parseLong(v);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String witnessName(WitnessValue w) {
        return w.name().toUpperCase(Locale.ROOT);
    }

    private static String witnessRef(WitnessValue w) {
        return "witness::" + witnessName(w);
    }

    private static String constant(String name, String type, String value) {
        return "const " + name + ": " + type + " = " + value + ";";
    }
}
