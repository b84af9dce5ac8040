package simgo.sema;

import simgo.ast.expr.*;

import java.util.Map;

/**
 * Compile-time evaluation of initializer expressions into SimplicityHL
 * literal text.
 *
 * Literals are returned as written. A binary expression whose operands
 * both evaluate to base-10 integers is folded for {@code + - * /} (never
 * for a zero divisor) and for the six comparisons. {@code !} turns
 * {@code true} into {@code false} and anything else into {@code true}.
 * Every other shape evaluates to {@code true}: this is an approximation,
 * not constant propagation, and it is not reported as an error.
 *
 * <p>With a non-null environment identifiers found in it evaluate to the
 * bound value; unbound identifiers still evaluate to {@code true}.
 */
public final class ExpressionEvaluator implements Expr.Visitor<String> {

    public static final String TRUE = "true";
    public static final String FALSE = "false";

    private final Map<String, String> env;

    public ExpressionEvaluator() {
        this(null);
    }

    public ExpressionEvaluator(Map<String, String> env) {
        this.env = env;
    }

    public String evaluate(Expr e) {
        return e.accept(this);
    }

    @Override
    public String visitBasicLit(BasicLit e) {
        return e.value();
    }

    @Override
    public String visitBoolLiteral(BoolLiteral e) {
        return e.value() ? TRUE : FALSE;
    }

    @Override
    public String visitIdent(Ident e) {
        if (env != null) {
            String bound = env.get(e.name());
            if (bound != null) return bound;
        }
        return TRUE;
    }

    @Override
    public String visitBinary(BinaryExpr e) {
        String left = evaluate(e.left());
        String right = evaluate(e.right());

        Long l = parseInteger(left);
        Long r = parseInteger(right);
        if (l == null || r == null) return TRUE;

        long a = l;
        long b = r;
        return switch (e.op()) {
            case ADD -> Long.toString(a + b);
            case SUB -> Long.toString(a - b);
            case MUL -> Long.toString(a * b);
            case DIV -> b != 0 ? Long.toString(a / b) : TRUE;
            case GT -> Boolean.toString(a > b);
            case LT -> Boolean.toString(a < b);
            case GE -> Boolean.toString(a >= b);
            case LE -> Boolean.toString(a <= b);
            case EQ -> Boolean.toString(a == b);
            case NE -> Boolean.toString(a != b);
            default -> TRUE;
        };
    }

    @Override
    public String visitUnary(UnaryExpr e) {
        if (e.op() != UnaryExpr.Operator.NOT) return TRUE;
        return TRUE.equals(evaluate(e.expr())) ? FALSE : TRUE;
    }

    // calls are not executed at compile time
    @Override
    public String visitCall(CallExpr e) {
        return TRUE;
    }

    @Override
    public String visitSelector(SelectorExpr e) {
        return TRUE;
    }

    @Override
    public String visitIndex(IndexExpr e) {
        return TRUE;
    }

    @Override
    public String visitCompositeLit(CompositeLit e) {
        return TRUE;
    }

    @Override
    public String visitFuncLit(FuncLit e) {
        return TRUE;
    }

    @Override
    public String visitTypeExpr(TypeExpr e) {
        return TRUE;
    }

    // signed 64-bit base-10 only
    static Long parseInteger(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
