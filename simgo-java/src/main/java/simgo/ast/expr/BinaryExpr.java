package simgo.ast.expr;

public record BinaryExpr(
        Expr left,
        Operator op,
        Expr right
) implements Expr {

    public enum Operator {
        ADD, SUB, MUL, DIV, MOD,
        BIT_AND, BIT_OR, BIT_XOR, AND_NOT, SHL, SHR,
        EQ, NE, LT, GT, LE, GE,
        AND, OR
    }

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitBinary(this); }
}
