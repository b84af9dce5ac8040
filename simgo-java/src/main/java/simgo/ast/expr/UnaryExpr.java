package simgo.ast.expr;

public record UnaryExpr(
        Operator op,
        Expr expr
) implements Expr {
    public enum Operator {
        NEG, PLUS, NOT, COMPLEMENT, ADDRESS, DEREF, RECEIVE
    }

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitUnary(this); }
}
