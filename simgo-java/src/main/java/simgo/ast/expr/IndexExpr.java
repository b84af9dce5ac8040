package simgo.ast.expr;

public record IndexExpr(
        Expr target,
        Expr index
) implements Expr {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitIndex(this); }
}
