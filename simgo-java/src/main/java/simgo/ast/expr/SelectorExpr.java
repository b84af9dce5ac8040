package simgo.ast.expr;

public record SelectorExpr(
        Expr target,
        String name
) implements Expr {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitSelector(this); }
}
