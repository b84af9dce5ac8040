package simgo.ast.expr;

public record BoolLiteral(boolean value) implements Expr {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitBoolLiteral(this); }
}
