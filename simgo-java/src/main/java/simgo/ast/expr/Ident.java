package simgo.ast.expr;

public record Ident(String name) implements Expr {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitIdent(this); }
}
