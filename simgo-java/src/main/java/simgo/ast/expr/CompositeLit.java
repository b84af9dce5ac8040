package simgo.ast.expr;

import simgo.ast.type.TypeRef;

import java.util.List;

public record CompositeLit(
        TypeRef type,            // null for elided element literals
        List<Element> elements
) implements Expr {

    public record Element(Expr key, Expr value) {}   // key may be null

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitCompositeLit(this); }
}
