package simgo.ast.expr;

import simgo.ast.type.TypeRef;

// make(map[string]int)
public record TypeExpr(TypeRef type) implements Expr {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitTypeExpr(this); }
}
