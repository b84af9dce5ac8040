package simgo.ast.type;

import simgo.ast.expr.Expr;

public record ArrayTypeRef(
        Expr length,       // null => slice
        TypeRef element
) implements TypeRef {

    public boolean isSlice() {
        return length == null;
    }

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitArray(this); }
}
