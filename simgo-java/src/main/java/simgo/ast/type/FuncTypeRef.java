package simgo.ast.type;

import simgo.ast.decl.Field;

import java.util.List;

public record FuncTypeRef(List<Field> params, List<Field> results) implements TypeRef {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitFunc(this); }
}
