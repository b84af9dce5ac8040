package simgo.ast.type;

import simgo.ast.decl.Field;

import java.util.List;

public record StructTypeRef(List<Field> fields) implements TypeRef {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitStruct(this); }
}
