package simgo.ast.type;

import simgo.ast.decl.Field;

import java.util.List;

// methods are single-name fields of function type; embedded interfaces have no name
public record InterfaceTypeRef(List<Field> methods) implements TypeRef {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitInterface(this); }
}
