package simgo.ast.type;

public record MapTypeRef(TypeRef key, TypeRef value) implements TypeRef {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitMap(this); }
}
