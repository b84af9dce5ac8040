package simgo.ast.type;

public record NamedTypeRef(String name) implements TypeRef {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitNamed(this); }
}
