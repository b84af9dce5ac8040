package simgo.ast.type;

public record PointerTypeRef(TypeRef element) implements TypeRef {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitPointer(this); }
}
