package simgo.ast.type;

public record QualifiedTypeRef(String pkg, String name) implements TypeRef {

    public String qualifiedName() {
        return pkg + "." + name;
    }

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitQualified(this); }
}
