package simgo.ast.decl;

import java.util.List;

public record TypeDecl(List<TypeSpec> specs) implements Decl {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitType(this); }
}
