package simgo.ast.decl;

import java.util.List;

public record ConstDecl(List<ValueSpec> specs) implements Decl {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitConst(this); }
}
