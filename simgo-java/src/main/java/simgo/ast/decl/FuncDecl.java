package simgo.ast.decl;

import simgo.ast.stmt.BlockStmt;

import java.util.List;

public record FuncDecl(
        Field receiver,          // null for plain functions
        String name,
        List<Field> params,
        List<Field> results,
        BlockStmt body
) implements Decl {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitFunc(this); }
}
