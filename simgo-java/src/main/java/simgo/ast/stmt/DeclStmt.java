package simgo.ast.stmt;

import simgo.ast.decl.Decl;

public record DeclStmt(Decl decl) implements Stmt {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitDecl(this); }
}
