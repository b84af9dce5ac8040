package simgo.ast.stmt;

import simgo.ast.expr.Expr;

public record IfStmt(
        Stmt init,               // may be null
        Expr condition,
        BlockStmt thenBlock,
        BlockStmt elseBlock      // may be null; "else if" is wrapped in a block
) implements Stmt {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitIf(this); }
}
