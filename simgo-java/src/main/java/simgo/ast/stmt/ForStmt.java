package simgo.ast.stmt;

import simgo.ast.expr.Expr;

// absent clauses are null
public record ForStmt(
        Stmt init,
        Expr condition,
        Stmt post,
        BlockStmt body
) implements Stmt {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitFor(this); }
}
