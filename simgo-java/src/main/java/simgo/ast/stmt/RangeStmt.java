package simgo.ast.stmt;

import simgo.ast.expr.Expr;

public record RangeStmt(
        Expr key,       // may be null
        Expr value,     // may be null
        boolean define,
        Expr range,
        BlockStmt body
) implements Stmt {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitRange(this); }
}
