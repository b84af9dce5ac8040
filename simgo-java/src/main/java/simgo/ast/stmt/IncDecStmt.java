package simgo.ast.stmt;

import simgo.ast.expr.Expr;

public record IncDecStmt(Expr target, boolean increment) implements Stmt {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitIncDec(this); }
}
