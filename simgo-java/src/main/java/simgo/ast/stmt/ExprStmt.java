package simgo.ast.stmt;

import simgo.ast.expr.Expr;

public record ExprStmt(Expr expr) implements Stmt {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitExpr(this); }
}
