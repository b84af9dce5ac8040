package simgo.ast.stmt;

import simgo.ast.expr.CallExpr;

public record GoStmt(CallExpr call) implements Stmt {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitGo(this); }
}
