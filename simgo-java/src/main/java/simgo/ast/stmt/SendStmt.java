package simgo.ast.stmt;

import simgo.ast.expr.Expr;

public record SendStmt(Expr channel, Expr value) implements Stmt {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitSend(this); }
}
