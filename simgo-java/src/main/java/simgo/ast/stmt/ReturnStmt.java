package simgo.ast.stmt;

import simgo.ast.expr.Expr;

import java.util.List;

public record ReturnStmt(List<Expr> results) implements Stmt {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitReturn(this); }
}
