package simgo.ast.stmt;

import simgo.ast.expr.Expr;

import java.util.List;

public record AssignStmt(
        List<Expr> lhs,
        Operator op,
        List<Expr> rhs
) implements Stmt {

    public enum Operator {
        DEFINE,   // :=
        ASSIGN,   // =
        ADD_ASSIGN, SUB_ASSIGN, MUL_ASSIGN, DIV_ASSIGN, MOD_ASSIGN
    }

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitAssign(this); }
}
