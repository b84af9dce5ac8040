package simgo.ast.expr;

import simgo.ast.stmt.BlockStmt;
import simgo.ast.type.FuncTypeRef;

public record FuncLit(
        FuncTypeRef type,
        BlockStmt body
) implements Expr {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitFuncLit(this); }
}
