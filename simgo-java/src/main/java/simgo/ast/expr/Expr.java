package simgo.ast.expr;

public sealed interface Expr
        permits BasicLit, BoolLiteral, Ident,
        BinaryExpr, UnaryExpr, CallExpr,
        SelectorExpr, IndexExpr, CompositeLit,
        FuncLit, TypeExpr {

    <R> R accept(Visitor<R> v);

    interface Visitor<R> {
        R visitBasicLit(BasicLit e);
        R visitBoolLiteral(BoolLiteral e);
        R visitIdent(Ident e);
        R visitBinary(BinaryExpr e);
        R visitUnary(UnaryExpr e);
        R visitCall(CallExpr e);
        R visitSelector(SelectorExpr e);
        R visitIndex(IndexExpr e);
        R visitCompositeLit(CompositeLit e);
        R visitFuncLit(FuncLit e);
        R visitTypeExpr(TypeExpr e);
    }
}
