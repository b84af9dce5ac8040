package simgo.ast.stmt;

public sealed interface Stmt
        permits BlockStmt, DeclStmt, AssignStmt, IncDecStmt,
        ExprStmt, SendStmt, ReturnStmt, IfStmt,
        ForStmt, RangeStmt, GoStmt {

    <R> R accept(Visitor<R> v);

    interface Visitor<R> {
        R visitBlock(BlockStmt s);
        R visitDecl(DeclStmt s);
        R visitAssign(AssignStmt s);
        R visitIncDec(IncDecStmt s);
        R visitExpr(ExprStmt s);
        R visitSend(SendStmt s);
        R visitReturn(ReturnStmt s);
        R visitIf(IfStmt s);
        R visitFor(ForStmt s);
        R visitRange(RangeStmt s);
        R visitGo(GoStmt s);
    }
}
