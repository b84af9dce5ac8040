package simgo.ast.decl;

public sealed interface Decl
        permits FuncDecl, ConstDecl, VarDecl, TypeDecl {

    <R> R accept(Visitor<R> v);

    interface Visitor<R> {
        R visitFunc(FuncDecl d);
        R visitConst(ConstDecl d);
        R visitVar(VarDecl d);
        R visitType(TypeDecl d);
    }
}
