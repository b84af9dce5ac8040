package simgo.ast.type;

public sealed interface TypeRef
        permits NamedTypeRef, QualifiedTypeRef, ArrayTypeRef,
        StructTypeRef, PointerTypeRef, MapTypeRef,
        ChanTypeRef, InterfaceTypeRef, FuncTypeRef {

    <R> R accept(Visitor<R> v);

    interface Visitor<R> {
        R visitNamed(NamedTypeRef t);
        R visitQualified(QualifiedTypeRef t);
        R visitArray(ArrayTypeRef t);
        R visitStruct(StructTypeRef t);
        R visitPointer(PointerTypeRef t);
        R visitMap(MapTypeRef t);
        R visitChan(ChanTypeRef t);
        R visitInterface(InterfaceTypeRef t);
        R visitFunc(FuncTypeRef t);
    }
}
