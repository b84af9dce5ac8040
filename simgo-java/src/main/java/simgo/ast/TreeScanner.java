package simgo.ast;

import simgo.ast.decl.*;
import simgo.ast.expr.*;
import simgo.ast.stmt.*;
import simgo.ast.type.*;

import java.util.List;

/**
 * Depth-first walk over every node of a {@link Program}. Subclasses override
 * the visit methods they care about and call {@code super} (or one of the
 * {@code scan} helpers) to keep descending; returning without doing so
 * prunes that subtree.
 */
public abstract class TreeScanner
        implements Decl.Visitor<Void>, Stmt.Visitor<Void>, Expr.Visitor<Void>, TypeRef.Visitor<Void> {

    public void scan(Program program) {
        for (Decl d : program.decls()) scan(d);
    }

    protected final void scan(Decl d) {
        if (d != null) d.accept(this);
    }

    protected final void scan(Stmt s) {
        if (s != null) s.accept(this);
    }

    protected final void scan(Expr e) {
        if (e != null) e.accept(this);
    }

    protected final void scan(TypeRef t) {
        if (t != null) t.accept(this);
    }

    protected final void scanExprs(List<Expr> exprs) {
        for (Expr e : exprs) scan(e);
    }

    protected final void scanFields(List<Field> fields) {
        for (Field f : fields) scan(f.type());
    }

    protected final void scanSpecs(List<ValueSpec> specs) {
        for (ValueSpec spec : specs) {
            scan(spec.type());
            scanExprs(spec.values());
        }
    }

    // ---------- declarations ----------

    @Override
    public Void visitFunc(FuncDecl d) {
        if (d.receiver() != null) scan(d.receiver().type());
        scanFields(d.params());
        scanFields(d.results());
        scan(d.body());
        return null;
    }

    @Override
    public Void visitConst(ConstDecl d) {
        scanSpecs(d.specs());
        return null;
    }

    @Override
    public Void visitVar(VarDecl d) {
        scanSpecs(d.specs());
        return null;
    }

    @Override
    public Void visitType(TypeDecl d) {
        for (TypeSpec spec : d.specs()) scan(spec.type());
        return null;
    }

    // ---------- statements ----------

    @Override
    public Void visitBlock(BlockStmt s) {
        for (Stmt st : s.statements()) scan(st);
        return null;
    }

    @Override
    public Void visitDecl(DeclStmt s) {
        scan(s.decl());
        return null;
    }

    @Override
    public Void visitAssign(AssignStmt s) {
        scanExprs(s.lhs());
        scanExprs(s.rhs());
        return null;
    }

    @Override
    public Void visitIncDec(IncDecStmt s) {
        scan(s.target());
        return null;
    }

    @Override
    public Void visitExpr(ExprStmt s) {
        scan(s.expr());
        return null;
    }

    @Override
    public Void visitSend(SendStmt s) {
        scan(s.channel());
        scan(s.value());
        return null;
    }

    @Override
    public Void visitReturn(ReturnStmt s) {
        scanExprs(s.results());
        return null;
    }

    @Override
    public Void visitIf(IfStmt s) {
        scan(s.init());
        scan(s.condition());
        scan(s.thenBlock());
        scan(s.elseBlock());
        return null;
    }

    @Override
    public Void visitFor(ForStmt s) {
        scan(s.init());
        scan(s.condition());
        scan(s.post());
        scan(s.body());
        return null;
    }

    @Override
    public Void visitRange(RangeStmt s) {
        scan(s.key());
        scan(s.value());
        scan(s.range());
        scan(s.body());
        return null;
    }

    @Override
    public Void visitGo(GoStmt s) {
        scan(s.call());
        return null;
    }

    // ---------- expressions ----------

    @Override
    public Void visitBasicLit(BasicLit e) {
        return null;
    }

    @Override
    public Void visitBoolLiteral(BoolLiteral e) {
        return null;
    }

    @Override
    public Void visitIdent(Ident e) {
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpr e) {
        scan(e.left());
        scan(e.right());
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpr e) {
        scan(e.expr());
        return null;
    }

    @Override
    public Void visitCall(CallExpr e) {
        scan(e.callee());
        scanExprs(e.args());
        return null;
    }

    @Override
    public Void visitSelector(SelectorExpr e) {
        scan(e.target());
        return null;
    }

    @Override
    public Void visitIndex(IndexExpr e) {
        scan(e.target());
        scan(e.index());
        return null;
    }

    @Override
    public Void visitCompositeLit(CompositeLit e) {
        scan(e.type());
        for (CompositeLit.Element el : e.elements()) {
            scan(el.key());
            scan(el.value());
        }
        return null;
    }

    @Override
    public Void visitFuncLit(FuncLit e) {
        scan(e.type());
        scan(e.body());
        return null;
    }

    @Override
    public Void visitTypeExpr(TypeExpr e) {
        scan(e.type());
        return null;
    }

    // ---------- types ----------

    @Override
    public Void visitNamed(NamedTypeRef t) {
        return null;
    }

    @Override
    public Void visitQualified(QualifiedTypeRef t) {
        return null;
    }

    @Override
    public Void visitArray(ArrayTypeRef t) {
        scan(t.length());
        scan(t.element());
        return null;
    }

    @Override
    public Void visitStruct(StructTypeRef t) {
        scanFields(t.fields());
        return null;
    }

    @Override
    public Void visitPointer(PointerTypeRef t) {
        scan(t.element());
        return null;
    }

    @Override
    public Void visitMap(MapTypeRef t) {
        scan(t.key());
        scan(t.value());
        return null;
    }

    @Override
    public Void visitChan(ChanTypeRef t) {
        scan(t.element());
        return null;
    }

    @Override
    public Void visitInterface(InterfaceTypeRef t) {
        scanFields(t.methods());
        return null;
    }

    @Override
    public Void visitFunc(FuncTypeRef t) {
        scanFields(t.params());
        scanFields(t.results());
        return null;
    }
}
