package simgo.io;

import simgo.ast.Program;
import simgo.ast.decl.*;
import simgo.ast.expr.*;
import simgo.ast.stmt.*;
import simgo.ast.type.*;

import java.util.List;
import java.util.function.Consumer;

/**
 * Indented text dump of a syntax tree, used by debug mode. Each node prints
 * its kind, then its components in declaration order one level deeper:
 *
 * <pre>
 * Program
 *   packageName: "main"
 *   decls: [1]
 *     FuncDecl
 *       ...
 * </pre>
 */
public final class AstPrinter
        implements Decl.Visitor<Void>, Stmt.Visitor<Void>, Expr.Visitor<Void>, TypeRef.Visitor<Void> {
    private static final String STEP = "  ";

    private final StringBuilder out = new StringBuilder();
    private int depth;

    private AstPrinter() {}

    public static String print(Program program) {
        AstPrinter p = new AstPrinter();
        p.node("Program", () -> {
            p.value("packageName", program.packageName());
            p.strings("imports", program.imports());
            p.list("decls", program.decls(), d -> d.accept(p));
        });
        return p.out.toString();
    }

    // ---------- declarations ----------

    @Override
    public Void visitFunc(FuncDecl d) {
        node("FuncDecl", () -> {
            child("receiver", d.receiver());
            value("name", d.name());
            fields("params", d.params());
            fields("results", d.results());
            child("body", d.body());
        });
        return null;
    }

    @Override
    public Void visitConst(ConstDecl d) {
        node("ConstDecl", () -> valueSpecs(d.specs()));
        return null;
    }

    @Override
    public Void visitVar(VarDecl d) {
        node("VarDecl", () -> valueSpecs(d.specs()));
        return null;
    }

    @Override
    public Void visitType(TypeDecl d) {
        node("TypeDecl", () -> list("specs", d.specs(), spec -> node("TypeSpec", () -> {
            value("name", spec.name());
            child("type", spec.type());
            value("alias", spec.alias());
        })));
        return null;
    }

    private void valueSpecs(List<ValueSpec> specs) {
        list("specs", specs, spec -> node("ValueSpec", () -> {
            strings("names", spec.names());
            child("type", spec.type());
            exprs("values", spec.values());
        }));
    }

    private void field(Field f) {
        node("Field", () -> {
            strings("names", f.names());
            child("type", f.type());
        });
    }

    // ---------- statements ----------

    @Override
    public Void visitBlock(BlockStmt s) {
        node("BlockStmt", () -> list("statements", s.statements(), st -> st.accept(this)));
        return null;
    }

    @Override
    public Void visitDecl(DeclStmt s) {
        node("DeclStmt", () -> child("decl", s.decl()));
        return null;
    }

    @Override
    public Void visitAssign(AssignStmt s) {
        node("AssignStmt", () -> {
            exprs("lhs", s.lhs());
            value("op", s.op());
            exprs("rhs", s.rhs());
        });
        return null;
    }

    @Override
    public Void visitIncDec(IncDecStmt s) {
        node("IncDecStmt", () -> {
            child("target", s.target());
            value("increment", s.increment());
        });
        return null;
    }

    @Override
    public Void visitExpr(ExprStmt s) {
        node("ExprStmt", () -> child("expr", s.expr()));
        return null;
    }

    @Override
    public Void visitSend(SendStmt s) {
        node("SendStmt", () -> {
            child("channel", s.channel());
            child("value", s.value());
        });
        return null;
    }

    @Override
    public Void visitReturn(ReturnStmt s) {
        node("ReturnStmt", () -> exprs("results", s.results()));
        return null;
    }

    @Override
    public Void visitIf(IfStmt s) {
        node("IfStmt", () -> {
            child("init", s.init());
            child("condition", s.condition());
            child("thenBlock", s.thenBlock());
            child("elseBlock", s.elseBlock());
        });
        return null;
    }

    @Override
    public Void visitFor(ForStmt s) {
        node("ForStmt", () -> {
            child("init", s.init());
            child("condition", s.condition());
            child("post", s.post());
            child("body", s.body());
        });
        return null;
    }

    @Override
    public Void visitRange(RangeStmt s) {
        node("RangeStmt", () -> {
            child("key", s.key());
            child("value", s.value());
            value("define", s.define());
            child("range", s.range());
            child("body", s.body());
        });
        return null;
    }

    @Override
    public Void visitGo(GoStmt s) {
        node("GoStmt", () -> child("call", s.call()));
        return null;
    }

    // ---------- expressions ----------

    @Override
    public Void visitBasicLit(BasicLit e) {
        node("BasicLit", () -> {
            value("kind", e.kind());
            value("value", e.value());
        });
        return null;
    }

    @Override
    public Void visitBoolLiteral(BoolLiteral e) {
        node("BoolLiteral", () -> value("value", e.value()));
        return null;
    }

    @Override
    public Void visitIdent(Ident e) {
        node("Ident", () -> value("name", e.name()));
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpr e) {
        node("BinaryExpr", () -> {
            child("left", e.left());
            value("op", e.op());
            child("right", e.right());
        });
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpr e) {
        node("UnaryExpr", () -> {
            value("op", e.op());
            child("expr", e.expr());
        });
        return null;
    }

    @Override
    public Void visitCall(CallExpr e) {
        node("CallExpr", () -> {
            child("callee", e.callee());
            exprs("args", e.args());
        });
        return null;
    }

    @Override
    public Void visitSelector(SelectorExpr e) {
        node("SelectorExpr", () -> {
            child("target", e.target());
            value("name", e.name());
        });
        return null;
    }

    @Override
    public Void visitIndex(IndexExpr e) {
        node("IndexExpr", () -> {
            child("target", e.target());
            child("index", e.index());
        });
        return null;
    }

    @Override
    public Void visitCompositeLit(CompositeLit e) {
        node("CompositeLit", () -> {
            child("type", e.type());
            list("elements", e.elements(), el -> node("Element", () -> {
                child("key", el.key());
                child("value", el.value());
            }));
        });
        return null;
    }

    @Override
    public Void visitFuncLit(FuncLit e) {
        node("FuncLit", () -> {
            child("type", e.type());
            child("body", e.body());
        });
        return null;
    }

    @Override
    public Void visitTypeExpr(TypeExpr e) {
        node("TypeExpr", () -> child("type", e.type()));
        return null;
    }

    // ---------- types ----------

    @Override
    public Void visitNamed(NamedTypeRef t) {
        node("NamedTypeRef", () -> value("name", t.name()));
        return null;
    }

    @Override
    public Void visitQualified(QualifiedTypeRef t) {
        node("QualifiedTypeRef", () -> {
            value("pkg", t.pkg());
            value("name", t.name());
        });
        return null;
    }

    @Override
    public Void visitArray(ArrayTypeRef t) {
        node("ArrayTypeRef", () -> {
            child("length", t.length());
            child("element", t.element());
        });
        return null;
    }

    @Override
    public Void visitStruct(StructTypeRef t) {
        node("StructTypeRef", () -> fields("fields", t.fields()));
        return null;
    }

    @Override
    public Void visitPointer(PointerTypeRef t) {
        node("PointerTypeRef", () -> child("element", t.element()));
        return null;
    }

    @Override
    public Void visitMap(MapTypeRef t) {
        node("MapTypeRef", () -> {
            child("key", t.key());
            child("value", t.value());
        });
        return null;
    }

    @Override
    public Void visitChan(ChanTypeRef t) {
        node("ChanTypeRef", () -> {
            value("direction", t.direction());
            child("element", t.element());
        });
        return null;
    }

    @Override
    public Void visitInterface(InterfaceTypeRef t) {
        node("InterfaceTypeRef", () -> fields("methods", t.methods()));
        return null;
    }

    @Override
    public Void visitFunc(FuncTypeRef t) {
        node("FuncTypeRef", () -> {
            fields("params", t.params());
            fields("results", t.results());
        });
        return null;
    }

    // ---------- layout ----------

    private void node(String kind, Runnable components) {
        line(kind);
        depth++;
        components.run();
        depth--;
    }

    private void child(String name, Object node, Runnable print) {
        if (node == null) {
            line(name + ": nil");
            return;
        }
        line(name + ":");
        depth++;
        print.run();
        depth--;
    }

    private void child(String name, Decl d) {
        child(name, d, () -> d.accept(this));
    }

    private void child(String name, Stmt s) {
        child(name, s, () -> s.accept(this));
    }

    private void child(String name, Expr e) {
        child(name, e, () -> e.accept(this));
    }

    private void child(String name, TypeRef t) {
        child(name, t, () -> t.accept(this));
    }

    private void child(String name, Field f) {
        child(name, f, () -> field(f));
    }

    private <T> void list(String name, List<T> items, Consumer<T> print) {
        line(name + ": [" + items.size() + "]");
        depth++;
        items.forEach(print);
        depth--;
    }

    private void exprs(String name, List<Expr> items) {
        list(name, items, e -> e.accept(this));
    }

    private void fields(String name, List<Field> items) {
        list(name, items, this::field);
    }

    private void strings(String name, List<String> items) {
        list(name, items, s -> line(quote(s)));
    }

    private void value(String name, Object v) {
        line(name + ": " + (v == null ? "nil" : v instanceof String s ? quote(s) : v.toString()));
    }

    private static String quote(String s) {
        return "\"" + s + "\"";
    }

    private void line(String text) {
        out.append(STEP.repeat(depth)).append(text).append('\n');
    }
}
