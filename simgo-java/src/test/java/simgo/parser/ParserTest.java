package simgo.parser;

import simgo.ast.Program;
import simgo.ast.decl.*;
import simgo.ast.expr.*;
import simgo.ast.stmt.*;
import simgo.ast.type.*;
import simgo.lexer.Lexer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static Program parse(String src) {
        var tokens = new Lexer(src).tokenize();
        return new Parser(tokens).parseProgram();
    }

    private static FuncDecl firstFn(Program p) {
        return (FuncDecl) p.decls().get(0);
    }

    private static List<Stmt> bodyOf(String stmts) {
        var p = parse("package main\nfunc f() {\n" + stmts + "\n}\n");
        return firstFn(p).body().statements();
    }

    private static Expr returned(String expr) {
        var ret = (ReturnStmt) bodyOf("return " + expr).get(0);
        return ret.results().get(0);
    }

    private static TypeRef varType(String type) {
        var p = parse("package main\nvar v " + type + "\n");
        return ((VarDecl) p.decls().get(0)).specs().get(0).type();
    }

    @Test
    void parse_package_and_imports() {
        var p = parse("""
                package main

                import "fmt"
                import (
                    "os"
                    b "bytes"
                )
                """);
        assertEquals("main", p.packageName());
        assertEquals(List.of("fmt", "os", "bytes"), p.imports());
        assertTrue(p.decls().isEmpty());
    }

    @Test
    void parse_grouped_params_and_result() {
        var f = firstFn(parse("""
                package main
                func Add(a, b uint32, ok bool) uint32 {
                    return a
                }
                """));
        assertEquals("Add", f.name());
        assertNull(f.receiver());
        assertEquals(2, f.params().size());
        assertEquals(List.of("a", "b"), f.params().get(0).names());
        assertEquals(new NamedTypeRef("uint32"), f.params().get(0).type());
        assertEquals(List.of("ok"), f.params().get(1).names());
        assertEquals(1, f.results().size());
        assertEquals(new NamedTypeRef("uint32"), f.results().get(0).type());
    }

    @Test
    void parse_multiline_params_with_trailing_comma() {
        var f = firstFn(parse("""
                package main
                func AtomicSwap(
                    amount uint64,
                    timelock uint32,
                    hashlockValid bool,
                ) bool {
                    return true
                }
                """));
        assertEquals(3, f.params().size());
        assertEquals(List.of("hashlockValid"), f.params().get(2).names());
    }

    @Test
    void parse_unnamed_results_and_method_receiver() {
        var f = firstFn(parse("""
                package main
                func (p Point) Split() (uint32, bool) {
                    return 1, true
                }
                """));
        assertEquals(List.of("p"), f.receiver().names());
        assertEquals(2, f.results().size());
        assertTrue(f.results().get(0).names().isEmpty());
        assertEquals(new NamedTypeRef("bool"), f.results().get(1).type());
    }

    @Test
    void parse_function_without_body_or_results() {
        var f = firstFn(parse("package main\nfunc external(x uint8)\n"));
        assertNull(f.body());
        assertTrue(f.results().isEmpty());
    }

    @Test
    void parse_array_and_slice_types() {
        var a = (ArrayTypeRef) varType("[32]byte");
        assertFalse(a.isSlice());
        assertEquals(new BasicLit(BasicLit.Kind.INT, "32"), a.length());
        assertEquals(new NamedTypeRef("byte"), a.element());

        var s = (ArrayTypeRef) varType("[]byte");
        assertTrue(s.isSlice());

        var nested = (ArrayTypeRef) varType("[2][4]uint8");
        assertInstanceOf(ArrayTypeRef.class, nested.element());
    }

    @Test
    void parse_reference_types() {
        assertEquals(new MapTypeRef(new NamedTypeRef("string"), new NamedTypeRef("uint64")), varType("map[string]uint64"));
        assertEquals(ChanTypeRef.Direction.BOTH, ((ChanTypeRef) varType("chan int")).direction());
        assertEquals(ChanTypeRef.Direction.SEND, ((ChanTypeRef) varType("chan<- int")).direction());
        assertEquals(ChanTypeRef.Direction.RECEIVE, ((ChanTypeRef) varType("<-chan int")).direction());
        assertEquals(new PointerTypeRef(new NamedTypeRef("T")), varType("*T"));
        assertEquals(new QualifiedTypeRef("bitcoin", "Hash"), varType("bitcoin.Hash"));
        assertInstanceOf(FuncTypeRef.class, varType("func(uint8) bool"));
    }

    @Test
    void parse_variadic_param_as_slice() {
        var f = firstFn(parse("package main\nfunc sum(xs ...uint64) {}\n"));
        assertTrue(((ArrayTypeRef) f.params().get(0).type()).isSlice());
    }

    @Test
    void parse_struct_and_interface_type_decls() {
        var p = parse("""
                package main
                type Point struct {
                    X, Y uint32
                    Tag  string `json:"tag"`
                }
                type Reader interface {
                    Read() []byte
                }
                """);
        var point = ((TypeDecl) p.decls().get(0)).specs().get(0);
        assertEquals("Point", point.name());
        var st = (StructTypeRef) point.type();
        assertEquals(2, st.fields().size());
        assertEquals(List.of("X", "Y"), st.fields().get(0).names());

        var reader = (InterfaceTypeRef) ((TypeDecl) p.decls().get(1)).specs().get(0).type();
        assertEquals(1, reader.methods().size());
        assertEquals(List.of("Read"), reader.methods().get(0).names());
        assertInstanceOf(FuncTypeRef.class, reader.methods().get(0).type());
    }

    @Test
    void parse_grouped_const_and_var() {
        var p = parse("""
                package main
                const (
                    MinAmount uint64 = 1000
                    MaxAmount = 5000
                )
                var a, b = 1, 2
                """);
        var c = (ConstDecl) p.decls().get(0);
        assertEquals(2, c.specs().size());
        assertEquals(new NamedTypeRef("uint64"), c.specs().get(0).type());
        assertNull(c.specs().get(1).type());
        var v = (VarDecl) p.decls().get(1);
        assertEquals(List.of("a", "b"), v.specs().get(0).names());
        assertEquals(2, v.specs().get(0).values().size());
    }

    @Test
    void parse_simple_statements() {
        var stmts = bodyOf("""
                x := 1
                var y uint64 = 2
                y += 3
                x++
                f(x)
                const k = 4
                a, b = b, a
                """);
        assertEquals(7, stmts.size());
        assertEquals(AssignStmt.Operator.DEFINE, ((AssignStmt) stmts.get(0)).op());
        assertInstanceOf(VarDecl.class, ((DeclStmt) stmts.get(1)).decl());
        assertEquals(AssignStmt.Operator.ADD_ASSIGN, ((AssignStmt) stmts.get(2)).op());
        assertTrue(((IncDecStmt) stmts.get(3)).increment());
        assertEquals("f", ((CallExpr) ((ExprStmt) stmts.get(4)).expr()).calleeName());
        assertInstanceOf(ConstDecl.class, ((DeclStmt) stmts.get(5)).decl());
        var swap = (AssignStmt) stmts.get(6);
        assertEquals(AssignStmt.Operator.ASSIGN, swap.op());
        assertEquals(2, swap.lhs().size());
    }

    @Test
    void parse_bare_return_before_brace() {
        var stmts = bodyOf("if !ok {\n    return\n}");
        var ifs = (IfStmt) stmts.get(0);
        var ret = (ReturnStmt) ifs.thenBlock().statements().get(0);
        assertTrue(ret.results().isEmpty());
    }

    @Test
    void parse_if_else_if_else() {
        var stmts = bodyOf("""
                if a {
                    return 1
                } else if b {
                    return 2
                } else {
                    return 3
                }
                """);
        var ifs = (IfStmt) stmts.get(0);
        assertEquals(new Ident("a"), ifs.condition());
        assertNull(ifs.init());
        var elseIf = (IfStmt) ifs.elseBlock().statements().get(0);
        assertEquals(new Ident("b"), elseIf.condition());
        assertNotNull(elseIf.elseBlock());
    }

    @Test
    void parse_if_with_init() {
        var ifs = (IfStmt) bodyOf("if v := f(); v {\n}").get(0);
        assertInstanceOf(AssignStmt.class, ifs.init());
        assertEquals(new Ident("v"), ifs.condition());
    }

    @Test
    void parse_composite_literal_vs_block_in_if_header() {
        var stmts = bodyOf("""
                p := Point{1, 2}
                if x == y {
                }
                if p == (Point{X: 1}) {
                }
                """);
        var lit = (CompositeLit) ((AssignStmt) stmts.get(0)).rhs().get(0);
        assertEquals(new NamedTypeRef("Point"), lit.type());
        assertEquals(2, lit.elements().size());

        var cond = (BinaryExpr) ((IfStmt) stmts.get(1)).condition();
        assertEquals(new Ident("y"), cond.right());

        var keyed = (BinaryExpr) ((IfStmt) stmts.get(2)).condition();
        var keyedLit = (CompositeLit) keyed.right();
        assertEquals(new Ident("X"), keyedLit.elements().get(0).key());
    }

    @Test
    void parse_for_forms() {
        var stmts = bodyOf("""
                for {
                }
                for x < 3 {
                }
                for i := 0; i < 3; i++ {
                }
                for k, v := range xs {
                }
                for range xs {
                }
                """);
        var infinite = (ForStmt) stmts.get(0);
        assertNull(infinite.condition());

        var whileLoop = (ForStmt) stmts.get(1);
        assertInstanceOf(BinaryExpr.class, whileLoop.condition());

        var classic = (ForStmt) stmts.get(2);
        assertInstanceOf(AssignStmt.class, classic.init());
        assertInstanceOf(IncDecStmt.class, classic.post());

        var range = (RangeStmt) stmts.get(3);
        assertTrue(range.define());
        assertEquals(new Ident("k"), range.key());
        assertEquals(new Ident("v"), range.value());

        var bare = (RangeStmt) stmts.get(4);
        assertNull(bare.key());
    }

    @Test
    void parse_go_statement_and_make() {
        var stmts = bodyOf("""
                go func() {}()
                m := make(map[string]int)
                ch <- 1
                """);
        var go = (GoStmt) stmts.get(0);
        assertInstanceOf(FuncLit.class, go.call().callee());

        var make = (CallExpr) ((AssignStmt) stmts.get(1)).rhs().get(0);
        assertEquals("make", make.calleeName());
        assertInstanceOf(MapTypeRef.class, ((TypeExpr) make.args().get(0)).type());

        assertInstanceOf(SendStmt.class, stmts.get(2));
    }

    @Test
    void parse_precedence() {
        var add = (BinaryExpr) returned("a + b * c");
        assertEquals(BinaryExpr.Operator.ADD, add.op());
        assertEquals(BinaryExpr.Operator.MUL, ((BinaryExpr) add.right()).op());

        var or = (BinaryExpr) returned("a || b && c");
        assertEquals(BinaryExpr.Operator.OR, or.op());
        assertEquals(BinaryExpr.Operator.AND, ((BinaryExpr) or.right()).op());

        var cmp = (BinaryExpr) returned("a + 1 >= b");
        assertEquals(BinaryExpr.Operator.GE, cmp.op());

        var paren = (BinaryExpr) returned("(a + b) * c");
        assertEquals(BinaryExpr.Operator.MUL, paren.op());
        assertEquals(BinaryExpr.Operator.ADD, ((BinaryExpr) paren.left()).op());

        var not = (UnaryExpr) returned("!ok");
        assertEquals(UnaryExpr.Operator.NOT, not.op());
    }

    @Test
    void parse_postfix_chain() {
        var e = returned("pkg.items[0].Len()");
        var call = (CallExpr) e;
        assertNull(call.calleeName());
        var sel = (SelectorExpr) call.callee();
        assertEquals("Len", sel.name());
        assertInstanceOf(IndexExpr.class, sel.target());
    }

    @Test
    void parse_error_reports_position_and_token() {
        var e = assertThrows(ParseException.class, () -> parse("package main\nx := 1\n"));
        assertEquals("[2:1] Expected 'func', 'var', 'const' or 'type' at top-level (got IDENTIFIER 'x')", e.getMessage());
    }

    @Test
    void parse_error_names_newline() {
        var e = assertThrows(ParseException.class, () -> parse("package main\nvar x\n"));
        assertEquals("[2:6] Expected type or initializer in var declaration (got SEMICOLON newline)", e.getMessage());
    }

    @Test
    void parse_errors() {
        assertThrows(ParseException.class, () -> parse("func main() {}\n"));
        assertThrows(ParseException.class, () -> parse("package main\nfunc f( {\n"));
        var goErr = assertThrows(ParseException.class, () -> parse("package main\nfunc f() {\n    go f\n}\n"));
        assertTrue(goErr.getMessage().contains("Expression in go must be function call"));
        var defErr = assertThrows(ParseException.class, () -> parse("package main\nfunc f() {\n    a.b := 1\n}\n"));
        assertTrue(defErr.getMessage().contains("Non-name on left side of ':='"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"atomic_swap", "basic_swap", "simple_logic", "simple_multisig", "simple_payment"})
    void parse_bundled_examples(String name) throws IOException {
        String src;
        try (InputStream in = ParserTest.class.getResourceAsStream("/examples/" + name + ".go")) {
            assertNotNull(in, name);
            src = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        var p = parse(src);
        assertEquals("main", p.packageName());
        assertTrue(p.decls().stream().anyMatch(d -> d instanceof FuncDecl f && f.name().equals("main")));
    }
}
