package simgo.sema;

import simgo.ast.Program;
import simgo.lexer.Lexer;
import simgo.parser.Parser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class ValidatorTest {

    private final Validator validator = new Validator();

    private static Program parse(String src) {
        return new Parser(new Lexer(src).tokenize()).parseProgram();
    }

    private List<String> issues(String src) {
        return validator.check(parse(src));
    }

    static Stream<Arguments> unsupported() {
        return Stream.of(
                Arguments.of("package main\nfunc f() {\n    for {\n    }\n}\n", Validator.LOOPS),
                Arguments.of("package main\nfunc f() {\n    for i := 0; i < 3; i++ {\n    }\n}\n", Validator.LOOPS),
                Arguments.of("package main\nfunc f(xs [4]uint8) {\n    for _, x := range xs {\n    }\n}\n", Validator.LOOPS),
                Arguments.of("package main\nfunc f() {\n    go func() {}()\n}\n", Validator.GOROUTINES),
                Arguments.of("package main\nfunc f() {\n    ch := make(chan int)\n}\n", Validator.CHANNELS),
                Arguments.of("package main\nfunc f(c <-chan bool) {}\n", Validator.CHANNELS),
                Arguments.of("package main\ntype Reader interface {\n    Read() bool\n}\n", Validator.INTERFACES),
                Arguments.of("package main\nfunc f(data []byte) {}\n", Validator.SLICES),
                Arguments.of("package main\nvar buf []uint8\n", Validator.SLICES),
                Arguments.of("package main\nfunc f() {\n    m := make(map[string]int)\n}\n", Validator.MAPS),
                Arguments.of("package main\ntype Table map[string]uint64\n", Validator.MAPS)
        );
    }

    @ParameterizedTest
    @MethodSource("unsupported")
    void reports_each_unsupported_construct_once(String src, String expected) {
        assertEquals(List.of(expected), issues(src));
    }

    @Test
    void accepts_supported_program() {
        var src = """
                package main

                const MinAmount uint64 = 1000

                type Point struct {
                    X, Y uint32
                }

                func Check(amount uint64, key [32]byte) bool {
                    if amount < MinAmount {
                        return false
                    }
                    return true
                }

                func main() {
                    var amount uint64 = 5000
                    ok := Check(amount, [32]byte{})
                    if !ok {
                        return
                    }
                }
                """;
        assertTrue(issues(src).isEmpty());
        assertDoesNotThrow(() -> validator.validate(parse(src)));
    }

    @Test
    void collects_every_issue_in_order() {
        var src = """
                package main

                func f(data []byte) {
                    for {
                    }
                    m := make(map[string]int)
                }

                type Reader interface {
                    Read() []byte
                }
                """;
        assertEquals(List.of(Validator.SLICES, Validator.LOOPS, Validator.MAPS, Validator.INTERFACES), issues(src));
    }

    @Test
    void rejected_construct_bodies_are_not_descended() {
        var src = """
                package main
                func f() {
                    for {
                        m := make(map[string]int)
                    }
                }
                """;
        assertEquals(List.of(Validator.LOOPS), issues(src));
    }

    @Test
    void finds_constructs_in_nested_blocks_and_literals() {
        var src = """
                package main
                func f(ok bool) {
                    if ok {
                        g := func(xs []uint8) bool { return true }
                    } else {
                        go g()
                    }
                }
                """;
        assertEquals(List.of(Validator.SLICES, Validator.GOROUTINES), issues(src));
    }

    @Test
    void validate_throws_with_all_issues() {
        var p = parse("package main\nfunc f(a []byte, m map[string]int) {}\n");
        var e = assertThrows(ValidationException.class, () -> validator.validate(p));
        assertEquals(List.of(Validator.SLICES, Validator.MAPS), e.issues());
        assertEquals("unsupported Go features detected:\n" + Validator.SLICES + "\n" + Validator.MAPS, e.getMessage());
    }
}
