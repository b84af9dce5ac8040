package simgo.compiler;

import simgo.lexer.LexerException;
import simgo.parser.ParseException;
import simgo.sema.EvaluationMode;
import simgo.sema.ValidationException;
import simgo.sema.Validator;
import simgo.types.TypeMappingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class CompilerTest {

    private static String compile(String src) {
        return new Compiler(CompilerConfig.defaults()).compile(src, "test.go");
    }

    private static String example(String name) throws IOException {
        try (InputStream in = CompilerTest.class.getResourceAsStream("/examples/" + name + ".go")) {
            assertNotNull(in, name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void compiles_basic_function() {
        var out = compile("""
                package main

                func Add(a uint32, b uint32) uint32 {
                    return a + b
                }

                func main() {
                    result := Add(40, 2)
                }
                """);
        assertEquals("""
                mod witness {
                    const RESULT: bool = true;
                }
                mod param {
                }

                fn add(a: u32, b: u32) -> u32 {
                    true
                }

                fn main() {
                    assert!(witness::RESULT);
                }
                """, out);
    }

    @Test
    void precomputes_validation_witnesses() {
        var out = compile("""
                package main

                func ValidateAmount(amountValid bool) bool {
                    return amountValid
                }

                func main() {
                    var amount uint64 = 1000
                    amountValid := amount > 0
                    result := ValidateAmount(amountValid)
                }
                """);
        assertTrue(out.contains("const AMOUNT: u64 = 1000"));
        assertTrue(out.contains("const AMOUNT_VALID: bool = true"));
        assertTrue(out.contains("fn validate_amount(amount_valid: bool) -> bool"));
    }

    @Test
    void constants_go_to_param_module() {
        var out = compile("""
                package main

                const MinAmount uint64 = 1000

                func main() {
                    var amount uint64 = 5000
                }
                """);
        assertTrue(out.contains("mod param {\n    const MIN_AMOUNT: u64 = 1000;\n}"));
        assertTrue(out.contains("mod witness {\n    const AMOUNT: u64 = 5000;\n}"));
        assertTrue(out.contains("assert!(true);"));
    }

    @Test
    void boolean_parameters() {
        var out = compile("""
                package main

                func ValidateLogic(a bool, b bool) bool {
                	if !a {
                		return false
                	}
                	return b
                }

                func main() {
                	result := ValidateLogic(true, false)
                }
                """);
        assertTrue(out.contains("fn validate_logic(a: bool, b: bool) -> bool {\n    b\n}"));
    }

    @Test
    void compiles_basic_swap_example() throws IOException {
        assertEquals("""
                mod witness {
                    const AMOUNT: u64 = 1000;
                    const RATE: u64 = 1500;
                    const MIN_FEE: u64 = 100;
                    const AMOUNT_VALID: bool = true;
                    const CALCULATED_FEE: bool = true;
                    const FEE_VALID: bool = true;
                    const RESULT: bool = true;
                }
                mod param {
                }

                fn validate_amount(amount_valid: bool) -> bool {
                    amount_valid
                }

                fn validate_fee(fee_valid: bool) -> bool {
                    fee_valid
                }

                fn basic_swap(amount_valid: bool, fee_valid: bool) -> bool {
                    fee_valid
                }

                fn main() {
                    assert!(witness::RESULT);
                }
                """, compile(example("basic_swap")));
    }

    @Test
    void propagation_folds_derived_values() throws IOException {
        var config = CompilerConfig.defaults().withEvaluationMode(EvaluationMode.PROPAGATE);
        var out = new Compiler(config).compile(example("basic_swap"), "basic_swap.go");
        assertTrue(out.contains("const CALCULATED_FEE: u64 = 150;"));
        assertTrue(out.contains("const FEE_VALID: bool = true;"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"atomic_swap", "basic_swap", "simple_logic", "simple_multisig", "simple_payment"})
    void compiles_bundled_examples(String name) throws IOException {
        var out = compile(example(name));
        assertTrue(out.startsWith("mod witness {\n"));
        assertTrue(out.contains("\nmod param {\n"));
        assertTrue(out.contains("\nfn main() {\n    assert!("));
        assertTrue(out.endsWith("}\n"));
        assertTrue(out.split("\n").length >= 10, out);
    }

    @Test
    void maps_array_parameters() throws IOException {
        var out = compile(example("simple_payment"));
        assertTrue(out.contains("fn check_sig(pubkey: [u8; 32], sig: [u8; 64], msg: [u8; 32]) -> bool {"));
        assertTrue(out.contains("fn validate_timelock(locktime: u32) -> bool {"));
    }

    @Test
    void output_is_deterministic() throws IOException {
        var src = example("simple_multisig");
        assertEquals(compile(src), compile(src));
    }

    static Stream<Arguments> unsupported() {
        return Stream.of(
                Arguments.of("package main\nfunc process(data []byte) {}\n", "slices are not supported"),
                Arguments.of("package main\nfunc process() {\n    m := make(map[string]int)\n}\n", "maps are not supported"),
                Arguments.of("package main\nfunc process() {\n    ch := make(chan int)\n}\n", "channels are not supported"),
                Arguments.of("package main\nfunc process() {\n    go func() {}()\n}\n", "goroutines are not supported"),
                Arguments.of("package main\ntype Reader interface {\n    Read() []byte\n}\n", "interfaces are not supported"),
                Arguments.of("package main\nfunc process() {\n    for {\n    }\n}\n", "loops are not supported")
        );
    }

    @ParameterizedTest
    @MethodSource("unsupported")
    void rejects_unsupported_features(String src, String fragment) {
        var e = assertThrows(CompilationException.class, () -> compile(src));
        assertEquals(CompilationException.Stage.VALIDATION, e.stage());
        assertTrue(e.getMessage().startsWith("Go code validation failed: unsupported Go features detected:\n"));
        assertTrue(e.getMessage().contains(fragment), e.getMessage());
        assertInstanceOf(ValidationException.class, e.getCause());
    }

    @Test
    void validation_lists_every_issue() {
        var e = assertThrows(CompilationException.class,
                () -> compile("package main\nfunc f(a []byte, m map[string]int) {}\n"));
        var cause = (ValidationException) e.getCause();
        assertEquals(2, cause.issues().size());
        assertTrue(e.getMessage().endsWith(Validator.SLICES + "\n" + Validator.MAPS));
    }

    @Test
    void parse_errors_carry_filename() {
        var e = assertThrows(CompilationException.class,
                () -> new Compiler(CompilerConfig.defaults()).compile("package main\nfunc (", "broken.go"));
        assertEquals(CompilationException.Stage.PARSE, e.stage());
        assertTrue(e.getMessage().startsWith("failed to parse Go source broken.go: "));
        assertInstanceOf(ParseException.class, e.getCause());
    }

    @Test
    void lexer_errors_are_parse_failures() {
        var e = assertThrows(CompilationException.class, () -> compile("package main\n@\n"));
        assertEquals(CompilationException.Stage.PARSE, e.stage());
        assertInstanceOf(LexerException.class, e.getCause());
    }

    @Test
    void unmappable_types_fail_analysis() {
        var e = assertThrows(CompilationException.class, () -> compile("package main\nfunc F(x *uint8) {}\n"));
        assertEquals(CompilationException.Stage.ANALYSIS, e.stage());
        assertEquals("code analysis failed: unsupported Go type: pointer", e.getMessage());
        assertInstanceOf(TypeMappingException.class, e.getCause());

        var q = assertThrows(CompilationException.class,
                () -> compile("package main\nfunc F(s bitcoin.Script) {}\n"));
        assertEquals("code analysis failed: unsupported bitcoin type: Script", q.getMessage());
    }

    @Test
    void simplicity_target_is_not_implemented() {
        var compiler = new Compiler(CompilerConfig.defaults().withTarget(Target.SIMPLICITY));
        var e = assertThrows(CompilationException.class,
                () -> compiler.compile("package main\nfunc main() {\n}\n", "test.go"));
        assertEquals(CompilationException.Stage.TARGET, e.stage());
        assertEquals("direct Simplicity compilation not yet implemented", e.getMessage());
    }

    @Test
    void validation_runs_before_target_check() {
        var compiler = new Compiler(CompilerConfig.defaults().withTarget(Target.SIMPLICITY));
        var e = assertThrows(CompilationException.class,
                () -> compiler.compile("package main\nvar s []byte\n", "test.go"));
        assertEquals(CompilationException.Stage.VALIDATION, e.stage());
    }

    @Test
    void debug_mode_produces_same_output() throws IOException {
        var src = example("simple_logic");
        var debug = new Compiler(CompilerConfig.defaults().withDebug(true));
        assertEquals(compile(src), debug.compile(src, "simple_logic.go"));
    }

    @Test
    void config_defaults_and_withers() {
        var c = CompilerConfig.defaults();
        assertEquals(Target.SIMPLICITY_HL, c.target());
        assertFalse(c.debug());
        assertEquals(EvaluationMode.LITERAL, c.evaluationMode());
        assertEquals("main", c.entryFunction());

        var changed = c.withEntryFunction("run").withDebug(true);
        assertEquals("run", changed.entryFunction());
        assertTrue(changed.debug());
        assertEquals("main", c.entryFunction());

        assertThrows(NullPointerException.class, () -> c.withTarget(null));
    }

    @Test
    void target_ids() {
        assertEquals(Target.SIMPLICITY_HL, Target.fromId("simplicityhl"));
        assertEquals(Target.SIMPLICITY, Target.fromId("simplicity"));
        var e = assertThrows(IllegalArgumentException.class, () -> Target.fromId("wasm"));
        assertEquals("unsupported target: wasm (expected one of simplicityhl, simplicity)", e.getMessage());
    }
}
