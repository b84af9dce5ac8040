package simgo.compiler;

import simgo.sema.Analyzer;
import simgo.sema.EvaluationMode;

import java.util.Objects;

public record CompilerConfig(
        Target target,
        boolean debug,
        EvaluationMode evaluationMode,
        String entryFunction
) {
    public CompilerConfig {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(evaluationMode, "evaluationMode");
        Objects.requireNonNull(entryFunction, "entryFunction");
    }

    public static CompilerConfig defaults() {
        return new CompilerConfig(Target.SIMPLICITY_HL, false, EvaluationMode.LITERAL, Analyzer.DEFAULT_ENTRY);
    }

    public CompilerConfig withTarget(Target target) {
        return new CompilerConfig(target, debug, evaluationMode, entryFunction);
    }

    public CompilerConfig withDebug(boolean debug) {
        return new CompilerConfig(target, debug, evaluationMode, entryFunction);
    }

    public CompilerConfig withEvaluationMode(EvaluationMode evaluationMode) {
        return new CompilerConfig(target, debug, evaluationMode, entryFunction);
    }

    public CompilerConfig withEntryFunction(String entryFunction) {
        return new CompilerConfig(target, debug, evaluationMode, entryFunction);
    }
}
