package simgo.compiler;

public class CompilationException extends RuntimeException {

    public enum Stage {
        PARSE, VALIDATION, TARGET, ANALYSIS
    }

    private final Stage stage;

    public CompilationException(Stage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public CompilationException(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public Stage stage() {
        return stage;
    }
}
