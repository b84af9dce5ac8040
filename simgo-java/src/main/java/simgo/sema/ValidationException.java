package simgo.sema;

import java.util.List;

public class ValidationException extends RuntimeException {
    private final List<String> issues;

    public ValidationException(List<String> issues) {
        super("unsupported Go features detected:\n" + String.join("\n", issues));
        this.issues = List.copyOf(issues);
    }

    public List<String> issues() {
        return issues;
    }
}
