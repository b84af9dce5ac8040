package simgo.sema;

import java.util.List;

public record Function(
        String name,
        List<Parameter> parameters,
        String returnType,       // null when the Go function has no result
        List<String> body        // unindented lines
) {
    public boolean hasReturnType() {
        return returnType != null;
    }
}
