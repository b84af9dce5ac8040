package simgo.sema;

// name is already UPPER_SNAKE_CASE
public record Constant(String name, String type, String value) {}
