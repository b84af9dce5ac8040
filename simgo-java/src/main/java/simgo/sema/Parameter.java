package simgo.sema;

public record Parameter(String name, String type) {}
