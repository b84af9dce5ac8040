package simgo.sema;

public enum EvaluationMode {
    LITERAL,     // identifiers evaluate to true
    PROPAGATE    // identifiers resolve to earlier witnesses and constants
}
