package simgo.ast.expr;

public record BasicLit(Kind kind, String value) implements Expr {    // value keeps its quotes

    public enum Kind {
        INT, FLOAT, STRING, CHAR
    }

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitBasicLit(this); }
}
