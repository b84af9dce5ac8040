package simgo.ast.type;

public record ChanTypeRef(Direction direction, TypeRef element) implements TypeRef {

    public enum Direction {
        BOTH, SEND, RECEIVE
    }

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitChan(this); }
}
