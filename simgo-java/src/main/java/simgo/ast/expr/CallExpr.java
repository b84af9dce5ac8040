package simgo.ast.expr;

import java.util.List;

public record CallExpr(
        Expr callee,
        List<Expr> args
) implements Expr {

    // null unless the callee is a plain identifier
    public String calleeName() {
        return callee instanceof Ident id ? id.name() : null;
    }

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitCall(this); }
}
