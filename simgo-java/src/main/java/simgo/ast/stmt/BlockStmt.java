package simgo.ast.stmt;

import java.util.List;

public record BlockStmt(List<Stmt> statements) implements Stmt {

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitBlock(this); }
}
