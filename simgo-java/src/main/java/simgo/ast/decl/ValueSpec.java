package simgo.ast.decl;

import simgo.ast.expr.Expr;
import simgo.ast.type.TypeRef;

import java.util.List;

public record ValueSpec(
        List<String> names,
        TypeRef type,          // may be null
        List<Expr> values      // may be shorter than names
) {}
