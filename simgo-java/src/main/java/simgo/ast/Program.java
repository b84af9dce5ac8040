package simgo.ast;

import simgo.ast.decl.Decl;

import java.util.List;

public record Program(
        String packageName,
        List<String> imports,
        List<Decl> decls
) {}
