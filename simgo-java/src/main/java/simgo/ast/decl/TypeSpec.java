package simgo.ast.decl;

import simgo.ast.type.TypeRef;

public record TypeSpec(String name, TypeRef type, boolean alias) {}
