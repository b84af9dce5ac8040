package simgo.ast.decl;

import simgo.ast.type.TypeRef;

import java.util.List;

// "a, b uint32" shares one type; no names means anonymous parameter or embedded field
public record Field(List<String> names, TypeRef type) {}
