package simgo.types;

import simgo.ast.decl.Field;
import simgo.ast.expr.BasicLit;
import simgo.ast.expr.Expr;
import simgo.ast.expr.Ident;
import simgo.ast.type.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps Go types onto SimplicityHL types.
 *
 * <ul>
 *   <li>builtin identifiers come from a fixed table; other identifiers are
 *       returned unchanged and assumed to be defined elsewhere</li>
 *   <li>{@code [N]T} becomes {@code [T; N]}; N must be an integer literal</li>
 *   <li>structs become tuples, {@code (T,)} for a single slot</li>
 *   <li>{@code bitcoin.X} resolves through a second table</li>
 * </ul>
 *
 * Stateless; one instance may be shared.
 */
public final class TypeMapper implements TypeRef.Visitor<String> {

    public static final String UNIT = "()";

    private static final Map<String, String> builtinTypes = Map.ofEntries(
            Map.entry("bool", "bool"),
            Map.entry("uint8", "u8"),
            Map.entry("uint16", "u16"),
            Map.entry("uint32", "u32"),
            Map.entry("uint64", "u64"),
            Map.entry("byte", "u8"),

            // bitcoin types used unqualified
            Map.entry("Hash", "u256"),
            Map.entry("Address", "u256"),
            Map.entry("Pubkey", "u256"),
            Map.entry("Signature", "[u8; 64]")
    );

    private static final Map<String, String> bitcoinTypes = Map.of(
            "Hash", "u256",
            "Address", "u256",
            "Pubkey", "u256",
            "Signature", "[u8; 64]",
            "Amount", "u64"
    );

    private static final Map<String, Integer> bitWidths = Map.ofEntries(
            Map.entry("bool", 1),
            Map.entry("u1", 1),
            Map.entry("u2", 2),
            Map.entry("u4", 4),
            Map.entry("u8", 8),
            Map.entry("u16", 16),
            Map.entry("u32", 32),
            Map.entry("u64", 64),
            Map.entry("u128", 128),
            Map.entry("u256", 256),
            Map.entry(UNIT, 0)
    );

    /**
     * Converts a Go type to its SimplicityHL spelling.
     *
     * @throws TypeMappingException for slices, non-literal array lengths,
     *         unknown qualified names and types with no tuple/array form
     */
    public String mapType(TypeRef type) {
        return type.accept(this);
    }

    public boolean isSupported(TypeRef type) {
        try {
            mapType(type);
            return true;
        } catch (TypeMappingException e) {
            return false;
        }
    }

    public List<String> supportedTypes() {
        return builtinTypes.keySet().stream().sorted().toList();
    }

    /**
     * Size in bits of a SimplicityHL type string. Arrays multiply, tuples
     * add up their slots; anything unrecognised (null included) is 0.
     * Widths past {@code Long.MAX_VALUE} saturate there.
     */
    public long bitWidth(String simplicityType) {
        if (simplicityType == null) return 0;
        String t = simplicityType.trim();
        Integer fixed = bitWidths.get(t);
        if (fixed != null) return fixed;

        if (t.startsWith("[") && t.endsWith("]")) {
            String inner = t.substring(1, t.length() - 1);
            int sep = inner.lastIndexOf(';');
            if (sep < 0) return 0;
            long count;
            try {
                count = Long.parseLong(inner.substring(sep + 1).trim());
            } catch (NumberFormatException e) {
                return 0;
            }
            if (count < 0) return 0;
            return saturatingMultiply(bitWidth(inner.substring(0, sep)), count);
        }

        if (t.startsWith("(") && t.endsWith(")")) {
            long total = 0;
            for (String slot : splitTopLevel(t.substring(1, t.length() - 1))) {
                if (slot.isBlank()) continue;
                try {
                    total = Math.addExact(total, bitWidth(slot));
                } catch (ArithmeticException e) {
                    return Long.MAX_VALUE;
                }
            }
            return total;
        }
        return 0;
    }

    private static long saturatingMultiply(long width, long count) {
        try {
            return Math.multiplyExact(width, count);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    // ---------- visitor ----------

    @Override
    public String visitNamed(NamedTypeRef t) {
        return builtinTypes.getOrDefault(t.name(), t.name());
    }

    @Override
    public String visitQualified(QualifiedTypeRef t) {
        if ("bitcoin".equals(t.pkg())) {
            String mapped = bitcoinTypes.get(t.name());
            if (mapped == null) throw new TypeMappingException("unsupported bitcoin type: " + t.name());
            return mapped;
        }
        throw new TypeMappingException("unsupported qualified type: " + t.qualifiedName());
    }

    @Override
    public String visitArray(ArrayTypeRef t) {
        String elemType;
        try {
            elemType = mapType(t.element());
        } catch (TypeMappingException e) {
            throw new TypeMappingException("failed to map array element type: " + e.getMessage(), e);
        }

        if (t.isSlice()) {
            throw new TypeMappingException("slices are not supported, use fixed-size arrays");
        }

        long length;
        try {
            length = arrayLength(t.length());
        } catch (TypeMappingException e) {
            throw new TypeMappingException("failed to evaluate array length: " + e.getMessage(), e);
        }
        return "[" + elemType + "; " + length + "]";
    }

    @Override
    public String visitStruct(StructTypeRef t) {
        List<String> slots = new ArrayList<>();
        for (Field field : t.fields()) {
            String fieldType;
            try {
                fieldType = mapType(field.type());
            } catch (TypeMappingException e) {
                throw new TypeMappingException("failed to map struct field type: " + e.getMessage(), e);
            }
            int count = field.names().isEmpty() ? 1 : field.names().size();
            for (int i = 0; i < count; i++) slots.add(fieldType);
        }

        if (slots.isEmpty()) return UNIT;
        if (slots.size() == 1) return "(" + slots.get(0) + ",)";
        return "(" + String.join(", ", slots) + ")";
    }

    @Override
    public String visitPointer(PointerTypeRef t) {
        throw unsupported("pointer");
    }

    @Override
    public String visitMap(MapTypeRef t) {
        throw unsupported("map");
    }

    @Override
    public String visitChan(ChanTypeRef t) {
        throw unsupported("chan");
    }

    @Override
    public String visitInterface(InterfaceTypeRef t) {
        throw unsupported("interface");
    }

    @Override
    public String visitFunc(FuncTypeRef t) {
        throw unsupported("func");
    }

    // ---------- helpers ----------

    private static long arrayLength(Expr length) {
        if (length instanceof BasicLit lit && lit.kind() == BasicLit.Kind.INT) {
            try {
                return Long.parseLong(lit.value());
            } catch (NumberFormatException e) {
                throw new TypeMappingException("invalid array length: " + lit.value(), e);
            }
        }
        if (length instanceof Ident) {
            // constant names would need evaluation here
            throw new TypeMappingException("array length must be a literal integer");
        }
        throw new TypeMappingException("unsupported array length expression: " + length.getClass().getSimpleName());
    }

    private static TypeMappingException unsupported(String kind) {
        return new TypeMappingException("unsupported Go type: " + kind);
    }

    // splits "a, [b; 2], (c, d)" on commas that are not nested
    private static List<String> splitTopLevel(String s) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(' || c == '[') depth++;
            else if (c == ')' || c == ']') depth--;
            else if (c == ',' && depth == 0) {
                parts.add(s.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(s.substring(start));
        return parts;
    }
}
