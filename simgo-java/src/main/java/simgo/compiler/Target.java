package simgo.compiler;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum Target {
    SIMPLICITY_HL("simplicityhl"),
    SIMPLICITY("simplicity");

    private final String id;

    Target(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Target fromId(String id) {
        for (Target t : values()) {
            if (t.id.equals(id)) return t;
        }
        throw new IllegalArgumentException("unsupported target: " + id + " (expected one of "
                + Arrays.stream(values()).map(Target::id).collect(Collectors.joining(", ")) + ")");
    }
}
