package simgo.sema;

import java.util.Locale;

public final class Names {
    private Names() {}

    // ValidateAmount -> validate_amount; every capital starts a new word
    public static String toSnakeCase(String name) {
        if (name.isEmpty()) return name;

        StringBuilder sb = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                if (i > 0) sb.append('_');
                sb.append((char) (c - 'A' + 'a'));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    // minFee -> MIN_FEE
    public static String toUpperSnakeCase(String name) {
        return toSnakeCase(name).toUpperCase(Locale.ROOT);
    }
}
