package info.isaksson.erland.idlgen.naming;

import java.util.Map;

/**
 * Escapes string literals for generated sources.
 *
 * <p>Newline, carriage return, tab, double quote and backslash become their two-character
 * backslash forms; every other character, non-ASCII included, is copied unchanged.</p>
 */
public final class StringEscaper {

    private static final Map<Character, String> ESCAPES = Map.of(
            '\n', "\\n",
            '\r', "\\r",
            '\t', "\\t",
            '"', "\\\"",
            '\\', "\\\\"
    );

    private StringEscaper() {}

    public static String escape(String in) {
        if (in == null) throw new IllegalArgumentException("string is null");
        StringBuilder out = new StringBuilder(in.length() + 8);
        for (int i = 0; i < in.length(); i++) {
            char c = in.charAt(i);
            String replacement = ESCAPES.get(c);
            if (replacement != null) {
                out.append(replacement);
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    /** The fixed escape table (unmodifiable). */
    public static Map<Character, String> table() {
        return ESCAPES;
    }
}
