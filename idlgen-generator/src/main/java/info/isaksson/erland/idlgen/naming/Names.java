package info.isaksson.erland.idlgen.naming;

import java.util.Locale;

/**
 * Case transforms shared by all backends.
 *
 * <p>All methods return the empty string for empty input and reject null.
 * {@link #underscore} and {@link #camelcase} are approximate inverses only:
 * <ul>
 *   <li>{@code underscore}: first character lower-cased; every later upper-case character gets an
 *   underscore inserted before it and is lower-cased. Runs of capitals are split per character
 *   ({@code HTTPServer -> h_t_t_p_server}); existing underscores and digits are kept.</li>
 *   <li>{@code camelcase}: every underscore is dropped and the next non-underscore character is
 *   upper-cased ({@code _private -> Private}, {@code a__b -> aB}, {@code v_2 -> v2}); trailing
 *   underscores disappear; other characters keep their case.</li>
 * </ul>
 */
public final class Names {

    private Names() {}

    /** Upper-case the first character only. */
    public static String capitalize(String in) {
        requireNonNull(in);
        if (in.isEmpty()) return in;
        return Character.toUpperCase(in.charAt(0)) + in.substring(1);
    }

    /** Lower-case the first character only. */
    public static String decapitalize(String in) {
        requireNonNull(in);
        if (in.isEmpty()) return in;
        return Character.toLowerCase(in.charAt(0)) + in.substring(1);
    }

    public static String lowercase(String in) {
        requireNonNull(in);
        return in.toLowerCase(Locale.ROOT);
    }

    /** {@code aMultiWord -> a_multi_word}, {@code CamelCase -> camel_case}, {@code name -> name}. */
    public static String underscore(String in) {
        requireNonNull(in);
        if (in.isEmpty()) return in;
        StringBuilder out = new StringBuilder(in.length() + 8);
        out.append(Character.toLowerCase(in.charAt(0)));
        for (int i = 1; i < in.length(); i++) {
            char c = in.charAt(i);
            if (Character.isUpperCase(c)) {
                out.append('_').append(Character.toLowerCase(c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    /** {@code a_multi_word -> aMultiWord}, {@code some_name -> someName}, {@code name -> name}. */
    public static String camelcase(String in) {
        requireNonNull(in);
        StringBuilder out = new StringBuilder(in.length());
        boolean afterUnderscore = false;
        for (int i = 0; i < in.length(); i++) {
            char c = in.charAt(i);
            if (c == '_') {
                afterUnderscore = true;
                continue;
            }
            if (afterUnderscore) {
                out.append(Character.toUpperCase(c));
                afterUnderscore = false;
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static void requireNonNull(String in) {
        if (in == null) throw new IllegalArgumentException("name is null");
    }
}
