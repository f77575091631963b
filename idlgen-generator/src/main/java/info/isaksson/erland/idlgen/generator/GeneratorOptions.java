package info.isaksson.erland.idlgen.generator;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Backend options, written as {@code flag,key=value,...} after the target name on the command
 * line (e.g. {@code java:beans,indent=4}). Flags map to the empty string. Key order is kept.
 */
public final class GeneratorOptions {

    private static final GeneratorOptions EMPTY = new GeneratorOptions("", Collections.emptyMap());

    private final String raw;
    private final Map<String, String> values;

    private GeneratorOptions(String raw, Map<String, String> values) {
        this.raw = raw;
        this.values = values;
    }

    public static GeneratorOptions empty() {
        return EMPTY;
    }

    /**
     * @throws IllegalArgumentException on an empty key or a key given twice
     */
    public static GeneratorOptions parse(String raw) {
        if (raw == null || raw.isBlank()) return EMPTY;
        Map<String, String> out = new LinkedHashMap<>();
        for (String part : raw.split(",")) {
            String item = part.trim();
            if (item.isEmpty()) continue;
            int eq = item.indexOf('=');
            String key = (eq < 0 ? item : item.substring(0, eq)).trim();
            String value = eq < 0 ? "" : item.substring(eq + 1).trim();
            if (key.isEmpty()) {
                throw new IllegalArgumentException("Invalid generator option (empty name): " + item);
            }
            if (out.put(key, value) != null) {
                throw new IllegalArgumentException("Duplicate generator option: " + key);
            }
        }
        return new GeneratorOptions(raw.trim(), Collections.unmodifiableMap(out));
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    /** Value of {@code key}; the empty string for a flag; null when absent. */
    public String get(String key) {
        return values.get(key);
    }

    public String get(String key, String defaultValue) {
        String v = values.get(key);
        return v == null || v.isEmpty() ? defaultValue : v;
    }

    public int getInt(String key, int defaultValue) {
        String v = get(key, null);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for option " + key + ": " + v, e);
        }
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * @throws IllegalArgumentException naming the first option not in {@code known}
     */
    public void requireOnly(Collection<String> known, String target) {
        for (String key : values.keySet()) {
            if (!known.contains(key)) {
                throw new IllegalArgumentException("Unknown option '" + key + "' for generator '" + target
                        + "' (known: " + String.join(", ", new TreeSet<>(known)) + ")");
            }
        }
    }

    /** The option string as given, trimmed. */
    public String raw() {
        return raw;
    }

    @Override public String toString() {
        return raw;
    }
}
