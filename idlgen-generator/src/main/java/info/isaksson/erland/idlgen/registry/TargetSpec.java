package info.isaksson.erland.idlgen.registry;

import java.util.Objects;

/**
 * A target as written on the command line: {@code id} or {@code id:options}.
 */
public final class TargetSpec {
    public final String id;
    public final String options;

    public TargetSpec(String id, String options) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.options = options == null ? "" : options;
    }

    /**
     * @throws IllegalArgumentException for a blank value or an empty id
     */
    public static TargetSpec parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Target must not be blank");
        }
        String s = value.trim();
        int colon = s.indexOf(':');
        String id = (colon < 0 ? s : s.substring(0, colon)).trim();
        String options = colon < 0 ? "" : s.substring(colon + 1).trim();
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Invalid target (empty generator name): " + value);
        }
        return new TargetSpec(id, options);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TargetSpec)) return false;
        TargetSpec that = (TargetSpec) o;
        return id.equals(that.id) && options.equals(that.options);
    }

    @Override public int hashCode() {
        return Objects.hash(id, options);
    }

    @Override public String toString() {
        return options.isEmpty() ? id : id + ":" + options;
    }
}
