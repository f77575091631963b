package info.isaksson.erland.idlgen.naming;

/**
 * Allocates temporary variable names ({@code prefix + n}). The counter is shared by all prefixes
 * and only guarantees uniqueness within one instance.
 */
public final class TempNames {

    private int counter;

    public String next(String prefix) {
        if (prefix == null) throw new IllegalArgumentException("prefix is null");
        return prefix + counter++;
    }
}
