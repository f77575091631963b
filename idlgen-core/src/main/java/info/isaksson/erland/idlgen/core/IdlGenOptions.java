package info.isaksson.erland.idlgen.core;

/**
 * Options for a generation run, mirroring the CLI flags.
 */
public final class IdlGenOptions {

    /**
     * Output root; every generator writes to {@code <outputRoot>/gen-<target>/}. When null the
     * program's own output path is kept.
     */
    public String outputRoot = null;

    /** Also generate code for included programs (depth-first, before the including program). */
    public boolean recurse = false;
}
