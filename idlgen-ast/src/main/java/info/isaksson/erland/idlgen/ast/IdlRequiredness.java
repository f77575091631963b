package info.isaksson.erland.idlgen.ast;

/** Per-field optionality marker. */
public enum IdlRequiredness {
    REQUIRED,
    OPTIONAL,
    /** Neither keyword was written in the source. */
    DEFAULT
}
