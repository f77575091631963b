package info.isaksson.erland.idlgen.ast;

public enum IdlConstValueKind {
    INTEGER,
    DOUBLE,
    STRING,
    LIST,
    MAP,
    /** Reference to another const or to an enum value, e.g. {@code Operation.ADD}. */
    IDENTIFIER
}
