package info.isaksson.erland.idlgen.ast;

/**
 * The closed set of type variants an IDL program can reference.
 */
public enum IdlTypeKind {
    PRIMITIVE,
    LIST,
    SET,
    MAP,
    STRUCT,
    ENUM,
    SERVICE,
    TYPEDEF
}
