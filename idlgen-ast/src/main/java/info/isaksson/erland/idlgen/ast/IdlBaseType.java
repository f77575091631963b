package info.isaksson.erland.idlgen.ast;

/**
 * Primitive types, keyed by the keyword used in IDL sources.
 */
public enum IdlBaseType {
    VOID("void"),
    BOOL("bool"),
    BYTE("byte"),
    I16("i16"),
    I32("i32"),
    I64("i64"),
    DOUBLE("double"),
    STRING("string"),
    BINARY("binary");

    public final String keyword;

    IdlBaseType(String keyword) {
        this.keyword = keyword;
    }

    public static IdlBaseType fromKeyword(String v) {
        if (v == null) throw new IllegalArgumentException("primitive type keyword is null");
        String s = v.trim().toLowerCase();
        for (IdlBaseType t : values()) {
            if (t.keyword.equals(s)) return t;
        }
        throw new IllegalArgumentException("Unknown primitive type: " + v
                + " (expected one of: void|bool|byte|i16|i32|i64|double|string|binary)");
    }
}
