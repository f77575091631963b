package info.isaksson.erland.idlgen.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Reference to a type as written at a use site (field, parameter, const, typedef).
 *
 * <p>Named kinds (STRUCT/ENUM/SERVICE/TYPEDEF) carry the declared name, optionally qualified
 * with the name of an included program ({@code shared.SharedStruct}). A TYPEDEF reference may
 * carry its aliased type inline; otherwise it is looked up by name, see {@link IdlTypeResolver}.</p>
 */
@JsonPropertyOrder({"kind","name","elementType","keyType","valueType","aliased"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IdlType {
    public final IdlTypeKind kind;

    /** For PRIMITIVE: the keyword. For named kinds: the (possibly qualified) declared name. */
    public final String name;

    /** For LIST/SET. */
    public final IdlType elementType;

    /** For MAP. */
    public final IdlType keyType;
    public final IdlType valueType;

    /** For TYPEDEF, when the producer resolved the alias inline. */
    public final IdlType aliased;

    @JsonCreator
    public IdlType(
            @JsonProperty("kind") IdlTypeKind kind,
            @JsonProperty("name") String name,
            @JsonProperty("elementType") IdlType elementType,
            @JsonProperty("keyType") IdlType keyType,
            @JsonProperty("valueType") IdlType valueType,
            @JsonProperty("aliased") IdlType aliased
    ) {
        if (kind == null) throw new IllegalArgumentException("type kind is null");
        this.kind = kind;
        this.name = name;
        this.elementType = elementType;
        this.keyType = keyType;
        this.valueType = valueType;
        this.aliased = aliased;
    }

    public static IdlType primitive(IdlBaseType base) {
        return new IdlType(IdlTypeKind.PRIMITIVE, base.keyword, null, null, null, null);
    }

    public static IdlType voidType() { return primitive(IdlBaseType.VOID); }
    public static IdlType bool() { return primitive(IdlBaseType.BOOL); }
    public static IdlType i32() { return primitive(IdlBaseType.I32); }
    public static IdlType i64() { return primitive(IdlBaseType.I64); }
    public static IdlType string() { return primitive(IdlBaseType.STRING); }

    public static IdlType listOf(IdlType element) {
        return new IdlType(IdlTypeKind.LIST, null, element, null, null, null);
    }

    public static IdlType setOf(IdlType element) {
        return new IdlType(IdlTypeKind.SET, null, element, null, null, null);
    }

    public static IdlType mapOf(IdlType key, IdlType value) {
        return new IdlType(IdlTypeKind.MAP, null, null, key, value, null);
    }

    public static IdlType struct(String name) {
        return new IdlType(IdlTypeKind.STRUCT, name, null, null, null, null);
    }

    public static IdlType enumType(String name) {
        return new IdlType(IdlTypeKind.ENUM, name, null, null, null, null);
    }

    public static IdlType service(String name) {
        return new IdlType(IdlTypeKind.SERVICE, name, null, null, null, null);
    }

    /** Typedef reference resolved by name against the program's typedef declarations. */
    public static IdlType typedef(String name) {
        return new IdlType(IdlTypeKind.TYPEDEF, name, null, null, null, null);
    }

    /** Typedef reference carrying its aliased type inline. */
    public static IdlType typedef(String name, IdlType aliased) {
        return new IdlType(IdlTypeKind.TYPEDEF, name, null, null, null, aliased);
    }

    public boolean isTypedef() {
        return kind == IdlTypeKind.TYPEDEF;
    }

    public boolean isPrimitive() {
        return kind == IdlTypeKind.PRIMITIVE;
    }

    public boolean isContainer() {
        return kind == IdlTypeKind.LIST || kind == IdlTypeKind.SET || kind == IdlTypeKind.MAP;
    }

    public boolean isVoid() {
        return kind == IdlTypeKind.PRIMITIVE && IdlBaseType.VOID.keyword.equals(name);
    }

    /** The primitive kind; only valid for PRIMITIVE references. */
    public IdlBaseType baseType() {
        if (kind != IdlTypeKind.PRIMITIVE) {
            throw new IllegalStateException("not a primitive type: " + this);
        }
        return IdlBaseType.fromKeyword(name);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdlType)) return false;
        IdlType that = (IdlType) o;
        return kind == that.kind &&
                Objects.equals(name, that.name) &&
                Objects.equals(elementType, that.elementType) &&
                Objects.equals(keyType, that.keyType) &&
                Objects.equals(valueType, that.valueType) &&
                Objects.equals(aliased, that.aliased);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, name, elementType, keyType, valueType, aliased);
    }

    @Override public String toString() {
        switch (kind) {
            case LIST:
                return "list<" + elementType + ">";
            case SET:
                return "set<" + elementType + ">";
            case MAP:
                return "map<" + keyType + "," + valueType + ">";
            default:
                return String.valueOf(name);
        }
    }
}
