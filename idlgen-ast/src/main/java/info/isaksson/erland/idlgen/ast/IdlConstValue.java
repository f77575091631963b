package info.isaksson.erland.idlgen.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Literal value of a const or of a field default.
 *
 * <p>Exactly one payload field is set, depending on {@link #kind}. Map entries keep their
 * source order.</p>
 */
@JsonPropertyOrder({"kind","intValue","doubleValue","stringValue","identifier","elements","entries"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IdlConstValue {
    public final IdlConstValueKind kind;
    public final Long intValue;
    public final Double doubleValue;
    public final String stringValue;
    public final String identifier;
    public final List<IdlConstValue> elements;
    public final List<Entry> entries;

    @JsonCreator
    public IdlConstValue(
            @JsonProperty("kind") IdlConstValueKind kind,
            @JsonProperty("intValue") Long intValue,
            @JsonProperty("doubleValue") Double doubleValue,
            @JsonProperty("stringValue") String stringValue,
            @JsonProperty("identifier") String identifier,
            @JsonProperty("elements") List<IdlConstValue> elements,
            @JsonProperty("entries") List<Entry> entries
    ) {
        if (kind == null) throw new IllegalArgumentException("const value kind is null");
        this.kind = kind;
        this.intValue = intValue;
        this.doubleValue = doubleValue;
        this.stringValue = stringValue;
        this.identifier = identifier;
        this.elements = kind == IdlConstValueKind.LIST ? copy(elements) : null;
        this.entries = kind == IdlConstValueKind.MAP ? copy(entries) : null;
    }

    public static IdlConstValue ofInt(long v) {
        return new IdlConstValue(IdlConstValueKind.INTEGER, v, null, null, null, null, null);
    }

    public static IdlConstValue ofDouble(double v) {
        return new IdlConstValue(IdlConstValueKind.DOUBLE, null, v, null, null, null, null);
    }

    public static IdlConstValue ofString(String v) {
        return new IdlConstValue(IdlConstValueKind.STRING, null, null, v, null, null, null);
    }

    public static IdlConstValue identifier(String name) {
        return new IdlConstValue(IdlConstValueKind.IDENTIFIER, null, null, null, name, null, null);
    }

    public static IdlConstValue list(List<IdlConstValue> elements) {
        return new IdlConstValue(IdlConstValueKind.LIST, null, null, null, null, elements, null);
    }

    public static IdlConstValue map(List<Entry> entries) {
        return new IdlConstValue(IdlConstValueKind.MAP, null, null, null, null, null, entries);
    }

    public static Entry entry(IdlConstValue key, IdlConstValue value) {
        return new Entry(key, value);
    }

    private static <T> List<T> copy(List<T> in) {
        return in == null ? List.of() : List.copyOf(in);
    }

    @JsonPropertyOrder({"key","value"})
    public static final class Entry {
        public final IdlConstValue key;
        public final IdlConstValue value;

        @JsonCreator
        public Entry(
                @JsonProperty("key") IdlConstValue key,
                @JsonProperty("value") IdlConstValue value
        ) {
            this.key = key;
            this.value = value;
        }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Entry)) return false;
            Entry that = (Entry) o;
            return Objects.equals(key, that.key) && Objects.equals(value, that.value);
        }

        @Override public int hashCode() {
            return Objects.hash(key, value);
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdlConstValue)) return false;
        IdlConstValue that = (IdlConstValue) o;
        return kind == that.kind &&
                Objects.equals(intValue, that.intValue) &&
                Objects.equals(doubleValue, that.doubleValue) &&
                Objects.equals(stringValue, that.stringValue) &&
                Objects.equals(identifier, that.identifier) &&
                Objects.equals(elements, that.elements) &&
                Objects.equals(entries, that.entries);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, intValue, doubleValue, stringValue, identifier, elements, entries);
    }

    @Override public String toString() {
        switch (kind) {
            case INTEGER:
                return String.valueOf(intValue);
            case DOUBLE:
                return String.valueOf(doubleValue);
            case STRING:
                return '"' + stringValue + '"';
            case IDENTIFIER:
                return identifier;
            case LIST:
                return String.valueOf(elements);
            default:
                StringBuilder sb = new StringBuilder("{");
                for (int i = 0; i < entries.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(entries.get(i).key).append(": ").append(entries.get(i).value);
                }
                return sb.append('}').toString();
        }
    }
}
