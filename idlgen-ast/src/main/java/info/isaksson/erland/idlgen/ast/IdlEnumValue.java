package info.isaksson.erland.idlgen.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One enum constant. {@link #value} is null only before the owning {@link IdlEnum} assigned
 * implicit values.
 */
@JsonPropertyOrder({"name","value","doc"})
public final class IdlEnumValue {
    public final String name;
    public final Integer value;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String doc;

    @JsonCreator
    public IdlEnumValue(
            @JsonProperty("name") String name,
            @JsonProperty("value") Integer value,
            @JsonProperty("doc") String doc
    ) {
        this.name = Objects.requireNonNull(name, "enum value name must not be null");
        this.value = value;
        this.doc = doc;
    }

    public IdlEnumValue(String name, Integer value) {
        this(name, value, null);
    }

    /** Implicit value, assigned by the enum. */
    public static IdlEnumValue implicit(String name) {
        return new IdlEnumValue(name, null, null);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdlEnumValue)) return false;
        IdlEnumValue that = (IdlEnumValue) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(value, that.value) &&
                Objects.equals(doc, that.doc);
    }

    @Override public int hashCode() {
        return Objects.hash(name, value, doc);
    }

    @Override public String toString() {
        return name + " = " + value;
    }
}
