package info.isaksson.erland.idlgen.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Struct member, function parameter or declared function exception.
 */
@JsonPropertyOrder({"id","name","type","requiredness","defaultValue","doc"})
public final class IdlField {
    public final int id;
    public final String name;
    public final IdlType type;
    public final IdlRequiredness requiredness;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IdlConstValue defaultValue;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String doc;

    @JsonCreator
    public IdlField(
            @JsonProperty("id") int id,
            @JsonProperty("name") String name,
            @JsonProperty("type") IdlType type,
            @JsonProperty("requiredness") IdlRequiredness requiredness,
            @JsonProperty("defaultValue") IdlConstValue defaultValue,
            @JsonProperty("doc") String doc
    ) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "field name must not be null");
        this.type = Objects.requireNonNull(type, "field type must not be null");
        this.requiredness = requiredness == null ? IdlRequiredness.DEFAULT : requiredness;
        this.defaultValue = defaultValue;
        this.doc = doc;
    }

    public IdlField(int id, String name, IdlType type) {
        this(id, name, type, IdlRequiredness.DEFAULT, null, null);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdlField)) return false;
        IdlField that = (IdlField) o;
        return id == that.id &&
                Objects.equals(name, that.name) &&
                Objects.equals(type, that.type) &&
                requiredness == that.requiredness &&
                Objects.equals(defaultValue, that.defaultValue) &&
                Objects.equals(doc, that.doc);
    }

    @Override public int hashCode() {
        return Objects.hash(id, name, type, requiredness, defaultValue, doc);
    }

    @Override public String toString() {
        return id + ": " + type + " " + name;
    }
}
