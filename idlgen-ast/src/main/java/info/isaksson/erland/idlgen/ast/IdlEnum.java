package info.isaksson.erland.idlgen.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Enum declaration.
 *
 * <p>Values without an explicit number continue from the previous value (explicit or implicit)
 * plus one; the first one defaults to 0. After construction every value is numbered.</p>
 */
@JsonPropertyOrder({"name","values","doc"})
public final class IdlEnum {
    public final String name;
    public final List<IdlEnumValue> values;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String doc;

    @JsonCreator
    public IdlEnum(
            @JsonProperty("name") String name,
            @JsonProperty("values") List<IdlEnumValue> values,
            @JsonProperty("doc") String doc
    ) {
        this.name = Objects.requireNonNull(name, "enum name must not be null");
        this.values = assignValues(values);
        this.doc = doc;
    }

    public IdlEnum(String name, List<IdlEnumValue> values) {
        this(name, values, null);
    }

    /** Looks up a constant by name, or returns null. */
    public IdlEnumValue find(String valueName) {
        for (IdlEnumValue v : values) {
            if (v.name.equals(valueName)) return v;
        }
        return null;
    }

    private static List<IdlEnumValue> assignValues(List<IdlEnumValue> in) {
        if (in == null) return List.of();
        List<IdlEnumValue> out = new ArrayList<>(in.size());
        int next = 0;
        for (IdlEnumValue v : in) {
            if (v == null) continue;
            int assigned = v.value != null ? v.value : next;
            out.add(v.value != null ? v : new IdlEnumValue(v.name, assigned, v.doc));
            next = assigned + 1;
        }
        return List.copyOf(out);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdlEnum)) return false;
        IdlEnum that = (IdlEnum) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(values, that.values) &&
                Objects.equals(doc, that.doc);
    }

    @Override public int hashCode() {
        return Objects.hash(name, values, doc);
    }

    @Override public String toString() {
        return "enum " + name;
    }
}
