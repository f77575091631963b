package info.isaksson.erland.idlgen.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** A struct, or an exception when {@link #isException} is set. */
@JsonPropertyOrder({"name","isException","fields","doc"})
public final class IdlStruct {
    public final String name;
    public final boolean isException;
    public final List<IdlField> fields;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String doc;

    @JsonCreator
    public IdlStruct(
            @JsonProperty("name") String name,
            @JsonProperty("isException") boolean isException,
            @JsonProperty("fields") List<IdlField> fields,
            @JsonProperty("doc") String doc
    ) {
        this.name = Objects.requireNonNull(name, "struct name must not be null");
        this.isException = isException;
        this.fields = fields == null ? List.of() : List.copyOf(fields);
        this.doc = doc;
    }

    public static IdlStruct struct(String name, List<IdlField> fields) {
        return new IdlStruct(name, false, fields, null);
    }

    public static IdlStruct exception(String name, List<IdlField> fields) {
        return new IdlStruct(name, true, fields, null);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdlStruct)) return false;
        IdlStruct that = (IdlStruct) o;
        return isException == that.isException &&
                Objects.equals(name, that.name) &&
                Objects.equals(fields, that.fields) &&
                Objects.equals(doc, that.doc);
    }

    @Override public int hashCode() {
        return Objects.hash(name, isException, fields, doc);
    }

    @Override public String toString() {
        return (isException ? "exception " : "struct ") + name;
    }
}
