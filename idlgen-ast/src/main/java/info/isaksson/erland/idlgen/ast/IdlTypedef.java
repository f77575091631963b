package info.isaksson.erland.idlgen.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** {@code typedef <type> <name>} declaration. */
@JsonPropertyOrder({"name","type","doc"})
public final class IdlTypedef {
    public final String name;
    public final IdlType type;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String doc;

    @JsonCreator
    public IdlTypedef(
            @JsonProperty("name") String name,
            @JsonProperty("type") IdlType type,
            @JsonProperty("doc") String doc
    ) {
        this.name = Objects.requireNonNull(name, "typedef name must not be null");
        this.type = Objects.requireNonNull(type, "typedef type must not be null");
        this.doc = doc;
    }

    public IdlTypedef(String name, IdlType type) {
        this(name, type, null);
    }

    /** A use-site reference to this typedef. */
    public IdlType asType() {
        return IdlType.typedef(name);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdlTypedef)) return false;
        IdlTypedef that = (IdlTypedef) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(type, that.type) &&
                Objects.equals(doc, that.doc);
    }

    @Override public int hashCode() {
        return Objects.hash(name, type, doc);
    }

    @Override public String toString() {
        return "typedef " + type + " " + name;
    }
}
