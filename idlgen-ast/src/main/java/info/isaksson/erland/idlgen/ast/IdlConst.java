package info.isaksson.erland.idlgen.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"name","type","value","doc"})
public final class IdlConst {
    public final String name;
    public final IdlType type;
    public final IdlConstValue value;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String doc;

    @JsonCreator
    public IdlConst(
            @JsonProperty("name") String name,
            @JsonProperty("type") IdlType type,
            @JsonProperty("value") IdlConstValue value,
            @JsonProperty("doc") String doc
    ) {
        this.name = Objects.requireNonNull(name, "const name must not be null");
        this.type = Objects.requireNonNull(type, "const type must not be null");
        this.value = Objects.requireNonNull(value, "const value must not be null");
        this.doc = doc;
    }

    public IdlConst(String name, IdlType type, IdlConstValue value) {
        this(name, type, value, null);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdlConst)) return false;
        IdlConst that = (IdlConst) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(type, that.type) &&
                Objects.equals(value, that.value) &&
                Objects.equals(doc, that.doc);
    }

    @Override public int hashCode() {
        return Objects.hash(name, type, value, doc);
    }

    @Override public String toString() {
        return "const " + type + " " + name + " = " + value;
    }
}
