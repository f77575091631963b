package info.isaksson.erland.idlgen.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonPropertyOrder({"name","extends","functions","doc"})
public final class IdlService {
    public final String name;

    /** Name of the extended service, possibly include-qualified; null when there is none. */
    @JsonProperty("extends")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String extendsName;

    public final List<IdlFunction> functions;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String doc;

    @JsonCreator
    public IdlService(
            @JsonProperty("name") String name,
            @JsonProperty("extends") String extendsName,
            @JsonProperty("functions") List<IdlFunction> functions,
            @JsonProperty("doc") String doc
    ) {
        this.name = Objects.requireNonNull(name, "service name must not be null");
        this.extendsName = extendsName;
        this.functions = functions == null ? List.of() : List.copyOf(functions);
        this.doc = doc;
    }

    public IdlService(String name, String extendsName, List<IdlFunction> functions) {
        this(name, extendsName, functions, null);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdlService)) return false;
        IdlService that = (IdlService) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(extendsName, that.extendsName) &&
                Objects.equals(functions, that.functions) &&
                Objects.equals(doc, that.doc);
    }

    @Override public int hashCode() {
        return Objects.hash(name, extendsName, functions, doc);
    }

    @Override public String toString() {
        return "service " + name + (extendsName == null ? "" : " extends " + extendsName);
    }
}
