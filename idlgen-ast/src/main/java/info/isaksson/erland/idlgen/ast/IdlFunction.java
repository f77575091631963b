package info.isaksson.erland.idlgen.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Service function. Parameters and declared exceptions are fields, in source order.
 * A oneway function returns void and declares no exceptions.
 */
@JsonPropertyOrder({"name","returnType","parameters","exceptions","oneway","doc"})
public final class IdlFunction {
    public final String name;
    public final IdlType returnType;
    public final List<IdlField> parameters;
    public final List<IdlField> exceptions;
    public final boolean oneway;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String doc;

    @JsonCreator
    public IdlFunction(
            @JsonProperty("name") String name,
            @JsonProperty("returnType") IdlType returnType,
            @JsonProperty("parameters") List<IdlField> parameters,
            @JsonProperty("exceptions") List<IdlField> exceptions,
            @JsonProperty("oneway") boolean oneway,
            @JsonProperty("doc") String doc
    ) {
        this.name = Objects.requireNonNull(name, "function name must not be null");
        this.returnType = returnType == null ? IdlType.voidType() : returnType;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.exceptions = exceptions == null ? List.of() : List.copyOf(exceptions);
        this.oneway = oneway;
        this.doc = doc;
    }

    public IdlFunction(String name, IdlType returnType, List<IdlField> parameters, List<IdlField> exceptions) {
        this(name, returnType, parameters, exceptions, false, null);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdlFunction)) return false;
        IdlFunction that = (IdlFunction) o;
        return oneway == that.oneway &&
                Objects.equals(name, that.name) &&
                Objects.equals(returnType, that.returnType) &&
                Objects.equals(parameters, that.parameters) &&
                Objects.equals(exceptions, that.exceptions) &&
                Objects.equals(doc, that.doc);
    }

    @Override public int hashCode() {
        return Objects.hash(name, returnType, parameters, exceptions, oneway, doc);
    }

    @Override public String toString() {
        return (oneway ? "oneway " : "") + returnType + " " + name + parameters;
    }
}
