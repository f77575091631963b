package info.isaksson.erland.idlgen.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root of the AST: one parsed IDL file.
 *
 * <p>Every declaration list keeps source declaration order. Structs and exceptions share one
 * list (see {@link IdlStruct#isException}). Instances are immutable; generators only read them.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name","path","outPath","namespaces","includes","typedefs","enums","consts","structs","services"})
public final class IdlProgram {
    public final String name;

    /** Path of the IDL source this program was parsed from. */
    public final String path;

    /** Output root under which every generator creates its own sub-directory. */
    public final String outPath;

    /** Namespace per scope, e.g. {@code java -> com.example}. Insertion order is kept. */
    public final Map<String, String> namespaces;

    public final List<IdlProgram> includes;
    public final List<IdlTypedef> typedefs;
    public final List<IdlEnum> enums;
    public final List<IdlConst> consts;
    public final List<IdlStruct> structs;
    public final List<IdlService> services;

    @JsonCreator
    public IdlProgram(
            @JsonProperty("name") String name,
            @JsonProperty("path") String path,
            @JsonProperty("outPath") String outPath,
            @JsonProperty("namespaces") Map<String, String> namespaces,
            @JsonProperty("includes") List<IdlProgram> includes,
            @JsonProperty("typedefs") List<IdlTypedef> typedefs,
            @JsonProperty("enums") List<IdlEnum> enums,
            @JsonProperty("consts") List<IdlConst> consts,
            @JsonProperty("structs") List<IdlStruct> structs,
            @JsonProperty("services") List<IdlService> services
    ) {
        this.name = Objects.requireNonNull(name, "program name must not be null");
        this.path = path;
        this.outPath = outPath == null ? "." : outPath;
        this.namespaces = namespaces == null || namespaces.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(namespaces));
        this.includes = copy(includes);
        this.typedefs = copy(typedefs);
        this.enums = copy(enums);
        this.consts = copy(consts);
        this.structs = copy(structs);
        this.services = copy(services);
    }

    private static <T> List<T> copy(List<T> in) {
        return in == null ? List.of() : List.copyOf(in);
    }

    /** Namespace declared for {@code scope}, falling back to the {@code *} scope, else null. */
    public String namespace(String scope) {
        String ns = namespaces.get(scope);
        return ns != null ? ns : namespaces.get("*");
    }

    /**
     * Copy of this program (and, recursively, its includes) rooted at another output path.
     * This program is left untouched.
     */
    public IdlProgram withOutPath(String newOutPath) {
        List<IdlProgram> movedIncludes = new ArrayList<>(includes.size());
        for (IdlProgram inc : includes) {
            movedIncludes.add(inc.withOutPath(newOutPath));
        }
        return new IdlProgram(name, path, newOutPath, namespaces, movedIncludes,
                typedefs, enums, consts, structs, services);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Convenience builder for programs assembled in code (tests, adapters). */
    public static final class Builder {
        private final String name;
        private String path;
        private String outPath;
        private final Map<String, String> namespaces = new LinkedHashMap<>();
        private final List<IdlProgram> includes = new ArrayList<>();
        private final List<IdlTypedef> typedefs = new ArrayList<>();
        private final List<IdlEnum> enums = new ArrayList<>();
        private final List<IdlConst> consts = new ArrayList<>();
        private final List<IdlStruct> structs = new ArrayList<>();
        private final List<IdlService> services = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder path(String path) { this.path = path; return this; }
        public Builder outPath(String outPath) { this.outPath = outPath; return this; }
        public Builder namespace(String scope, String ns) { namespaces.put(scope, ns); return this; }
        public Builder include(IdlProgram p) { includes.add(p); return this; }
        public Builder typedef(IdlTypedef t) { typedefs.add(t); return this; }
        public Builder enumDecl(IdlEnum e) { enums.add(e); return this; }
        public Builder constDecl(IdlConst c) { consts.add(c); return this; }
        public Builder struct(IdlStruct s) { structs.add(s); return this; }
        public Builder service(IdlService s) { services.add(s); return this; }

        public IdlProgram build() {
            return new IdlProgram(name, path, outPath, namespaces, includes,
                    typedefs, enums, consts, structs, services);
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdlProgram)) return false;
        IdlProgram that = (IdlProgram) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(path, that.path) &&
                Objects.equals(outPath, that.outPath) &&
                Objects.equals(namespaces, that.namespaces) &&
                Objects.equals(includes, that.includes) &&
                Objects.equals(typedefs, that.typedefs) &&
                Objects.equals(enums, that.enums) &&
                Objects.equals(consts, that.consts) &&
                Objects.equals(structs, that.structs) &&
                Objects.equals(services, that.services);
    }

    @Override public int hashCode() {
        return Objects.hash(name, path, outPath, namespaces, includes, typedefs, enums, consts, structs, services);
    }

    @Override public String toString() {
        return "program " + name;
    }
}
