package info.isaksson.erland.idlgen.ast;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Read-only name lookups over a program and its includes.
 *
 * <p>Unqualified names are looked up in the scope program; {@code inc.Name} is looked up in the
 * included program named {@code inc}. Nothing here has side effects on the AST or on any
 * generator.</p>
 */
public final class IdlTypeResolver {

    private final IdlProgram program;

    public IdlTypeResolver(IdlProgram program) {
        if (program == null) throw new IllegalArgumentException("program is null");
        this.program = program;
    }

    /**
     * Follow typedef aliases until a non-typedef type is reached.
     *
     * <p>Aliases resolved by name continue in the scope of the program that declared the
     * typedef. Names in the result are qualified relative to this program, so a typedef in
     * {@code shared} aliasing its own {@code Item} resolves to {@code shared.Item}. A typedef
     * reached twice is a cycle.</p>
     *
     * @throws TypeResolutionException on a cycle or an undeclared typedef name
     */
    public IdlType trueType(IdlType type) {
        if (type == null) throw new IllegalArgumentException("type is null");
        IdlType current = type;
        IdlProgram scope = program;
        String prefix = "";
        Set<String> seen = new LinkedHashSet<>();
        while (current.isTypedef()) {
            Scoped target = scopeOf(scope, current.name);
            if (current.aliased != null) {
                if (target != null) {
                    prefix += qualifierOf(current.name);
                    scope = target.program;
                }
                current = current.aliased;
                continue;
            }
            if (target == null) {
                throw new TypeResolutionException("Unknown typedef: " + current.name);
            }
            String key = target.program.name + "." + target.simpleName;
            if (!seen.add(key)) {
                throw new TypeResolutionException("Typedef cycle: " + String.join(" -> ", seen) + " -> " + key);
            }
            IdlTypedef def = find(target.program.typedefs, target.simpleName, t -> t.name);
            if (def == null) {
                throw new TypeResolutionException("Unknown typedef: " + current.name);
            }
            prefix += qualifierOf(current.name);
            scope = target.program;
            current = def.type;
        }
        return prefix.isEmpty() ? current : qualify(current, prefix);
    }

    /** Include qualifier of {@code name} including the trailing dot, or "" when unqualified. */
    private static String qualifierOf(String name) {
        int dot = name == null ? -1 : name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(0, dot + 1);
    }

    /** Copy of {@code t} with every declared name prefixed by {@code prefix}. */
    private static IdlType qualify(IdlType t, String prefix) {
        if (t == null) return null;
        switch (t.kind) {
            case PRIMITIVE:
                return t;
            case LIST:
            case SET:
                return new IdlType(t.kind, t.name, qualify(t.elementType, prefix), null, null, null);
            case MAP:
                return new IdlType(t.kind, t.name, null, qualify(t.keyType, prefix), qualify(t.valueType, prefix), null);
            default:
                return new IdlType(t.kind, prefix + t.name, null, null, null, qualify(t.aliased, prefix));
        }
    }

    public IdlTypedef findTypedef(String name) {
        return lookup(name, p -> p.typedefs, t -> t.name);
    }

    public IdlStruct findStruct(String name) {
        return lookup(name, p -> p.structs, s -> s.name);
    }

    public IdlEnum findEnum(String name) {
        return lookup(name, p -> p.enums, e -> e.name);
    }

    public IdlService findService(String name) {
        return lookup(name, p -> p.services, s -> s.name);
    }

    public IdlConst findConst(String name) {
        return lookup(name, p -> p.consts, c -> c.name);
    }

    /**
     * Program whose scope {@code name} lives in once its include qualifiers are followed: this
     * program for an unqualified name, null for an unknown include.
     */
    public IdlProgram declaringProgram(String name) {
        Scoped scoped = scopeOf(program, name);
        return scoped == null ? null : scoped.program;
    }

    /**
     * Service chain from {@code service} up through its {@code extends} parents.
     *
     * @throws TypeResolutionException on an unknown parent or an extends cycle
     */
    public List<IdlService> serviceHierarchy(IdlService service) {
        List<IdlService> out = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        IdlService current = service;
        IdlProgram scope = program;
        while (current != null) {
            if (!seen.add(scope.name + "." + current.name)) {
                throw new TypeResolutionException("Service extends cycle at " + current.name);
            }
            out.add(current);
            if (current.extendsName == null) break;
            Scoped parent = scopeOf(scope, current.extendsName);
            IdlService next = parent == null ? null : find(parent.program.services, parent.simpleName, s -> s.name);
            if (next == null) {
                throw new TypeResolutionException("Unknown extended service: " + current.extendsName);
            }
            scope = parent.program;
            current = next;
        }
        return out;
    }

    private <T> T lookup(String name, Function<IdlProgram, List<T>> decls, Function<T, String> nameOf) {
        Scoped scoped = scopeOf(program, name);
        return scoped == null ? null : find(decls.apply(scoped.program), scoped.simpleName, nameOf);
    }

    private static <T> T find(List<T> decls, String simpleName, Function<T, String> nameOf) {
        for (T d : decls) {
            if (simpleName.equals(nameOf.apply(d))) return d;
        }
        return null;
    }

    private static Scoped scopeOf(IdlProgram scope, String name) {
        if (name == null) return null;
        int dot = name.indexOf('.');
        if (dot < 0) return new Scoped(scope, name);
        String includeName = name.substring(0, dot);
        for (IdlProgram inc : scope.includes) {
            if (inc.name.equals(includeName)) {
                return scopeOf(inc, name.substring(dot + 1));
            }
        }
        return null;
    }

    private static final class Scoped {
        final IdlProgram program;
        final String simpleName;

        Scoped(IdlProgram program, String simpleName) {
            this.program = program;
            this.simpleName = simpleName;
        }
    }
}
