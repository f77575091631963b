package info.isaksson.erland.idlgen.backend.java;

import info.isaksson.erland.idlgen.ast.IdlBaseType;
import info.isaksson.erland.idlgen.ast.IdlConst;
import info.isaksson.erland.idlgen.ast.IdlConstValue;
import info.isaksson.erland.idlgen.ast.IdlConstValueKind;
import info.isaksson.erland.idlgen.ast.IdlProgram;
import info.isaksson.erland.idlgen.ast.IdlType;
import info.isaksson.erland.idlgen.ast.IdlTypeKind;
import info.isaksson.erland.idlgen.ast.IdlTypeResolver;
import info.isaksson.erland.idlgen.ast.TypeResolutionException;
import info.isaksson.erland.idlgen.naming.Names;
import info.isaksson.erland.idlgen.naming.StringEscaper;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Maps IDL types and literals to Java source text.
 *
 * <p>Every method takes the import set of the compilation unit being rendered and adds the
 * {@code java.*} types the returned text needs. Typedefs are always replaced by their true type.</p>
 */
final class JavaTypes {

    private final IdlProgram program;
    private final IdlTypeResolver types;

    JavaTypes(IdlProgram program, IdlTypeResolver types) {
        this.program = program;
        this.types = types;
    }

    /** Java package for {@code p}: its {@code java} namespace, else null (default package). */
    static String packageOf(IdlProgram p) {
        String ns = p.namespace("java");
        return ns == null || ns.isBlank() ? null : ns.trim();
    }

    static String constantsClassName(IdlProgram p) {
        return Names.capitalize(Names.camelcase(p.name)) + "Constants";
    }

    /**
     * Name of a declared type as written from this program's package: simple for local
     * declarations, fully qualified for declarations of an included program.
     */
    String className(String declName) {
        IdlProgram owner = types.declaringProgram(declName);
        if (owner == null) {
            throw new TypeResolutionException("Unknown include in type name: " + declName);
        }
        return qualify(owner, simpleName(declName));
    }

    private String qualify(IdlProgram owner, String simple) {
        if (owner == program) return simple;
        String pkg = packageOf(owner);
        return pkg == null ? simple : pkg + "." + simple;
    }

    String javaType(IdlType type, Set<String> imports) {
        return javaType(type, false, imports);
    }

    String javaType(IdlType type, boolean boxed, Set<String> imports) {
        IdlType t = types.trueType(type);
        switch (t.kind) {
            case PRIMITIVE:
                return primitive(t.baseType(), boxed);
            case LIST:
                imports.add("java.util.List");
                return "List<" + javaType(t.elementType, true, imports) + ">";
            case SET:
                imports.add("java.util.Set");
                return "Set<" + javaType(t.elementType, true, imports) + ">";
            case MAP:
                imports.add("java.util.Map");
                return "Map<" + javaType(t.keyType, true, imports) + ", " + javaType(t.valueType, true, imports) + ">";
            case STRUCT:
            case ENUM:
            case SERVICE:
                return className(t.name);
            default:
                throw new IllegalStateException("Unresolved type: " + t);
        }
    }

    private static String primitive(IdlBaseType base, boolean boxed) {
        switch (base) {
            case VOID: return boxed ? "Void" : "void";
            case BOOL: return boxed ? "Boolean" : "boolean";
            case BYTE: return boxed ? "Byte" : "byte";
            case I16: return boxed ? "Short" : "short";
            case I32: return boxed ? "Integer" : "int";
            case I64: return boxed ? "Long" : "long";
            case DOUBLE: return boxed ? "Double" : "double";
            case STRING: return "String";
            case BINARY: return "byte[]";
            default: throw new IllegalStateException("Unhandled base type: " + base);
        }
    }

    /** True for types compared with {@code ==} in generated {@code equals}. */
    boolean isJavaPrimitive(IdlType type, boolean boxed) {
        if (boxed) return false;
        IdlType t = types.trueType(type);
        if (!t.isPrimitive()) return false;
        IdlBaseType b = t.baseType();
        return b != IdlBaseType.STRING && b != IdlBaseType.BINARY && b != IdlBaseType.VOID;
    }

    boolean isBinary(IdlType type) {
        IdlType t = types.trueType(type);
        return t.isPrimitive() && t.baseType() == IdlBaseType.BINARY;
    }

    boolean isDouble(IdlType type) {
        IdlType t = types.trueType(type);
        return t.isPrimitive() && t.baseType() == IdlBaseType.DOUBLE;
    }

    boolean isBool(IdlType type) {
        IdlType t = types.trueType(type);
        return t.isPrimitive() && t.baseType() == IdlBaseType.BOOL;
    }

    /**
     * Java expression for {@code value} typed as {@code type}. Collections become unmodifiable
     * insertion-ordered values; repeated set elements and map keys collapse the way
     * {@code add}/{@code put} would, with the last map value winning.
     *
     * @throws IllegalArgumentException when the value cannot be expressed as that type
     */
    String literal(IdlType type, IdlConstValue value, Set<String> imports) {
        IdlType t = types.trueType(type);
        if (value.kind == IdlConstValueKind.IDENTIFIER) {
            return identifier(t, value.identifier);
        }
        switch (t.kind) {
            case PRIMITIVE:
                return primitiveLiteral(t.baseType(), value, imports);
            case ENUM:
                return className(t.name) + ".findByValue(" + requireKind(value, IdlConstValueKind.INTEGER, t).intValue + ")";
            case LIST:
                imports.add("java.util.List");
                return "List.of(" + elements(t.elementType, requireKind(value, IdlConstValueKind.LIST, t).elements, imports) + ")";
            case SET: {
                List<IdlConstValue> values = requireKind(value, IdlConstValueKind.LIST, t).elements;
                if (values.isEmpty()) {
                    imports.add("java.util.Set");
                    return "Set.of()";
                }
                imports.add("java.util.Collections");
                return "Collections.unmodifiableSet(" + linkedSet(t, values, imports) + ")";
            }
            case MAP: {
                List<IdlConstValue.Entry> entries = requireKind(value, IdlConstValueKind.MAP, t).entries;
                if (entries.isEmpty()) {
                    imports.add("java.util.Map");
                    return "Map.of()";
                }
                imports.add("java.util.Collections");
                return "Collections.unmodifiableMap(" + linkedMap(t, entries, imports) + ")";
            }
            default:
                throw new IllegalArgumentException("No literal form for type " + t + ": " + value);
        }
    }

    /**
     * Like {@link #literal} but the outermost collection is a fresh mutable
     * {@code ArrayList}/{@code LinkedHashSet}/{@code LinkedHashMap}; used for field defaults.
     */
    String mutableLiteral(IdlType type, IdlConstValue value, Set<String> imports) {
        IdlType t = types.trueType(type);
        if (!t.isContainer()) {
            return literal(type, value, imports);
        }
        if (t.kind == IdlTypeKind.LIST || value.kind == IdlConstValueKind.IDENTIFIER) {
            return mutableCopy(t, literal(type, value, imports), imports);
        }
        if (t.kind == IdlTypeKind.SET) {
            List<IdlConstValue> values = requireKind(value, IdlConstValueKind.LIST, t).elements;
            if (values.isEmpty()) {
                imports.add("java.util.LinkedHashSet");
                return "new LinkedHashSet<>()";
            }
            return linkedSet(t, values, imports);
        }
        List<IdlConstValue.Entry> entries = requireKind(value, IdlConstValueKind.MAP, t).entries;
        if (entries.isEmpty()) {
            imports.add("java.util.LinkedHashMap");
            return "new LinkedHashMap<>()";
        }
        return linkedMap(t, entries, imports);
    }

    private static String mutableCopy(IdlType t, String expression, Set<String> imports) {
        switch (t.kind) {
            case LIST:
                imports.add("java.util.ArrayList");
                return "new ArrayList<>(" + expression + ")";
            case SET:
                imports.add("java.util.LinkedHashSet");
                return "new LinkedHashSet<>(" + expression + ")";
            default:
                imports.add("java.util.LinkedHashMap");
                return "new LinkedHashMap<>(" + expression + ")";
        }
    }

    /** {@code new LinkedHashSet<>(Arrays.asList(...))}; tolerates repeated elements. */
    private String linkedSet(IdlType t, List<IdlConstValue> values, Set<String> imports) {
        imports.add("java.util.Arrays");
        imports.add("java.util.LinkedHashSet");
        return "new LinkedHashSet<>(Arrays.asList(" + elements(t.elementType, values, imports) + "))";
    }

    /** Entries collected into a {@code LinkedHashMap}; a repeated key keeps its last value. */
    private String linkedMap(IdlType t, List<IdlConstValue.Entry> entries, Set<String> imports) {
        imports.add("java.util.LinkedHashMap");
        imports.add("java.util.Map");
        imports.add("java.util.stream.Collectors");
        imports.add("java.util.stream.Stream");
        List<String> parts = new ArrayList<>();
        for (IdlConstValue.Entry e : entries) {
            parts.add("Map.entry(" + literal(t.keyType, e.key, imports) + ", " + literal(t.valueType, e.value, imports) + ")");
        }
        return "Stream.of(" + String.join(", ", parts) + ")"
                + ".collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (previous, latest) -> latest, LinkedHashMap::new))";
    }

    private String elements(IdlType elementType, List<IdlConstValue> values, Set<String> imports) {
        List<String> parts = new ArrayList<>(values.size());
        for (IdlConstValue v : values) {
            parts.add(literal(elementType, v, imports));
        }
        return String.join(", ", parts);
    }

    private String primitiveLiteral(IdlBaseType base, IdlConstValue value, Set<String> imports) {
        switch (base) {
            case BOOL:
                return requireKind(value, IdlConstValueKind.INTEGER, base).intValue != 0 ? "true" : "false";
            case BYTE:
                return "(byte) " + inRange(value, base, Byte.MIN_VALUE, Byte.MAX_VALUE);
            case I16:
                return "(short) " + inRange(value, base, Short.MIN_VALUE, Short.MAX_VALUE);
            case I32:
                return String.valueOf(inRange(value, base, Integer.MIN_VALUE, Integer.MAX_VALUE));
            case I64:
                return requireKind(value, IdlConstValueKind.INTEGER, base).intValue + "L";
            case DOUBLE:
                if (value.kind == IdlConstValueKind.INTEGER) return value.intValue + ".0";
                return doubleLiteral(requireKind(value, IdlConstValueKind.DOUBLE, base).doubleValue);
            case STRING:
                return quote(requireKind(value, IdlConstValueKind.STRING, base).stringValue);
            case BINARY:
                imports.add("java.nio.charset.StandardCharsets");
                return quote(requireKind(value, IdlConstValueKind.STRING, base).stringValue) + ".getBytes(StandardCharsets.UTF_8)";
            default:
                throw new IllegalArgumentException("No literal form for " + base.keyword + ": " + value);
        }
    }

    private static long inRange(IdlConstValue value, IdlBaseType base, long min, long max) {
        long v = requireKind(value, IdlConstValueKind.INTEGER, base).intValue;
        if (v < min || v > max) {
            throw new IllegalArgumentException("Value " + v + " is out of range for " + base.keyword);
        }
        return v;
    }

    private static String doubleLiteral(double d) {
        if (Double.isNaN(d)) return "Double.NaN";
        if (d == Double.POSITIVE_INFINITY) return "Double.POSITIVE_INFINITY";
        if (d == Double.NEGATIVE_INFINITY) return "Double.NEGATIVE_INFINITY";
        return String.valueOf(d);
    }

    /** Enum constants become {@code Enum.NAME}; names of consts refer to the constants class. */
    private String identifier(IdlType t, String id) {
        if (t.kind == IdlTypeKind.ENUM) {
            return className(t.name) + "." + simpleName(id);
        }
        IdlConst c = types.findConst(id);
        if (c != null) {
            IdlProgram owner = types.declaringProgram(id);
            return qualify(owner, constantsClassName(owner)) + "." + c.name;
        }
        if (t.isPrimitive() && t.baseType() == IdlBaseType.BOOL && ("true".equals(id) || "false".equals(id))) {
            return id;
        }
        throw new IllegalArgumentException("Unknown identifier '" + id + "' for type " + t);
    }

    static String quote(String s) {
        return '"' + StringEscaper.escape(s) + '"';
    }

    private static IdlConstValue requireKind(IdlConstValue v, IdlConstValueKind kind, Object type) {
        if (v.kind != kind) {
            throw new IllegalArgumentException("Value " + v + " is not valid for type " + type);
        }
        return v;
    }

    private static String simpleName(String declName) {
        int dot = declName.lastIndexOf('.');
        return dot < 0 ? declName : declName.substring(dot + 1);
    }
}
