package info.isaksson.erland.idlgen.backend.java;

import info.isaksson.erland.idlgen.ast.IdlConst;
import info.isaksson.erland.idlgen.ast.IdlConstValue;
import info.isaksson.erland.idlgen.ast.IdlConstValueKind;
import info.isaksson.erland.idlgen.ast.IdlEnum;
import info.isaksson.erland.idlgen.ast.IdlEnumValue;
import info.isaksson.erland.idlgen.ast.IdlField;
import info.isaksson.erland.idlgen.ast.IdlFunction;
import info.isaksson.erland.idlgen.ast.IdlProgram;
import info.isaksson.erland.idlgen.ast.IdlRequiredness;
import info.isaksson.erland.idlgen.ast.IdlService;
import info.isaksson.erland.idlgen.ast.IdlStruct;
import info.isaksson.erland.idlgen.ast.IdlType;
import info.isaksson.erland.idlgen.ast.IdlTypeKind;
import info.isaksson.erland.idlgen.ast.IdlTypedef;
import info.isaksson.erland.idlgen.generator.AbstractGenerator;
import info.isaksson.erland.idlgen.generator.GeneratorOptions;
import info.isaksson.erland.idlgen.naming.DocComments;
import info.isaksson.erland.idlgen.naming.Names;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Java backend: one compilation unit per enum, struct, exception and service below
 * {@code gen-java/<package path>/}, plus {@code <Program>Constants} for the consts.
 *
 * <p>The package is the program's {@code java} namespace. Typedefs produce no output; every use
 * of one is written as its true type. Options: {@code beans} (private fields with accessors
 * instead of public fields).</p>
 */
public final class JavaGenerator extends AbstractGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(JavaGenerator.class);

    public static final String ID = "java";
    public static final Set<String> OPTIONS = Set.of("beans");

    private final boolean beans;
    private final JavaTypes javaTypes;
    private final String packageName;

    public JavaGenerator(IdlProgram program, GeneratorOptions options) {
        super(program, options, "gen-java");
        this.options.requireOnly(OPTIONS, ID);
        this.beans = this.options.has("beans");
        this.javaTypes = new JavaTypes(program, types);
        this.packageName = JavaTypes.packageOf(program);
    }

    @Override
    public void initGenerator() {
        LOG.debug("Java package for program '{}': {}", programName(), packageName == null ? "<default>" : packageName);
    }

    @Override
    public void generateTypedef(IdlTypedef typedef) {
        // Java has no type aliases; references are emitted as the true type.
    }

    @Override
    public void generateEnum(IdlEnum enumDecl) throws IOException {
        String name = enumDecl.name;
        StringBuilder body = new StringBuilder();
        body.append(DocComments.render(indent(), "/**", " * ", enumDecl.doc, " */"));
        line(body, "public enum " + name + " {");
        indentUp();
        List<IdlEnumValue> values = enumDecl.values;
        for (int i = 0; i < values.size(); i++) {
            IdlEnumValue v = values.get(i);
            body.append(DocComments.render(indent(), "/**", " * ", v.doc, " */"));
            line(body, v.name + "(" + v.value + ")" + (i + 1 < values.size() ? "," : ";"));
        }
        if (values.isEmpty()) line(body, ";");
        line(body, "");
        line(body, "private final int value;");
        line(body, "");
        line(body, name + "(int value) {");
        indentUp();
        line(body, "this.value = value;");
        indentDown();
        line(body, "}");
        line(body, "");
        line(body, "public int getValue() {");
        indentUp();
        line(body, "return value;");
        indentDown();
        line(body, "}");
        line(body, "");
        line(body, "/** The constant with the given value, or null. */");
        line(body, "public static " + name + " findByValue(int value) {");
        indentUp();
        String v = tmp("v");
        line(body, "for (" + name + " " + v + " : values()) {");
        indentUp();
        line(body, "if (" + v + ".value == value) {");
        indentUp();
        line(body, "return " + v + ";");
        indentDown();
        line(body, "}");
        indentDown();
        line(body, "}");
        line(body, "return null;");
        indentDown();
        line(body, "}");
        indentDown();
        line(body, "}");

        writeUnit(name, new TreeSet<>(), body);
    }

    /** All consts go into one class; collection values are filled in a static initializer. */
    @Override
    public void generateConsts(List<IdlConst> consts) throws IOException {
        if (consts.isEmpty()) return;
        String name = JavaTypes.constantsClassName(program);
        Set<String> imports = new TreeSet<>();
        StringBuilder body = new StringBuilder();
        List<IdlConst> deferred = new ArrayList<>();

        line(body, "public final class " + name + " {");
        indentUp();
        line(body, "");
        line(body, "private " + name + "() {");
        line(body, "}");
        for (IdlConst c : consts) {
            line(body, "");
            body.append(DocComments.render(indent(), "/**", " * ", c.doc, " */"));
            String type = javaTypes.javaType(c.type, imports);
            if (trueType(c.type).isContainer() && c.value.kind != IdlConstValueKind.IDENTIFIER) {
                line(body, "public static final " + type + " " + c.name + ";");
                deferred.add(c);
            } else {
                line(body, "public static final " + type + " " + c.name + " = " + javaTypes.literal(c.type, c.value, imports) + ";");
            }
        }
        if (!deferred.isEmpty()) {
            line(body, "");
            line(body, "static {");
            indentUp();
            for (IdlConst c : deferred) {
                writeContainerInit(body, c, imports);
            }
            indentDown();
            line(body, "}");
        }
        indentDown();
        line(body, "}");

        writeUnit(name, imports, body);
    }

    private void writeContainerInit(StringBuilder body, IdlConst c, Set<String> imports) {
        IdlType t = trueType(c.type);
        String type = javaTypes.javaType(c.type, imports);
        IdlConstValueKind expected = t.kind == IdlTypeKind.MAP ? IdlConstValueKind.MAP : IdlConstValueKind.LIST;
        if (c.value.kind != expected) {
            throw new IllegalArgumentException("Value " + c.value + " is not valid for const " + c.name + " of type " + t);
        }
        String local = tmp("tmp");
        imports.add("java.util.Collections");
        switch (t.kind) {
            case LIST:
                imports.add("java.util.ArrayList");
                line(body, type + " " + local + " = new ArrayList<>();");
                for (IdlConstValue e : c.value.elements) {
                    line(body, local + ".add(" + javaTypes.literal(t.elementType, e, imports) + ");");
                }
                line(body, c.name + " = Collections.unmodifiableList(" + local + ");");
                break;
            case SET:
                imports.add("java.util.LinkedHashSet");
                line(body, type + " " + local + " = new LinkedHashSet<>();");
                for (IdlConstValue e : c.value.elements) {
                    line(body, local + ".add(" + javaTypes.literal(t.elementType, e, imports) + ");");
                }
                line(body, c.name + " = Collections.unmodifiableSet(" + local + ");");
                break;
            default:
                imports.add("java.util.LinkedHashMap");
                line(body, type + " " + local + " = new LinkedHashMap<>();");
                for (IdlConstValue.Entry e : c.value.entries) {
                    line(body, local + ".put(" + javaTypes.literal(t.keyType, e.key, imports) + ", "
                            + javaTypes.literal(t.valueType, e.value, imports) + ");");
                }
                line(body, c.name + " = Collections.unmodifiableMap(" + local + ");");
                break;
        }
    }

    /** Structs and exceptions; exceptions arrive here through the default exception hook. */
    @Override
    public void generateStruct(IdlStruct struct) throws IOException {
        String name = struct.name;
        Set<String> imports = new TreeSet<>();
        StringBuilder body = new StringBuilder();
        List<FieldInfo> fields = new ArrayList<>();
        for (IdlField f : struct.fields) {
            boolean boxed = f.requiredness == IdlRequiredness.OPTIONAL;
            fields.add(new FieldInfo(f, javaTypes.javaType(f.type, boxed, imports), boxed));
        }

        body.append(DocComments.render(indent(), "/**", " * ", struct.doc, " */"));
        line(body, "public class " + name + (struct.isException ? " extends Exception" : "") + " {");
        indentUp();
        if (struct.isException) {
            line(body, "");
            line(body, "private static final long serialVersionUID = 1L;");
        }

        line(body, "");
        for (FieldInfo fi : fields) {
            body.append(DocComments.render(indent(), "/**", " * ", fi.field.doc, " */"));
            String init = fi.field.defaultValue == null ? "" : " = " + defaultExpression(fi, imports);
            line(body, (beans ? "private " : "public ") + fi.javaType + " " + fi.field.name + init + ";");
        }
        if (!fields.isEmpty()) line(body, "");

        line(body, "public " + name + "() {");
        line(body, "}");
        if (!fields.isEmpty()) {
            line(body, "");
            List<String> params = new ArrayList<>();
            for (FieldInfo fi : fields) params.add(fi.javaType + " " + fi.field.name);
            line(body, "public " + name + "(" + String.join(", ", params) + ") {");
            indentUp();
            for (FieldInfo fi : fields) {
                line(body, "this." + fi.field.name + " = " + fi.field.name + ";");
            }
            indentDown();
            line(body, "}");
        }

        if (beans) {
            for (FieldInfo fi : fields) {
                writeAccessors(body, fi);
            }
        }

        writeEquals(body, name, fields, imports);
        writeHashCode(body, fields, imports);
        writeToString(body, name, fields, imports);

        indentDown();
        line(body, "}");

        writeUnit(name, imports, body);
    }

    private String defaultExpression(FieldInfo fi, Set<String> imports) {
        return javaTypes.mutableLiteral(fi.field.type, fi.field.defaultValue, imports);
    }

    private void writeAccessors(StringBuilder body, FieldInfo fi) {
        String prop = Names.capitalize(fi.field.name);
        boolean isBool = javaTypes.isBool(fi.field.type) && !fi.boxed;
        line(body, "");
        line(body, "public " + fi.javaType + " " + (isBool ? "is" : "get") + prop + "() {");
        indentUp();
        line(body, "return " + fi.field.name + ";");
        indentDown();
        line(body, "}");
        line(body, "");
        line(body, "public void set" + prop + "(" + fi.javaType + " " + fi.field.name + ") {");
        indentUp();
        line(body, "this." + fi.field.name + " = " + fi.field.name + ";");
        indentDown();
        line(body, "}");
    }

    private void writeEquals(StringBuilder body, String name, List<FieldInfo> fields, Set<String> imports) {
        line(body, "");
        line(body, "@Override");
        line(body, "public boolean equals(Object o) {");
        indentUp();
        line(body, "if (this == o) return true;");
        line(body, "if (!(o instanceof " + name + ")) return false;");
        if (fields.isEmpty()) {
            line(body, "return true;");
        } else {
            line(body, name + " that = (" + name + ") o;");
            List<String> terms = new ArrayList<>();
            for (FieldInfo fi : fields) {
                String n = fi.field.name;
                if (javaTypes.isBinary(fi.field.type)) {
                    imports.add("java.util.Arrays");
                    terms.add("Arrays.equals(" + n + ", that." + n + ")");
                } else if (javaTypes.isDouble(fi.field.type) && !fi.boxed) {
                    terms.add("Double.compare(" + n + ", that." + n + ") == 0");
                } else if (javaTypes.isJavaPrimitive(fi.field.type, fi.boxed)) {
                    terms.add(n + " == that." + n);
                } else {
                    imports.add("java.util.Objects");
                    terms.add("Objects.equals(" + n + ", that." + n + ")");
                }
            }
            line(body, "return " + String.join(" &&\n" + indent() + "    ", terms) + ";");
        }
        indentDown();
        line(body, "}");
    }

    private void writeHashCode(StringBuilder body, List<FieldInfo> fields, Set<String> imports) {
        line(body, "");
        line(body, "@Override");
        line(body, "public int hashCode() {");
        indentUp();
        imports.add("java.util.Objects");
        List<String> args = new ArrayList<>();
        for (FieldInfo fi : fields) {
            if (javaTypes.isBinary(fi.field.type)) {
                imports.add("java.util.Arrays");
                args.add("Arrays.hashCode(" + fi.field.name + ")");
            } else {
                args.add(fi.field.name);
            }
        }
        line(body, "return Objects.hash(" + String.join(", ", args) + ");");
        indentDown();
        line(body, "}");
    }

    private void writeToString(StringBuilder body, String name, List<FieldInfo> fields, Set<String> imports) {
        line(body, "");
        line(body, "@Override");
        line(body, "public String toString() {");
        indentUp();
        StringBuilder expr = new StringBuilder("\"" + name + "(");
        for (int i = 0; i < fields.size(); i++) {
            FieldInfo fi = fields.get(i);
            String n = fi.field.name;
            expr.append(i == 0 ? "" : ", ").append(n).append("=\" + ");
            if (javaTypes.isBinary(fi.field.type)) {
                imports.add("java.util.Arrays");
                expr.append("Arrays.toString(").append(n).append(")");
            } else {
                expr.append(n);
            }
            expr.append(" + \"");
        }
        expr.append(")\"");
        line(body, "return " + expr + ";");
        indentDown();
        line(body, "}");
    }

    @Override
    public void generateService(IdlService service) throws IOException {
        String name = serviceName(service);
        Set<String> imports = new TreeSet<>();
        StringBuilder body = new StringBuilder();

        body.append(DocComments.render(indent(), "/**", " * ", service.doc, " */"));
        String parent = service.extendsName == null ? "" : " extends " + javaTypes.className(service.extendsName);
        line(body, "public interface " + name + parent + " {");
        indentUp();
        for (IdlFunction f : service.functions) {
            line(body, "");
            String doc = f.doc;
            if (f.oneway) {
                doc = (doc == null || doc.isBlank() ? "" : doc + "\n\n") + "One-way call: the caller does not wait for completion.";
            }
            body.append(DocComments.render(indent(), "/**", " * ", doc, " */"));
            List<String> params = new ArrayList<>();
            for (IdlField p : f.parameters) {
                params.add(javaTypes.javaType(p.type, imports) + " " + p.name);
            }
            List<String> throwsList = new ArrayList<>();
            for (IdlField x : f.exceptions) {
                IdlType xt = trueType(x.type);
                if (xt.kind != IdlTypeKind.STRUCT) {
                    throw new IllegalArgumentException("Declared exception '" + x.name + "' of " + name + "." + f.name
                            + " is not an exception type: " + xt);
                }
                throwsList.add(javaTypes.className(xt.name));
            }
            String returnType = f.oneway ? "void" : javaTypes.javaType(f.returnType, imports);
            line(body, returnType + " " + f.name + "(" + String.join(", ", params) + ")"
                    + (throwsList.isEmpty() ? "" : " throws " + String.join(", ", throwsList)) + ";");
        }
        indentDown();
        line(body, "}");

        writeUnit(name, imports, body);
    }

    private void writeUnit(String className, Set<String> imports, StringBuilder body) throws IOException {
        StringBuilder out = new StringBuilder();
        out.append("// Generated by idlgen from ").append(program.path == null ? programName() : program.path)
                .append(". Do not edit.\n");
        if (packageName != null) {
            out.append("package ").append(packageName).append(";\n");
        }
        out.append('\n');
        if (!imports.isEmpty()) {
            for (String imp : imports) {
                out.append("import ").append(imp).append(";\n");
            }
            out.append('\n');
        }
        out.append(body);

        String dir = packageName == null ? "" : packageName.replace('.', '/') + "/";
        String path = dir + className + ".java";
        writeFile(path, out.toString());
        LOG.debug("Wrote {}", path);
    }

    private void line(StringBuilder out, String text) {
        if (text.isEmpty()) {
            out.append('\n');
        } else {
            out.append(indent()).append(text).append('\n');
        }
    }

    private static final class FieldInfo {
        final IdlField field;
        final String javaType;
        final boolean boxed;

        FieldInfo(IdlField field, String javaType, boolean boxed) {
            this.field = field;
            this.javaType = javaType;
            this.boxed = boxed;
        }
    }
}
