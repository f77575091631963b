package info.isaksson.erland.idlgen.backend.json;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.idlgen.ast.IdlConst;
import info.isaksson.erland.idlgen.ast.IdlConstValue;
import info.isaksson.erland.idlgen.ast.IdlEnum;
import info.isaksson.erland.idlgen.ast.IdlEnumValue;
import info.isaksson.erland.idlgen.ast.IdlField;
import info.isaksson.erland.idlgen.ast.IdlFunction;
import info.isaksson.erland.idlgen.ast.IdlProgram;
import info.isaksson.erland.idlgen.ast.IdlService;
import info.isaksson.erland.idlgen.ast.IdlStruct;
import info.isaksson.erland.idlgen.ast.IdlType;
import info.isaksson.erland.idlgen.ast.IdlTypedef;
import info.isaksson.erland.idlgen.generator.AbstractGenerator;
import info.isaksson.erland.idlgen.generator.GeneratorOptions;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Writes a JSON description of the program to {@code gen-json/<program>.json}.
 *
 * <p>Declarations appear in source order. Every type reference is written as its IDL spelling;
 * references through a typedef also carry the resolved {@code trueType}.</p>
 *
 * <p>Options: {@code pretty} (default) or {@code compact}.</p>
 */
public final class JsonGenerator extends AbstractGenerator {

    public static final String ID = "json";
    public static final Set<String> OPTIONS = Set.of("pretty", "compact");

    private final ObjectMapper mapper = new ObjectMapper();
    private final boolean pretty;

    private ObjectNode root;
    private ArrayNode typedefs;
    private ArrayNode enums;
    private ArrayNode consts;
    private ArrayNode structs;
    private ArrayNode exceptions;
    private ArrayNode services;

    public JsonGenerator(IdlProgram program, GeneratorOptions options) {
        super(program, options, "gen-json");
        this.options.requireOnly(OPTIONS, ID);
        if (this.options.has("pretty") && this.options.has("compact")) {
            throw new IllegalArgumentException("Options 'pretty' and 'compact' are mutually exclusive");
        }
        this.pretty = !this.options.has("compact");
    }

    @Override
    public void initGenerator() {
        root = mapper.createObjectNode();
        root.put("name", programName());
        if (program.path != null) root.put("path", program.path);

        ObjectNode ns = root.putObject("namespaces");
        for (Map.Entry<String, String> e : program.namespaces.entrySet()) {
            ns.put(e.getKey(), e.getValue());
        }
        ArrayNode includes = root.putArray("includes");
        for (IdlProgram inc : program.includes) {
            includes.add(inc.name);
        }

        typedefs = root.putArray("typedefs");
        enums = root.putArray("enums");
        consts = root.putArray("consts");
        structs = root.putArray("structs");
        exceptions = root.putArray("exceptions");
        services = root.putArray("services");
    }

    @Override
    public void generateTypedef(IdlTypedef typedef) {
        ObjectNode n = typedefs.addObject();
        n.put("name", typedef.name);
        n.put("type", typedef.type.toString());
        n.put("trueType", trueType(typedef.type).toString());
        putDoc(n, typedef.doc);
    }

    @Override
    public void generateEnum(IdlEnum enumDecl) {
        ObjectNode n = enums.addObject();
        n.put("name", enumDecl.name);
        ArrayNode values = n.putArray("values");
        for (IdlEnumValue v : enumDecl.values) {
            ObjectNode vn = values.addObject();
            vn.put("name", v.name);
            vn.put("value", v.value);
            putDoc(vn, v.doc);
        }
        putDoc(n, enumDecl.doc);
    }

    @Override
    public void generateConsts(List<IdlConst> constDecls) {
        for (IdlConst c : constDecls) {
            ObjectNode n = consts.addObject();
            n.put("name", c.name);
            putType(n, "type", c.type);
            n.set("value", valueNode(c.value));
            putDoc(n, c.doc);
        }
    }

    @Override
    public void generateStruct(IdlStruct struct) {
        ObjectNode n = (struct.isException ? exceptions : structs).addObject();
        n.put("name", struct.name);
        putFields(n.putArray("fields"), struct.fields);
        putDoc(n, struct.doc);
    }

    @Override
    public void generateService(IdlService service) {
        ObjectNode n = services.addObject();
        n.put("name", serviceName(service));
        if (service.extendsName != null) n.put("extends", service.extendsName);
        ArrayNode functions = n.putArray("functions");
        for (IdlFunction f : service.functions) {
            ObjectNode fn = functions.addObject();
            fn.put("name", f.name);
            putType(fn, "returnType", f.returnType);
            fn.put("oneway", f.oneway);
            putFields(fn.putArray("parameters"), f.parameters);
            putFields(fn.putArray("exceptions"), f.exceptions);
            putDoc(fn, f.doc);
        }
        putDoc(n, service.doc);
    }

    @Override
    public void closeGenerator() throws IOException {
        String json = pretty
                ? mapper.writer(createPrettyPrinter()).writeValueAsString(root)
                : mapper.writeValueAsString(root);
        writeFile(programName() + ".json", json + "\n");
    }

    private void putFields(ArrayNode out, List<IdlField> fields) {
        for (IdlField f : fields) {
            ObjectNode fn = out.addObject();
            fn.put("id", f.id);
            fn.put("name", f.name);
            putType(fn, "type", f.type);
            fn.put("requiredness", f.requiredness.name().toLowerCase(Locale.ROOT));
            if (f.defaultValue != null) fn.set("default", valueNode(f.defaultValue));
            putDoc(fn, f.doc);
        }
    }

    private void putType(ObjectNode n, String key, IdlType type) {
        n.put(key, type.toString());
        IdlType resolved = trueType(type);
        if (!resolved.equals(type)) {
            n.put("trueType", resolved.toString());
        }
    }

    private static void putDoc(ObjectNode n, String doc) {
        if (doc != null && !doc.isBlank()) n.put("doc", doc);
    }

    private ObjectNode valueNode(IdlConstValue v) {
        ObjectNode n = mapper.createObjectNode();
        switch (v.kind) {
            case INTEGER:
                n.put("int", v.intValue);
                break;
            case DOUBLE:
                n.put("double", v.doubleValue);
                break;
            case STRING:
                n.put("string", v.stringValue);
                break;
            case IDENTIFIER:
                n.put("identifier", v.identifier);
                break;
            case LIST: {
                ArrayNode arr = n.putArray("list");
                for (IdlConstValue e : v.elements) arr.add(valueNode(e));
                break;
            }
            case MAP: {
                ArrayNode arr = n.putArray("map");
                for (IdlConstValue.Entry e : v.entries) {
                    ObjectNode en = arr.addObject();
                    en.set("key", valueNode(e.key));
                    en.set("value", valueNode(e.value));
                }
                break;
            }
            default:
                throw new IllegalStateException("Unhandled const value kind: " + v.kind);
        }
        return n;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
