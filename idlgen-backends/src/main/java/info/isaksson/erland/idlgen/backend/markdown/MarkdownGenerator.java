package info.isaksson.erland.idlgen.backend.markdown;

import info.isaksson.erland.idlgen.ast.IdlConst;
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
import info.isaksson.erland.idlgen.naming.Names;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reference documentation for a program in {@code gen-markdown/<program>.md}.
 *
 * <p>Sections follow the dispatch order and are only written when they have content.
 * Exceptions get their own section instead of being listed with the structs.</p>
 */
public final class MarkdownGenerator extends AbstractGenerator {

    public static final String ID = "markdown";
    public static final Set<String> OPTIONS = Set.of();

    private final StringBuilder out = new StringBuilder();
    private String section;

    public MarkdownGenerator(IdlProgram program, GeneratorOptions options) {
        super(program, options, "gen-markdown");
        this.options.requireOnly(OPTIONS, ID);
    }

    @Override
    public void initGenerator() {
        out.append("# ").append(programName()).append("\n\n");
        if (program.path != null) {
            out.append("Source: `").append(program.path).append("`\n\n");
        }
        if (!program.namespaces.isEmpty()) {
            out.append("| Scope | Namespace |\n|---|---|\n");
            for (Map.Entry<String, String> e : program.namespaces.entrySet()) {
                out.append("| ").append(cell(e.getKey())).append(" | ").append(cell(e.getValue())).append(" |\n");
            }
            out.append('\n');
        }
        if (!program.includes.isEmpty()) {
            List<String> names = new ArrayList<>();
            for (IdlProgram inc : program.includes) names.add("`" + inc.name + "`");
            out.append("Includes: ").append(String.join(", ", names)).append("\n\n");
        }
    }

    @Override
    public void generateTypedef(IdlTypedef typedef) {
        section("Typedefs");
        out.append("- `").append(typedef.name).append("` = ").append(typeRef(typedef.type));
        if (typedef.doc != null && !typedef.doc.isBlank()) {
            out.append(": ").append(oneLine(typedef.doc));
        }
        out.append('\n');
    }

    @Override
    public void generateEnum(IdlEnum enumDecl) {
        section("Enums");
        out.append("### ").append(enumDecl.name).append("\n\n");
        doc(enumDecl.doc);
        out.append("| Name | Value | Description |\n|---|---|---|\n");
        for (IdlEnumValue v : enumDecl.values) {
            out.append("| `").append(v.name).append("` | ").append(v.value).append(" | ")
                    .append(cell(v.doc)).append(" |\n");
        }
        out.append('\n');
    }

    @Override
    public void generateConsts(List<IdlConst> consts) {
        if (consts.isEmpty()) return;
        section("Constants");
        out.append("| Name | Type | Value |\n|---|---|---|\n");
        for (IdlConst c : consts) {
            out.append("| `").append(c.name).append("` | ").append(cell(typeRef(c.type))).append(" | `")
                    .append(cell(String.valueOf(c.value))).append("` |\n");
        }
        out.append('\n');
    }

    @Override
    public void generateStruct(IdlStruct struct) {
        section("Structs");
        structBody(struct);
    }

    @Override
    public void generateXception(IdlStruct exception) {
        section("Exceptions");
        structBody(exception);
    }

    @Override
    public void generateService(IdlService service) {
        section("Services");
        out.append("### ").append(serviceName(service)).append("\n\n");
        if (service.extendsName != null) {
            out.append("Extends `").append(service.extendsName).append("`.\n\n");
        }
        doc(service.doc);
        for (IdlFunction f : service.functions) {
            List<String> params = new ArrayList<>();
            for (IdlField p : f.parameters) {
                params.add(p.id + ": " + p.type + " " + p.name);
            }
            out.append("#### ").append(f.name).append("\n\n");
            out.append("```\n")
                    .append(f.oneway ? "oneway " : "")
                    .append(f.returnType).append(' ').append(f.name)
                    .append('(').append(String.join(", ", params)).append(')');
            if (!f.exceptions.isEmpty()) {
                List<String> xs = new ArrayList<>();
                for (IdlField x : f.exceptions) xs.add(x.id + ": " + x.type + " " + x.name);
                out.append(" throws (").append(String.join(", ", xs)).append(')');
            }
            out.append("\n```\n\n");
            doc(f.doc);
        }
    }

    @Override
    public void closeGenerator() throws IOException {
        writeFile(programName() + ".md", out.toString());
    }

    private void structBody(IdlStruct struct) {
        out.append("### ").append(struct.name).append("\n\n");
        doc(struct.doc);
        if (struct.fields.isEmpty()) {
            out.append("_No fields._\n\n");
            return;
        }
        out.append("| Id | Name | Type | Requiredness | Default | Description |\n|---|---|---|---|---|---|\n");
        for (IdlField f : struct.fields) {
            out.append("| ").append(f.id)
                    .append(" | `").append(f.name).append('`')
                    .append(" | ").append(cell(typeRef(f.type)))
                    .append(" | ").append(Names.lowercase(f.requiredness.name()))
                    .append(" | ").append(f.defaultValue == null ? "" : "`" + cell(f.defaultValue.toString()) + "`")
                    .append(" | ").append(cell(f.doc))
                    .append(" |\n");
        }
        out.append('\n');
    }

    private void section(String title) {
        if (title.equals(section)) return;
        section = title;
        out.append("## ").append(title).append("\n\n");
    }

    private void doc(String doc) {
        if (doc == null || doc.isBlank()) return;
        out.append(doc.strip()).append("\n\n");
    }

    /** IDL spelling; typedef references also show the true type. */
    private String typeRef(IdlType type) {
        IdlType resolved = trueType(type);
        return resolved.equals(type) ? "`" + type + "`" : "`" + type + "` (`" + resolved + "`)";
    }

    private static String oneLine(String s) {
        return s.strip().replaceAll("\\s*\\R\\s*", " ");
    }

    private static String cell(String s) {
        if (s == null) return "";
        return oneLine(s).replace("|", "\\|");
    }
}
