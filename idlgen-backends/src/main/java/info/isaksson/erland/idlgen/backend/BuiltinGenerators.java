package info.isaksson.erland.idlgen.backend;

import info.isaksson.erland.idlgen.backend.java.JavaGenerator;
import info.isaksson.erland.idlgen.backend.json.JsonGenerator;
import info.isaksson.erland.idlgen.backend.markdown.MarkdownGenerator;
import info.isaksson.erland.idlgen.registry.GeneratorRegistry;

/** The backends shipped with idlgen. */
public final class BuiltinGenerators {

    private BuiltinGenerators() {}

    public static GeneratorRegistry registry() {
        return builder().build();
    }

    /** Builder pre-populated with the built-in backends, for callers that add their own. */
    public static GeneratorRegistry.Builder builder() {
        return GeneratorRegistry.builder()
                .register(JsonGenerator.ID, "JSON",
                        "Program description as JSON (options: pretty, compact)", JsonGenerator::new)
                .register(JavaGenerator.ID, "Java",
                        "Java enums, classes and service interfaces (options: beans)", JavaGenerator::new)
                .register(MarkdownGenerator.ID, "Markdown",
                        "Reference documentation in Markdown", MarkdownGenerator::new);
    }
}
