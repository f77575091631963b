package info.isaksson.erland.idlgen.backend.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.idlgen.ast.IdlProgram;
import info.isaksson.erland.idlgen.backend.Fixtures;
import info.isaksson.erland.idlgen.generator.GeneratorOptions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class JsonGeneratorTest {

    @Test
    void describesProgramInDeclarationOrder() throws Exception {
        Path root = Files.createTempDirectory("idlgen-json-");
        IdlProgram program = Fixtures.tutorial(root);

        JsonGenerator g = new JsonGenerator(program, GeneratorOptions.empty());
        g.generateProgram();

        Path out = root.resolve("gen-json/tutorial.json");
        assertEquals(1, g.generatedFiles().size());
        assertEquals(out.toAbsolutePath().normalize(), g.generatedFiles().get(0));

        String text = Files.readString(out);
        assertTrue(text.endsWith("}\n"));
        assertTrue(text.contains("\n  \"typedefs\""), "pretty printed by default");

        JsonNode json = new ObjectMapper().readTree(text);
        assertEquals("tutorial", json.get("name").asText());
        assertEquals("tutorial", json.get("namespaces").get("java").asText());
        assertEquals("shared", json.get("includes").get(0).asText());

        JsonNode typedef = json.get("typedefs").get(0);
        assertEquals("MyInteger", typedef.get("name").asText());
        assertEquals("i32", typedef.get("trueType").asText());

        JsonNode work = json.get("structs").get(0);
        assertEquals("Work", work.get("name").asText());
        assertEquals(1, json.get("structs").size());
        JsonNode num2 = work.get("fields").get(1);
        assertEquals("MyInteger", num2.get("type").asText());
        assertEquals("i32", num2.get("trueType").asText());
        assertEquals(0, work.get("fields").get(0).get("default").get("int").asInt());
        assertEquals("optional", work.get("fields").get(3).get("requiredness").asText());

        assertEquals("InvalidOperation", json.get("exceptions").get(0).get("name").asText());

        JsonNode consts = json.get("consts");
        assertEquals("INT32CONSTANT", consts.get(0).get("name").asText());
        JsonNode map = consts.get(1).get("value").get("map");
        assertEquals("hello", map.get(0).get("key").get("string").asText());
        assertEquals("moon", map.get(1).get("value").get("string").asText());

        JsonNode calc = json.get("services").get(0);
        assertEquals("shared.SharedService", calc.get("extends").asText());
        JsonNode zip = calc.get("functions").get(3);
        assertEquals("zip", zip.get("name").asText());
        assertTrue(zip.get("oneway").asBoolean());
    }

    @Test
    void compactWritesOneLine() throws Exception {
        Path root = Files.createTempDirectory("idlgen-json-compact-");
        IdlProgram program = Fixtures.tutorial(root);

        new JsonGenerator(program, GeneratorOptions.parse("compact")).generateProgram();

        String text = Files.readString(root.resolve("gen-json/tutorial.json"));
        assertEquals(1, text.split("\n").length);
    }

    @Test
    void rejectsUnknownAndConflictingOptions() {
        IdlProgram p = IdlProgram.builder("p").build();
        assertThrows(IllegalArgumentException.class, () -> new JsonGenerator(p, GeneratorOptions.parse("yaml")));
        assertThrows(IllegalArgumentException.class, () -> new JsonGenerator(p, GeneratorOptions.parse("pretty,compact")));
    }
}
