package info.isaksson.erland.idlgen.ast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IdlJsonDeterminismTest {

    @Test
    void writeMatchesGoldenTutorial() throws Exception {
        Path goldenPath = golden("ast/golden/tutorial.json");
        String golden = Files.readString(goldenPath, StandardCharsets.UTF_8);

        IdlProgram program = IdlJson.read(goldenPath);

        ObjectMapper om = new ObjectMapper();
        JsonNode goldenNode = om.readTree(golden);

        String rendered = IdlJson.toJsonString(program);
        assertEquals(goldenNode, om.readTree(rendered), "Rendered JSON must be semantically equal to golden fixture.");

        Path tmp = Files.createTempFile("idljson-", ".json");
        IdlJson.write(program, tmp);
        String written = Files.readString(tmp, StandardCharsets.UTF_8);
        assertEquals(goldenNode, om.readTree(written));

        Path tmp2 = Files.createTempFile("idljson-", ".json");
        IdlJson.write(program, tmp2);
        assertEquals(written, Files.readString(tmp2, StandardCharsets.UTF_8), "Writing twice must produce identical output.");
    }

    @Test
    void readKeepsDeclarationOrderAndResolvesModel() throws Exception {
        IdlProgram program = IdlJson.read(golden("ast/golden/tutorial.json"));

        assertEquals("tutorial", program.name);
        assertEquals(List.of("Work", "InvalidOperation"), program.structs.stream().map(s -> s.name).toList());
        assertTrue(program.structs.get(1).isException);
        assertEquals("shared", program.includes.get(0).name);
        assertEquals("shared.SharedService", program.services.get(0).extendsName);
        assertEquals(List.of("ping", "add", "calculate", "zip"),
                program.services.get(0).functions.stream().map(f -> f.name).toList());
        assertTrue(program.services.get(0).functions.get(3).oneway);
        assertEquals(IdlRequiredness.OPTIONAL, program.structs.get(0).fields.get(3).requiredness);
        assertEquals(IdlConstValueKind.MAP, program.consts.get(1).value.kind);
        assertEquals("goodnight", program.consts.get(1).value.entries.get(1).key.stringValue);
    }

    @Test
    void roundTripIsLossless() throws IOException {
        IdlProgram program = IdlProgram.builder("demo")
                .namespace("java", "com.example.demo")
                .enumDecl(new IdlEnum("Color", List.of(IdlEnumValue.implicit("RED"), new IdlEnumValue("GREEN", 5))))
                .constDecl(new IdlConst("NAMES", IdlType.listOf(IdlType.string()),
                        IdlConstValue.list(List.of(IdlConstValue.ofString("a\"b"), IdlConstValue.ofString("c")))))
                .constDecl(new IdlConst("DEFAULT_COLOR", IdlType.enumType("Color"), IdlConstValue.identifier("Color.GREEN")))
                .constDecl(new IdlConst("PI", IdlType.primitive(IdlBaseType.DOUBLE), IdlConstValue.ofDouble(3.14)))
                .struct(IdlStruct.struct("Point", List.of(
                        new IdlField(1, "x", IdlType.i32(), IdlRequiredness.REQUIRED, null, "horizontal"),
                        new IdlField(2, "tags", IdlType.setOf(IdlType.string())))))
                .build();

        IdlProgram back = IdlJson.readFromString(IdlJson.toJsonString(program));
        assertEquals(program, back);
    }

    @Test
    void rejectsNullArguments() {
        assertThrows(IllegalArgumentException.class, () -> IdlJson.read(null));
        assertThrows(IllegalArgumentException.class, () -> IdlJson.readFromString(null));
        assertThrows(IllegalArgumentException.class, () -> IdlJson.toJsonString(null));
    }

    private static Path golden(String resourcePath) throws URISyntaxException {
        return Path.of(IdlJsonDeterminismTest.class.getClassLoader().getResource(resourcePath).toURI());
    }
}
