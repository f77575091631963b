package info.isaksson.erland.idlgen.backend;

import info.isaksson.erland.idlgen.ast.IdlProgram;
import info.isaksson.erland.idlgen.backend.java.JavaGenerator;
import info.isaksson.erland.idlgen.registry.GeneratorDescriptor;
import info.isaksson.erland.idlgen.registry.GeneratorRegistry;
import info.isaksson.erland.idlgen.registry.UnsupportedTargetException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BuiltinGeneratorsTest {

    @Test
    void registersTheThreeBackendsInOrder() {
        GeneratorRegistry registry = BuiltinGenerators.registry();
        List<String> ids = new ArrayList<>();
        for (GeneratorDescriptor d : registry.descriptors()) ids.add(d.id);
        assertEquals(List.of("json", "java", "markdown"), ids);
    }

    @Test
    void createsBoundInstancesAndRejectsUnknownTargets() {
        GeneratorRegistry registry = BuiltinGenerators.registry();
        IdlProgram p = IdlProgram.builder("p").outPath("/tmp/x").build();

        JavaGenerator g = (JavaGenerator) registry.create("java", p, "beans");
        assertEquals("/tmp/x/gen-java/", g.outDir());

        assertThrows(UnsupportedTargetException.class, () -> registry.create("cobol", p, ""));
        assertThrows(IllegalArgumentException.class, () -> registry.create("java", p, "nope"));
    }

    @Test
    void builderAcceptsAdditionalBackends() {
        GeneratorRegistry registry = BuiltinGenerators.builder()
                .register("java2", JavaGenerator::new)
                .build();
        assertTrue(registry.isRegistered("java2"));
        assertTrue(registry.isRegistered("json"));
    }
}
