package info.isaksson.erland.idlgen.registry;

import info.isaksson.erland.idlgen.ast.IdlEnum;
import info.isaksson.erland.idlgen.ast.IdlProgram;
import info.isaksson.erland.idlgen.ast.IdlService;
import info.isaksson.erland.idlgen.ast.IdlStruct;
import info.isaksson.erland.idlgen.ast.IdlTypedef;
import info.isaksson.erland.idlgen.generator.AbstractGenerator;
import info.isaksson.erland.idlgen.generator.Generator;
import info.isaksson.erland.idlgen.generator.GeneratorOptions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class GeneratorRegistryTest {

    static final class NoopGenerator extends AbstractGenerator {
        NoopGenerator(IdlProgram program, GeneratorOptions options) {
            super(program, options, "gen-noop");
        }

        @Override public void generateTypedef(IdlTypedef typedef) {}
        @Override public void generateEnum(IdlEnum enumDecl) {}
        @Override public void generateStruct(IdlStruct struct) {}
        @Override public void generateService(IdlService service) {}
    }

    private final IdlProgram program = IdlProgram.builder("p").build();

    @Test
    void createsRegisteredGeneratorWithOptions() {
        GeneratorRegistry registry = GeneratorRegistry.builder()
                .register("noop", "No-op", "does nothing", NoopGenerator::new)
                .build();

        Generator g = registry.create("noop", program, "a,b=c");
        assertInstanceOf(NoopGenerator.class, g);
        assertSame(program, g.program());
        assertEquals("c", ((NoopGenerator) g).options().get("b"));

        Generator viaSpec = registry.create(TargetSpec.parse("noop:a"), program);
        assertTrue(((NoopGenerator) viaSpec).options().has("a"));
        assertNotSame(g, viaSpec);
    }

    @Test
    void unknownTargetConstructsNothing() {
        AtomicInteger constructed = new AtomicInteger();
        GeneratorRegistry registry = GeneratorRegistry.builder()
                .register("noop", (p, o) -> {
                    constructed.incrementAndGet();
                    return new NoopGenerator(p, o);
                })
                .build();

        UnsupportedTargetException ex = assertThrows(UnsupportedTargetException.class,
                () -> registry.create("cobol", program, "==malformed"));
        assertEquals("cobol", ex.target());
        assertEquals("Unsupported target: cobol", ex.getMessage());
        assertEquals(0, constructed.get());

        assertThrows(UnsupportedTargetException.class, () -> registry.descriptor(null));
        assertFalse(registry.isRegistered("cobol"));
        assertFalse(registry.isRegistered(null));
    }

    @Test
    void descriptorsKeepRegistrationOrder() {
        GeneratorRegistry registry = GeneratorRegistry.builder()
                .register("b", NoopGenerator::new)
                .register("a", "Alpha", null, NoopGenerator::new)
                .build();

        List<GeneratorDescriptor> ds = registry.descriptors();
        assertEquals(2, ds.size());
        assertEquals("b", ds.get(0).id);
        assertEquals("b", ds.get(0).displayName);
        assertEquals("Alpha", ds.get(1).displayName);
        assertEquals("", ds.get(1).description);
        assertThrows(UnsupportedOperationException.class, () -> registry.descriptors().clear());
    }

    @Test
    void builderRejectsBadRegistrations() {
        GeneratorRegistry.Builder b = GeneratorRegistry.builder().register("x", NoopGenerator::new);
        assertThrows(IllegalArgumentException.class, () -> b.register("x", NoopGenerator::new));
        assertThrows(IllegalArgumentException.class, () -> b.register(" ", NoopGenerator::new));
        assertThrows(IllegalArgumentException.class, () -> b.register("a:b", NoopGenerator::new));
        assertThrows(IllegalArgumentException.class, () -> b.register("y", null));
    }

    @Test
    void builtRegistryIsNotAffectedByLaterRegistrations() {
        GeneratorRegistry.Builder b = GeneratorRegistry.builder().register("x", NoopGenerator::new);
        GeneratorRegistry first = b.build();
        b.register("y", NoopGenerator::new);

        assertFalse(first.isRegistered("y"));
        assertTrue(b.build().isRegistered("y"));
    }

    @Test
    void backendCanRejectOptions() {
        GeneratorRegistry registry = GeneratorRegistry.builder()
                .register("strict", (p, o) -> {
                    o.requireOnly(List.of("ok"), "strict");
                    return new NoopGenerator(p, o);
                })
                .build();

        assertThrows(IllegalArgumentException.class, () -> registry.create("strict", program, "nope"));
        assertNotNull(registry.create("strict", program, "ok"));
    }

    @Test
    void nullFactoryResultIsReported() {
        GeneratorRegistry registry = GeneratorRegistry.builder().register("bad", (p, o) -> null).build();
        assertThrows(IllegalStateException.class, () -> registry.create("bad", program, ""));
    }
}
