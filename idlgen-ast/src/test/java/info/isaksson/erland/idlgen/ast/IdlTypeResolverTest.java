package info.isaksson.erland.idlgen.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IdlTypeResolverTest {

    @Test
    void followsChainedTypedefsToTrueType() {
        IdlProgram program = IdlProgram.builder("p")
                .typedef(new IdlTypedef("A", IdlType.typedef("B")))
                .typedef(new IdlTypedef("B", IdlType.typedef("C")))
                .typedef(new IdlTypedef("C", IdlType.listOf(IdlType.i64())))
                .build();

        IdlType resolved = new IdlTypeResolver(program).trueType(IdlType.typedef("A"));

        assertEquals(IdlType.listOf(IdlType.i64()), resolved);
    }

    @Test
    void nonTypedefIsReturnedAsIs() {
        IdlProgram program = IdlProgram.builder("p").build();
        IdlType t = IdlType.struct("Work");
        assertSame(t, new IdlTypeResolver(program).trueType(t));
    }

    @Test
    void inlineAliasIsFollowedWithoutLookup() {
        IdlProgram program = IdlProgram.builder("p").build();
        IdlType t = IdlType.typedef("Outer", IdlType.typedef("Inner", IdlType.string()));
        assertEquals(IdlType.string(), new IdlTypeResolver(program).trueType(t));
    }

    @Test
    void typedefCycleFailsDeterministically() {
        IdlProgram program = IdlProgram.builder("p")
                .typedef(new IdlTypedef("A", IdlType.typedef("B")))
                .typedef(new IdlTypedef("B", IdlType.typedef("A")))
                .build();
        IdlTypeResolver resolver = new IdlTypeResolver(program);

        TypeResolutionException ex = assertThrows(TypeResolutionException.class,
                () -> resolver.trueType(IdlType.typedef("A")));
        assertEquals("Typedef cycle: p.A -> p.B -> p.A", ex.getMessage());
    }

    @Test
    void selfReferencingTypedefIsACycle() {
        IdlProgram program = IdlProgram.builder("p")
                .typedef(new IdlTypedef("Loop", IdlType.typedef("Loop")))
                .build();
        assertThrows(TypeResolutionException.class,
                () -> new IdlTypeResolver(program).trueType(IdlType.typedef("Loop")));
    }

    @Test
    void danglingTypedefNameFails() {
        IdlProgram program = IdlProgram.builder("p").build();
        TypeResolutionException ex = assertThrows(TypeResolutionException.class,
                () -> new IdlTypeResolver(program).trueType(IdlType.typedef("Missing")));
        assertTrue(ex.getMessage().contains("Missing"));
    }

    @Test
    void qualifiedNamesResolveInIncludedProgramScope() {
        IdlProgram shared = IdlProgram.builder("shared")
                .typedef(new IdlTypedef("Id", IdlType.typedef("RawId")))
                .typedef(new IdlTypedef("RawId", IdlType.i64()))
                .struct(IdlStruct.struct("SharedStruct", List.of()))
                .build();
        IdlProgram program = IdlProgram.builder("main")
                .include(shared)
                .typedef(new IdlTypedef("RawId", IdlType.string()))
                .build();
        IdlTypeResolver resolver = new IdlTypeResolver(program);

        // RawId is looked up in 'shared', where Id was declared, not in 'main'.
        assertEquals(IdlType.i64(), resolver.trueType(IdlType.typedef("shared.Id")));
        assertNotNull(resolver.findStruct("shared.SharedStruct"));
        assertNull(resolver.findStruct("SharedStruct"));
        assertNull(resolver.findStruct("nosuch.SharedStruct"));
    }

    @Test
    void trueTypeFromIncludedTypedefIsQualifiedWithTheInclude() {
        IdlProgram shared = IdlProgram.builder("shared")
                .struct(IdlStruct.struct("Item", List.of()))
                .typedef(new IdlTypedef("ItemAlias", IdlType.struct("Item")))
                .typedef(new IdlTypedef("Items", IdlType.mapOf(IdlType.string(), IdlType.listOf(IdlType.typedef("ItemAlias")))))
                .build();
        IdlProgram program = IdlProgram.builder("main")
                .include(shared)
                .struct(IdlStruct.struct("Item", List.of()))
                .typedef(new IdlTypedef("Local", IdlType.typedef("shared.ItemAlias")))
                .build();
        IdlTypeResolver resolver = new IdlTypeResolver(program);

        assertEquals(IdlType.struct("shared.Item"), resolver.trueType(IdlType.typedef("shared.ItemAlias")));
        assertEquals(IdlType.struct("shared.Item"), resolver.trueType(IdlType.typedef("Local")));
        assertSame(shared.structs.get(0), resolver.findStruct(resolver.trueType(IdlType.typedef("Local")).name));

        IdlType items = resolver.trueType(IdlType.typedef("shared.Items"));
        assertEquals(IdlType.mapOf(IdlType.string(), IdlType.listOf(IdlType.typedef("shared.ItemAlias"))), items);
        assertEquals(IdlType.struct("shared.Item"), resolver.trueType(items.valueType.elementType));
    }

    @Test
    void qualifiersAccumulateThroughNestedIncludes() {
        IdlProgram base = IdlProgram.builder("base")
                .enumDecl(new IdlEnum("Color", List.of(), null))
                .build();
        IdlProgram mid = IdlProgram.builder("mid")
                .include(base)
                .typedef(new IdlTypedef("Paint", IdlType.enumType("base.Color")))
                .build();
        IdlProgram program = IdlProgram.builder("top").include(mid).build();
        IdlTypeResolver resolver = new IdlTypeResolver(program);

        IdlType resolved = resolver.trueType(IdlType.typedef("mid.Paint"));
        assertEquals(IdlType.enumType("mid.base.Color"), resolved);
        assertSame(base, resolver.declaringProgram(resolved.name));
        assertNotNull(resolver.findEnum(resolved.name));
    }

    @Test
    void resolutionDoesNotChangeTheProgram() {
        IdlProgram program = IdlProgram.builder("p")
                .typedef(new IdlTypedef("A", IdlType.typedef("B")))
                .typedef(new IdlTypedef("B", IdlType.i32()))
                .build();
        IdlProgram before = IdlProgram.builder("p")
                .typedef(new IdlTypedef("A", IdlType.typedef("B")))
                .typedef(new IdlTypedef("B", IdlType.i32()))
                .build();

        new IdlTypeResolver(program).trueType(IdlType.typedef("A"));

        assertEquals(before, program);
    }

    @Test
    void serviceHierarchyWalksExtendsAcrossIncludes() {
        IdlService base = new IdlService("SharedService", null, List.of());
        IdlProgram shared = IdlProgram.builder("shared").service(base).build();
        IdlService calc = new IdlService("Calculator", "shared.SharedService", List.of());
        IdlProgram program = IdlProgram.builder("tutorial").include(shared).service(calc).build();

        List<IdlService> chain = new IdlTypeResolver(program).serviceHierarchy(calc);

        assertEquals(List.of(calc, base), chain);
    }

    @Test
    void serviceHierarchyRejectsUnknownParent() {
        IdlService orphan = new IdlService("Orphan", "Nobody", List.of());
        IdlProgram program = IdlProgram.builder("p").service(orphan).build();
        assertThrows(TypeResolutionException.class, () -> new IdlTypeResolver(program).serviceHierarchy(orphan));
    }

    @Test
    void declaringProgramFollowsIncludeQualifiers() {
        IdlProgram shared = IdlProgram.builder("shared").build();
        IdlProgram program = IdlProgram.builder("p").include(shared).build();
        IdlTypeResolver resolver = new IdlTypeResolver(program);

        assertSame(program, resolver.declaringProgram("Local"));
        assertSame(shared, resolver.declaringProgram("shared.SharedStruct"));
        assertNull(resolver.declaringProgram("missing.X"));
    }
}
