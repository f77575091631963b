package info.isaksson.erland.idlgen.ast;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IdlProgramTest {

    @Test
    void enumValuesAutoIncrementFromPreviousValue() {
        IdlEnum e = new IdlEnum("E", List.of(
                IdlEnumValue.implicit("A"),
                IdlEnumValue.implicit("B"),
                new IdlEnumValue("C", 10),
                IdlEnumValue.implicit("D"),
                new IdlEnumValue("E", 3),
                IdlEnumValue.implicit("F")
        ));

        assertEquals(List.of(0, 1, 10, 11, 3, 4), e.values.stream().map(v -> v.value).toList());
        assertEquals(11, e.find("D").value);
        assertNull(e.find("Z"));
    }

    @Test
    void withOutPathCopiesAndLeavesOriginalUntouched() {
        IdlProgram inc = IdlProgram.builder("inc").outPath("a").build();
        IdlProgram p = IdlProgram.builder("p").outPath("a").include(inc).build();

        IdlProgram moved = p.withOutPath("b");

        assertEquals("a", p.outPath);
        assertEquals("a", p.includes.get(0).outPath);
        assertEquals("b", moved.outPath);
        assertEquals("b", moved.includes.get(0).outPath);
    }

    @Test
    void listsAreImmutableCopies() {
        List<IdlStruct> structs = new ArrayList<>();
        structs.add(IdlStruct.struct("S", List.of()));
        IdlProgram p = new IdlProgram("p", null, null, null, null, null, null, null, structs, null);

        structs.add(IdlStruct.struct("T", List.of()));

        assertEquals(1, p.structs.size());
        assertThrows(UnsupportedOperationException.class, () -> p.structs.add(IdlStruct.struct("U", List.of())));
        assertEquals(".", p.outPath);
    }

    @Test
    void namespaceFallsBackToWildcardScope() {
        IdlProgram p = IdlProgram.builder("p")
                .namespace("*", "everything")
                .namespace("java", "com.example")
                .build();
        assertEquals("com.example", p.namespace("java"));
        assertEquals("everything", p.namespace("py"));
        assertNull(IdlProgram.builder("q").build().namespace("java"));
    }

    @Test
    void typeHelpers() {
        assertTrue(IdlType.voidType().isVoid());
        assertTrue(IdlType.mapOf(IdlType.string(), IdlType.i32()).isContainer());
        assertEquals("map<string,list<i32>>", IdlType.mapOf(IdlType.string(), IdlType.listOf(IdlType.i32())).toString());
        assertEquals(IdlBaseType.I64, IdlType.i64().baseType());
        assertThrows(IllegalStateException.class, () -> IdlType.struct("S").baseType());
        assertThrows(IllegalArgumentException.class, () -> IdlBaseType.fromKeyword("float"));
    }
}
