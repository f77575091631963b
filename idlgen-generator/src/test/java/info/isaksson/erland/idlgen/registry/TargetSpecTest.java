package info.isaksson.erland.idlgen.registry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TargetSpecTest {

    @Test
    void parsesIdAndOptions() {
        assertEquals(new TargetSpec("java", ""), TargetSpec.parse("java"));
        assertEquals(new TargetSpec("java", "beans,indent=4"), TargetSpec.parse(" java:beans,indent=4 "));
        assertEquals(new TargetSpec("json", ""), TargetSpec.parse("json:"));
        assertEquals("java:beans", TargetSpec.parse("java:beans").toString());
    }

    @Test
    void rejectsBlankOrNamelessTargets() {
        assertThrows(IllegalArgumentException.class, () -> TargetSpec.parse(null));
        assertThrows(IllegalArgumentException.class, () -> TargetSpec.parse(" "));
        assertThrows(IllegalArgumentException.class, () -> TargetSpec.parse(":beans"));
    }
}
