package info.isaksson.erland.idlgen.naming;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TempNamesTest {

    @Test
    void counterIsSharedAcrossPrefixes() {
        TempNames t = new TempNames();
        assertEquals("tmp0", t.next("tmp"));
        assertEquals("tmp1", t.next("tmp"));
        assertEquals("val2", t.next("val"));
        assertEquals("tmp3", t.next("tmp"));
    }

    @Test
    void namesAreUniqueWithinInstance() {
        TempNames t = new TempNames();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            assertTrue(seen.add(t.next(i % 2 == 0 ? "x" : "y")));
        }
    }

    @Test
    void nullPrefixIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TempNames().next(null));
    }
}
