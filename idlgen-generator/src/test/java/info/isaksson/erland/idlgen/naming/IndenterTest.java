package info.isaksson.erland.idlgen.naming;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IndenterTest {

    @Test
    void twoSpacesPerLevel() {
        Indenter in = new Indenter();
        assertEquals("", in.indent());
        in.indentUp();
        assertEquals("  ", in.indent());
        in.indentUp();
        in.indentUp();
        assertEquals("      ", in.indent());
        assertEquals(3, in.depth());
        in.indentDown();
        assertEquals("    ", in.indent());
    }

    @Test
    void underflowIsAnError() {
        Indenter in = new Indenter();
        in.indentUp();
        in.indentDown();
        IllegalStateException ex = assertThrows(IllegalStateException.class, in::indentDown);
        assertTrue(ex.getMessage().contains("underflow"));
        assertEquals(0, in.depth());
    }
}
