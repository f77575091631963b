package info.isaksson.erland.idlgen.naming;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StringEscaperTest {

    @Test
    void escapesControlQuoteAndBackslash() {
        assertEquals("a\\nb\\\"c\\\\d", StringEscaper.escape("a\nb\"c\\d"));
        assertEquals("\\r\\t", StringEscaper.escape("\r\t"));
    }

    @Test
    void leavesEverythingElseUntouched() {
        assertEquals("", StringEscaper.escape(""));
        assertEquals("plain text 123", StringEscaper.escape("plain text 123"));
        assertEquals("smörgåsbord ☃ 'single'", StringEscaper.escape("smörgåsbord ☃ 'single'"));
    }

    @Test
    void tableIsFixed() {
        assertEquals(5, StringEscaper.table().size());
        assertEquals("\\n", StringEscaper.table().get('\n'));
        assertThrows(UnsupportedOperationException.class, () -> StringEscaper.table().put('x', "y"));
    }

    @Test
    void nullIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> StringEscaper.escape(null));
    }
}
