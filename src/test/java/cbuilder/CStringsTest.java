package cbuilder;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CStringsTest {

    @Test
    public void testEscape() {
        assertEquals("say \\\"hi\\\"", CStrings.escape("say \"hi\""));
        assertEquals("\\b\\r\\f\\n\\t", CStrings.escape("\b\r\f\n\t"));
        assertEquals("back\\slash 'single' ä", CStrings.escape("back\\slash 'single' ä"));
    }

    @Test
    public void testQuote() {
        assertEquals("\"a\\nb\"", CStrings.quote("a\nb"));
        assertEquals("\"\"", CStrings.quote(""));
    }
}
