package cbuilder;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CodeBufferTest {

    @Test
    public void testIndentation() {
        CodeBuffer buffer = new CodeBuffer();
        buffer.writeln("a {");
        buffer.indent();
        buffer.writeln("b;");
        buffer.writeln();
        buffer.write("c");
        buffer.write("d");
        buffer.writeln(";");
        buffer.outdent();
        buffer.writeln("}");
        assertEquals("a {\n    b;\n\n    cd;\n}\n", buffer.toString());
    }

    @Test
    public void testCustomIndentAndSeparator() {
        CodeBuffer buffer = new CodeBuffer("\t", "\r\n");
        buffer.indent();
        buffer.writeln("x;");
        buffer.outdent();
        assertEquals("\tx;\r\n", buffer.toString());
    }

    @Test
    public void testUnterminatedLine() {
        CodeBuffer buffer = new CodeBuffer();
        buffer.write("partial");
        assertEquals("partial", buffer.toString());
    }

    @Test
    public void testOutdentBelowZero() {
        CodeBuffer buffer = new CodeBuffer();
        assertThrows(IllegalStateException.class, buffer::outdent);
    }
}
