package cbuilder;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static cbuilder.Expression.identifier;
import static cbuilder.Expression.value;
import static org.junit.jupiter.api.Assertions.*;

public class ExpressionTest {

    @Test
    public void testLiteralValues() {
        assertEquals("NULL", value(null).getCode());
        assertSame(Expression.NULL, value(null));
        assertEquals("0", value(0).getCode());
        assertEquals("42", value(42L).getCode());
        assertEquals("1.5", value(1.5).getCode());
        assertEquals("1000", value(new BigDecimal("1E+3")).getCode());
        assertEquals("\"a\\\"b\"", value("a\"b").getCode());
        assertEquals("\"line\\n\\tend\"", value("line\n\tend").getCode());
    }

    @Test
    public void testUnsupportedValue() {
        UnsupportedValueException e = assertThrows(UnsupportedValueException.class, () -> value(true));
        assertEquals(Boolean.class, e.getValueType());
        assertTrue(e.getMessage().contains("java.lang.Boolean"), e.getMessage());

        assertThrows(IllegalArgumentException.class, () -> value(List.of(1)));
    }

    @Test
    public void testNonFiniteValues() {
        UnsupportedValueException e = assertThrows(UnsupportedValueException.class, () -> value(Double.NaN));
        assertEquals(Double.class, e.getValueType());
        assertTrue(e.getMessage().contains("NaN"), e.getMessage());
        assertThrows(UnsupportedValueException.class, () -> value(Double.POSITIVE_INFINITY));
        assertThrows(UnsupportedValueException.class, () -> value(Float.NEGATIVE_INFINITY));
        assertEquals("2.5", value(2.5f).getCode());
    }

    @Test
    public void testCastAndReference() {
        var e = identifier("buf");
        assertEquals("(char*) buf", e.cast(CType.CHAR.pointer()).getCode());
        assertEquals("&buf", e.reference().getCode());
        assertEquals("*buf", e.dereference().getCode());
        assertEquals("sizeof(buf)", e.sizeof().getCode());
    }

    @Test
    public void testBinaryOperators() {
        var a = identifier("a");
        var b = identifier("b");
        assertEquals("a * b", a.multiply(b).getCode());
        assertEquals("a / b", a.divide(b).getCode());
        assertEquals("a % b", a.modulo(b).getCode());
        assertEquals("a + b", a.add(b).getCode());
        assertEquals("a - b", a.subtract(b).getCode());
        assertEquals("a == b", a.equalTo(b).getCode());
        assertEquals("a != b", a.notEqualTo(b).getCode());
        assertEquals("a && b", a.and(b).getCode());
        assertEquals("a || b", a.or(b).getCode());
        assertEquals("a < b", a.lessThan(b).getCode());
        assertEquals("a <= b", a.lessOrEqual(b).getCode());
        assertEquals("a > b", a.greaterThan(b).getCode());
        assertEquals("a >= b", a.greaterOrEqual(b).getCode());
        assertEquals("a << b", a.shiftLeft(b).getCode());
        assertEquals("a >> b", a.shiftRight(b).getCode());
        assertEquals("a & b", a.bitAnd(b).getCode());
        assertEquals("a | b", a.bitOr(b).getCode());
        assertEquals("a ^ b", a.bitXor(b).getCode());
    }

    @Test
    public void testUnaryOperators() {
        var i = identifier("i");
        assertEquals("i++", i.increment().getCode());
        assertEquals("i--", i.decrement().getCode());
        assertEquals("++i", i.incrementPre().getCode());
        assertEquals("--i", i.decrementPre().getCode());
        assertEquals("!i", i.not().getCode());
        assertEquals("~i", i.complement().getCode());
        assertEquals("-i", i.negative().getCode());
        assertEquals("(i)", i.parentheses().getCode());
    }

    @Test
    public void testNoAutomaticParentheses() {
        var a = identifier("a");
        var sum = a.add(value(1));
        assertEquals("a + 1 * 2", sum.multiply(value(2)).getCode());
        assertEquals("(a + 1) * 2", sum.parentheses().multiply(value(2)).getCode());
    }

    @Test
    public void testCompositionDoesNotModifyOperands() {
        var a = identifier("a");
        a.add(identifier("b"));
        a.increment();
        assertEquals("a", a.getCode());
    }

    @Test
    public void testInvokeAndIndex() {
        var printf = identifier("printf");
        assertEquals("printf(\"%d\\n\", x)", printf.invoke(value("%d\n"), identifier("x")).getCode());
        assertEquals("f()", identifier("f").invoke().getCode());
        assertEquals("argv[1]", identifier("argv").index(value(1)).getCode());
        assertEquals("p.x", identifier("p").member("x").getCode());
        assertEquals("p->next", identifier("p").arrow("next").getCode());
    }

    @Test
    public void testConditionalAndAssignment() {
        var cond = identifier("a").greaterThan(identifier("b"));
        assertEquals("a > b ? a : b", cond.conditional(identifier("a"), identifier("b")).getCode());
        assertEquals("x = 3", value(3).assignTo("x").getCode());
        assertEquals("x += 3", value(3).assignTo("x", "+=").getCode());
    }

    @Test
    public void testArrayInitializer() {
        assertEquals("{ 1, 2, 3 }", Expression.array(value(1), value(2), value(3)).getCode());
    }

    @Test
    public void testStatements() {
        assertEquals("return 0;", value(0).asReturn().getCode());
        assertEquals("throw err;", identifier("err").asThrow().getCode());

        CodeBuffer buffer = new CodeBuffer();
        identifier("i").increment().render(buffer);
        assertEquals("i++;\n", buffer.toString());
    }

    @Test
    public void testEquality() {
        assertEquals(identifier("a").add(value(1)), new Expression("a + 1"));
        assertEquals(new Expression("x").hashCode(), identifier("x").hashCode());
        assertNotEquals(identifier("x"), identifier("y"));
    }
}
