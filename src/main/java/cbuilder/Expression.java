package cbuilder;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * A C expression, held as a single line of code.
 *
 * Every composition returns a new expression that textually wraps its
 * operands. Operators are not checked for precedence: callers that need
 * grouping add it with {@link #parentheses()}.
 */
public final class Expression implements Emittable {

	public static final Expression NULL = new Expression("NULL");

	private final String code;

	public Expression(String code) {
		this.code = Preconditions.checkNotNull(code);
	}

	/**
	 * Creates the C literal for a Java value: {@code null} becomes
	 * {@code NULL}, strings are quoted and escaped, numbers use their decimal
	 * spelling.
	 *
	 * @throws UnsupportedValueException for any other type, and for NaN or
	 *         infinite floating point values
	 */
	public static Expression value(Object value) {
		if (value == null) {
			return NULL;
		}
		if (value instanceof String) {
			return new Expression(CStrings.quote((String) value));
		}
		if (value instanceof BigDecimal) {
			return new Expression(((BigDecimal) value).toPlainString());
		}
		if (value instanceof Double || value instanceof Float) {
			double d = ((Number) value).doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d)) {
				throw new UnsupportedValueException(value.getClass(),
						"Cannot express the non-finite value " + value + " as a C literal.");
			}
		}
		if (value instanceof Number) {
			return new Expression(value.toString());
		}
		throw new UnsupportedValueException(value.getClass());
	}

	public static Expression identifier(String name) {
		return new Expression(name);
	}

	/**
	 * An initializer list, e.g. {@code { 1, 2, 3 }}.
	 */
	public static Expression array(List<Expression> values) {
		return new Expression("{ " + join(values) + " }");
	}

	public static Expression array(Expression... values) {
		return array(Arrays.asList(values));
	}

	public String getCode() {
		return code;
	}

	public Code asReturn() {
		return new Code("return " + code + ";");
	}

	public Code asThrow() {
		return new Code("throw " + code + ";");
	}

	public Expression invoke(List<Expression> arguments) {
		return new Expression(code + "(" + join(arguments) + ")");
	}

	public Expression invoke(Expression... arguments) {
		return invoke(Arrays.asList(arguments));
	}

	/** Assigns this value to the variable {@code name}. */
	public Expression assignTo(String name) {
		return assignTo(name, "=");
	}

	/**
	 * Assigns this value to the variable {@code name} with a compound
	 * operator such as {@code +=}.
	 */
	public Expression assignTo(String name, String op) {
		return new Expression(name + " " + op + " " + code);
	}

	public Expression increment() {
		return new Expression(code + "++");
	}

	public Expression decrement() {
		return new Expression(code + "--");
	}

	public Expression incrementPre() {
		return new Expression("++" + code);
	}

	public Expression decrementPre() {
		return new Expression("--" + code);
	}

	public Expression conditional(Expression ifTrue, Expression ifFalse) {
		return new Expression(code + " ? " + ifTrue.code + " : " + ifFalse.code);
	}

	public Expression cast(CType type) {
		return new Expression("(" + type.getCode() + ") " + code);
	}

	public Expression reference() {
		return new Expression("&" + code);
	}

	public Expression dereference() {
		return new Expression("*" + code);
	}

	public Expression parentheses() {
		return new Expression("(" + code + ")");
	}

	public Expression sizeof() {
		return new Expression("sizeof(" + code + ")");
	}

	public Expression not() {
		return new Expression("!" + code);
	}

	public Expression complement() {
		return new Expression("~" + code);
	}

	public Expression negative() {
		return new Expression("-" + code);
	}

	public Expression index(Expression index) {
		return new Expression(code + "[" + index.code + "]");
	}

	public Expression member(String name) {
		return new Expression(code + "." + name);
	}

	public Expression arrow(String name) {
		return new Expression(code + "->" + name);
	}

	public Expression multiply(Expression other) {
		return binary("*", other);
	}

	public Expression divide(Expression other) {
		return binary("/", other);
	}

	public Expression modulo(Expression other) {
		return binary("%", other);
	}

	public Expression add(Expression other) {
		return binary("+", other);
	}

	public Expression subtract(Expression other) {
		return binary("-", other);
	}

	public Expression equalTo(Expression other) {
		return binary("==", other);
	}

	public Expression notEqualTo(Expression other) {
		return binary("!=", other);
	}

	public Expression and(Expression other) {
		return binary("&&", other);
	}

	public Expression or(Expression other) {
		return binary("||", other);
	}

	public Expression lessThan(Expression other) {
		return binary("<", other);
	}

	public Expression lessOrEqual(Expression other) {
		return binary("<=", other);
	}

	public Expression greaterThan(Expression other) {
		return binary(">", other);
	}

	public Expression greaterOrEqual(Expression other) {
		return binary(">=", other);
	}

	public Expression shiftLeft(Expression other) {
		return binary("<<", other);
	}

	public Expression shiftRight(Expression other) {
		return binary(">>", other);
	}

	public Expression bitAnd(Expression other) {
		return binary("&", other);
	}

	public Expression bitOr(Expression other) {
		return binary("|", other);
	}

	public Expression bitXor(Expression other) {
		return binary("^", other);
	}

	private Expression binary(String op, Expression other) {
		return new Expression(code + " " + op + " " + other.code);
	}

	static String join(List<Expression> expressions) {
		StringBuilder result = new StringBuilder();
		boolean first = true;
		for (Expression e : expressions) {
			if (!first) {
				result.append(", ");
			}
			result.append(e.code);
			first = false;
		}
		return result.toString();
	}

	/**
	 * Writes this expression as a statement.
	 */
	@Override
	public void render(CodeSink out) {
		out.writeln(code + ";");
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Expression) {
			return code.equals(((Expression) obj).code);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return code.hashCode();
	}

	@Override
	public String toString() {
		return code;
	}
}
