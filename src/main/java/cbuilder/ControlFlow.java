package cbuilder;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * A braced control-flow block such as {@code if}, {@code while} or
 * {@code switch}. Instances are created through the static factories.
 */
public class ControlFlow extends Commentable {

	private final String preamble;
	private final String suffix;
	private final List<Emittable> body = Lists.newArrayList();

	private ControlFlow(String preamble, String suffix) {
		this.preamble = Preconditions.checkNotNull(preamble);
		this.suffix = suffix;
	}

	private ControlFlow(String preamble) {
		this(preamble, "");
	}

	public static ControlFlow whileLoop(Expression condition) {
		return new ControlFlow("while (" + condition.getCode() + ")");
	}

	/**
	 * {@code do { ... } while (condition);}
	 */
	public static ControlFlow doWhile(Expression condition) {
		return new ControlFlow("do", "while (" + condition.getCode() + ");");
	}

	public static ControlFlow ifThen(Expression condition) {
		return new ControlFlow("if (" + condition.getCode() + ")");
	}

	public static ControlFlow elseIf(Expression condition) {
		return new ControlFlow("else if (" + condition.getCode() + ")");
	}

	public static ControlFlow elseBlock() {
		return new ControlFlow("else");
	}

	public static ControlFlow forLoop(Expression initializer, Expression condition, Expression accumulator) {
		return forLoop(initializer.getCode(), condition, accumulator);
	}

	/**
	 * A loop that declares its counter, e.g. {@code for (int i = 0; i < n; i++)}.
	 */
	public static ControlFlow forLoop(Field initializer, Expression condition, Expression accumulator) {
		return forLoop(initializer.getDeclaration(), condition, accumulator);
	}

	private static ControlFlow forLoop(String initializer, Expression condition, Expression accumulator) {
		return new ControlFlow("for (" + initializer + "; " + condition.getCode() + "; " + accumulator.getCode() + ")");
	}

	public static ControlFlow switchBlock(Expression condition) {
		return new ControlFlow("switch (" + condition.getCode() + ")");
	}

	public static ControlFlow tryBlock() {
		return new ControlFlow("try");
	}

	public static ControlFlow catchBlock(Parameter parameter) {
		return new ControlFlow("catch (" + parameter.getDeclaration() + ")");
	}

	public static ControlFlow finallyBlock() {
		return new ControlFlow("finally");
	}

	public String getPreamble() {
		return preamble;
	}

	public String getSuffix() {
		return suffix;
	}

	public List<Emittable> getBody() {
		return body;
	}

	@Override
	protected void renderBody(CodeSink out) {
		out.writeln(preamble + " {");
		out.indent();
		for (Emittable e : body) {
			e.render(out);
		}
		out.outdent();
		if (suffix.isEmpty()) {
			out.writeln("}");
		} else {
			out.writeln("} " + suffix);
		}
	}
}
