package cbuilder;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * A {@code case} or {@code default} label inside a switch block. The body is
 * indented below the label, without braces.
 */
public class SwitchCase implements Emittable {

	private final Expression expression;
	private final List<Emittable> body = Lists.newArrayList();

	public SwitchCase(Expression expression) {
		this.expression = Preconditions.checkNotNull(expression);
	}

	private SwitchCase() {
		this.expression = null;
	}

	public static SwitchCase defaultCase() {
		return new SwitchCase();
	}

	/**
	 * @return the case label, or {@code null} for the default case
	 */
	public Expression getExpression() {
		return expression;
	}

	public boolean isDefault() {
		return expression == null;
	}

	public List<Emittable> getBody() {
		return body;
	}

	@Override
	public void render(CodeSink out) {
		if (expression == null) {
			out.write("default:");
		} else {
			out.write("case " + expression.getCode() + ":");
		}
		out.writeln();
		out.indent();
		for (Emittable e : body) {
			e.render(out);
		}
		out.outdent();
	}
}
