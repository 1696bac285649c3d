package cbuilder;

import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * A C {@code enum}. Every value is assigned its position explicitly.
 */
public class CEnum extends Commentable {

	private final String name;
	private final List<String> values = Lists.newArrayList();

	public CEnum(String name, String... values) {
		this.name = Preconditions.checkNotNull(name);
		Collections.addAll(this.values, values);
	}

	public String getName() {
		return name;
	}

	public List<String> getValues() {
		return values;
	}

	/**
	 * The type spelling {@code enum name}.
	 */
	public CType asType() {
		return new CType(name).asEnum();
	}

	@Override
	protected void renderBody(CodeSink out) {
		out.writeln("enum " + name + " {");
		out.indent();
		for (int i = 0; i < values.size(); i++) {
			String trail = i == values.size() - 1 ? "" : ",";
			out.writeln(values.get(i) + " = " + i + trail);
		}
		out.outdent();
		out.writeln("};");
	}
}
