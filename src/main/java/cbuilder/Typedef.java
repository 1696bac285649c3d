package cbuilder;

import com.google.common.base.Preconditions;

/**
 * A {@code typedef}. A {@link Struct} is written as a block with one field
 * per line instead of its single line spelling.
 */
public class Typedef extends Commentable {

	private final CType type;
	private final String name;

	public Typedef(CType type, String name) {
		this.type = Preconditions.checkNotNull(type);
		this.name = Preconditions.checkNotNull(name);
	}

	public CType getType() {
		return type;
	}

	public String getName() {
		return name;
	}

	@Override
	protected void renderBody(CodeSink out) {
		if (type instanceof Struct) {
			out.writeln("typedef struct {");
			out.indent();
			for (Field f : ((Struct) type).getFields()) {
				f.render(out);
			}
			out.outdent();
			out.writeln("} " + name + ";");
		} else {
			out.writeln("typedef " + type.getCode() + " " + name + ";");
		}
	}
}
