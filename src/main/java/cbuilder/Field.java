package cbuilder;

import com.google.common.base.Preconditions;

/**
 * A member of a {@link Struct}, or a variable declaration.
 */
public class Field extends Commentable {

	private final CType type;
	private final String name;
	private final Expression value;

	public Field(CType type, String name) {
		this(type, name, null);
	}

	/**
	 * @param value the initializer, or {@code null} for none
	 */
	public Field(CType type, String name, Expression value) {
		this.type = Preconditions.checkNotNull(type);
		this.name = Preconditions.checkNotNull(name);
		this.value = value;
	}

	public CType getType() {
		return type;
	}

	public String getName() {
		return name;
	}

	public Expression getValue() {
		return value;
	}

	/**
	 * The declaration without the terminating semicolon.
	 */
	public String getDeclaration() {
		if (value == null) {
			return type.getCode() + " " + name;
		}
		return type.getCode() + " " + name + " = " + value.getCode();
	}

	@Override
	protected void renderBody(CodeSink out) {
		out.writeln(getDeclaration() + ";");
	}

	@Override
	public String toString() {
		return getDeclaration();
	}
}
