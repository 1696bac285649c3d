package cbuilder;

import com.google.common.base.Preconditions;

/**
 * A parameter of a {@link FunctionSignature}.
 */
public class Parameter {

	private final CType type;
	private final String name;

	public Parameter(CType type, String name) {
		this.type = Preconditions.checkNotNull(type);
		this.name = Preconditions.checkNotNull(name);
	}

	public CType getType() {
		return type;
	}

	public String getName() {
		return name;
	}

	/**
	 * The parameter as written in a parameter list, e.g. {@code char** argv}.
	 */
	public String getDeclaration() {
		return type.getCode() + " " + name;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Parameter) {
			Parameter parameter = (Parameter) obj;
			return getDeclaration().equals(parameter.getDeclaration());
		}
		return false;
	}

	@Override
	public int hashCode() {
		return getDeclaration().hashCode();
	}

	@Override
	public String toString() {
		return getDeclaration();
	}
}
