package cbuilder;

import java.util.Collections;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * The signature of a C function. Rendered on its own it is a prototype
 * declaration.
 */
public class FunctionSignature extends Commentable {

	private static final Joiner COMMA = Joiner.on(", ");

	private final CType returnType;
	private final String name;
	private final List<Parameter> parameters = Lists.newArrayList();

	public FunctionSignature(CType returnType, String name, Parameter... parameters) {
		this.returnType = Preconditions.checkNotNull(returnType);
		this.name = Preconditions.checkNotNull(name);
		Collections.addAll(this.parameters, parameters);
	}

	public CType getReturnType() {
		return returnType;
	}

	public String getName() {
		return name;
	}

	public List<Parameter> getParameters() {
		return parameters;
	}

	/**
	 * E.g. {@code int main(int argc, char** argv)}.
	 */
	public String getSignature() {
		List<String> params = Lists.newArrayList();
		for (Parameter p : parameters) {
			params.add(p.getDeclaration());
		}
		return returnType.getCode() + " " + name + "(" + COMMA.join(params) + ")";
	}

	String getParameterTypes() {
		List<String> types = Lists.newArrayList();
		for (Parameter p : parameters) {
			types.add(p.getType().getCode());
		}
		return COMMA.join(types);
	}

	/**
	 * The type of a pointer to a function with this signature, e.g.
	 * {@code int (*)(int, int)}.
	 */
	public CType pointerType() {
		return new CType(returnType.getCode() + " (*)(" + getParameterTypes() + ")");
	}

	/**
	 * A parameter named like this function that holds a pointer to a
	 * function with this signature, e.g. {@code int (*compare)(int, int)}.
	 */
	public Parameter asParameter() {
		return new FunctionPointerParameter(this);
	}

	@Override
	protected void renderBody(CodeSink out) {
		out.writeln(getSignature() + ";");
	}

	@Override
	public String toString() {
		return getSignature();
	}
}
