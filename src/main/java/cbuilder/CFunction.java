package cbuilder;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * A C function definition.
 */
public class CFunction extends Commentable {

	private final FunctionSignature signature;
	private final List<Emittable> body = Lists.newArrayList();

	public CFunction(FunctionSignature signature) {
		this.signature = Preconditions.checkNotNull(signature);
	}

	public FunctionSignature getSignature() {
		return signature;
	}

	public List<Emittable> getBody() {
		return body;
	}

	@Override
	protected void renderBody(CodeSink out) {
		out.writeln(signature.getSignature() + " {");
		out.indent();
		for (Emittable e : body) {
			e.render(out);
		}
		out.outdent();
		out.writeln("}");
	}
}
