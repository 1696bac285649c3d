package cbuilder;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * Wraps its body in an include guard. The body is not indented.
 */
public class Ifndef implements Emittable {

	private final String name;
	private final List<Emittable> body = Lists.newArrayList();

	public Ifndef(String name) {
		this.name = Preconditions.checkNotNull(name);
	}

	public String getName() {
		return name;
	}

	public List<Emittable> getBody() {
		return body;
	}

	@Override
	public void render(CodeSink out) {
		out.writeln("#ifndef " + name);
		out.writeln("#define " + name);
		for (Emittable e : body) {
			e.render(out);
		}
		out.writeln("#endif");
	}
}
