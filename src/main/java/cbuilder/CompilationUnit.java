package cbuilder;

import java.util.List;

import com.google.common.collect.Lists;

/**
 * A C source or header file: the root of a tree.
 *
 * Top-level nodes are written one after another. Blank lines between them
 * have to be added as content, e.g. {@link Code#EMPTY}.
 */
public class CompilationUnit extends Commentable {

	private final List<Emittable> body = Lists.newArrayList();

	public List<Emittable> getBody() {
		return body;
	}

	/**
	 * Renders this unit into a fresh {@link CodeBuffer} and returns the text.
	 */
	public String render() {
		CodeBuffer buffer = new CodeBuffer();
		render(buffer);
		return buffer.toString();
	}

	@Override
	protected void renderBody(CodeSink out) {
		for (Emittable e : body) {
			e.render(out);
		}
	}
}
