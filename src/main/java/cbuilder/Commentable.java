package cbuilder;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.Lists;

/**
 * An {@link Emittable} with a list of comments that is written in front of
 * the node itself.
 *
 * A single comment becomes a {@code //} line, two or more become one block
 * comment with a line per entry.
 */
public abstract class Commentable implements Emittable {

	private final List<String> comments = Lists.newArrayList();

	public List<String> getComments() {
		return comments;
	}

	public void addComments(String... lines) {
		Collections.addAll(comments, lines);
	}

	@Override
	public final void render(CodeSink out) {
		renderComments(out);
		renderBody(out);
	}

	protected abstract void renderBody(CodeSink out);

	private void renderComments(CodeSink out) {
		if (comments.size() == 1) {
			out.writeln("// " + comments.get(0));
		} else if (comments.size() > 1) {
			out.writeln("/*");
			for (String c : comments) {
				out.writeln(" * " + c);
			}
			out.writeln(" */");
		}
	}
}
