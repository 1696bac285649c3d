package cbuilder;

import com.google.common.base.Preconditions;

/**
 * An {@code #include} directive.
 */
public class Include extends Commentable {

	private final String source;

	private Include(String source) {
		this.source = source;
	}

	/**
	 * Includes a header relative to the source directory:
	 * {@code #include "path"}.
	 */
	public static Include quotes(String path) {
		return new Include(CStrings.quote(Preconditions.checkNotNull(path)));
	}

	/**
	 * Includes a system header: {@code #include <path>}.
	 */
	public static Include system(String path) {
		return new Include("<" + Preconditions.checkNotNull(path) + ">");
	}

	/**
	 * The quoted or angle-bracketed path.
	 */
	public String getSource() {
		return source;
	}

	@Override
	protected void renderBody(CodeSink out) {
		out.writeln("#include " + source);
	}
}
