package cbuilder;

import com.google.common.base.Preconditions;

/**
 * A line of C code, emitted verbatim.
 */
public class Code implements Emittable {

	public static final Code BREAK = new Code("break;");
	public static final Code CONTINUE = new Code("continue;");
	public static final Code EMPTY = new Code("");

	private final String code;

	public Code(String code) {
		this.code = Preconditions.checkNotNull(code);
	}

	public static Code returnVoid() {
		return new Code("return;");
	}

	public String getCode() {
		return code;
	}

	@Override
	public void render(CodeSink out) {
		out.writeln(code);
	}

	@Override
	public String toString() {
		return code;
	}
}
