package cbuilder;

import com.google.common.base.Preconditions;

/**
 * In-memory {@link CodeSink}. The accumulated text is returned by
 * {@link #toString()}.
 */
public class CodeBuffer implements CodeSink {

	public static final String DEFAULT_INDENT = "    ";

	private final StringBuilder sb = new StringBuilder();
	private final String indentUnit;
	private final String lineSeparator;
	private int depth = 0;
	private boolean atLineStart = true;

	public CodeBuffer() {
		this(DEFAULT_INDENT, "\n");
	}

	public CodeBuffer(String indentUnit, String lineSeparator) {
		this.indentUnit = Preconditions.checkNotNull(indentUnit);
		this.lineSeparator = Preconditions.checkNotNull(lineSeparator);
	}

	@Override
	public void write(String text) {
		if (text.isEmpty()) {
			return;
		}
		if (atLineStart) {
			for (int i = 0; i < depth; i++) {
				sb.append(indentUnit);
			}
			atLineStart = false;
		}
		sb.append(text);
	}

	@Override
	public void writeln(String text) {
		write(text);
		writeln();
	}

	@Override
	public void writeln() {
		sb.append(lineSeparator);
		atLineStart = true;
	}

	@Override
	public void indent() {
		depth++;
	}

	@Override
	public void outdent() {
		Preconditions.checkState(depth > 0, "outdent without matching indent");
		depth--;
	}

	public int getDepth() {
		return depth;
	}

	@Override
	public String toString() {
		return sb.toString();
	}
}
