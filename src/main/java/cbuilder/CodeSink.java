package cbuilder;

/**
 * Line oriented target that {@link Emittable}s write to.
 *
 * Every construct that calls {@link #indent()} must call {@link #outdent()}
 * before it returns, so that siblings see the depth they started with.
 */
public interface CodeSink {

	/**
	 * Appends text to the current line. The indentation is placed when a
	 * fresh line receives its first text.
	 */
	void write(String text);

	/**
	 * Appends text and terminates the current line.
	 */
	void writeln(String text);

	/**
	 * Terminates the current line.
	 */
	void writeln();

	void indent();

	void outdent();

}
