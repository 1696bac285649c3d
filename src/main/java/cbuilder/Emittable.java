package cbuilder;

/**
 * A node of the C source tree that can write itself to a {@link CodeSink}.
 *
 * Rendering must not modify the node, so a tree can be rendered any number
 * of times with the same result.
 */
public interface Emittable {

	void render(CodeSink out);

}
