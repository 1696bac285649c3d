package cbuilder;

import java.util.Collections;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

/**
 * An anonymous struct type. Its spelling is computed from the current
 * fields every time it is asked for, so fields may be added until the tree
 * is rendered.
 */
public class Struct extends CType {

	private final List<Field> fields = Lists.newArrayList();

	public Struct(Field... fields) {
		Collections.addAll(this.fields, fields);
	}

	public List<Field> getFields() {
		return fields;
	}

	@Override
	public String getCode() {
		List<String> decls = Lists.newArrayList();
		for (Field f : fields) {
			decls.add(f.getDeclaration());
		}
		return "struct { " + Joiner.on("; ").join(decls) + " }";
	}
}
