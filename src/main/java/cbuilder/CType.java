package cbuilder;

import com.google.common.base.Preconditions;

/**
 * The spelling of a C type, e.g. {@code const char*}.
 *
 * Descriptors are immutable; every composition returns a new one.
 */
public class CType implements Emittable {

	public static final CType CHAR = new CType("char");
	public static final CType INT = new CType("int");
	public static final CType FLOAT = new CType("float");
	public static final CType DOUBLE = new CType("double");
	public static final CType INT8_T = new CType("int8_t");
	public static final CType INT16_T = new CType("int16_t");
	public static final CType INT32_T = new CType("int32_t");
	public static final CType INT64_T = new CType("int64_t");
	public static final CType UINT8_T = new CType("uint8_t");
	public static final CType UINT16_T = new CType("uint16_t");
	public static final CType UINT32_T = new CType("uint32_t");
	public static final CType UINT64_T = new CType("uint64_t");
	public static final CType SIZE_T = new CType("size_t");
	public static final CType PTRDIFF_T = new CType("ptrdiff_t");
	public static final CType VOID = new CType("void");

	private final String code;

	public CType(String code) {
		this.code = Preconditions.checkNotNull(code);
	}

	/** Only for subclasses that compute their spelling. */
	protected CType() {
		this.code = null;
	}

	public String getCode() {
		return code;
	}

	public CType pointer() {
		return new CType(getCode() + "*");
	}

	public CType array() {
		return new CType(getCode() + "[]");
	}

	public CType array(int size) {
		Preconditions.checkArgument(size >= 0, "negative array size: %s", size);
		return new CType(getCode() + "[" + size + "]");
	}

	public CType array(Expression size) {
		return new CType(getCode() + "[" + size.getCode() + "]");
	}

	public CType prefix(String text) {
		return new CType(text + " " + getCode());
	}

	public CType suffix(String text) {
		return new CType(getCode() + " " + text);
	}

	public CType asUnsigned() {
		return prefix("unsigned");
	}

	public CType asConst() {
		return prefix("const");
	}

	public CType asStatic() {
		return prefix("static");
	}

	public CType asExtern() {
		return prefix("extern");
	}

	/**
	 * Adds a linkage specification, e.g. {@code extern "C" int}.
	 */
	public CType asExtern(String linkage) {
		return prefix("extern " + CStrings.quote(linkage));
	}

	public CType asRegister() {
		return prefix("register");
	}

	public CType asVolatile() {
		return prefix("volatile");
	}

	public CType asShort() {
		return prefix("short");
	}

	public CType asLong() {
		return prefix("long");
	}

	public CType asInline() {
		return prefix("inline");
	}

	public CType asStruct() {
		return prefix("struct");
	}

	public CType asEnum() {
		return prefix("enum");
	}

	public Expression sizeof() {
		return new Expression("sizeof(" + getCode() + ")");
	}

	@Override
	public void render(CodeSink out) {
		out.writeln(getCode());
	}

	@Override
	public String toString() {
		return getCode();
	}
}
