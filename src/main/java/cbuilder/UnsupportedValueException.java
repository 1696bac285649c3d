package cbuilder;

/**
 * Thrown when a Java value has no C literal spelling.
 */
public class UnsupportedValueException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final Class<?> valueType;

	public UnsupportedValueException(Class<?> valueType) {
		this(valueType, "Cannot express a value of type " + valueType.getName() + " as a C expression.");
	}

	public UnsupportedValueException(Class<?> valueType, String message) {
		super(message);
		this.valueType = valueType;
	}

	public Class<?> getValueType() {
		return valueType;
	}
}
