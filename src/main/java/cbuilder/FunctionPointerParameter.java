package cbuilder;

/**
 * A parameter holding a pointer to a function with a given signature:
 * {@code int (*compare)(int, int)}.
 */
final class FunctionPointerParameter extends Parameter {

	private final FunctionSignature signature;

	FunctionPointerParameter(FunctionSignature signature) {
		super(signature.pointerType(), signature.getName());
		this.signature = signature;
	}

	/**
	 * Recomputed from the signature, which may still gain parameters.
	 */
	@Override
	public CType getType() {
		return signature.pointerType();
	}

	@Override
	public String getDeclaration() {
		return signature.getReturnType().getCode() + " (*" + getName() + ")(" + signature.getParameterTypes() + ")";
	}
}
