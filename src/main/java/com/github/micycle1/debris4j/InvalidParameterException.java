package com.github.micycle1.debris4j;

/**
 * A generation parameter lies outside its documented range.
 */
public class InvalidParameterException extends DebrisException {

	private static final long serialVersionUID = 1L;

	private final String field;
	private final String bound;

	public InvalidParameterException(String field, String bound, Object value) {
		super(field + " must be " + bound + " (was " + value + ")");
		this.field = field;
		this.bound = bound;
	}

	/**
	 * @return name of the offending parameter, e.g. {@code "vertexCount"}
	 */
	public String field() {
		return field;
	}

	/**
	 * @return human-readable description of the accepted range
	 */
	public String bound() {
		return bound;
	}
}
