package com.github.micycle1.debris4j;

/**
 * Base type for all failures reported by debris generation and export.
 * <p>
 * Every subtype is terminal for the attempt that raised it: no partial or
 * default mesh is ever returned alongside one of these.
 */
public class DebrisException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public DebrisException(String message) {
		super(message);
	}

	public DebrisException(String message, Throwable cause) {
		super(message, cause);
	}
}
