package com.github.micycle1.debris4j;

/**
 * Export was requested before any mesh was generated.
 */
public class NoMeshGeneratedException extends DebrisException {

	private static final long serialVersionUID = 1L;

	public NoMeshGeneratedException(String message) {
		super(message);
	}
}
