package com.github.micycle1.debris4j;

/**
 * The sampled point configuration cannot form a solid convex polyhedron
 * (coincident, collinear or coplanar points, or a zero-extent cloud).
 * <p>
 * The failure belongs to one random draw; callers may retry with a fresh draw.
 */
public class DegenerateGeometryException extends DebrisException {

	private static final long serialVersionUID = 1L;

	public DegenerateGeometryException(String message) {
		super(message);
	}

	public DegenerateGeometryException(String message, Throwable cause) {
		super(message, cause);
	}
}
