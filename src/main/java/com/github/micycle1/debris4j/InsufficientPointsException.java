package com.github.micycle1.debris4j;

public class InsufficientPointsException extends DebrisException {

	private static final long serialVersionUID = 1L;

	private final int actual;
	private final int required;

	public InsufficientPointsException(int actual, int required) {
		super("Convex hull needs at least " + required + " points (got " + actual + ")");
		this.actual = actual;
		this.required = required;
	}

	public int actual() {
		return actual;
	}

	public int required() {
		return required;
	}
}
