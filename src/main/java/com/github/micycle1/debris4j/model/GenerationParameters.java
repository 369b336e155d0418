package com.github.micycle1.debris4j.model;

import com.github.micycle1.debris4j.InvalidParameterException;

/**
 * Immutable, validated inputs for one debris generation.
 *
 * @param vertexCount          number of points sampled before hull extraction,
 *                             in {@code [5, 20]}
 * @param characteristicLength target maximum pairwise vertex distance in
 *                             millimetres, in {@code [1, 100]}
 * @param irregularity         standard deviation of the per-axis Gaussian noise
 *                             added to the unit-sphere samples, in
 *                             {@code [0, 1]}
 */
public record GenerationParameters(int vertexCount, double characteristicLength, double irregularity) {

	public static final int MIN_VERTEX_COUNT = 5;
	public static final int MAX_VERTEX_COUNT = 20;
	public static final double MIN_CHARACTERISTIC_LENGTH = 1.0;
	public static final double MAX_CHARACTERISTIC_LENGTH = 100.0;
	public static final double MIN_IRREGULARITY = 0.0;
	public static final double MAX_IRREGULARITY = 1.0;

	public GenerationParameters {
		if (vertexCount < MIN_VERTEX_COUNT || vertexCount > MAX_VERTEX_COUNT) {
			throw new InvalidParameterException("vertexCount", "between " + MIN_VERTEX_COUNT + " and " + MAX_VERTEX_COUNT, vertexCount);
		}
		if (!inRange(characteristicLength, MIN_CHARACTERISTIC_LENGTH, MAX_CHARACTERISTIC_LENGTH)) {
			throw new InvalidParameterException("characteristicLength",
					"between " + MIN_CHARACTERISTIC_LENGTH + " and " + MAX_CHARACTERISTIC_LENGTH + " mm", characteristicLength);
		}
		if (!inRange(irregularity, MIN_IRREGULARITY, MAX_IRREGULARITY)) {
			throw new InvalidParameterException("irregularity", "between " + MIN_IRREGULARITY + " and " + MAX_IRREGULARITY, irregularity);
		}
	}

	/**
	 * @return 10 vertices, 10 mm, irregularity 0.5
	 */
	public static GenerationParameters defaults() {
		return new GenerationParameters(10, 10.0, 0.5);
	}

	public GenerationParameters withVertexCount(int vertexCount) {
		return new GenerationParameters(vertexCount, characteristicLength, irregularity);
	}

	public GenerationParameters withCharacteristicLength(double characteristicLength) {
		return new GenerationParameters(vertexCount, characteristicLength, irregularity);
	}

	public GenerationParameters withIrregularity(double irregularity) {
		return new GenerationParameters(vertexCount, characteristicLength, irregularity);
	}

	private static boolean inRange(double v, double min, double max) {
		// false for NaN
		return v >= min && v <= max;
	}
}
