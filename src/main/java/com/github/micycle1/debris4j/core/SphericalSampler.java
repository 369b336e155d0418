package com.github.micycle1.debris4j.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.debris4j.geom.PointCloud;

/**
 * Draws the seed cloud of a fragment: points on the unit sphere plus isotropic
 * Gaussian noise.
 * <p>
 * The polar angle is drawn uniformly from {@code [0, pi]} rather than through
 * {@code acos(uniform)}, so point density is higher near the poles. This is a
 * known non-uniformity that is kept for reproducibility of existing shapes.
 * <p>
 * Draw order is fixed: every azimuth, then every polar angle, then the
 * {@code (x, y, z)} noise of each point in turn. A seeded {@link Random}
 * therefore yields bit-identical clouds.
 */
public final class SphericalSampler {

	private static final double TWO_PI = 2 * Math.PI;

	private SphericalSampler() {
	}

	/**
	 * @param vertexCount  number of points to draw, at least 1
	 * @param irregularity per-axis noise standard deviation, non-negative
	 * @param random       caller-owned random source
	 * @return a new cloud of {@code vertexCount} points
	 */
	public static PointCloud sample(int vertexCount, double irregularity, Random random) {
		Objects.requireNonNull(random, "random");
		if (vertexCount < 1) {
			throw new IllegalArgumentException("vertexCount must be positive");
		}
		if (!Double.isFinite(irregularity) || irregularity < 0) {
			throw new IllegalArgumentException("irregularity must be finite and >= 0");
		}

		double[] theta = new double[vertexCount];
		for (int i = 0; i < vertexCount; i++) {
			theta[i] = random.nextDouble() * TWO_PI;
		}
		double[] phi = new double[vertexCount];
		for (int i = 0; i < vertexCount; i++) {
			phi[i] = random.nextDouble() * Math.PI;
		}

		List<Coordinate> points = new ArrayList<>(vertexCount);
		for (int i = 0; i < vertexCount; i++) {
			double sinPhi = Math.sin(phi[i]);
			double x = sinPhi * Math.cos(theta[i]) + random.nextGaussian() * irregularity;
			double y = sinPhi * Math.sin(theta[i]) + random.nextGaussian() * irregularity;
			double z = Math.cos(phi[i]) + random.nextGaussian() * irregularity;
			points.add(new Coordinate(x, y, z));
		}
		return new PointCloud(points);
	}
}
