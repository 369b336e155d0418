package com.github.micycle1.debris4j.core;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.debris4j.DegenerateGeometryException;
import com.github.micycle1.debris4j.geom.Geom;
import com.github.micycle1.debris4j.geom.PointCloud;

/**
 * Rescales a cloud isotropically so that its maximum pairwise distance equals
 * a target characteristic length.
 */
public final class ScaleNormalizer {

	private static final Logger log = LoggerFactory.getLogger(ScaleNormalizer.class);

	private ScaleNormalizer() {
	}

	/**
	 * Scales {@code cloud} in place.
	 *
	 * @param cloud                points to rescale
	 * @param characteristicLength target maximum pairwise distance, positive
	 * @return the factor every ordinate was multiplied by
	 * @throws DegenerateGeometryException if all points coincide
	 */
	public static double normalize(PointCloud cloud, double characteristicLength) {
		Objects.requireNonNull(cloud, "cloud");
		if (!Double.isFinite(characteristicLength) || characteristicLength <= 0) {
			throw new IllegalArgumentException("characteristicLength must be finite and > 0");
		}

		double maxDistance = Geom.max(Geom.distanceMatrix(cloud.points()));
		if (!Double.isFinite(maxDistance) || maxDistance <= 0) {
			throw new DegenerateGeometryException("Point cloud has zero extent (max pairwise distance " + maxDistance + ")");
		}

		double scale = characteristicLength / maxDistance;
		cloud.scale(scale);
		log.debug("Scaled {} points by {} (max distance {} -> {})", cloud.size(), scale, maxDistance, characteristicLength);
		return scale;
	}
}
