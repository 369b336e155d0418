package com.github.micycle1.debris4j.geom;

import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.math.Vector3D;

/**
 * Geometric primitives and utility operations shared by the generation stages.
 * <p>
 * Points are JTS {@link Coordinate}s carrying all three ordinates.
 */
public final class Geom {

	/** Relative tolerance used when comparing lengths against a target size. */
	public static final double LENGTH_REL_TOL = 1e-9;
	/** Hull volume below this fraction of {@code diameter^3} counts as flat. */
	public static final double VOLUME_REL_EPS = 1e-12;
	private static final double NEAR_ZERO_EPS = 1e-12;

	private Geom() {
	}

	public static boolean nearZero(double val) {
		return Math.abs(val) <= NEAR_ZERO_EPS;
	}

	public static double dist2(Coordinate a, Coordinate b) {
		double dx = b.x - a.x;
		double dy = b.y - a.y;
		double dz = b.z - a.z;
		return dx * dx + dy * dy + dz * dz;
	}

	/**
	 * Full symmetric pairwise Euclidean distance matrix with a zero diagonal.
	 */
	public static double[][] distanceMatrix(List<Coordinate> points) {
		int n = points.size();
		double[][] d = new double[n][n];
		for (int i = 0; i < n; i++) {
			for (int j = i + 1; j < n; j++) {
				double dist = Math.sqrt(dist2(points.get(i), points.get(j)));
				d[i][j] = dist;
				d[j][i] = dist;
			}
		}
		return d;
	}

	public static double max(double[][] matrix) {
		double max = 0;
		for (double[] row : matrix) {
			for (double v : row) {
				// propagate NaN
				if (v > max || Double.isNaN(v)) {
					max = v;
				}
			}
		}
		return max;
	}

	/**
	 * Maximum pairwise distance (diameter) of a point set; {@code 0} for fewer
	 * than two points.
	 */
	public static double maxPairwiseDistance(List<Coordinate> points) {
		double best = 0;
		for (int i = 0; i < points.size(); i++) {
			for (int j = i + 1; j < points.size(); j++) {
				best = Math.max(best, dist2(points.get(i), points.get(j)));
			}
		}
		return Math.sqrt(best);
	}

	public static Coordinate centroid(List<Coordinate> points) {
		double x = 0, y = 0, z = 0;
		for (Coordinate p : points) {
			x += p.x;
			y += p.y;
			z += p.z;
		}
		int n = points.size();
		return new Coordinate(x / n, y / n, z / n);
	}

	/**
	 * Non-normalised normal {@code (b - a) x (c - a)}; its direction follows the
	 * right-hand rule over the winding {@code a -> b -> c}.
	 */
	public static Vector3D cross(Coordinate a, Coordinate b, Coordinate c) {
		double ux = b.x - a.x, uy = b.y - a.y, uz = b.z - a.z;
		double vx = c.x - a.x, vy = c.y - a.y, vz = c.z - a.z;
		return new Vector3D(uy * vz - uz * vy, uz * vx - ux * vz, ux * vy - uy * vx);
	}

	/**
	 * Unit normal of triangle {@code a, b, c}, or the zero vector when the
	 * triangle has no area.
	 */
	public static Vector3D unitNormal(Coordinate a, Coordinate b, Coordinate c) {
		Vector3D n = cross(a, b, c);
		double len = n.length();
		if (nearZero(len)) {
			return new Vector3D(0, 0, 0);
		}
		return new Vector3D(n.getX() / len, n.getY() / len, n.getZ() / len);
	}

	/**
	 * Six times the signed volume of tetrahedron {@code apex, a, b, c}. Positive
	 * when {@code a -> b -> c} winds counter-clockwise seen from outside, i.e.
	 * from the side opposite {@code apex}.
	 */
	public static double signedVolume6(Coordinate apex, Coordinate a, Coordinate b, Coordinate c) {
		Vector3D n = cross(a, b, c);
		return n.getX() * (a.x - apex.x) + n.getY() * (a.y - apex.y) + n.getZ() * (a.z - apex.z);
	}
}
