package com.github.micycle1.debris4j.geom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;

/**
 * Ordered, mutable cloud of 3D points.
 * <p>
 * Scaling rewrites the ordinates in place; point identity and order never
 * change, so index {@code i} always refers to the {@code i}-th sampled point.
 */
public class PointCloud implements Iterable<Coordinate> {

	private final List<Coordinate> points;

	public PointCloud(List<Coordinate> points) {
		this.points = new ArrayList<>(points.size());
		for (Coordinate p : points) {
			this.points.add(new Coordinate(p.x, p.y, p.z));
		}
	}

	/**
	 * Builds a cloud from {@code {x, y, z}} triples.
	 */
	public static PointCloud of(double[]... xyz) {
		List<Coordinate> points = new ArrayList<>(xyz.length);
		for (double[] p : xyz) {
			if (p.length != 3) {
				throw new IllegalArgumentException("Each point must be a double[3]");
			}
			points.add(new Coordinate(p[0], p[1], p[2]));
		}
		return new PointCloud(points);
	}

	public int size() {
		return points.size();
	}

	public Coordinate get(int i) {
		return points.get(i);
	}

	/**
	 * @return read-only view over the live points
	 */
	public List<Coordinate> points() {
		return Collections.unmodifiableList(points);
	}

	/**
	 * Multiplies every ordinate of every point by {@code factor}.
	 */
	public void scale(double factor) {
		for (Coordinate p : points) {
			p.x *= factor;
			p.y *= factor;
			p.z *= factor;
		}
	}

	/**
	 * @return ordinates packed as {@code x0, y0, z0, x1, ...}
	 */
	public double[] toPackedArray() {
		double[] coords = new double[points.size() * 3];
		for (int i = 0; i < points.size(); i++) {
			Coordinate p = points.get(i);
			coords[i * 3] = p.x;
			coords[i * 3 + 1] = p.y;
			coords[i * 3 + 2] = p.z;
		}
		return coords;
	}

	@Override
	public Iterator<Coordinate> iterator() {
		return points().iterator();
	}
}
