package com.github.micycle1.debris4j.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.debris4j.DegenerateGeometryException;
import com.github.micycle1.debris4j.InsufficientPointsException;
import com.github.micycle1.debris4j.geom.Geom;
import com.github.micycle1.debris4j.geom.PointCloud;
import com.github.micycle1.debris4j.model.ConvexPolyhedron;
import com.github.quickhull3d.InternalErrorException;
import com.github.quickhull3d.QuickHull3D;

/**
 * Extracts the convex hull of a point cloud as a triangulated polyhedron.
 * <p>
 * Hull construction is delegated to QuickHull3D. Points that are not extreme
 * are dropped, so the hull may have fewer vertices than the cloud. Hull
 * vertices keep the exact ordinates of their source points.
 */
public final class ConvexHullBuilder {

	public static final int MIN_HULL_POINTS = 4;

	private static final Logger log = LoggerFactory.getLogger(ConvexHullBuilder.class);

	private ConvexHullBuilder() {
	}

	/**
	 * @param cloud scaled point cloud
	 * @return hull with outward-wound triangular faces
	 * @throws InsufficientPointsException if the cloud has fewer than
	 *                                     {@value #MIN_HULL_POINTS} points
	 * @throws DegenerateGeometryException if the points are coincident,
	 *                                     collinear or coplanar
	 */
	public static ConvexPolyhedron build(PointCloud cloud) {
		return build(cloud, new QuickHull3D());
	}

	static ConvexPolyhedron build(PointCloud cloud, QuickHull3D hull) {
		Objects.requireNonNull(cloud, "cloud");
		if (cloud.size() < MIN_HULL_POINTS) {
			throw new InsufficientPointsException(cloud.size(), MIN_HULL_POINTS);
		}

		try {
			hull.build(cloud.toPackedArray());
			hull.triangulate();
		} catch (IllegalArgumentException | InternalErrorException e) {
			// InternalErrorException: numerical breakdown on near-degenerate input
			throw new DegenerateGeometryException("Convex hull construction failed: " + e.getMessage(), e);
		}

		int[] sourceIndices = hull.getVertexPointIndices();
		List<Coordinate> vertices = new ArrayList<>(sourceIndices.length);
		for (int idx : sourceIndices) {
			vertices.add(cloud.get(idx));
		}

		Coordinate centroid = Geom.centroid(vertices);
		List<int[]> faces = new ArrayList<>();
		double volume6 = 0;
		for (int[] face : hull.getFaces()) {
			if (face.length != 3) {
				throw new IllegalStateException("Hull face with " + face.length + " vertices after triangulation");
			}
			double v = Geom.signedVolume6(centroid, vertices.get(face[0]), vertices.get(face[1]), vertices.get(face[2]));
			if (v < 0) {
				face = new int[] { face[0], face[2], face[1] };
				v = -v;
			}
			volume6 += v;
			faces.add(face);
		}

		double diameter = Geom.maxPairwiseDistance(vertices);
		if (volume6 / 6.0 <= Geom.VOLUME_REL_EPS * diameter * diameter * diameter) {
			throw new DegenerateGeometryException("Convex hull encloses no volume");
		}

		log.debug("Hull of {} points: {} vertices, {} faces", cloud.size(), vertices.size(), faces.size());
		return new ConvexPolyhedron(vertices, faces, sourceIndices);
	}
}
