package com.github.micycle1.debris4j.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.math.Vector3D;

import com.github.micycle1.debris4j.DegenerateGeometryException;
import com.github.micycle1.debris4j.InsufficientPointsException;
import com.github.micycle1.debris4j.geom.PointCloud;
import com.github.micycle1.debris4j.model.ConvexPolyhedron;
import com.github.quickhull3d.InternalErrorException;
import com.github.quickhull3d.QuickHull3D;

class ConvexHullBuilderTest {

	@Test
	void tetrahedron() {
		ConvexPolyhedron hull = ConvexHullBuilder.build(PointCloud.of(p(0, 0, 0), p(1, 0, 0), p(0, 1, 0), p(0, 0, 1)));
		assertEquals(4, hull.vertexCount());
		assertEquals(4, hull.faceCount());
		assertOutward(hull);
	}

	@Test
	void cubeDropsInteriorPoint() {
		PointCloud cloud = PointCloud.of(p(0, 0, 0), p(1, 0, 0), p(1, 1, 0), p(0, 1, 0), p(0, 0, 1), p(1, 0, 1), p(1, 1, 1), p(0, 1, 1),
				p(0.5, 0.5, 0.5));
		ConvexPolyhedron hull = ConvexHullBuilder.build(cloud);
		assertEquals(8, hull.vertexCount());
		assertEquals(12, hull.faceCount());
		assertFalse(Arrays.stream(hull.sourceIndices()).anyMatch(i -> i == 8), "Interior point must not be a hull vertex");
		assertOutward(hull);
	}

	@Test
	void hullVerticesKeepSourceOrdinates() {
		PointCloud cloud = SphericalSampler.sample(15, 0.3, new Random(21));
		ScaleNormalizer.normalize(cloud, 25);
		ConvexPolyhedron hull = ConvexHullBuilder.build(cloud);
		int[] src = hull.sourceIndices();
		for (int i = 0; i < hull.vertexCount(); i++) {
			assertTrue(hull.vertices().get(i).equals3D(cloud.get(src[i])));
		}
		assertTrue(hull.vertexCount() <= cloud.size());
	}

	@Test
	void tooFewPoints() {
		var e = assertThrows(InsufficientPointsException.class, () -> ConvexHullBuilder.build(PointCloud.of(p(0, 0, 0), p(1, 0, 0), p(0, 1, 0))));
		assertEquals(3, e.actual());
		assertEquals(4, e.required());
	}

	@Test
	void coplanarPointsAreDegenerate() {
		PointCloud cloud = PointCloud.of(p(0, 0, 0), p(1, 0, 0), p(1, 1, 0), p(0, 1, 0), p(0.3, 0.6, 0));
		assertThrows(DegenerateGeometryException.class, () -> ConvexHullBuilder.build(cloud));
	}

	@Test
	void hullNumericalFailureIsDegenerate() {
		QuickHull3D failing = new QuickHull3D() {
			@Override
			public void build(double[] coords) {
				throw new InternalErrorException("face not found");
			}
		};
		PointCloud cloud = PointCloud.of(p(0, 0, 0), p(1, 0, 0), p(0, 1, 0), p(0, 0, 1));
		var e = assertThrows(DegenerateGeometryException.class, () -> ConvexHullBuilder.build(cloud, failing));
		assertTrue(e.getCause() instanceof InternalErrorException);
	}

	@Test
	void collinearPointsAreDegenerate() {
		PointCloud cloud = PointCloud.of(p(0, 0, 0), p(1, 1, 1), p(2, 2, 2), p(3, 3, 3), p(4, 4, 4));
		assertThrows(DegenerateGeometryException.class, () -> ConvexHullBuilder.build(cloud));
	}

	@Test
	void fourSampledPointsYieldHullOrTypedError() {
		// four unit-sphere samples with no noise may land near a plane
		for (long seed = 0; seed < 200; seed++) {
			PointCloud cloud = SphericalSampler.sample(4, 0.0, new Random(seed));
			ScaleNormalizer.normalize(cloud, 10);
			try {
				ConvexPolyhedron hull = ConvexHullBuilder.build(cloud);
				assertEquals(4, hull.vertexCount());
				assertEquals(4, hull.faceCount());
			} catch (DegenerateGeometryException e) {
				assertTrue(e.getMessage() != null && !e.getMessage().isEmpty());
			}
		}
	}

	private static void assertOutward(ConvexPolyhedron hull) {
		Coordinate centroid = hull.centroid();
		for (int i = 0; i < hull.faceCount(); i++) {
			int[] f = hull.faces().get(i);
			Coordinate a = hull.vertices().get(f[0]);
			Vector3D n = hull.faceNormal(i);
			double dot = n.getX() * (a.x - centroid.x) + n.getY() * (a.y - centroid.y) + n.getZ() * (a.z - centroid.z);
			assertTrue(dot > 0, "Face " + i + " is not wound outward");
		}
	}

	private static double[] p(double x, double y, double z) {
		return new double[] { x, y, z };
	}
}
