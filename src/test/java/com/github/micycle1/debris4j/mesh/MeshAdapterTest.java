package com.github.micycle1.debris4j.mesh;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.debris4j.DegenerateGeometryException;
import com.github.micycle1.debris4j.model.ConvexPolyhedron;
import com.github.micycle1.debris4j.model.GenerationParameters;
import com.github.micycle1.debris4j.model.MeshHandle;

class MeshAdapterTest {

	private static final List<Coordinate> TETRA = List.of(c(0, 0, 0), c(1, 0, 0), c(0, 1, 0), c(0, 0, 1));
	private static final List<int[]> TETRA_FACES = List.of(f(0, 2, 1), f(0, 1, 3), f(0, 3, 2), f(1, 2, 3));

	@Test
	void wrapsPolyhedronUnchanged() {
		ConvexPolyhedron hull = new ConvexPolyhedron(TETRA, TETRA_FACES, new int[] { 0, 1, 2, 3 });
		MeshHandle mesh = MeshAdapter.toMesh(hull, hull.diameter(), GenerationParameters.defaults());
		assertEquals(4, mesh.vertexCount());
		assertEquals(4, mesh.faceCount());
		assertEquals(Math.sqrt(2), mesh.achievedCharacteristicLength(), 1e-15);
		for (int i = 0; i < 4; i++) {
			assertEquals(hull.vertices().get(i), mesh.vertices().get(i));
		}
	}

	@Test
	void meshHandleRejectsOpenSurface() {
		assertThrows(DegenerateGeometryException.class,
				() -> new MeshHandle(TETRA, List.of(f(0, 2, 1), f(0, 1, 3), f(0, 3, 2)), 1.0, GenerationParameters.defaults()));
	}

	@Test
	void polyhedronAccessorsReturnCopies() {
		ConvexPolyhedron hull = new ConvexPolyhedron(TETRA, TETRA_FACES, new int[] { 0, 1, 2, 3 });
		hull.faces().get(0)[0] = 7;
		hull.vertices().get(0).z = 5;
		assertEquals(0, hull.face(0)[0]);
		assertEquals(0.0, hull.vertex(0).z);
		MeshAdapter.toMesh(hull, hull.diameter(), GenerationParameters.defaults());
	}

	@Test
	void acceptsClosedTetrahedron() {
		MeshAdapter.validateClosedSurface(TETRA, TETRA_FACES);
	}

	@Test
	void rejectsOutOfRangeIndex() {
		assertThrows(DegenerateGeometryException.class,
				() -> MeshAdapter.validateClosedSurface(TETRA, List.of(f(0, 2, 1), f(0, 1, 3), f(0, 3, 2), f(1, 2, 4))));
	}

	@Test
	void rejectsRepeatedIndex() {
		assertThrows(DegenerateGeometryException.class,
				() -> MeshAdapter.validateClosedSurface(TETRA, List.of(f(0, 2, 1), f(0, 1, 3), f(0, 3, 2), f(1, 1, 3))));
	}

	@Test
	void rejectsOpenSurface() {
		assertThrows(DegenerateGeometryException.class, () -> MeshAdapter.validateClosedSurface(TETRA, List.of(f(0, 2, 1), f(0, 1, 3), f(0, 3, 2))));
	}

	@Test
	void rejectsInconsistentWinding() {
		assertThrows(DegenerateGeometryException.class,
				() -> MeshAdapter.validateClosedSurface(TETRA, List.of(f(0, 1, 2), f(0, 1, 3), f(0, 3, 2), f(1, 2, 3))));
	}

	@Test
	void rejectsEmptyFaceList() {
		assertThrows(DegenerateGeometryException.class, () -> MeshAdapter.validateClosedSurface(TETRA, List.of()));
	}

	private static Coordinate c(double x, double y, double z) {
		return new Coordinate(x, y, z);
	}

	private static int[] f(int a, int b, int c) {
		return new int[] { a, b, c };
	}
}
