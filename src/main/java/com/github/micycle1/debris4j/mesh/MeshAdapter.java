package com.github.micycle1.debris4j.mesh;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.debris4j.DegenerateGeometryException;
import com.github.micycle1.debris4j.model.ConvexPolyhedron;
import com.github.micycle1.debris4j.model.GenerationParameters;
import com.github.micycle1.debris4j.model.MeshHandle;

/**
 * Packages a hull into the exportable {@link MeshHandle}.
 * <p>
 * This is the boundary to mesh writers, which produce garbage for a face list
 * that references missing vertices or leaves holes. The adapter checks the
 * following before handing data across:
 * <ul>
 * <li>every face is an {@code int[3]} of distinct, in-range vertex
 * indices;</li>
 * <li>every undirected edge is shared by exactly two faces, traversed once in
 * each direction (closed, consistently oriented);</li>
 * <li>{@code V - E + F == 2} (genus 0).</li>
 * </ul>
 */
public final class MeshAdapter {

	private MeshAdapter() {
	}

	record EdgeRef(int a, int b) {
		EdgeRef {
			if (a > b) {
				int t = a;
				a = b;
				b = t;
			}
		}
	}

	private record DirectedEdge(int from, int to) {
	}

	/**
	 * @param polyhedron                   hull to export
	 * @param achievedCharacteristicLength measured maximum pairwise vertex
	 *                                     distance of {@code polyhedron}
	 * @param parameters                   parameters the hull was generated from
	 * @return mesh with the same vertex and face data as {@code polyhedron}
	 * @throws DegenerateGeometryException if the faces do not form a closed
	 *                                     genus-0 surface
	 */
	public static MeshHandle toMesh(ConvexPolyhedron polyhedron, double achievedCharacteristicLength, GenerationParameters parameters) {
		Objects.requireNonNull(polyhedron, "polyhedron");
		Objects.requireNonNull(parameters, "parameters");
		// the MeshHandle constructor runs validateClosedSurface
		return new MeshHandle(polyhedron.vertices(), polyhedron.faces(), achievedCharacteristicLength, parameters);
	}

	/**
	 * Checks that {@code faces} describe a closed, consistently oriented genus-0
	 * triangle surface over {@code vertices}.
	 *
	 * @throws DegenerateGeometryException if any check fails
	 */
	public static void validateClosedSurface(List<Coordinate> vertices, List<int[]> faces) {
		if (faces.isEmpty()) {
			throw new DegenerateGeometryException("Mesh has no faces");
		}
		Map<EdgeRef, Integer> edgeUse = new HashMap<>();
		Set<DirectedEdge> directed = new HashSet<>();
		Set<Integer> referenced = new HashSet<>();
		for (int[] f : faces) {
			validateTriangle(f, vertices.size());
			for (int side = 0; side < 3; side++) {
				int a = f[side];
				int b = f[(side + 1) % 3];
				referenced.add(a);
				edgeUse.merge(new EdgeRef(a, b), 1, Integer::sum);
				if (!directed.add(new DirectedEdge(a, b))) {
					throw new DegenerateGeometryException("Inconsistent face orientation at edge " + a + "-" + b);
				}
			}
		}
		for (Map.Entry<EdgeRef, Integer> e : edgeUse.entrySet()) {
			if (e.getValue() != 2) {
				throw new DegenerateGeometryException("Edge " + e.getKey().a() + "-" + e.getKey().b() + " is shared by " + e.getValue() + " faces");
			}
		}
		int euler = referenced.size() - edgeUse.size() + faces.size();
		if (euler != 2) {
			throw new DegenerateGeometryException("Mesh surface is not genus 0 (V - E + F = " + euler + ")");
		}
	}

	private static void validateTriangle(int[] triangle, int vertexCount) {
		if (triangle == null || triangle.length != 3) {
			throw new DegenerateGeometryException("Each face must be an int[3]");
		}
		int a = triangle[0];
		int b = triangle[1];
		int c = triangle[2];
		if (a < 0 || b < 0 || c < 0 || a >= vertexCount || b >= vertexCount || c >= vertexCount) {
			throw new DegenerateGeometryException("Face contains out-of-range vertex index");
		}
		if (a == b || b == c || a == c) {
			throw new DegenerateGeometryException("Face vertices must be distinct");
		}
	}
}
