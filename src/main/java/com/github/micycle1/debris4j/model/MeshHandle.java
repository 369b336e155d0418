package com.github.micycle1.debris4j.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.math.Vector3D;

import com.github.micycle1.debris4j.DegenerateGeometryException;
import com.github.micycle1.debris4j.geom.Geom;
import com.github.micycle1.debris4j.mesh.MeshAdapter;

/**
 * Exportable triangle mesh of one generated debris fragment.
 * <p>
 * The face set is always a closed, consistently wound surface whose indices
 * lie in range: the constructor checks it, and accessors hand out copies only.
 */
public final class MeshHandle {

	private final List<Coordinate> vertices;
	private final List<int[]> faces;
	private final double achievedCharacteristicLength;
	private final GenerationParameters parameters;

	/**
	 * @throws DegenerateGeometryException if {@code faces} is not a closed
	 *                                     genus-0 surface over {@code vertices}
	 */
	public MeshHandle(List<Coordinate> vertices, List<int[]> faces, double achievedCharacteristicLength, GenerationParameters parameters) {
		List<Coordinate> v = new ArrayList<>(vertices.size());
		for (Coordinate c : vertices) {
			v.add(new Coordinate(c.x, c.y, c.z));
		}
		List<int[]> f = ConvexPolyhedron.copyFaces(faces);
		MeshAdapter.validateClosedSurface(v, f);
		this.vertices = Collections.unmodifiableList(v);
		this.faces = Collections.unmodifiableList(f);
		this.achievedCharacteristicLength = achievedCharacteristicLength;
		this.parameters = parameters;
	}

	/**
	 * @return copies of the vertices; writing to them leaves the mesh untouched
	 */
	public List<Coordinate> vertices() {
		return ConvexPolyhedron.copyVertices(vertices);
	}

	/**
	 * @return copies of the faces; writing to them leaves the mesh untouched
	 */
	public List<int[]> faces() {
		return ConvexPolyhedron.copyFaces(faces);
	}

	public Coordinate vertex(int i) {
		return new Coordinate(vertices.get(i));
	}

	public int[] face(int i) {
		return faces.get(i).clone();
	}

	public int vertexCount() {
		return vertices.size();
	}

	public int faceCount() {
		return faces.size();
	}

	/**
	 * @return the three corners of a face, in winding order
	 */
	public Coordinate[] triangle(int faceIndex) {
		int[] f = faces.get(faceIndex);
		return new Coordinate[] { vertex(f[0]), vertex(f[1]), vertex(f[2]) };
	}

	public Vector3D faceNormal(int faceIndex) {
		Coordinate[] t = triangle(faceIndex);
		return Geom.unitNormal(t[0], t[1], t[2]);
	}

	/**
	 * @return maximum pairwise vertex distance after scaling, in millimetres
	 */
	public double achievedCharacteristicLength() {
		return achievedCharacteristicLength;
	}

	/**
	 * @return the parameters this mesh was generated from
	 */
	public GenerationParameters parameters() {
		return parameters;
	}

	/**
	 * One-line report of the achieved size, e.g.
	 * {@code Actual max distance: 10.00 mm (1.00 cm)}.
	 */
	public String summary() {
		return String.format(Locale.ROOT, "Actual max distance: %.2f mm (%.2f cm)", achievedCharacteristicLength, achievedCharacteristicLength / 10.0);
	}

	@Override
	public String toString() {
		return "MeshHandle[vertices=" + vertices.size() + ", faces=" + faces.size() + ", achievedCharacteristicLength=" + achievedCharacteristicLength + "]";
	}
}
