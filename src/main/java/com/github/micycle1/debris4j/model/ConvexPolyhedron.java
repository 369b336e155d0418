package com.github.micycle1.debris4j.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.math.Vector3D;

import com.github.micycle1.debris4j.geom.Geom;

/**
 * Convex hull of a point cloud: the extreme points and a triangulation of the
 * boundary.
 * <p>
 * Face indices refer to {@link #vertices()}, never to the source cloud. Faces
 * wind counter-clockwise when seen from outside.
 */
public final class ConvexPolyhedron {

	private final List<Coordinate> vertices;
	private final List<int[]> faces;
	private final int[] sourceIndices;

	/**
	 * @param vertices      hull vertices
	 * @param faces         triangles as {@code int[3]} indices into
	 *                      {@code vertices}
	 * @param sourceIndices for each hull vertex, its index in the cloud the hull
	 *                      was built from
	 */
	public ConvexPolyhedron(List<Coordinate> vertices, List<int[]> faces, int[] sourceIndices) {
		if (sourceIndices.length != vertices.size()) {
			throw new IllegalArgumentException("sourceIndices length (" + sourceIndices.length + ") must equal vertex count (" + vertices.size() + ")");
		}
		List<Coordinate> v = new ArrayList<>(vertices.size());
		for (Coordinate c : vertices) {
			v.add(new Coordinate(c.x, c.y, c.z));
		}
		List<int[]> f = new ArrayList<>(faces.size());
		for (int[] face : faces) {
			validateFace(face, v.size());
			f.add(face.clone());
		}
		this.vertices = Collections.unmodifiableList(v);
		this.faces = Collections.unmodifiableList(f);
		this.sourceIndices = sourceIndices.clone();
	}

	/**
	 * @return copies of the hull vertices
	 */
	public List<Coordinate> vertices() {
		return copyVertices(vertices);
	}

	/**
	 * @return copies of the faces
	 */
	public List<int[]> faces() {
		return copyFaces(faces);
	}

	public Coordinate vertex(int i) {
		return new Coordinate(vertices.get(i));
	}

	public int[] face(int i) {
		return faces.get(i).clone();
	}

	public int[] sourceIndices() {
		return sourceIndices.clone();
	}

	public int vertexCount() {
		return vertices.size();
	}

	public int faceCount() {
		return faces.size();
	}

	public Vector3D faceNormal(int faceIndex) {
		int[] f = faces.get(faceIndex);
		return Geom.unitNormal(vertices.get(f[0]), vertices.get(f[1]), vertices.get(f[2]));
	}

	/**
	 * @return maximum pairwise distance between hull vertices
	 */
	public double diameter() {
		return Geom.maxPairwiseDistance(vertices);
	}

	public Coordinate centroid() {
		return Geom.centroid(vertices);
	}

	static List<Coordinate> copyVertices(List<Coordinate> vertices) {
		List<Coordinate> copy = new ArrayList<>(vertices.size());
		for (Coordinate c : vertices) {
			copy.add(new Coordinate(c.x, c.y, c.z));
		}
		return copy;
	}

	static List<int[]> copyFaces(List<int[]> faces) {
		List<int[]> copy = new ArrayList<>(faces.size());
		for (int[] face : faces) {
			copy.add(face.clone());
		}
		return copy;
	}

	static void validateFace(int[] face, int vertexCount) {
		if (face == null || face.length != 3) {
			throw new IllegalArgumentException("Each face must be an int[3]");
		}
		for (int idx : face) {
			if (idx < 0 || idx >= vertexCount) {
				throw new IllegalArgumentException("Face " + Arrays.toString(face) + " references vertex outside [0, " + vertexCount + ")");
			}
		}
	}
}
