package com.github.micycle1.debris4j.export;

import java.io.IOException;
import java.io.OutputStream;

import com.github.micycle1.debris4j.model.MeshHandle;

/**
 * Serialises a {@link MeshHandle} into a triangulated-surface file format.
 * <p>
 * Implementations may rely on the face indices of the mesh being in range and
 * on faces winding counter-clockwise seen from outside. They must not close
 * {@code out}.
 */
public interface MeshWriter {

	void write(MeshHandle mesh, OutputStream out) throws IOException;

	/**
	 * @return conventional file extension without the dot
	 */
	default String fileExtension() {
		return "stl";
	}
}
