package com.github.micycle1.debris4j;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Random;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.debris4j.core.ConvexHullBuilder;
import com.github.micycle1.debris4j.core.ScaleNormalizer;
import com.github.micycle1.debris4j.core.SphericalSampler;
import com.github.micycle1.debris4j.export.MeshWriter;
import com.github.micycle1.debris4j.export.StlWriter;
import com.github.micycle1.debris4j.geom.PointCloud;
import com.github.micycle1.debris4j.mesh.MeshAdapter;
import com.github.micycle1.debris4j.model.ConvexPolyhedron;
import com.github.micycle1.debris4j.model.GenerationParameters;
import com.github.micycle1.debris4j.model.MeshHandle;

/**
 * Public API for generating random convex debris fragments.
 * <p>
 * Generation runs four stages in order: {@link SphericalSampler} draws a
 * perturbed unit-sphere cloud, {@link ScaleNormalizer} rescales it to the
 * requested characteristic length, {@link ConvexHullBuilder} extracts the
 * hull, and {@link MeshAdapter} packages the result as a {@link MeshHandle}.
 * Any failure aborts the attempt; no partial mesh is returned.
 * <p>
 * The random source is always explicit. Passing the same seed and parameters
 * yields bit-identical meshes.
 */
public class Debris {

	private static final Logger log = LoggerFactory.getLogger(Debris.class);

	private Debris() {
	}

	/**
	 * Generates a fragment using a fresh, unseeded random source.
	 */
	public static MeshHandle generate(GenerationParameters parameters) {
		return generate(parameters, new Random());
	}

	public static MeshHandle generate(GenerationParameters parameters, long seed) {
		return generate(parameters, new Random(seed));
	}

	/**
	 * Generates a fragment from {@code parameters}, drawing from {@code random}.
	 *
	 * @param parameters validated generation parameters
	 * @param random     caller-owned random source; advanced by the call
	 * @return the fragment mesh
	 * @throws DegenerateGeometryException if the draw cannot form a solid hull
	 */
	public static MeshHandle generate(GenerationParameters parameters, Random random) {
		Objects.requireNonNull(parameters, "parameters");
		Objects.requireNonNull(random, "random");

		PointCloud cloud = SphericalSampler.sample(parameters.vertexCount(), parameters.irregularity(), random);
		ScaleNormalizer.normalize(cloud, parameters.characteristicLength());
		ConvexPolyhedron hull = ConvexHullBuilder.build(cloud);
		MeshHandle mesh = MeshAdapter.toMesh(hull, hull.diameter(), parameters);

		log.debug("Generated {} from {}", mesh, parameters);
		return mesh;
	}

	/**
	 * Writes {@code mesh} to {@code target} as binary STL.
	 */
	public static void export(MeshHandle mesh, Path target) throws IOException {
		export(mesh, target, StlWriter.binary());
	}

	/**
	 * Writes {@code mesh} to {@code target} with {@code writer}.
	 * <p>
	 * Output goes to a temporary sibling first and is moved over {@code target}
	 * only once complete, so a failed write leaves no partial file behind.
	 *
	 * @throws NoMeshGeneratedException if {@code mesh} is {@code null}; no file
	 *                                  is created
	 */
	public static void export(MeshHandle mesh, Path target, MeshWriter writer) throws IOException {
		if (mesh == null) {
			throw new NoMeshGeneratedException("No debris generated yet; generate a mesh before exporting");
		}
		Objects.requireNonNull(target, "target");
		Objects.requireNonNull(writer, "writer");

		Path absolute = target.toAbsolutePath();
		// not createTempFile: its owner-only mode would survive the move
		Path tmp = absolute.resolveSibling("." + absolute.getFileName() + "." + UUID.randomUUID() + ".tmp");
		OutputStream stream = Files.newOutputStream(tmp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
		try {
			try (OutputStream out = new BufferedOutputStream(stream)) {
				writer.write(mesh, out);
			}
			Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
		} catch (IOException | RuntimeException e) {
			try {
				Files.deleteIfExists(tmp);
			} catch (IOException cleanup) {
				e.addSuppressed(cleanup);
			}
			throw e;
		}
		log.info("Wrote {} faces to {}", mesh.faceCount(), absolute);
	}
}
