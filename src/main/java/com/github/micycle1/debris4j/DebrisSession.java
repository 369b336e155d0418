package com.github.micycle1.debris4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

import com.github.micycle1.debris4j.export.MeshWriter;
import com.github.micycle1.debris4j.export.StlWriter;
import com.github.micycle1.debris4j.model.GenerationParameters;
import com.github.micycle1.debris4j.model.MeshHandle;

/**
 * Remembers the most recently generated mesh for a later export request, as an
 * interactive front end needs.
 * <p>
 * A failed generation leaves the previous mesh in place. Not thread-safe.
 */
public class DebrisSession {

	private final Random random;
	private MeshHandle latest;

	public DebrisSession() {
		this(new Random());
	}

	/**
	 * @param random random source shared by every generation in this session
	 */
	public DebrisSession(Random random) {
		this.random = Objects.requireNonNull(random, "random");
	}

	public MeshHandle generate(GenerationParameters parameters) {
		MeshHandle mesh = Debris.generate(parameters, random);
		latest = mesh;
		return mesh;
	}

	public Optional<MeshHandle> latest() {
		return Optional.ofNullable(latest);
	}

	public void exportLatest(Path target) throws IOException {
		exportLatest(target, StlWriter.binary());
	}

	/**
	 * @throws NoMeshGeneratedException if nothing has been generated yet
	 */
	public void exportLatest(Path target, MeshWriter writer) throws IOException {
		Debris.export(latest, target, writer);
	}
}
