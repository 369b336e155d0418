package com.github.micycle1.debris4j.export;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.math.Vector3D;

import com.github.micycle1.debris4j.model.MeshHandle;

/**
 * STL writer in ASCII or binary form.
 * <p>
 * Each facet carries the unit normal of its winding (zero for a triangle
 * without area) followed by its three corners.
 */
public final class StlWriter implements MeshWriter {

	public enum Format {
		ASCII, BINARY
	}

	static final int HEADER_BYTES = 80;
	static final int FACET_BYTES = 50;

	private final Format format;
	private final String solidName;

	public StlWriter(Format format, String solidName) {
		this.format = Objects.requireNonNull(format, "format");
		this.solidName = Objects.requireNonNull(solidName, "solidName");
		if (solidName.isBlank() || solidName.chars().anyMatch(Character::isWhitespace)) {
			throw new IllegalArgumentException("solidName must be a single non-blank token");
		}
	}

	public static StlWriter binary() {
		return new StlWriter(Format.BINARY, "debris");
	}

	public static StlWriter ascii() {
		return new StlWriter(Format.ASCII, "debris");
	}

	public Format format() {
		return format;
	}

	@Override
	public void write(MeshHandle mesh, OutputStream out) throws IOException {
		Objects.requireNonNull(mesh, "mesh");
		Objects.requireNonNull(out, "out");
		if (format == Format.BINARY) {
			writeBinary(mesh, out);
		} else {
			writeAscii(mesh, out);
		}
	}

	private void writeBinary(MeshHandle mesh, OutputStream out) throws IOException {
		byte[] header = new byte[HEADER_BYTES];
		// binary headers must not begin with "solid"
		byte[] label = ("debris4j binary STL: " + solidName).getBytes(StandardCharsets.US_ASCII);
		System.arraycopy(label, 0, header, 0, Math.min(label.length, HEADER_BYTES));
		out.write(header);

		ByteBuffer count = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN);
		count.putInt(mesh.faceCount());
		out.write(count.array());

		ByteBuffer facet = ByteBuffer.allocate(FACET_BYTES).order(ByteOrder.LITTLE_ENDIAN);
		for (int i = 0; i < mesh.faceCount(); i++) {
			facet.clear();
			Vector3D n = mesh.faceNormal(i);
			facet.putFloat((float) n.getX());
			facet.putFloat((float) n.getY());
			facet.putFloat((float) n.getZ());
			for (Coordinate c : mesh.triangle(i)) {
				facet.putFloat((float) c.x);
				facet.putFloat((float) c.y);
				facet.putFloat((float) c.z);
			}
			facet.putShort((short) 0);
			out.write(facet.array());
		}
		out.flush();
	}

	private void writeAscii(MeshHandle mesh, OutputStream out) throws IOException {
		Writer w = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.US_ASCII));
		w.write("solid " + solidName + "\n");
		for (int i = 0; i < mesh.faceCount(); i++) {
			Vector3D n = mesh.faceNormal(i);
			w.write(String.format(Locale.ROOT, "  facet normal %e %e %e\n", n.getX(), n.getY(), n.getZ()));
			w.write("    outer loop\n");
			for (Coordinate c : mesh.triangle(i)) {
				w.write(String.format(Locale.ROOT, "      vertex %e %e %e\n", c.x, c.y, c.z));
			}
			w.write("    endloop\n");
			w.write("  endfacet\n");
		}
		w.write("endsolid " + solidName + "\n");
		w.flush();
	}
}
