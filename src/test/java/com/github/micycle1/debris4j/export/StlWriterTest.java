package com.github.micycle1.debris4j.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.debris4j.model.GenerationParameters;
import com.github.micycle1.debris4j.model.MeshHandle;

class StlWriterTest {

	private static final MeshHandle TETRA = new MeshHandle(List.of(c(0, 0, 0), c(1, 0, 0), c(0, 1, 0), c(0, 0, 1)),
			List.of(f(0, 2, 1), f(0, 1, 3), f(0, 3, 2), f(1, 2, 3)), Math.sqrt(2), GenerationParameters.defaults());

	@Test
	void binaryLayout() throws IOException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		StlWriter.binary().write(TETRA, out);
		byte[] bytes = out.toByteArray();

		assertEquals(StlWriter.HEADER_BYTES + 4 + 4 * StlWriter.FACET_BYTES, bytes.length);
		assertFalse(new String(bytes, 0, 5, StandardCharsets.US_ASCII).equals("solid"));

		ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
		assertEquals(4, buf.getInt(StlWriter.HEADER_BYTES));

		// first facet is (0,2,1): normal -z, then the corners in winding order
		int base = StlWriter.HEADER_BYTES + 4;
		assertEquals(0f, buf.getFloat(base));
		assertEquals(0f, buf.getFloat(base + 4));
		assertEquals(-1f, buf.getFloat(base + 8));
		assertEquals(0f, buf.getFloat(base + 24));
		assertEquals(1f, buf.getFloat(base + 28));
		assertEquals(0, buf.getShort(base + 48));
	}

	@Test
	void asciiLayout() throws IOException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		new StlWriter(StlWriter.Format.ASCII, "fragment").write(TETRA, out);
		String text = out.toString(StandardCharsets.US_ASCII);

		assertTrue(text.startsWith("solid fragment\n"));
		assertTrue(text.endsWith("endsolid fragment\n"));
		assertEquals(4, count(text, "facet normal"));
		assertEquals(12, count(text, "vertex "));
		assertTrue(text.contains("facet normal 0.000000e+00 0.000000e+00 -1.000000e+00"), text);
	}

	@Test
	void rejectsBadSolidName() {
		assertThrows(IllegalArgumentException.class, () -> new StlWriter(StlWriter.Format.ASCII, "two words"));
	}

	private static int count(String text, String token) {
		int n = 0;
		for (int i = text.indexOf(token); i >= 0; i = text.indexOf(token, i + 1)) {
			n++;
		}
		return n;
	}

	private static Coordinate c(double x, double y, double z) {
		return new Coordinate(x, y, z);
	}

	private static int[] f(int a, int b, int c) {
		return new int[] { a, b, c };
	}
}
