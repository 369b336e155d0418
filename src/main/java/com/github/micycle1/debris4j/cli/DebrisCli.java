package com.github.micycle1.debris4j.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Random;

import com.github.micycle1.debris4j.Debris;
import com.github.micycle1.debris4j.DegenerateGeometryException;
import com.github.micycle1.debris4j.InvalidParameterException;
import com.github.micycle1.debris4j.export.StlWriter;
import com.github.micycle1.debris4j.model.GenerationParameters;
import com.github.micycle1.debris4j.model.MeshHandle;

/**
 * Command-line front end.
 *
 * <pre>
 * debris4j [--vertices N] [--length MM] [--irregularity F] [--seed S] [--output FILE] [--ascii]
 * </pre>
 *
 * Omitted options take the values of {@link GenerationParameters#defaults()}.
 */
public final class DebrisCli {

	static final int EXIT_OK = 0;
	static final int EXIT_IO = 1;
	static final int EXIT_USAGE = 2;
	static final int EXIT_DEGENERATE = 3;

	private static final String USAGE = "usage: debris4j [--vertices N] [--length MM] [--irregularity F] [--seed S] [--output FILE] [--ascii]";

	private DebrisCli() {
	}

	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}

	static int run(String[] args, PrintStream out, PrintStream err) {
		GenerationParameters params = GenerationParameters.defaults();
		Long seed = null;
		Path output = null;
		boolean ascii = false;

		try {
			for (int i = 0; i < args.length; i++) {
				String arg = args[i];
				switch (arg) {
					case "--vertices" -> params = params.withVertexCount(Integer.parseInt(value(args, ++i, arg)));
					case "--length" -> params = params.withCharacteristicLength(Double.parseDouble(value(args, ++i, arg)));
					case "--irregularity" -> params = params.withIrregularity(Double.parseDouble(value(args, ++i, arg)));
					case "--seed" -> seed = Long.parseLong(value(args, ++i, arg));
					case "--output" -> output = Path.of(value(args, ++i, arg));
					case "--ascii" -> ascii = true;
					case "--help", "-h" -> {
						out.println(USAGE);
						return EXIT_OK;
					}
					default -> throw new IllegalArgumentException("unknown option " + arg);
				}
			}
		} catch (InvalidParameterException e) {
			err.println("Error: " + e.getMessage());
			return EXIT_USAGE;
		} catch (IllegalArgumentException e) {
			// NumberFormatException included
			err.println("Error: " + e.getMessage());
			err.println(USAGE);
			return EXIT_USAGE;
		}

		MeshHandle mesh;
		try {
			mesh = Debris.generate(params, seed == null ? new Random() : new Random(seed));
		} catch (DegenerateGeometryException e) {
			err.println("Error: " + e.getMessage());
			return EXIT_DEGENERATE;
		}
		out.println(mesh.summary());
		out.println(mesh.vertexCount() + " vertices, " + mesh.faceCount() + " faces");

		if (output != null) {
			try {
				Debris.export(mesh, output, ascii ? StlWriter.ascii() : StlWriter.binary());
			} catch (IOException e) {
				err.println("Error: could not write " + output + ": " + e.getMessage());
				return EXIT_IO;
			}
			out.println("STL file saved to " + output);
		}
		return EXIT_OK;
	}

	private static String value(String[] args, int i, String option) {
		if (i >= args.length) {
			throw new IllegalArgumentException("missing value for " + option);
		}
		return args[i];
	}
}
