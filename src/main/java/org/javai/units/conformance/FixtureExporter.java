package org.javai.units.conformance;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.units.UnitCodec;
import org.javai.units.ast.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates conformance fixtures from unit texts: each input is parsed, and the
 * resulting tree (in Polish notation) and generated text are recorded as the
 * expected values. Developers review the exported corpus and commit it, so later
 * changes to parsing or generation show up as fixture diffs.
 *
 * Inputs are read one per line; blank lines and lines starting with {@code #} are
 * skipped.
 */
public class FixtureExporter {

	private static final Logger logger = LoggerFactory.getLogger(FixtureExporter.class);

	private final UnitCodec codec;
	private final ConformanceCaseReader corpus;

	public FixtureExporter(UnitCodec codec) {
		this.codec = Objects.requireNonNull(codec, "codec must not be null");
		this.corpus = new ConformanceCaseReader();
	}

	/**
	 * Usage: {@code FixtureExporter <inputs.txt> <corpus.json>}
	 */
	public static void main(String[] args) {
		if (args.length != 2) {
			System.err.println("Usage: FixtureExporter <inputs.txt> <corpus.json>");
			System.exit(2);
		}
		try {
			FixtureExporter exporter = new FixtureExporter(UnitCodec.withBundledDefinitions());
			exporter.exportFile(Path.of(args[0]), Path.of(args[1]));
			System.exit(0);
		} catch (Exception e) {
			System.err.println("Failed to export fixtures: " + e.getMessage());
			e.printStackTrace(System.err);
			System.exit(1);
		}
	}

	/**
	 * Build a case for one input.
	 *
	 * @throws org.javai.units.UnitsException if the input does not parse
	 */
	public ConformanceCase caseFor(String input) {
		Expression expression = codec.parse(input);
		return new ConformanceCase(input, codec.toPolish(expression), codec.generate(expression), null);
	}

	public List<ConformanceCase> casesFor(List<String> inputs) {
		List<ConformanceCase> cases = new ArrayList<>();
		for (String input : inputs) {
			cases.add(caseFor(input));
		}
		return cases;
	}

	/**
	 * Read inputs from {@code inputFile} and write the corpus to {@code target},
	 * creating parent directories as needed.
	 *
	 * @return the number of cases written
	 */
	public int exportFile(Path inputFile, Path target) throws IOException {
		List<String> inputs = new ArrayList<>();
		for (String line : Files.readAllLines(inputFile, StandardCharsets.ISO_8859_1)) {
			String trimmed = line.strip();
			if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
				inputs.add(trimmed);
			}
		}
		return export(inputs, target);
	}

	public int export(List<String> inputs, Path target) throws IOException {
		List<ConformanceCase> cases = casesFor(inputs);
		Path parent = target.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.write(target, corpus.write(cases));
		logger.info("Exported {} conformance cases to {}", cases.size(), target);
		return cases.size();
	}
}
