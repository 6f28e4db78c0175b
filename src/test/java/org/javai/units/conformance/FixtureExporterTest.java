package org.javai.units.conformance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.units.UnitCodec;
import org.javai.units.parse.UnrecognizedUnitException;
import org.javai.units.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FixtureExporterTest {

	private final FixtureExporter exporter = new FixtureExporter(UnitCodec.withBundledDefinitions());

	@Test
	void buildsCaseFromParseResult() {
		ConformanceCase c = exporter.caseFor("W/(m K)");

		assertThat(c.input()).isEqualTo("W/(m K)");
		assertThat(c.expectedAst()).isEqualTo("(/ (* W) (* m K))");
		assertThat(c.expectedOutput()).isEqualTo("W/(m K)");
		assertThat(c.hasDimensions()).isFalse();
	}

	@Test
	void failsOnUnparseableInput() {
		assertThatThrownBy(() -> exporter.caseFor("furlong/fortnight"))
				.isInstanceOf(UnrecognizedUnitException.class);
	}

	@Test
	void exportsCorpusReadableByTheReader(@TempDir Path dir) throws Exception {
		Path inputs = dir.resolve("inputs.txt");
		Files.write(inputs, List.of("# units for the corpus", "", "km^2", "°C", "  3 {chem: CO2}  "),
				StandardCharsets.ISO_8859_1);
		Path target = dir.resolve("out/corpus.json");

		int written;
		try (LogCaptorAppender appender = LogCaptorAppender.create(FixtureExporter.class, Level.INFO)) {
			written = exporter.exportFile(inputs, target);

			assertThat(appender.messages()).anyMatch(msg -> msg.startsWith("Exported 3 conformance cases"));
		}

		assertThat(written).isEqualTo(3);
		List<ConformanceCase> cases;
		try (InputStream is = Files.newInputStream(target)) {
			cases = new ConformanceCaseReader().read(is);
		}
		assertThat(cases).extracting(ConformanceCase::input).containsExactly("km^2", "°C", "3 {chem: CO2}");
		assertThat(cases.get(1).expectedAst()).isEqualTo("(* °C)");
	}
}
