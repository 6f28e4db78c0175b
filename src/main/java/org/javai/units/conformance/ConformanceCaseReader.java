package org.javai.units.conformance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.javai.units.text.Latin1Text;

/**
 * Reads and writes conformance corpora: a JSON array of case objects with the
 * optional fields {@code input}, {@code ast}, {@code output} and {@code dimensions}.
 * Corpus files are exchanged as Latin-1; characters outside it (such as the
 * temperature label) are written as JSON escapes.
 */
public class ConformanceCaseReader {

	static final String INPUT = "input";
	static final String AST = "ast";
	static final String OUTPUT = "output";
	static final String DIMENSIONS = "dimensions";

	private final ObjectMapper mapper = new ObjectMapper()
			.configure(SerializationFeature.INDENT_OUTPUT, true);

	public List<ConformanceCase> read(InputStream inputStream) {
		JsonNode root;
		try {
			root = mapper.readTree(new InputStreamReader(inputStream, StandardCharsets.ISO_8859_1));
		} catch (JsonProcessingException e) {
			throw new ConformanceFormatException("Malformed conformance corpus: " + e.getOriginalMessage(), e);
		} catch (IOException e) {
			throw new ConformanceFormatException("Failed to read conformance corpus", e);
		}
		return fromTree(root);
	}

	public List<ConformanceCase> read(String json) {
		try {
			return fromTree(mapper.readTree(json));
		} catch (JsonProcessingException e) {
			throw new ConformanceFormatException("Malformed conformance corpus: " + e.getOriginalMessage(), e);
		}
	}

	/**
	 * Serialize cases as a Latin-1 encoded JSON array, non-ASCII characters escaped.
	 */
	public byte[] write(List<ConformanceCase> cases) {
		ArrayNode array = mapper.createArrayNode();
		for (ConformanceCase c : cases) {
			ObjectNode node = array.addObject();
			putIfPresent(node, INPUT, c.input());
			putIfPresent(node, AST, c.expectedAst());
			putIfPresent(node, OUTPUT, c.expectedOutput());
			putIfPresent(node, DIMENSIONS, c.dimensions() != null ? c.dimensions().toString() : null);
		}
		try {
			return Latin1Text.encode(mapper.writer()
					.with(JsonWriteFeature.ESCAPE_NON_ASCII)
					.writeValueAsString(array));
		} catch (JsonProcessingException e) {
			throw new ConformanceFormatException("Failed to serialize conformance corpus", e);
		}
	}

	private List<ConformanceCase> fromTree(JsonNode root) {
		if (root == null || !root.isArray()) {
			throw new ConformanceFormatException("A conformance corpus must be a JSON array");
		}
		List<ConformanceCase> cases = new ArrayList<>();
		int index = 0;
		for (JsonNode entry : root) {
			if (!entry.isObject()) {
				throw new ConformanceFormatException("Case " + index + " is not an object");
			}
			try {
				String dimensions = text(entry, DIMENSIONS);
				cases.add(new ConformanceCase(
						text(entry, INPUT),
						text(entry, AST),
						text(entry, OUTPUT),
						dimensions != null ? DimensionVector.parse(dimensions) : null));
			} catch (ConformanceFormatException e) {
				throw new ConformanceFormatException("Case " + index + ": " + e.getMessage(), e);
			}
			index++;
		}
		return cases;
	}

	private static String text(JsonNode entry, String field) {
		JsonNode value = entry.get(field);
		if (value == null || value.isNull()) {
			return null;
		}
		if (!value.isTextual()) {
			throw new ConformanceFormatException("Field '" + field + "' must be a string");
		}
		return value.asText();
	}

	private static void putIfPresent(ObjectNode node, String field, String value) {
		if (value != null) {
			node.put(field, value);
		}
	}
}
