package org.javai.units.definitions;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads definitions documents into {@link DefinitionsTable}s.
 * <p>
 * The canonical source is JSON; local extension tables may also be written in
 * YAML. Both share one shape, and array order is priority order:
 *
 * <pre>
 * {
 *   "prefixes":   [ {"symbol": "k", "scale": 3, "name": "kilo"} ],
 *   "units":      [ {"symbol": "kg", "name": "kilogram"}, "g" ],
 *   "currencies": [ "USD", "EUR" ]
 * }
 * </pre>
 *
 * Documents are decoded as Latin-1. Non-ASCII symbols are best written with JSON
 * {@code \\u} escapes so the file is encoding-neutral.
 */
public class DefinitionsParser {

	private final ObjectMapper mapper = new ObjectMapper();
	private final Yaml yaml = new Yaml();

	/**
	 * Parse a JSON definitions document.
	 */
	public DefinitionsTable parseJson(InputStream inputStream) {
		return parseJson(new InputStreamReader(inputStream, StandardCharsets.ISO_8859_1));
	}

	public DefinitionsTable parseJson(Reader reader) {
		JsonNode root;
		try {
			root = mapper.readTree(reader);
		} catch (JsonProcessingException e) {
			throw new DefinitionsException("Malformed JSON definitions document: " + e.getOriginalMessage(), e);
		} catch (IOException e) {
			throw new DefinitionsException("Failed to read JSON definitions document", e);
		}
		if (root == null || !root.isObject()) {
			throw new DefinitionsException("Definitions document must be a JSON object");
		}
		return buildFromJson(root);
	}

	public DefinitionsTable parseJsonString(String json) {
		try {
			return buildFromJson(mapper.readTree(json));
		} catch (JsonProcessingException e) {
			throw new DefinitionsException("Malformed JSON definitions document: " + e.getOriginalMessage(), e);
		}
	}

	/**
	 * Parse a YAML definitions document (used for local extension tables).
	 */
	public DefinitionsTable parseYaml(InputStream inputStream) {
		return parseYaml(new InputStreamReader(inputStream, StandardCharsets.ISO_8859_1));
	}

	public DefinitionsTable parseYaml(Reader reader) {
		Object data;
		try {
			data = yaml.load(reader);
		} catch (RuntimeException e) {
			throw new DefinitionsException("Malformed YAML definitions document", e);
		}
		return buildFromYaml(data);
	}

	public DefinitionsTable parseYamlString(String content) {
		Object data;
		try {
			data = yaml.load(content);
		} catch (RuntimeException e) {
			throw new DefinitionsException("Malformed YAML definitions document", e);
		}
		return buildFromYaml(data);
	}

	/**
	 * Parse a file, choosing the format from its extension ({@code .yml}/{@code .yaml} or JSON).
	 */
	public DefinitionsTable parse(Path path) {
		String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
		try (InputStream is = Files.newInputStream(path)) {
			if (fileName.endsWith(".yml") || fileName.endsWith(".yaml")) {
				return parseYaml(is);
			}
			return parseJson(is);
		} catch (IOException e) {
			throw new DefinitionsException("Failed to read definitions from path: " + path, e);
		}
	}

	private DefinitionsTable buildFromJson(JsonNode root) {
		if (root == null || !root.isObject()) {
			throw new DefinitionsException("Definitions document must be a JSON object");
		}
		List<Prefix> prefixes = new ArrayList<>();
		for (JsonNode entry : arraySection(root, "prefixes")) {
			if (!entry.isObject() || !entry.hasNonNull("symbol") || !entry.hasNonNull("scale")) {
				throw new DefinitionsException("Prefix entries need 'symbol' and 'scale': " + entry);
			}
			if (!entry.get("scale").canConvertToExactIntegral()) {
				throw new DefinitionsException("Prefix scale must be an integer: " + entry);
			}
			prefixes.add(newPrefix(entry.get("symbol").asText(), entry.get("scale").asInt(), textOrNull(entry, "name")));
		}
		List<UnitDefinition> units = new ArrayList<>();
		for (JsonNode entry : arraySection(root, "units")) {
			if (entry.isTextual()) {
				units.add(newUnit(entry.asText(), null));
			} else if (entry.isObject() && entry.hasNonNull("symbol")) {
				units.add(newUnit(entry.get("symbol").asText(), textOrNull(entry, "name")));
			} else {
				throw new DefinitionsException("Unit entries need a 'symbol': " + entry);
			}
		}
		List<CurrencyCode> currencies = new ArrayList<>();
		for (JsonNode entry : arraySection(root, "currencies")) {
			if (entry.isTextual()) {
				currencies.add(newCurrency(entry.asText()));
			} else if (entry.isObject() && entry.hasNonNull("code")) {
				currencies.add(newCurrency(entry.get("code").asText()));
			} else {
				throw new DefinitionsException("Currency entries must be codes: " + entry);
			}
		}
		return DefinitionsTable.of(prefixes, units, currencies);
	}

	private List<JsonNode> arraySection(JsonNode root, String name) {
		JsonNode section = root.get(name);
		if (section == null || section.isNull()) {
			return List.of();
		}
		if (!section.isArray()) {
			throw new DefinitionsException("Section '" + name + "' must be an array");
		}
		List<JsonNode> entries = new ArrayList<>();
		section.forEach(entries::add);
		return entries;
	}

	private String textOrNull(JsonNode entry, String field) {
		JsonNode value = entry.get(field);
		return value != null && !value.isNull() ? value.asText() : null;
	}

	@SuppressWarnings("unchecked")
	private DefinitionsTable buildFromYaml(Object data) {
		if (data == null) {
			return DefinitionsTable.empty();
		}
		if (!(data instanceof Map)) {
			throw new DefinitionsException("Definitions document must be a mapping");
		}
		Map<String, Object> root = (Map<String, Object>) data;
		List<Prefix> prefixes = new ArrayList<>();
		for (Object entry : listSection(root, "prefixes")) {
			if (!(entry instanceof Map<?, ?> map) || map.get("symbol") == null || !(map.get("scale") instanceof Integer)) {
				throw new DefinitionsException("Prefix entries need 'symbol' and an integer 'scale': " + entry);
			}
			prefixes.add(newPrefix(String.valueOf(map.get("symbol")), (Integer) map.get("scale"), stringOrNull(map.get("name"))));
		}
		List<UnitDefinition> units = new ArrayList<>();
		for (Object entry : listSection(root, "units")) {
			if (entry instanceof String symbol) {
				units.add(newUnit(symbol, null));
			} else if (entry instanceof Map<?, ?> map && map.get("symbol") != null) {
				units.add(newUnit(String.valueOf(map.get("symbol")), stringOrNull(map.get("name"))));
			} else {
				throw new DefinitionsException("Unit entries need a 'symbol': " + entry);
			}
		}
		List<CurrencyCode> currencies = new ArrayList<>();
		for (Object entry : listSection(root, "currencies")) {
			if (entry instanceof String code) {
				currencies.add(newCurrency(code));
			} else if (entry instanceof Map<?, ?> map && map.get("code") != null) {
				currencies.add(newCurrency(String.valueOf(map.get("code"))));
			} else {
				throw new DefinitionsException("Currency entries must be codes: " + entry);
			}
		}
		return DefinitionsTable.of(prefixes, units, currencies);
	}

	private List<?> listSection(Map<String, Object> root, String name) {
		Object section = root.get(name);
		if (section == null) {
			return List.of();
		}
		if (!(section instanceof List<?> list)) {
			throw new DefinitionsException("Section '" + name + "' must be a list");
		}
		return list;
	}

	private String stringOrNull(Object value) {
		return value != null ? String.valueOf(value) : null;
	}

	private Prefix newPrefix(String symbol, int scale, String name) {
		try {
			return new Prefix(symbol, scale, name);
		} catch (IllegalArgumentException e) {
			throw new DefinitionsException(e.getMessage(), e);
		}
	}

	private UnitDefinition newUnit(String symbol, String name) {
		try {
			return new UnitDefinition(symbol, name);
		} catch (IllegalArgumentException e) {
			throw new DefinitionsException(e.getMessage(), e);
		}
	}

	private CurrencyCode newCurrency(String code) {
		try {
			return new CurrencyCode(code);
		} catch (IllegalArgumentException e) {
			throw new DefinitionsException(e.getMessage(), e);
		}
	}
}
