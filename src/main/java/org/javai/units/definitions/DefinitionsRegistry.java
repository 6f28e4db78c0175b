package org.javai.units.definitions;

import java.io.IOException;
import java.io.InputStream;
import java.net.JarURLConnection;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles the definitions table an application parses with.
 * <p>
 * A registry holds one canonical table and any number of named extension tables.
 * {@link #table()} merges them, canonical first and extensions in registration
 * order, so the canonical entries keep priority. Registries are ordinary objects;
 * several can coexist in one process, each producing its own immutable table.
 *
 * <pre>{@code
 * DefinitionsTable table = DefinitionsRegistry.create()
 *         .registerCanonical(DefinitionsRegistry.class.getClassLoader())
 *         .registerMetaInfExtensions(DefinitionsRegistry.class.getClassLoader())
 *         .table();
 * }</pre>
 */
public final class DefinitionsRegistry {

	private static final Logger logger = LoggerFactory.getLogger(DefinitionsRegistry.class);

	public static final String CANONICAL_RESOURCE = "META-INF/units/definitions.json";
	static final String EXTENSION_DIRECTORY = "META-INF/units/";
	static final String EXTENSION_PREFIX = "extension-";

	private final DefinitionsParser parser;
	private DefinitionsTable canonical = DefinitionsTable.empty();
	private final Map<String, DefinitionsTable> extensions = new LinkedHashMap<>();

	private DefinitionsRegistry(DefinitionsParser parser) {
		this.parser = parser;
	}

	public static DefinitionsRegistry create() {
		return new DefinitionsRegistry(new DefinitionsParser());
	}

	/**
	 * Convenience: the bundled canonical table with no extensions.
	 */
	public static DefinitionsTable bundled() {
		return create().registerCanonical(DefinitionsRegistry.class.getClassLoader()).table();
	}

	/**
	 * Replace the canonical table.
	 */
	public DefinitionsRegistry registerCanonical(DefinitionsTable table) {
		this.canonical = Objects.requireNonNull(table, "table must not be null");
		logger.info("Registered canonical definitions: {} prefixes, {} units, {} currencies",
				table.prefixes().size(), table.units().size(), table.currencies().size());
		return this;
	}

	/**
	 * Load the canonical table from {@value #CANONICAL_RESOURCE} on the given loader.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found
	 * @throws DefinitionsException if the document is invalid
	 */
	public DefinitionsRegistry registerCanonical(ClassLoader loader) {
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(CANONICAL_RESOURCE)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + CANONICAL_RESOURCE);
			}
			return registerCanonical(parser.parseJson(is));
		} catch (IOException e) {
			throw new DefinitionsException("Failed to load canonical definitions", e);
		}
	}

	/**
	 * Register an extension table under an id. The first registration for an id wins.
	 */
	public DefinitionsTable registerExtension(String id, DefinitionsTable table) {
		Objects.requireNonNull(table, "table must not be null");
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("Extension id must not be blank");
		}
		DefinitionsTable existing = extensions.get(id);
		if (existing != null) {
			logger.debug("Extension '{}' already registered; skipping", id);
			return existing;
		}
		extensions.put(id, table);
		logger.info("Registered extension '{}' with {} prefixes, {} units, {} currencies",
				id, table.prefixes().size(), table.units().size(), table.currencies().size());
		return table;
	}

	/**
	 * Load and register an extension table from a classpath resource. The resource
	 * name serves as the id; {@code .yml}/{@code .yaml} resources are read as YAML,
	 * everything else as JSON.
	 */
	public DefinitionsTable registerResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			return registerExtension(resourcePath, parseByName(resourcePath, is));
		} catch (IOException e) {
			throw new DefinitionsException("Failed to load definitions from resource: " + resourcePath, e);
		}
	}

	/**
	 * Load and register an extension table from the filesystem.
	 */
	public DefinitionsTable registerPath(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		return registerExtension(path.toString(), parser.parse(path));
	}

	/**
	 * Discover extension tables named {@code META-INF/units/extension-*.yml} (or
	 * {@code .json}) in exploded directories and JARs visible to the loader.
	 * Unreadable files are logged and skipped.
	 */
	public DefinitionsRegistry registerMetaInfExtensions(ClassLoader loader) {
		Objects.requireNonNull(loader, "loader must not be null");
		try {
			Enumeration<URL> resources = loader.getResources(EXTENSION_DIRECTORY);
			while (resources.hasMoreElements()) {
				URL url = resources.nextElement();
				if ("file".equalsIgnoreCase(url.getProtocol())) {
					loadFromDirectory(url);
				}
				else if ("jar".equalsIgnoreCase(url.getProtocol())) {
					loadFromJar(url);
				}
			}
		}
		catch (IOException e) {
			throw new DefinitionsException("Failed to scan " + EXTENSION_DIRECTORY + " for extension tables", e);
		}
		return this;
	}

	public Optional<DefinitionsTable> extension(String id) {
		return Optional.ofNullable(extensions.get(id));
	}

	public List<String> extensionIds() {
		return List.copyOf(extensions.keySet());
	}

	public DefinitionsTable canonical() {
		return canonical;
	}

	/**
	 * The canonical table merged with every registered extension.
	 *
	 * @throws DefinitionsException if an extension redefines an existing symbol
	 */
	public DefinitionsTable table() {
		DefinitionsTable merged = canonical;
		for (Map.Entry<String, DefinitionsTable> entry : extensions.entrySet()) {
			try {
				merged = merged.merge(entry.getValue());
			} catch (DefinitionsException e) {
				throw new DefinitionsException("Extension '" + entry.getKey() + "' conflicts with earlier definitions: "
						+ e.getMessage(), e);
			}
		}
		return merged;
	}

	private DefinitionsTable parseByName(String name, InputStream is) {
		return isYaml(name) ? parser.parseYaml(is) : parser.parseJson(is);
	}

	private static boolean isYaml(String name) {
		return name.endsWith(".yml") || name.endsWith(".yaml");
	}

	private static boolean isExtensionFile(String fileName) {
		return fileName.startsWith(EXTENSION_PREFIX)
				&& (isYaml(fileName) || fileName.endsWith(".json"));
	}

	private void loadFromDirectory(URL url) {
		List<Path> files = new ArrayList<>();
		try {
			Path directory = Paths.get(url.toURI());
			if (!Files.isDirectory(directory)) {
				return;
			}
			try (Stream<Path> listing = Files.list(directory)) {
				listing.filter(Files::isRegularFile)
						.filter(p -> isExtensionFile(p.getFileName().toString()))
						.sorted()
						.forEach(files::add);
			}
		}
		catch (Exception e) {
			logger.warn("Failed to scan directory {}", url, e);
			return;
		}
		for (Path file : files) {
			try {
				registerPath(file);
			}
			catch (RuntimeException e) {
				logger.warn("Failed to load extension table from {}", file, e);
			}
		}
	}

	private void loadFromJar(URL url) {
		try {
			JarURLConnection conn = (JarURLConnection) url.openConnection();
			conn.setUseCaches(false);
			try (JarFile jar = conn.getJarFile()) {
				Enumeration<JarEntry> entries = jar.entries();
				while (entries.hasMoreElements()) {
					JarEntry entry = entries.nextElement();
					String name = entry.getName();
					if (entry.isDirectory() || !name.startsWith(EXTENSION_DIRECTORY)) {
						continue;
					}
					String fileName = name.substring(EXTENSION_DIRECTORY.length());
					if (fileName.contains("/") || !isExtensionFile(fileName)) {
						continue;
					}
					try (InputStream is = jar.getInputStream(entry)) {
						registerExtension(name, parseByName(name, is));
					}
					catch (IOException | RuntimeException ex) {
						logger.warn("Failed to load extension table from JAR entry {}", name, ex);
					}
				}
			}
		}
		catch (IOException e) {
			logger.warn("Failed to scan JAR {}", url, e);
		}
	}
}
