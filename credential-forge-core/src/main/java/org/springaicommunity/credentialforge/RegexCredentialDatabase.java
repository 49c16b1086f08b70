package org.springaicommunity.credentialforge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Credential patterns loaded from a JSON regex database.
 *
 * <p>
 * Expected format:
 *
 * <pre>
 * {
 *   "credentials": [
 *     { "type": "aws_access_key", "regex": "AKIA[0-9A-Z]{16}", "description": "...",
 *       "generator": null, "examples": [] }
 *   ]
 * }
 * </pre>
 *
 * Every regex is compiled on load, so a database that loads is usable. Instances are
 * immutable; {@link #with(CredentialPattern)} returns an extended copy that can be written
 * back with {@link #save(Path, ObjectMapper)}.
 */
public final class RegexCredentialDatabase {

	private static final Logger logger = LoggerFactory.getLogger(RegexCredentialDatabase.class);

	/**
	 * Classpath location of the built-in database.
	 */
	public static final String DEFAULT_RESOURCE = "default-regex-db.json";

	private final Map<String, CredentialPattern> patterns;

	RegexCredentialDatabase(List<CredentialPattern> entries) {
		Map<String, CredentialPattern> byType = new LinkedHashMap<>();
		for (CredentialPattern entry : entries) {
			validate(entry);
			if (byType.put(entry.type(), entry) != null) {
				throw new ConfigurationException("Duplicate credential type in regex database: " + entry.type());
			}
		}
		this.patterns = Collections.unmodifiableMap(byType);
	}

	/**
	 * Load a database file.
	 * @param path JSON database file
	 * @param objectMapper mapper used to read the file
	 * @return the database
	 * @throws ConfigurationException if the file is missing or invalid
	 */
	public static RegexCredentialDatabase load(Path path, ObjectMapper objectMapper) {
		if (!Files.isRegularFile(path)) {
			throw new ConfigurationException("Regex database not found: " + path);
		}
		try (InputStream in = Files.newInputStream(path)) {
			RegexCredentialDatabase database = read(in, objectMapper, path.toString());
			logger.info("Loaded {} credential patterns from {}", database.size(), path);
			return database;
		}
		catch (IOException e) {
			throw new ConfigurationException("Failed to read regex database " + path + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Load the built-in database from the classpath.
	 * @param objectMapper mapper used to read the resource
	 * @return the database
	 */
	public static RegexCredentialDatabase loadDefault(ObjectMapper objectMapper) {
		try (InputStream in = RegexCredentialDatabase.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
			if (in == null) {
				throw new ConfigurationException("Built-in regex database missing from classpath: " + DEFAULT_RESOURCE);
			}
			RegexCredentialDatabase database = read(in, objectMapper, DEFAULT_RESOURCE);
			logger.debug("Loaded {} built-in credential patterns", database.size());
			return database;
		}
		catch (IOException e) {
			throw new ConfigurationException("Failed to read built-in regex database: " + e.getMessage(), e);
		}
	}

	/**
	 * Load a database file, or start an empty database if the file does not exist yet.
	 * @param path JSON database file
	 * @param objectMapper mapper used to read the file
	 * @return the loaded or empty database
	 */
	public static RegexCredentialDatabase loadOrEmpty(Path path, ObjectMapper objectMapper) {
		if (Files.notExists(path)) {
			logger.info("Regex database {} does not exist, starting an empty one", path);
			return new RegexCredentialDatabase(List.of());
		}
		return load(path, objectMapper);
	}

	private static RegexCredentialDatabase read(InputStream in, ObjectMapper objectMapper, String source)
			throws IOException {
		JsonNode root = objectMapper.readTree(in);
		JsonNode credentials = root == null ? null : root.get("credentials");
		if (credentials == null || !credentials.isArray()) {
			throw new ConfigurationException("Invalid regex database " + source + ": missing 'credentials' array");
		}
		List<CredentialPattern> entries = new ArrayList<>();
		for (JsonNode node : credentials) {
			entries.add(objectMapper.treeToValue(node, CredentialPattern.class));
		}
		return new RegexCredentialDatabase(entries);
	}

	private static void validate(CredentialPattern entry) {
		if (entry.type() == null || entry.type().isBlank()) {
			throw new ConfigurationException("Regex database entry without a type");
		}
		if (entry.regex() == null || entry.regex().isBlank()) {
			throw new ConfigurationException("Credential type " + entry.type() + " has no regex");
		}
		try {
			Pattern.compile(entry.regex());
		}
		catch (PatternSyntaxException e) {
			throw new ConfigurationException(
					"Credential type " + entry.type() + " has an invalid regex: " + e.getDescription());
		}
	}

	/**
	 * Add a credential type.
	 * @param pattern the new entry; its description must not be blank
	 * @return a new database holding the existing entries followed by the new one
	 * @throws ConfigurationException if the entry is invalid or its type already exists
	 */
	public RegexCredentialDatabase with(CredentialPattern pattern) {
		if (patterns.containsKey(pattern.type())) {
			throw new ConfigurationException("Credential type already exists: " + pattern.type());
		}
		if (pattern.description().isBlank()) {
			throw new ConfigurationException("Credential type " + pattern.type() + " needs a description");
		}
		List<CredentialPattern> entries = new ArrayList<>(patterns.values());
		entries.add(pattern);
		return new RegexCredentialDatabase(entries);
	}

	/**
	 * Write the database as JSON in the format {@link #load(Path, ObjectMapper)} reads.
	 * @param path target file; parent directories are created
	 * @param objectMapper mapper used to write the file
	 * @return the written file
	 * @throws CredentialForgeException if the file cannot be written
	 */
	public Path save(Path path, ObjectMapper objectMapper) {
		ObjectNode root = objectMapper.createObjectNode();
		ArrayNode credentials = root.putArray("credentials");
		for (CredentialPattern pattern : patterns.values()) {
			credentials.add(objectMapper.<ObjectNode>valueToTree(pattern));
		}
		try {
			Path parent = path.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), root);
			logger.info("Saved {} credential patterns to {}", patterns.size(), path);
			return path;
		}
		catch (IOException e) {
			throw new CredentialForgeException("Failed to save regex database to " + path, e);
		}
	}

	public Optional<CredentialPattern> find(String type) {
		return Optional.ofNullable(patterns.get(type));
	}

	public Set<String> types() {
		return patterns.keySet();
	}

	public int size() {
		return patterns.size();
	}

}
