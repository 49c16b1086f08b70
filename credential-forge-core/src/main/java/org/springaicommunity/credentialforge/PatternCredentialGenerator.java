package org.springaicommunity.credentialforge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * {@link CredentialGenerator} producing values from the patterns of a
 * {@link RegexCredentialDatabase}.
 *
 * <p>
 * Values are drawn from a {@link Random} seeded with the job's {@code unique_seed} and the
 * credential type, so a replayed batch yields the same credentials. Every value is checked
 * against its pattern, and a value already produced by this instance is regenerated up to
 * {@value #MAX_UNIQUE_ATTEMPTS} times.
 *
 * <p>
 * Instances keep per-session state and are not thread-safe; use one per worker.
 */
public class PatternCredentialGenerator implements CredentialGenerator {

	private static final Logger logger = LoggerFactory.getLogger(PatternCredentialGenerator.class);

	static final int MAX_UNIQUE_ATTEMPTS = 10;

	/**
	 * Generator hint producing a three-part JSON web token.
	 */
	static final String JWT_GENERATOR = "jwt";

	private static final String BASE64URL_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-_";

	private final RegexCredentialDatabase database;

	private final Map<String, RegexValueGenerator> generators = new HashMap<>();

	private final Set<String> generated = new HashSet<>();

	public PatternCredentialGenerator(RegexCredentialDatabase database) {
		this.database = database;
	}

	@Override
	public String generateCredential(String type, Map<String, Object> context) {
		CredentialPattern pattern = database.find(type).orElseThrow(() -> new UnknownCredentialTypeException(type));
		Random random = new Random(UniquenessSeeder.derive(seedOf(context), type.hashCode()));

		for (int attempt = 0; attempt < MAX_UNIQUE_ATTEMPTS; attempt++) {
			String value = JWT_GENERATOR.equalsIgnoreCase(pattern.generator()) ? jwt(random, context)
					: generatorFor(pattern).generate(random);
			if (!pattern.matches(value)) {
				throw new CredentialGenerationException(
						"Generated " + type + " value does not match its pattern " + pattern.regex());
			}
			if (generated.add(value)) {
				return value;
			}
			logger.debug("Duplicate {} value on attempt {}, regenerating", type, attempt + 1);
		}
		throw new CredentialGenerationException(
				"Could not generate a unique " + type + " value after " + MAX_UNIQUE_ATTEMPTS + " attempts");
	}

	@Override
	public Set<String> listCredentialTypes() {
		return database.types();
	}

	/**
	 * Returns the number of distinct values produced by this instance.
	 */
	public int generatedCount() {
		return generated.size();
	}

	private RegexValueGenerator generatorFor(CredentialPattern pattern) {
		RegexValueGenerator generator = generators.get(pattern.type());
		if (generator == null) {
			try {
				generator = RegexValueGenerator.compile(pattern.regex());
			}
			catch (IllegalArgumentException e) {
				throw new CredentialGenerationException(e.getMessage(), e);
			}
			generators.put(pattern.type(), generator);
		}
		return generator;
	}

	private static long seedOf(Map<String, Object> context) {
		Object seed = context.get("unique_seed");
		if (seed instanceof Number) {
			return ((Number) seed).longValue();
		}
		return System.nanoTime();
	}

	private static String jwt(Random random, Map<String, Object> context) {
		Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
		String header = "{\"alg\":\"HS256\",\"typ\":\"JWT\"}";
		long issuedAt = 1_600_000_000L + random.nextInt(200_000_000);
		String payload = String.format("{\"sub\":\"%d\",\"name\":\"user%d\",\"iat\":%d,\"idx\":%s}",
				1000 + random.nextInt(9000), random.nextInt(100_000), issuedAt, context.getOrDefault("file_index", 0));
		StringBuilder signature = new StringBuilder();
		for (int i = 0; i < 43; i++) {
			signature.append(BASE64URL_CHARS.charAt(random.nextInt(BASE64URL_CHARS.length())));
		}
		return encoder.encodeToString(header.getBytes(StandardCharsets.UTF_8)) + "."
				+ encoder.encodeToString(payload.getBytes(StandardCharsets.UTF_8)) + "." + signature;
	}

}
