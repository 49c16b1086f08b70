package org.springaicommunity.credentialforge;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Structural placement of credential values within a generated document.
 */
public enum EmbeddingMode {

	/**
	 * Credentials appear in the running text of the document body.
	 */
	INLINE_BODY("inline-body"),

	/**
	 * Credentials travel in a separate attachment or embedded file.
	 */
	ATTACHMENT_BLOB("attachment-blob"),

	/**
	 * Credentials are stored in document properties, headers or hidden fields.
	 */
	METADATA_FIELD("metadata-field"),

	/**
	 * Credentials are spread across several sections, sheets, slides or shapes.
	 */
	DISTRIBUTED_SECTIONS("distributed-sections");

	/**
	 * Strategy name that lets the engine pick among the supported modes.
	 */
	public static final String RANDOM = "random";

	private final String id;

	EmbeddingMode(String id) {
		this.id = id;
	}

	public String id() {
		return id;
	}

	/**
	 * Resolve a named embedding strategy. Accepts the canonical identifiers plus the
	 * short aliases {@code body} and {@code metadata}.
	 * @param strategy strategy name
	 * @return the matching mode, or {@code null} when the name is not a fixed mode (for
	 * example {@code random})
	 */
	@Nullable
	public static EmbeddingMode fromStrategy(String strategy) {
		String normalized = strategy.trim().toLowerCase(Locale.ROOT).replace('_', '-');
		switch (normalized) {
			case "inline-body", "body", "inline":
				return INLINE_BODY;
			case "attachment-blob", "attachment":
				return ATTACHMENT_BLOB;
			case "metadata-field", "metadata":
				return METADATA_FIELD;
			case "distributed-sections", "distributed", "sections":
				return DISTRIBUTED_SECTIONS;
			default:
				return null;
		}
	}

	/**
	 * Returns true if the given name is {@code random} or resolves to a fixed mode.
	 * @param strategy strategy name
	 * @return true if the strategy is recognised
	 */
	public static boolean isKnownStrategy(String strategy) {
		return RANDOM.equalsIgnoreCase(strategy.trim()) || fromStrategy(strategy) != null;
	}

}
