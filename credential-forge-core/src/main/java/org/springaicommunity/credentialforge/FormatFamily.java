package org.springaicommunity.credentialforge;

import java.util.List;

/**
 * Families of document formats sharing the same embedding capabilities. The first mode
 * of each capability list is the fallback used when a requested mode is unsupported.
 */
public enum FormatFamily {

	EMAIL(List.of(EmbeddingMode.INLINE_BODY, EmbeddingMode.ATTACHMENT_BLOB, EmbeddingMode.METADATA_FIELD)),

	SPREADSHEET(List.of(EmbeddingMode.METADATA_FIELD, EmbeddingMode.DISTRIBUTED_SECTIONS)),

	DOCUMENT(List.of(EmbeddingMode.INLINE_BODY, EmbeddingMode.METADATA_FIELD, EmbeddingMode.DISTRIBUTED_SECTIONS)),

	PRESENTATION(
			List.of(EmbeddingMode.DISTRIBUTED_SECTIONS, EmbeddingMode.INLINE_BODY, EmbeddingMode.METADATA_FIELD)),

	PDF(List.of(EmbeddingMode.INLINE_BODY, EmbeddingMode.METADATA_FIELD, EmbeddingMode.ATTACHMENT_BLOB)),

	IMAGE(List.of(EmbeddingMode.INLINE_BODY, EmbeddingMode.METADATA_FIELD)),

	DIAGRAM(List.of(EmbeddingMode.DISTRIBUTED_SECTIONS));

	private final List<EmbeddingMode> supportedModes;

	FormatFamily(List<EmbeddingMode> supportedModes) {
		this.supportedModes = supportedModes;
	}

	/**
	 * Returns the supported embedding modes in priority order.
	 * @return immutable, non-empty list of modes
	 */
	public List<EmbeddingMode> supportedModes() {
		return supportedModes;
	}

	public boolean supports(EmbeddingMode mode) {
		return supportedModes.contains(mode);
	}

	public EmbeddingMode fallbackMode() {
		return supportedModes.get(0);
	}

}
