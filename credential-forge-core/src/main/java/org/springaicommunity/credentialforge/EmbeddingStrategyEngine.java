package org.springaicommunity.credentialforge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Decides how and where credentials are placed in a document.
 *
 * <p>
 * Decisions are constrained by the capability set of the target format's
 * {@link FormatFamily}:
 * <ul>
 * <li>A named strategy is used only if the format supports it; otherwise the format's
 * first supported mode is used and the fallback is recorded in the decision.</li>
 * <li>{@code random} picks uniformly among the supported modes, using the job's
 * uniqueness seed so the choice is reproducible per job.</li>
 * <li>{@link EmbeddingMode#DISTRIBUTED_SECTIONS} assigns credentials to sections round
 * robin. The section count is derived from the content length bucket, so short content
 * is never asked for more sections than it can hold.</li>
 * </ul>
 *
 * <p>
 * The engine has no side effects beyond logging.
 */
public class EmbeddingStrategyEngine {

	private static final Logger logger = LoggerFactory.getLogger(EmbeddingStrategyEngine.class);

	/**
	 * Content shorter than this is "short".
	 */
	public static final int SHORT_CONTENT_LIMIT = 1000;

	/**
	 * Content shorter than this (and not short) is "medium".
	 */
	public static final int MEDIUM_CONTENT_LIMIT = 4000;

	static final int SHORT_SECTIONS = 2;

	static final int MEDIUM_SECTIONS = 4;

	static final int LONG_SECTIONS = 8;

	/**
	 * Decide the embedding for one document.
	 * @param format output format
	 * @param credentialTypes types of the credentials to embed, in embedding order
	 * @param contentLength length of the generated content in characters
	 * @param strategy configured strategy: "random" or a named mode
	 * @param seed the job's uniqueness seed
	 * @return the embedding decision
	 * @throws ConfigurationException if the format or strategy is unknown
	 */
	public EmbeddingDecision decide(String format, List<String> credentialTypes, int contentLength, String strategy,
			long seed) {
		FormatFamily family = FormatCatalog.familyOf(format);
		List<EmbeddingMode> supported = family.supportedModes();

		EmbeddingMode mode;
		boolean fallbackApplied = false;
		String fallbackReason = null;

		if (EmbeddingMode.RANDOM.equalsIgnoreCase(strategy.trim())) {
			Random random = UniquenessSeeder.random(seed, UniquenessSeeder.EMBEDDING_STREAM);
			mode = supported.get(random.nextInt(supported.size()));
		}
		else {
			EmbeddingMode requested = EmbeddingMode.fromStrategy(strategy);
			if (requested == null) {
				throw new ConfigurationException("Unknown embedding strategy: " + strategy);
			}
			if (family.supports(requested)) {
				mode = requested;
			}
			else {
				mode = family.fallbackMode();
				fallbackApplied = true;
				fallbackReason = String.format("Format '%s' (%s) does not support %s; using %s", format, family,
						requested.id(), mode.id());
				logger.debug(fallbackReason);
			}
		}

		int sectionCount = 1;
		Map<Integer, Integer> assignments = Map.of();
		if (mode == EmbeddingMode.DISTRIBUTED_SECTIONS) {
			sectionCount = sectionsFor(contentLength);
			assignments = assignSections(credentialTypes.size(), sectionCount);
		}

		return new EmbeddingDecision(mode, strategy, fallbackApplied, fallbackReason, sectionCount, assignments);
	}

	/**
	 * Returns the number of sections available for a given content length.
	 * @param contentLength length of the content in characters
	 * @return 2 for short, 4 for medium and 8 for long content
	 */
	public int sectionsFor(int contentLength) {
		if (contentLength < SHORT_CONTENT_LIMIT) {
			return SHORT_SECTIONS;
		}
		if (contentLength < MEDIUM_CONTENT_LIMIT) {
			return MEDIUM_SECTIONS;
		}
		return LONG_SECTIONS;
	}

	// round robin keeps every section at or below ceil(count / sections)
	private Map<Integer, Integer> assignSections(int credentialCount, int sectionCount) {
		Map<Integer, Integer> assignments = new LinkedHashMap<>();
		for (int i = 0; i < credentialCount; i++) {
			assignments.put(i, i % sectionCount);
		}
		return assignments;
	}

}
