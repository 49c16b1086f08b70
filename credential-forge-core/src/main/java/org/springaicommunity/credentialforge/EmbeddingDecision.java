package org.springaicommunity.credentialforge;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * How and where credentials are placed in one document.
 *
 * @param mode the embedding mode actually used
 * @param requestedStrategy the configured strategy ("random" or a mode name)
 * @param fallbackApplied true if the requested mode was unsupported by the format and
 * the format's first supported mode was used instead
 * @param fallbackReason explanation of the fallback, {@code null} when none was applied
 * @param sectionCount number of sections available to distributed placement, 1 for
 * other modes
 * @param sectionAssignments credential index to section index; populated for
 * {@link EmbeddingMode#DISTRIBUTED_SECTIONS} only
 */
public record EmbeddingDecision(EmbeddingMode mode, String requestedStrategy, boolean fallbackApplied,
		@Nullable String fallbackReason, int sectionCount, Map<Integer, Integer> sectionAssignments) {

	public EmbeddingDecision {
		sectionAssignments = Map.copyOf(sectionAssignments);
	}

	/**
	 * Returns the section a credential is placed in.
	 * @param credentialIndex index into the job's credential list
	 * @return the section index, 0 when the mode does not distribute
	 */
	public int sectionOf(int credentialIndex) {
		return sectionAssignments.getOrDefault(credentialIndex, 0);
	}

}
