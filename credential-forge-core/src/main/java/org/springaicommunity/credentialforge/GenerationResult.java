package org.springaicommunity.credentialforge;

import java.util.List;

/**
 * Outcome of one generation job: either a {@link Success} or a {@link Failure}.
 *
 * <p>
 * Results are immutable once produced. Every result carries its originating job index so
 * callers can restore submission order after out-of-order completion.
 */
public interface GenerationResult {

	/**
	 * Returns the index of the job this result belongs to.
	 */
	int jobIndex();

	/**
	 * Returns true if the job produced a document.
	 */
	boolean succeeded();

	/**
	 * A document was written.
	 *
	 * @param jobIndex originating job index
	 * @param path path of the written document
	 * @param format output format
	 * @param topic topic the content was generated for
	 * @param credentialTypes types of the credentials actually embedded
	 * @param credentialsEmbeddedCount number of credentials embedded
	 * @param embedding the embedding decision used for this document
	 * @param contentSource name of the content strategy that served the content
	 * @param failedCredentialTypes requested types that could not be generated
	 */
	record Success(int jobIndex, String path, String format, String topic, List<String> credentialTypes,
			int credentialsEmbeddedCount, EmbeddingDecision embedding, String contentSource,
			List<String> failedCredentialTypes) implements GenerationResult {

		public Success {
			credentialTypes = List.copyOf(credentialTypes);
			failedCredentialTypes = List.copyOf(failedCredentialTypes);
		}

		@Override
		public boolean succeeded() {
			return true;
		}

	}

	/**
	 * The job terminated without a document.
	 *
	 * @param jobIndex originating job index
	 * @param stage stage in which the job failed
	 * @param errorKind classification of the failure
	 * @param message human-readable cause
	 */
	record Failure(int jobIndex, JobStage stage, ErrorKind errorKind, String message) implements GenerationResult {

		@Override
		public boolean succeeded() {
			return false;
		}

	}

}
