package org.springaicommunity.credentialforge;

import java.nio.file.Path;
import java.util.List;

/**
 * One planned unit of work producing exactly one document.
 *
 * <p>
 * Created by {@link JobPlanner} and immutable thereafter. A job is processed by exactly
 * one worker and never shares its seed, path or result with another job.
 *
 * @param jobIndex zero-based index, unique and stable within the batch
 * @param format output format
 * @param topic topic for content generation, possibly a comma-joined multi-topic string
 * @param credentialTypes distinct credential types requested for this document
 * @param seed uniqueness seed derived by {@link UniquenessSeeder}
 * @param language content language handed to collaborators
 * @param targetPath where the document is written
 */
public record GenerationJob(int jobIndex, String format, String topic, List<String> credentialTypes, long seed,
		String language, Path targetPath) {

	public GenerationJob {
		credentialTypes = List.copyOf(credentialTypes);
	}

}
