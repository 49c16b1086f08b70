package org.springaicommunity.credentialforge;

/**
 * Pipeline stage of a single generation job, used to tag failures.
 */
public enum JobStage {

	CONTENT, CREDENTIALS, EMBEDDING, SYNTHESIS

}
