package org.springaicommunity.credentialforge;

/**
 * Classification of a failed generation job.
 */
public enum ErrorKind {

	/**
	 * Every content strategy failed, including the template fallback.
	 */
	CONTENT_GENERATION,

	/**
	 * Every requested credential type failed.
	 */
	CREDENTIAL_GENERATION,

	/**
	 * The format writer failed.
	 */
	SYNTHESIS,

	/**
	 * A collaborator call exceeded the configured job timeout.
	 */
	TIMEOUT,

	/**
	 * Anything the pipeline did not anticipate.
	 */
	UNEXPECTED

}
