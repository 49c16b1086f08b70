package org.springaicommunity.credentialforge;

import java.time.Duration;

/**
 * A collaborator call did not complete within the configured job timeout.
 */
public class CollaboratorTimeoutException extends CredentialForgeException {

	private final Duration timeout;

	public CollaboratorTimeoutException(String description, Duration timeout) {
		super(description + " timed out after " + timeout.toMillis() + "ms");
		this.timeout = timeout;
	}

	public Duration getTimeout() {
		return timeout;
	}

}
