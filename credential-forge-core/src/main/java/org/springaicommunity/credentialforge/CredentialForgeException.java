package org.springaicommunity.credentialforge;

/**
 * Base class for all errors raised by the generation pipeline.
 */
public class CredentialForgeException extends RuntimeException {

	public CredentialForgeException(String message) {
		super(message);
	}

	public CredentialForgeException(String message, Throwable cause) {
		super(message, cause);
	}

}
