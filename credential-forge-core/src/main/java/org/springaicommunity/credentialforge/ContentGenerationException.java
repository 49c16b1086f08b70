package org.springaicommunity.credentialforge;

/**
 * Topic content could not be produced by any content strategy.
 */
public class ContentGenerationException extends CredentialForgeException {

	public ContentGenerationException(String message) {
		super(message);
	}

	public ContentGenerationException(String message, Throwable cause) {
		super(message, cause);
	}

}
