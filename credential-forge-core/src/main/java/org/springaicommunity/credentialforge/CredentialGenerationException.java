package org.springaicommunity.credentialforge;

/**
 * A credential value could not be generated.
 */
public class CredentialGenerationException extends CredentialForgeException {

	public CredentialGenerationException(String message) {
		super(message);
	}

	public CredentialGenerationException(String message, Throwable cause) {
		super(message, cause);
	}

}
