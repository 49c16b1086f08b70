package org.springaicommunity.credentialforge;

/**
 * The requested credential type is not registered with the credential generator.
 */
public class UnknownCredentialTypeException extends CredentialGenerationException {

	private final String credentialType;

	public UnknownCredentialTypeException(String credentialType) {
		super("Unknown credential type: " + credentialType);
		this.credentialType = credentialType;
	}

	public String getCredentialType() {
		return credentialType;
	}

}
