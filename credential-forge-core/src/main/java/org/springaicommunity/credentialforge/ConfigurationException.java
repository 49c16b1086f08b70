package org.springaicommunity.credentialforge;

/**
 * Invalid batch configuration. Raised before any job starts; no partial batch is
 * attempted.
 */
public class ConfigurationException extends CredentialForgeException {

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}

}
