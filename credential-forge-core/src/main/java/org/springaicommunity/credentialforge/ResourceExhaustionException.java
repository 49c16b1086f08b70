package org.springaicommunity.credentialforge;

/**
 * The memory ceiling cannot fund even a single worker. Raised before any worker starts.
 */
public class ResourceExhaustionException extends CredentialForgeException {

	public ResourceExhaustionException(String message) {
		super(message);
	}

}
