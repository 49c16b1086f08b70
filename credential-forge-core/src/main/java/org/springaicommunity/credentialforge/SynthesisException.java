package org.springaicommunity.credentialforge;

/**
 * A format writer failed to produce its document (I/O error or format-specific
 * malformation). Never retried.
 */
public class SynthesisException extends CredentialForgeException {

	public SynthesisException(String message) {
		super(message);
	}

	public SynthesisException(String message, Throwable cause) {
		super(message, cause);
	}

}
