package org.springaicommunity.credentialforge;

import java.util.Map;
import java.util.Set;

/**
 * Produces synthetic credential values.
 *
 * <p>
 * Implementations are used by a single worker at a time; each worker obtains its own
 * instance.
 */
public interface CredentialGenerator {

	/**
	 * Generate a credential value.
	 * @param type credential type, one of {@link #listCredentialTypes()}
	 * @param context seed-derived job context ({@code file_index}, {@code unique_seed},
	 * {@code generation_timestamp}, {@code language}, {@code format})
	 * @return the generated value
	 * @throws UnknownCredentialTypeException if the type is not known
	 * @throws CredentialGenerationException if generation fails
	 */
	String generateCredential(String type, Map<String, Object> context);

	/**
	 * Returns the credential types this generator can produce.
	 */
	Set<String> listCredentialTypes();

}
