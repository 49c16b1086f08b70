package org.springaicommunity.credentialforge;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.regex.Pattern;

/**
 * One entry of the regex database.
 *
 * @param type credential type, e.g. "aws_access_key"
 * @param regex regular expression every generated value must match
 * @param description human-readable description
 * @param generator optional generator hint; {@code "jwt"} produces a structured token
 * @param examples sample values, informational only
 */
public record CredentialPattern(String type, String regex, String description, @Nullable String generator,
		List<String> examples) {

	public CredentialPattern {
		examples = examples != null ? List.copyOf(examples) : List.of();
		description = description != null ? description : "";
	}

	/**
	 * Returns true if the value matches this pattern in full.
	 * @param value candidate value
	 */
	public boolean matches(String value) {
		return Pattern.compile(regex).matcher(value).matches();
	}

}
