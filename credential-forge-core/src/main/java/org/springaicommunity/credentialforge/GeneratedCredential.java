package org.springaicommunity.credentialforge;

/**
 * A synthetic credential value together with its type.
 *
 * @param type credential type, e.g. "aws_access_key"
 * @param value the generated value
 */
public record GeneratedCredential(String type, String value) {
}
