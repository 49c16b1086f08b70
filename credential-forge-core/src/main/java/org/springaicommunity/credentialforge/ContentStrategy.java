package org.springaicommunity.credentialforge;

import java.util.Map;

/**
 * One way of producing topic content for a document, for example a language model or a
 * template set. Strategies are ranked by the {@link JobExecutor}; the first that succeeds
 * serves the content.
 */
public interface ContentStrategy {

	/**
	 * Returns a short name recorded as the content source of a document.
	 */
	String name();

	/**
	 * Generate content.
	 * @param topic topic, possibly several joined with ", "
	 * @param format output format the content is for
	 * @param context seed-derived job context
	 * @return the content text
	 * @throws ContentGenerationException if this strategy cannot produce content
	 */
	String generate(String topic, String format, Map<String, Object> context);

}
