package org.springaicommunity.credentialforge;

import java.nio.file.Path;
import java.util.List;

/**
 * Writes a document of a given format containing content and credentials.
 */
public interface DocumentSynthesizer {

	/**
	 * Write a document.
	 * @param format output format
	 * @param content topic content
	 * @param credentials credentials to embed, in order
	 * @param embedding where and how the credentials are placed
	 * @param targetPath path of the document to write
	 * @return the path actually written
	 * @throws SynthesisException if the document cannot be written
	 */
	Path synthesize(String format, String content, List<GeneratedCredential> credentials, EmbeddingDecision embedding,
			Path targetPath);

}
