package org.springaicommunity.credentialforge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * {@link DocumentSynthesizer} writing every format as a UTF-8 text rendition that honours
 * the embedding decision.
 *
 * <ul>
 * <li>{@code inline-body}: credentials follow the content body.</li>
 * <li>{@code metadata-field}: credentials are written as header fields before the
 * body.</li>
 * <li>{@code attachment-blob}: credentials go into a base64 attachment block after the
 * body.</li>
 * <li>{@code distributed-sections}: the body is split into the decided number of sections
 * and each credential is placed in its assigned section.</li>
 * </ul>
 * The file keeps the extension of its format; byte-level format fidelity is left to
 * format-specific synthesizers.
 */
public class TextDocumentSynthesizer implements DocumentSynthesizer {

	private static final Logger logger = LoggerFactory.getLogger(TextDocumentSynthesizer.class);

	static final String ATTACHMENT_BOUNDARY = "----=_credential_forge_attachment";

	@Override
	public Path synthesize(String format, String content, List<GeneratedCredential> credentials,
			EmbeddingDecision embedding, Path targetPath) {
		String document = render(format, content, credentials, embedding);
		try {
			Path parent = targetPath.getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Files.writeString(targetPath, document, StandardCharsets.UTF_8);
			logger.debug("Wrote {} ({} chars)", targetPath, document.length());
			return targetPath;
		}
		catch (IOException e) {
			throw new SynthesisException("Failed to write " + targetPath + ": " + e.getMessage(), e);
		}
	}

	String render(String format, String content, List<GeneratedCredential> credentials,
			EmbeddingDecision embedding) {
		StringBuilder out = new StringBuilder();
		out.append("Format: ").append(format).append('\n');
		switch (embedding.mode()) {
			case METADATA_FIELD:
				for (GeneratedCredential credential : credentials) {
					out.append("X-").append(fieldName(credential.type())).append(": ").append(credential.value())
						.append('\n');
				}
				out.append('\n').append(content);
				break;
			case INLINE_BODY:
				out.append('\n').append(content).append('\n');
				for (GeneratedCredential credential : credentials) {
					out.append(label(credential.type())).append(": ").append(credential.value()).append('\n');
				}
				break;
			case ATTACHMENT_BLOB:
				out.append('\n').append(content).append('\n');
				StringBuilder attachment = new StringBuilder();
				for (GeneratedCredential credential : credentials) {
					attachment.append(credential.type()).append('=').append(credential.value()).append('\n');
				}
				out.append(ATTACHMENT_BOUNDARY).append('\n');
				out.append("Content-Disposition: attachment; filename=\"credentials.txt\"\n");
				out.append("Content-Transfer-Encoding: base64\n\n");
				out.append(Base64.getMimeEncoder()
					.encodeToString(attachment.toString().getBytes(StandardCharsets.UTF_8)))
					.append('\n');
				out.append(ATTACHMENT_BOUNDARY).append("--\n");
				break;
			case DISTRIBUTED_SECTIONS:
				List<String> sections = split(content, embedding.sectionCount());
				for (int s = 0; s < sections.size(); s++) {
					out.append("\n[Section ").append(s + 1).append("]\n").append(sections.get(s)).append('\n');
					for (int c = 0; c < credentials.size(); c++) {
						if (embedding.sectionOf(c) == s) {
							GeneratedCredential credential = credentials.get(c);
							out.append(label(credential.type())).append(": ").append(credential.value()).append('\n');
						}
					}
				}
				break;
		}
		return out.toString();
	}

	// splits at whitespace so every section is non-empty when the content allows it
	static List<String> split(String content, int sectionCount) {
		List<String> sections = new ArrayList<>();
		int length = content.length();
		int start = 0;
		for (int s = 1; s <= sectionCount; s++) {
			int end = s == sectionCount ? length : Math.max(start, length * s / sectionCount);
			while (end < length && end > start && !Character.isWhitespace(content.charAt(end))) {
				end++;
			}
			sections.add(content.substring(start, end).trim());
			start = end;
		}
		return sections;
	}

	private static String label(String type) {
		return type.replace('_', ' ').toUpperCase();
	}

	private static String fieldName(String type) {
		StringBuilder name = new StringBuilder();
		for (String part : type.split("_")) {
			if (!part.isEmpty()) {
				if (name.length() > 0) {
					name.append('-');
				}
				name.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
			}
		}
		return name.toString();
	}

}
