package org.springaicommunity.credentialforge;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Content strategy filling per-family templates with the topic.
 *
 * <p>
 * Needs no external service and is the last entry of the default strategy ranking.
 * Multi-topic strings get one part per topic. Paragraph counts are drawn from the job's
 * {@code unique_seed}, so documents of the same topic differ in length and wording.
 */
public class TemplateContentStrategy implements ContentStrategy {

	public static final String NAME = "template";

	private static final List<String> OPENERS = List.of("This note summarises the current state of %s.",
			"Below is an overview of %s for the team.", "Following up on our discussion about %s.",
			"Please review the latest details regarding %s.");

	private static final List<String> SENTENCES = List.of(
			"The rollout is tracked in the shared planning board and reviewed weekly.",
			"Access to the staging environment is limited to the on-call rotation.",
			"Configuration values are kept alongside the deployment manifests.",
			"The integration tests run nightly against the pre-production cluster.",
			"Owners should confirm the migration window with operations before Friday.",
			"Service accounts are rotated at the end of every quarter.",
			"Monitoring dashboards were updated to include the new endpoints.",
			"Open questions are collected at the end of this document.");

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public String generate(String topic, String format, Map<String, Object> context) {
		if (topic.isBlank()) {
			throw new ContentGenerationException("Cannot generate content for a blank topic");
		}
		FormatFamily family = FormatCatalog.familyOf(format);
		Random random = new Random(seedOf(context));

		String[] topics = topic.split(",\\s*");
		StringBuilder content = new StringBuilder();
		content.append(title(family, topic)).append("\n\n");
		for (String part : topics) {
			if (topics.length > 1) {
				content.append(heading(family, part)).append("\n");
			}
			int paragraphs = 1 + random.nextInt(3);
			for (int p = 0; p < paragraphs; p++) {
				content.append(paragraph(part, random)).append("\n\n");
			}
		}
		content.append(closing(family));
		return content.toString();
	}

	private static String title(FormatFamily family, String topic) {
		switch (family) {
			case EMAIL:
				return "Subject: " + topic;
			case PRESENTATION:
				return "Slide deck: " + topic;
			case SPREADSHEET:
				return "Worksheet: " + topic;
			case DIAGRAM:
				return "Diagram: " + topic;
			default:
				return topic;
		}
	}

	private static String heading(FormatFamily family, String topic) {
		return family == FormatFamily.PRESENTATION ? "Slide: " + topic : "## " + topic;
	}

	private static String closing(FormatFamily family) {
		return family == FormatFamily.EMAIL ? "Best regards,\nPlatform Team\n" : "End of document.\n";
	}

	private static String paragraph(String topic, Random random) {
		StringBuilder paragraph = new StringBuilder(String.format(OPENERS.get(random.nextInt(OPENERS.size())), topic));
		int sentences = 2 + random.nextInt(4);
		for (int s = 0; s < sentences; s++) {
			paragraph.append(' ').append(SENTENCES.get(random.nextInt(SENTENCES.size())));
		}
		return paragraph.toString();
	}

	private static long seedOf(Map<String, Object> context) {
		Object seed = context.get("unique_seed");
		return seed instanceof Number ? ((Number) seed).longValue() : 0L;
	}

}
