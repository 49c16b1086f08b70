package org.springaicommunity.credentialforge;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lightweight collaborator implementations shared by the pipeline tests.
 */
final class StubCollaborators {

	private StubCollaborators() {
	}

	/**
	 * Generator producing "type-index" values; types listed as failing always throw.
	 */
	static CredentialGenerator credentials(Set<String> knownTypes, Set<String> failingTypes) {
		return new CredentialGenerator() {
			@Override
			public String generateCredential(String type, Map<String, Object> context) {
				if (!knownTypes.contains(type)) {
					throw new UnknownCredentialTypeException(type);
				}
				if (failingTypes.contains(type)) {
					throw new CredentialGenerationException("Generator for " + type + " is broken");
				}
				return type + "-" + context.get("file_index");
			}

			@Override
			public Set<String> listCredentialTypes() {
				return new LinkedHashSet<>(knownTypes);
			}
		};
	}

	static CredentialGenerator credentials(String... knownTypes) {
		return credentials(new LinkedHashSet<>(List.of(knownTypes)), Set.of());
	}

	static ContentStrategy content(String name, String text) {
		return new ContentStrategy() {
			@Override
			public String name() {
				return name;
			}

			@Override
			public String generate(String topic, String format, Map<String, Object> context) {
				return text + " about " + topic;
			}
		};
	}

	/**
	 * Synthesizer writing one line per credential to the target path.
	 */
	static DocumentSynthesizer plainFiles() {
		return (format, content, credentials, embedding, targetPath) -> {
			try {
				Files.createDirectories(targetPath.getParent());
				StringBuilder text = new StringBuilder(content).append('\n');
				for (GeneratedCredential credential : credentials) {
					text.append(credential.type()).append('=').append(credential.value()).append('\n');
				}
				Files.writeString(targetPath, text.toString());
				return targetPath;
			}
			catch (IOException e) {
				throw new UncheckedIOException(e);
			}
		};
	}

	static JobExecutor executor(CredentialGenerator generator) {
		return new JobExecutor(generator, List.of(content("stub", "Body")), plainFiles(),
				new EmbeddingStrategyEngine(), CollaboratorCallGuard.builder().build(), "random", 0L);
	}

	static GenerationJob job(int index, Path outputDirectory) {
		return new GenerationJob(index, "eml", "topic " + index, List.of("api_key"), UniquenessSeeder.seed(index, 0L),
				"en", outputDirectory.resolve("eml").resolve(index + "-topic.eml"));
	}

}
