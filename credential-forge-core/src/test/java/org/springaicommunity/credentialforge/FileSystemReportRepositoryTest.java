package org.springaicommunity.credentialforge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link FileSystemReportRepository}.
 *
 * Tests directory preparation, cleaning and report persistence.
 */
@DisplayName("FileSystemReportRepository Tests")
class FileSystemReportRepositoryTest {

	@TempDir
	Path tempDir;

	private ObjectMapper objectMapper;

	private FileSystemReportRepository repository;

	@BeforeEach
	void setUp() {
		objectMapper = ObjectMapperFactory.create();
		repository = new FileSystemReportRepository(objectMapper);
	}

	@Nested
	@DisplayName("Directory Tests")
	class DirectoryTest {

		@Test
		@DisplayName("Should create nested output directories")
		void shouldPrepareOutputDirectory() {
			Path outputDir = tempDir.resolve("a").resolve("b");

			assertThat(repository.prepareOutputDirectory(outputDir)).isEqualTo(outputDir).isDirectory();
		}

		@Test
		@DisplayName("Should fail with a configuration error when the directory cannot be created")
		void shouldFailWhenDirectoryBlocked() throws IOException {
			Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");

			assertThatThrownBy(() -> repository.prepareOutputDirectory(blocker.resolve("out")))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("Failed to create output directory")
				.hasCauseInstanceOf(IOException.class);
		}

		@Test
		@DisplayName("Should empty an existing directory and keep it")
		void shouldCleanOutputDirectory() throws IOException {
			Path outputDir = tempDir.resolve("out");
			Files.createDirectories(outputDir.resolve("eml"));
			Files.writeString(outputDir.resolve("eml").resolve("0-old.eml"), "old");
			Files.writeString(outputDir.resolve("generation_report.json"), "{}");

			repository.cleanOutputDirectory(outputDir);

			assertThat(outputDir).isDirectory().isEmptyDirectory();
		}

		@Test
		@DisplayName("Should create the directory when cleaning a missing one")
		void shouldCreateMissingDirectoryOnClean() {
			Path outputDir = tempDir.resolve("missing");

			repository.cleanOutputDirectory(outputDir);

			assertThat(outputDir).isDirectory();
		}

	}

	@Test
	@DisplayName("Should save the report as snake_case JSON")
	void shouldSaveReport() throws IOException {
		EmbeddingDecision decision = new EmbeddingDecision(EmbeddingMode.METADATA_FIELD, "inline-body", true,
				"Format 'xlsx' (SPREADSHEET) does not support inline-body; using metadata-field", 1, Map.of());
		GenerationResult.Success success = new GenerationResult.Success(0, "out/xlsx/0-budget.xlsx", "xlsx",
				"budget", List.of("api_key"), 1, decision, "template", List.of());
		GenerationResult.Failure failure = new GenerationResult.Failure(1, JobStage.SYNTHESIS, ErrorKind.SYNTHESIS,
				"disk full");
		BatchReport report = new BatchReport(List.of(success), List.of(failure), 1, 1, Map.of("xlsx", 1),
				Map.of("api_key", 1), Duration.ofMillis(1500), 2, 2, 1_700_000_000_000L, false, List.of());

		Path saved = repository.saveReport(tempDir.resolve("out"), report);

		assertThat(saved.getFileName().toString()).isEqualTo(ReportRepository.REPORT_FILE_NAME);
		JsonNode json = objectMapper.readTree(saved.toFile());
		assertThat(json.get("total_files").asInt()).isEqualTo(1);
		assertThat(json.get("requested_files").asInt()).isEqualTo(2);
		assertThat(json.get("duration").asText()).isEqualTo("PT1.5S");
		JsonNode embedding = json.get("successes").get(0).get("embedding");
		assertThat(embedding.get("mode").asText()).isEqualTo("METADATA_FIELD");
		assertThat(embedding.get("fallback_applied").asBoolean()).isTrue();
		assertThat(json.get("failures").get(0).get("error_kind").asText()).isEqualTo("SYNTHESIS");
	}

}
