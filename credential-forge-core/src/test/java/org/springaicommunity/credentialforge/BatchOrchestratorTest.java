package org.springaicommunity.credentialforge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for {@link BatchOrchestrator} with the built-in collaborators and with
 * stubs for failure scenarios.
 */
@DisplayName("BatchOrchestrator Tests")
class BatchOrchestratorTest {

	private static final long START = 1_700_000_000_000L;

	private static final long MB = 1024L * 1024;

	@TempDir
	Path tempDir;

	private BatchOrchestrator defaultOrchestrator() {
		return CredentialForgeBuilder.create().cpuCount(() -> 16).clock(() -> START).build();
	}

	private BatchConfiguration.Builder config(Path outputDir, int files) {
		return BatchConfiguration.builder()
			.outputDirectory(outputDir)
			.fileCount(files)
			.formats("eml")
			.credentialTypes("aws_access_key", "github_token")
			.topics("cloud migration")
			.credentialsPerFile(2)
			.memoryCeilingBytes(2048 * MB)
			.perWorkerEstimateBytes(500 * MB);
	}

	@Nested
	@DisplayName("Successful Batch Tests")
	class SuccessfulBatchTest {

		@Test
		@DisplayName("Should generate every requested document within the memory budget")
		void shouldGenerateBatch() throws IOException {
			Path outputDir = tempDir.resolve("out");

			BatchReport report = defaultOrchestrator().run(config(outputDir, 5).build());

			assertThat(report.successes()).hasSize(5);
			assertThat(report.failures()).isEmpty();
			assertThat(report.totalFiles()).isEqualTo(5);
			assertThat(report.totalCredentials()).isEqualTo(10);
			assertThat(report.workerCount()).isLessThanOrEqualTo(4);
			assertThat(report.filesByFormat()).containsExactly(entry("eml", 5));
			assertThat(report.credentialsByType()).containsEntry("aws_access_key", 5)
				.containsEntry("github_token", 5);
			assertThat(report.batchStartTime()).isEqualTo(START);
			assertThat(report.exitStatus()).isZero();
			assertThat(report.successes()).extracting(GenerationResult.Success::path).doesNotHaveDuplicates();

			for (GenerationResult.Success success : report.successes()) {
				Path document = Path.of(success.path());
				assertThat(document).exists().hasParent(outputDir.resolve("eml"));
				assertThat(document.getFileName().toString()).endsWith(".eml");
			}
		}

		@Test
		@DisplayName("Should write a JSON report next to the documents")
		void shouldWriteReport() throws IOException {
			Path outputDir = tempDir.resolve("out");

			defaultOrchestrator().run(config(outputDir, 3).build());

			Path reportFile = outputDir.resolve(ReportRepository.REPORT_FILE_NAME);
			assertThat(reportFile).exists();
			JsonNode json = new ObjectMapper().readTree(reportFile.toFile());
			assertThat(json.get("total_files").asInt()).isEqualTo(3);
			assertThat(json.get("successes")).hasSize(3);
			assertThat(json.get("files_by_format").get("eml").asInt()).isEqualTo(3);
		}

		@Test
		@DisplayName("Should not write a report when disabled")
		void shouldSkipReport() {
			Path outputDir = tempDir.resolve("out");

			defaultOrchestrator().run(config(outputDir, 1).writeReport(false).build());

			assertThat(outputDir.resolve(ReportRepository.REPORT_FILE_NAME)).doesNotExist();
		}

		@Test
		@DisplayName("Should produce identical documents sequentially and concurrently")
		void shouldMatchSequentialAndConcurrentRuns() throws IOException {
			Path sequentialDir = tempDir.resolve("sequential");
			Path concurrentDir = tempDir.resolve("concurrent");

			BatchReport sequential = defaultOrchestrator()
				.run(config(sequentialDir, 8).formats("eml", "pdf", "docx").concurrent(false).batchStartTime(START)
					.build());
			BatchReport concurrent = defaultOrchestrator()
				.run(config(concurrentDir, 8).formats("eml", "pdf", "docx").concurrent(true).batchStartTime(START)
					.build());

			assertThat(sequential.workerCount()).isEqualTo(1);
			assertThat(concurrent.workerCount()).isGreaterThan(1);
			assertThat(documents(concurrentDir)).isEqualTo(documents(sequentialDir));
		}

		@Test
		@DisplayName("Should treat zero files as a successful empty batch")
		void shouldHandleEmptyBatch() {
			Path outputDir = tempDir.resolve("out");

			BatchReport report = defaultOrchestrator()
				.run(BatchConfiguration.builder().outputDirectory(outputDir).fileCount(0).build());

			assertThat(report.successes()).isEmpty();
			assertThat(report.failures()).isEmpty();
			assertThat(report.exitStatus()).isZero();
		}

		@Test
		@DisplayName("Should clean the output directory when requested")
		void shouldCleanOutputDirectory() throws IOException {
			Path outputDir = tempDir.resolve("out");
			Files.createDirectories(outputDir);
			Path stale = Files.writeString(outputDir.resolve("stale.txt"), "old");

			defaultOrchestrator().run(config(outputDir, 1).cleanOutput(true).build());

			assertThat(stale).doesNotExist();
		}

		private Map<String, String> documents(Path root) throws IOException {
			Map<String, String> documents = new TreeMap<>();
			try (Stream<Path> files = Files.walk(root)) {
				for (Path file : files.filter(Files::isRegularFile).toList()) {
					if (!file.getFileName().toString().equals(ReportRepository.REPORT_FILE_NAME)) {
						documents.put(root.relativize(file).toString(), Files.readString(file));
					}
				}
			}
			return documents;
		}

	}

	@Nested
	@DisplayName("Failure Handling Tests")
	class FailureHandlingTest {

		@Test
		@DisplayName("Should isolate job failures and keep successful documents")
		void shouldIsolateFailures() {
			Path outputDir = tempDir.resolve("out");
			Set<String> known = new LinkedHashSet<>(List.of("aws_access_key", "broken_type"));
			BatchOrchestrator orchestrator = CredentialForgeBuilder.create()
				.cpuCount(() -> 4)
				.clock(() -> START)
				.credentialGenerator(() -> StubCollaborators.credentials(known, Set.of("broken_type")))
				.synthesizer(StubCollaborators::plainFiles)
				.build();

			BatchReport report = orchestrator.run(config(outputDir, 6).credentialTypes("aws_access_key", "broken_type")
				.credentialsPerFile(1)
				.build());

			assertThat(report.completedJobs()).isEqualTo(6);
			assertThat(report.successes()).hasSize(3);
			assertThat(report.failures()).hasSize(3)
				.allMatch(failure -> failure.errorKind() == ErrorKind.CREDENTIAL_GENERATION)
				.allMatch(failure -> failure.stage() == JobStage.CREDENTIALS);
			assertThat(report.exitStatus()).isEqualTo(2);
			assertThat(report.successes()).allMatch(success -> Files.exists(Path.of(success.path())));
		}

		@Test
		@DisplayName("Should record embedding fallbacks on each document")
		void shouldRecordFallbacks() {
			BatchReport report = defaultOrchestrator()
				.run(config(tempDir.resolve("out"), 2).formats("xlsx").embedStrategy("inline-body").build());

			assertThat(report.successes()).hasSize(2).allSatisfy(success -> {
				assertThat(success.embedding().fallbackApplied()).isTrue();
				assertThat(success.embedding().requestedStrategy()).isEqualTo("inline-body");
				assertThat(success.embedding().fallbackReason()).contains("xlsx");
			});
		}

		@Test
		@DisplayName("Should fail before any work when memory cannot fund one worker")
		void shouldFailOnResourceExhaustion() {
			Path outputDir = tempDir.resolve("out");

			assertThatThrownBy(
					() -> defaultOrchestrator().run(config(outputDir, 5).memoryCeilingBytes(100 * MB).build()))
				.isInstanceOf(ResourceExhaustionException.class);

			assertThat(outputDir).doesNotExist();
		}

		@Test
		@DisplayName("Should check the memory budget in sequential mode too")
		void shouldCheckBudgetWhenSequential() {
			assertThatThrownBy(() -> defaultOrchestrator()
				.run(config(tempDir.resolve("out"), 5).memoryCeilingBytes(100 * MB).concurrent(false).build()))
				.isInstanceOf(ResourceExhaustionException.class);
		}

		@Test
		@DisplayName("Should reject unknown credential types before any work")
		void shouldRejectUnknownCredentialTypes() {
			Path outputDir = tempDir.resolve("out");

			assertThatThrownBy(
					() -> defaultOrchestrator().run(config(outputDir, 2).credentialTypes("no_such_token").build()))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("no_such_token");

			assertThat(outputDir).doesNotExist();
		}

		@Test
		@DisplayName("Should reject a missing file count")
		void shouldRejectMissingFileCount() {
			assertThatThrownBy(() -> defaultOrchestrator().run(config(tempDir, 1).fileCount(null).build()))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("Number of files must be specified");
		}

		@Test
		@DisplayName("Should still return the report when it cannot be persisted")
		void shouldReturnReportWhenSaveFails() {
			Path outputDir = tempDir.resolve("out");
			ReportRepository failingSave = new ReportRepository() {
				@Override
				public Path prepareOutputDirectory(Path dir) {
					try {
						return Files.createDirectories(dir);
					}
					catch (IOException e) {
						throw new ConfigurationException("cannot create " + dir, e);
					}
				}

				@Override
				public void cleanOutputDirectory(Path dir) {
					prepareOutputDirectory(dir);
				}

				@Override
				public Path saveReport(Path dir, BatchReport report) {
					throw new CredentialForgeException("disk full");
				}
			};
			BatchOrchestrator orchestrator = CredentialForgeBuilder.create()
				.cpuCount(() -> 4)
				.clock(() -> START)
				.reportRepository(failingSave)
				.build();

			BatchReport report = orchestrator.run(config(outputDir, 3).concurrent(false).build());

			assertThat(report.completedJobs()).isEqualTo(3);
			assertThat(report.successes()).hasSize(3);
			assertThat(report.exitStatus()).isZero();
			assertThat(outputDir.resolve(ReportRepository.REPORT_FILE_NAME)).doesNotExist();
		}

		@Test
		@DisplayName("Should report undispatched jobs when cancelled")
		void shouldReportCancellation() {
			CancellationToken token = new CancellationToken();
			token.cancel();

			BatchReport report = defaultOrchestrator().run(config(tempDir.resolve("out"), 4).build(), token);

			assertThat(report.cancelled()).isTrue();
			assertThat(report.completedJobs()).isZero();
			assertThat(report.undispatchedJobs()).containsExactly(0, 1, 2, 3);
			assertThat(report.exitStatus()).isEqualTo(2);
		}

	}

}
