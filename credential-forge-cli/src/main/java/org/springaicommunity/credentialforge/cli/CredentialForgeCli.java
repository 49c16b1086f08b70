package org.springaicommunity.credentialforge.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.credentialforge.*;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Credential Forge CLI Application
 *
 * Plain Java command-line application generating synthetic documents that carry fake
 * credentials. No Spring dependencies - uses CredentialForgeBuilder for wiring.
 *
 * Usage: java -jar credential-forge-cli.jar [OPTIONS]
 *
 * Exit status: 0 when every document was generated, 2 when any job failed or the batch
 * was interrupted, 1 when the batch could not start.
 */
public class CredentialForgeCli {

	private static final Logger logger = LoggerFactory.getLogger(CredentialForgeCli.class);

	// time an interrupted batch gets to finish in-flight jobs and write its report
	private static final long SHUTDOWN_GRACE_SECONDS = 30;

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Generation failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	public static int run(String[] args) {
		ForgeProperties properties = EnvironmentSupport.applyTo(new ForgeProperties());
		ForgeArgumentParser argumentParser = new ForgeArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);

		if (config.listFormats) {
			printFormats();
			return 0;
		}

		if (config.listCredentialTypes) {
			printCredentialTypes(config);
			return 0;
		}

		if (config.isDatabaseUpdate()) {
			addCredentialType(config);
			return 0;
		}

		BatchOrchestrator orchestrator = CredentialForgeBuilder.create()
			.properties(properties)
			.regexDatabase(config.regexDb != null ? Path.of(config.regexDb) : null)
			.build();

		logConfiguration(config);

		CancellationToken token = new CancellationToken();
		CountDownLatch finished = new CountDownLatch(1);
		Thread shutdownHook = new Thread(() -> {
			if (token.cancel()) {
				logger.warn("Interrupted: finishing in-flight documents, no new documents will be started");
			}
			try {
				finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}, "credential-forge-shutdown");
		Runtime.getRuntime().addShutdownHook(shutdownHook);

		BatchReport report;
		try {
			report = orchestrator.run(config.toBatchConfiguration(), token);
		}
		finally {
			finished.countDown();
			removeShutdownHook(shutdownHook);
		}

		logResults(report, config.verbose);
		return report.exitStatus();
	}

	private static void removeShutdownHook(Thread hook) {
		try {
			Runtime.getRuntime().removeShutdownHook(hook);
		}
		catch (IllegalStateException e) {
			logger.debug("JVM already shutting down; shutdown hook stays registered");
		}
	}

	private static void printFormats() {
		for (String format : FormatCatalog.supportedFormats()) {
			FormatFamily family = FormatCatalog.familyOf(format);
			StringBuilder line = new StringBuilder(String.format("%-6s %-13s", format, family));
			for (EmbeddingMode mode : family.supportedModes()) {
				line.append(' ').append(mode.id());
			}
			System.out.println(line);
		}
	}

	private static void printCredentialTypes(ParsedConfiguration config) {
		RegexCredentialDatabase database;
		if (config.regexDb != null) {
			database = RegexCredentialDatabase.load(Path.of(config.regexDb), ObjectMapperFactory.create());
		}
		else {
			database = RegexCredentialDatabase.loadDefault(ObjectMapperFactory.create());
		}
		for (String type : database.types()) {
			CredentialPattern pattern = database.find(type).orElseThrow();
			System.out.printf("%-20s %s%n", type, pattern.description());
		}
	}

	private static void addCredentialType(ParsedConfiguration config) {
		ObjectMapper objectMapper = ObjectMapperFactory.create();
		Path databaseFile = Path.of(config.regexDb);
		CredentialPattern pattern = new CredentialPattern(config.addType, config.addRegex, config.addDescription,
				config.addGenerator, List.of());
		RegexCredentialDatabase.loadOrEmpty(databaseFile, objectMapper).with(pattern).save(databaseFile, objectMapper);
		logger.info("Added credential type '{}' to {}", config.addType, databaseFile);
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Output directory: {}", config.outputDir);
		logger.info("  Files: {}", config.numFiles);
		logger.info("  Formats: {}", config.formats);
		logger.info("  Credential types: {}", config.credentialTypes);
		logger.info("  Topics: {}", config.topics);
		logger.info("  Languages: {}", config.languages);
		logger.info("  Embed strategy: {}", config.embedStrategy);
		logger.info("  Credentials per file: {}", config.credentialsPerFile);
		logger.info("  Topics per file: {}", config.topicsPerFile);
		logger.info("  Selection: {}", config.selectionPolicy.id());
		logger.info("  Regex database: {}", config.regexDb != null ? config.regexDb : "(built-in)");
		logger.info("  Concurrent: {}", config.concurrent);
		logger.info("  Memory limit: {}",
				config.memoryLimitBytes != null ? (config.memoryLimitBytes / (1024 * 1024)) + "MB" : "(not set)");
		logger.info("  Timeout: {}", config.jobTimeout != null ? config.jobTimeout : "(none)");
		logger.info("  Seed: {}", config.seed != null ? config.seed : "(current time)");
		logger.info("  Clean: {}", config.clean);
	}

	private static void logResults(BatchReport report, boolean verbose) {
		if (report.allSucceeded()) {
			logger.info("Generation completed successfully!");
		}
		else if (report.cancelled()) {
			logger.warn("Generation interrupted: {} jobs were not started", report.undispatchedJobs().size());
		}
		else {
			logger.warn("Generation completed with {} failures", report.failures().size());
		}
		logger.info("Files generated: {}/{}", report.totalFiles(), report.requestedFiles());
		logger.info("Credentials embedded: {}", report.totalCredentials());
		logger.info("Workers: {}", report.workerCount());
		logger.info("Batch start time: {}", report.batchStartTime());

		if (verbose) {
			for (GenerationResult.Success success : report.successesInJobOrder()) {
				logger.info("  - {} [{}{}] {}", success.path(), success.embedding().mode().id(),
						success.embedding().fallbackApplied() ? ", fallback" : "", success.credentialTypes());
			}
		}
		for (GenerationResult.Failure failure : report.failures()) {
			logger.warn("  FAILED job {} at {} ({}): {}", failure.jobIndex(), failure.stage(), failure.errorKind(),
					failure.message());
		}
	}

}
