package org.springaicommunity.credentialforge;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Output
	public String outputDir;

	public boolean clean;

	public boolean writeReport;

	// What to generate
	@Nullable
	public Integer numFiles; // required unless listing or help

	public List<String> formats = new ArrayList<>();

	public List<String> credentialTypes = new ArrayList<>();

	public List<String> topics = new ArrayList<>();

	public List<String> languages = new ArrayList<>();

	public String embedStrategy;

	public int credentialsPerFile;

	public int topicsPerFile;

	public SelectionPolicy selectionPolicy;

	@Nullable
	public String regexDb;

	// Execution
	public int batchSize;

	public boolean concurrent;

	@Nullable
	public Long memoryLimitBytes;

	public long perWorkerMemoryBytes;

	public int maxWorkers;

	@Nullable
	public Duration jobTimeout;

	@Nullable
	public Long seed; // fixed batch start time for replay

	// Regex database authoring
	@Nullable
	public String addType;

	@Nullable
	public String addRegex;

	@Nullable
	public String addDescription;

	@Nullable
	public String addGenerator;

	// Modes
	public boolean verbose;

	public boolean helpRequested = false;

	public boolean listCredentialTypes = false;

	public boolean listFormats = false;

	public ParsedConfiguration(ForgeProperties defaultProperties) {
		this.outputDir = defaultProperties.getOutputDir();
		this.clean = defaultProperties.isCleanOutput();
		this.writeReport = defaultProperties.isWriteReport();
		this.languages.add(defaultProperties.getDefaultLanguage());
		this.embedStrategy = defaultProperties.getEmbedStrategy();
		this.credentialsPerFile = defaultProperties.getCredentialsPerFile();
		this.topicsPerFile = defaultProperties.getMaxTopicsPerFile();
		this.selectionPolicy = defaultProperties.getSelectionPolicy();
		this.regexDb = defaultProperties.getRegexDbPath();
		this.batchSize = defaultProperties.getBatchSize();
		this.concurrent = defaultProperties.isConcurrent();
		this.memoryLimitBytes = defaultProperties.getMemoryLimitBytes();
		this.perWorkerMemoryBytes = defaultProperties.getPerWorkerMemoryBytes();
		this.maxWorkers = defaultProperties.getMaxWorkers();
		this.jobTimeout = defaultProperties.getJobTimeout();
		this.verbose = defaultProperties.isVerbose();
	}

	/**
	 * Returns true if the arguments ask for information only and no batch should run.
	 */
	public boolean isInformationOnly() {
		return helpRequested || listCredentialTypes || listFormats;
	}

	/**
	 * Returns true if the arguments add a credential type to a regex database instead of
	 * running a batch.
	 */
	public boolean isDatabaseUpdate() {
		return addType != null;
	}

	/**
	 * Convert to a batch configuration.
	 * @return the batch configuration, not yet validated
	 */
	public BatchConfiguration toBatchConfiguration() {
		return BatchConfiguration.builder()
			.outputDirectory(Path.of(outputDir))
			.fileCount(numFiles)
			.formats(formats)
			.credentialTypes(credentialTypes)
			.topics(topics)
			.languages(languages)
			.embedStrategy(embedStrategy)
			.credentialsPerFile(credentialsPerFile)
			.maxTopicsPerFile(topicsPerFile)
			.selectionPolicy(selectionPolicy)
			.batchSize(batchSize)
			.concurrent(concurrent)
			.memoryCeilingBytes(memoryLimitBytes)
			.perWorkerEstimateBytes(perWorkerMemoryBytes)
			.maxWorkers(maxWorkers)
			.jobTimeout(jobTimeout)
			.batchStartTime(seed)
			.cleanOutput(clean)
			.writeReport(writeReport)
			.build();
	}

}
