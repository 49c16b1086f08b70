package org.springaicommunity.credentialforge;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable description of one batch of document generation.
 *
 * <p>
 * Instances are created through {@link #builder()} (or {@link #builder(ForgeProperties)}
 * to start from configured defaults) and checked with {@link #validated()} before a batch
 * is planned. The record is read-only after construction and is shared by all workers
 * without synchronization.
 *
 * @param outputDirectory root directory for generated documents
 * @param fileCount number of documents to generate; {@code null} means "not supplied"
 * and is rejected by {@link #validated()}
 * @param formats output formats, e.g. "eml", "xlsx"
 * @param credentialTypes credential types to embed, e.g. "aws_access_key"
 * @param topics topics for content generation; an entry may itself be a comma-joined
 * multi-topic string
 * @param embedStrategy "random" or a named {@link EmbeddingMode}
 * @param batchSize progress reporting granularity (jobs per logged batch)
 * @param concurrent false forces a single worker
 * @param memoryCeilingBytes memory budget for the worker pool, {@code null} when unset
 * @param perWorkerEstimateBytes static memory estimate for one worker
 * @param maxWorkers hard cap on the worker count
 * @param credentialsPerFile number of distinct credential types requested per document
 * @param maxTopicsPerFile upper bound of topics combined into one document
 * @param selectionPolicy how formats, topics and credential types are assigned to jobs
 * @param languages content languages handed to collaborators as context
 * @param jobTimeout optional bound on each collaborator call, {@code null} for none
 * @param batchStartTime fixed batch start (epoch millis) for deterministic replay,
 * {@code null} to capture the clock when the batch starts
 * @param cleanOutput delete the output directory contents before generating
 * @param writeReport persist the batch report next to the generated documents
 */
public record BatchConfiguration(Path outputDirectory, @Nullable Integer fileCount, List<String> formats,
		List<String> credentialTypes, List<String> topics, String embedStrategy, int batchSize, boolean concurrent,
		@Nullable Long memoryCeilingBytes, long perWorkerEstimateBytes, int maxWorkers, int credentialsPerFile,
		int maxTopicsPerFile, SelectionPolicy selectionPolicy, List<String> languages, @Nullable Duration jobTimeout,
		@Nullable Long batchStartTime, boolean cleanOutput, boolean writeReport) {

	public BatchConfiguration {
		formats = List.copyOf(formats);
		credentialTypes = List.copyOf(credentialTypes);
		topics = List.copyOf(topics);
		languages = List.copyOf(languages);
	}

	/**
	 * Returns the requested file count, treating an absent value as zero. Only meaningful
	 * after {@link #validated()}.
	 */
	public int requestedFiles() {
		return fileCount != null ? fileCount : 0;
	}

	/**
	 * Validate the configuration and return a normalized copy (trimmed, lower-cased
	 * formats, duplicates removed).
	 * @return normalized configuration
	 * @throws ConfigurationException if the configuration cannot be planned
	 */
	public BatchConfiguration validated() {
		List<String> errors = new ArrayList<>();

		if (fileCount == null) {
			errors.add("Number of files must be specified");
		}
		else if (fileCount < 0) {
			errors.add("Number of files must not be negative (got: " + fileCount + ")");
		}

		List<String> normalizedFormats = normalize(formats.stream().map(FormatCatalog::normalize).toList(), true);
		List<String> normalizedTypes = normalize(credentialTypes, false);
		List<String> normalizedTopics = normalize(topics, false);
		List<String> normalizedLanguages = normalize(languages, true);

		boolean hasWork = fileCount != null && fileCount > 0;
		if (hasWork) {
			if (normalizedFormats.isEmpty()) {
				errors.add("At least one format is required");
			}
			if (normalizedTypes.isEmpty()) {
				errors.add("At least one credential type is required");
			}
			if (normalizedTopics.isEmpty()) {
				errors.add("At least one topic is required");
			}
		}

		for (String format : normalizedFormats) {
			if (!FormatCatalog.isSupported(format)) {
				errors.add("Unsupported format: " + format);
			}
		}

		if (!EmbeddingMode.isKnownStrategy(embedStrategy)) {
			errors.add("Unknown embedding strategy: " + embedStrategy);
		}
		if (batchSize <= 0) {
			errors.add("Batch size must be positive (got: " + batchSize + ")");
		}
		if (memoryCeilingBytes != null && memoryCeilingBytes <= 0) {
			errors.add("Memory ceiling must be positive (got: " + memoryCeilingBytes + ")");
		}
		if (perWorkerEstimateBytes <= 0) {
			errors.add("Per-worker memory estimate must be positive (got: " + perWorkerEstimateBytes + ")");
		}
		if (maxWorkers <= 0) {
			errors.add("Maximum worker count must be positive (got: " + maxWorkers + ")");
		}
		if (credentialsPerFile <= 0) {
			errors.add("Credentials per file must be positive (got: " + credentialsPerFile + ")");
		}
		if (maxTopicsPerFile <= 0) {
			errors.add("Topics per file must be positive (got: " + maxTopicsPerFile + ")");
		}
		if (jobTimeout != null && (jobTimeout.isNegative() || jobTimeout.isZero())) {
			errors.add("Job timeout must be positive (got: " + jobTimeout + ")");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Batch configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new ConfigurationException(errorMsg.toString());
		}

		return toBuilder().formats(normalizedFormats)
			.credentialTypes(normalizedTypes)
			.topics(normalizedTopics)
			.languages(normalizedLanguages.isEmpty() ? List.of("en") : normalizedLanguages)
			.embedStrategy(embedStrategy.trim().toLowerCase(Locale.ROOT))
			.build();
	}

	private static List<String> normalize(List<String> values, boolean lowerCase) {
		Set<String> result = new LinkedHashSet<>();
		for (String value : values) {
			String trimmed = value.trim();
			if (trimmed.isEmpty()) {
				continue;
			}
			result.add(lowerCase ? trimmed.toLowerCase(Locale.ROOT) : trimmed);
		}
		return List.copyOf(result);
	}

	/**
	 * Create a builder initialised with the built-in defaults.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder(new ForgeProperties());
	}

	/**
	 * Create a builder initialised from configured defaults.
	 * @param properties default values
	 * @return new Builder instance
	 */
	public static Builder builder(ForgeProperties properties) {
		return new Builder(properties);
	}

	/**
	 * Create a builder pre-populated with this configuration's values.
	 * @return new Builder instance
	 */
	public Builder toBuilder() {
		Builder builder = new Builder(new ForgeProperties());
		builder.outputDirectory = outputDirectory;
		builder.fileCount = fileCount;
		builder.formats = formats;
		builder.credentialTypes = credentialTypes;
		builder.topics = topics;
		builder.embedStrategy = embedStrategy;
		builder.batchSize = batchSize;
		builder.concurrent = concurrent;
		builder.memoryCeilingBytes = memoryCeilingBytes;
		builder.perWorkerEstimateBytes = perWorkerEstimateBytes;
		builder.maxWorkers = maxWorkers;
		builder.credentialsPerFile = credentialsPerFile;
		builder.maxTopicsPerFile = maxTopicsPerFile;
		builder.selectionPolicy = selectionPolicy;
		builder.languages = languages;
		builder.jobTimeout = jobTimeout;
		builder.batchStartTime = batchStartTime;
		builder.cleanOutput = cleanOutput;
		builder.writeReport = writeReport;
		return builder;
	}

	/**
	 * Builder for {@link BatchConfiguration}.
	 */
	public static class Builder {

		private Path outputDirectory;

		@Nullable
		private Integer fileCount;

		private List<String> formats = List.of();

		private List<String> credentialTypes = List.of();

		private List<String> topics = List.of();

		private String embedStrategy;

		private int batchSize;

		private boolean concurrent;

		@Nullable
		private Long memoryCeilingBytes;

		private long perWorkerEstimateBytes;

		private int maxWorkers;

		private int credentialsPerFile;

		private int maxTopicsPerFile;

		private SelectionPolicy selectionPolicy;

		private List<String> languages;

		@Nullable
		private Duration jobTimeout;

		@Nullable
		private Long batchStartTime;

		private boolean cleanOutput;

		private boolean writeReport;

		private Builder(ForgeProperties defaults) {
			this.outputDirectory = Paths.get(defaults.getOutputDir());
			this.embedStrategy = defaults.getEmbedStrategy();
			this.batchSize = defaults.getBatchSize();
			this.concurrent = defaults.isConcurrent();
			this.memoryCeilingBytes = defaults.getMemoryLimitBytes();
			this.perWorkerEstimateBytes = defaults.getPerWorkerMemoryBytes();
			this.maxWorkers = defaults.getMaxWorkers();
			this.credentialsPerFile = defaults.getCredentialsPerFile();
			this.maxTopicsPerFile = defaults.getMaxTopicsPerFile();
			this.selectionPolicy = defaults.getSelectionPolicy();
			this.languages = List.of(defaults.getDefaultLanguage());
			this.jobTimeout = defaults.getJobTimeout();
			this.cleanOutput = defaults.isCleanOutput();
			this.writeReport = defaults.isWriteReport();
		}

		public Builder outputDirectory(Path outputDirectory) {
			this.outputDirectory = outputDirectory;
			return this;
		}

		public Builder fileCount(@Nullable Integer fileCount) {
			this.fileCount = fileCount;
			return this;
		}

		public Builder formats(List<String> formats) {
			this.formats = formats;
			return this;
		}

		public Builder formats(String... formats) {
			return formats(List.of(formats));
		}

		public Builder credentialTypes(List<String> credentialTypes) {
			this.credentialTypes = credentialTypes;
			return this;
		}

		public Builder credentialTypes(String... credentialTypes) {
			return credentialTypes(List.of(credentialTypes));
		}

		public Builder topics(List<String> topics) {
			this.topics = topics;
			return this;
		}

		public Builder topics(String... topics) {
			return topics(List.of(topics));
		}

		public Builder embedStrategy(String embedStrategy) {
			this.embedStrategy = embedStrategy;
			return this;
		}

		public Builder batchSize(int batchSize) {
			this.batchSize = batchSize;
			return this;
		}

		public Builder concurrent(boolean concurrent) {
			this.concurrent = concurrent;
			return this;
		}

		public Builder memoryCeilingBytes(@Nullable Long memoryCeilingBytes) {
			this.memoryCeilingBytes = memoryCeilingBytes;
			return this;
		}

		public Builder perWorkerEstimateBytes(long perWorkerEstimateBytes) {
			this.perWorkerEstimateBytes = perWorkerEstimateBytes;
			return this;
		}

		public Builder maxWorkers(int maxWorkers) {
			this.maxWorkers = maxWorkers;
			return this;
		}

		public Builder credentialsPerFile(int credentialsPerFile) {
			this.credentialsPerFile = credentialsPerFile;
			return this;
		}

		public Builder maxTopicsPerFile(int maxTopicsPerFile) {
			this.maxTopicsPerFile = maxTopicsPerFile;
			return this;
		}

		public Builder selectionPolicy(SelectionPolicy selectionPolicy) {
			this.selectionPolicy = selectionPolicy;
			return this;
		}

		public Builder languages(List<String> languages) {
			this.languages = languages;
			return this;
		}

		public Builder jobTimeout(@Nullable Duration jobTimeout) {
			this.jobTimeout = jobTimeout;
			return this;
		}

		public Builder batchStartTime(@Nullable Long batchStartTime) {
			this.batchStartTime = batchStartTime;
			return this;
		}

		public Builder cleanOutput(boolean cleanOutput) {
			this.cleanOutput = cleanOutput;
			return this;
		}

		public Builder writeReport(boolean writeReport) {
			this.writeReport = writeReport;
			return this;
		}

		public BatchConfiguration build() {
			return new BatchConfiguration(outputDirectory, fileCount, formats, credentialTypes, topics, embedStrategy,
					batchSize, concurrent, memoryCeilingBytes, perWorkerEstimateBytes, maxWorkers, credentialsPerFile,
					maxTopicsPerFile, selectionPolicy, languages, jobTimeout, batchStartTime, cleanOutput,
					writeReport);
		}

	}

}
