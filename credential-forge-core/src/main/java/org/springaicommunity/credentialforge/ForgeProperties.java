package org.springaicommunity.credentialforge;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Configuration properties for batch generation.
 *
 * <p>
 * Holds the defaults a {@link BatchConfiguration} starts from. Properties can be set
 * directly via setters or passed to {@link CredentialForgeBuilder} and
 * {@link ForgeArgumentParser}.
 *
 * <p>
 * The per-worker memory estimate is dominated by the content generation collaborator;
 * a loaded language model can take more than a gigabyte.
 */
public class ForgeProperties {

	/**
	 * Default per-worker memory estimate: 1.2 GiB.
	 */
	public static final long DEFAULT_PER_WORKER_MEMORY_BYTES = 1288490189L;

	/**
	 * Default upper bound on the worker count regardless of CPU count.
	 */
	public static final int DEFAULT_MAX_WORKERS = 64;

	/**
	 * Base directory for generated documents.
	 */
	private String outputDir = "./output";

	/**
	 * Number of completed jobs between progress log lines.
	 */
	private int batchSize = 10;

	/**
	 * Embedding strategy: "random" or a named embedding mode.
	 */
	private String embedStrategy = EmbeddingMode.RANDOM;

	/**
	 * Run jobs on a worker pool; false forces sequential execution.
	 */
	private boolean concurrent = true;

	/**
	 * Memory ceiling for the worker pool in bytes. Unset means CPU count alone decides.
	 */
	@Nullable
	private Long memoryLimitBytes;

	/**
	 * Static memory estimate for one worker in bytes.
	 */
	private long perWorkerMemoryBytes = DEFAULT_PER_WORKER_MEMORY_BYTES;

	/**
	 * Hard cap on the worker count.
	 */
	private int maxWorkers = DEFAULT_MAX_WORKERS;

	/**
	 * Number of distinct credential types requested per document.
	 */
	private int credentialsPerFile = 1;

	/**
	 * Maximum number of topics combined into one document.
	 */
	private int maxTopicsPerFile = 1;

	/**
	 * How formats, topics and credential types are spread over jobs.
	 */
	private SelectionPolicy selectionPolicy = SelectionPolicy.ROUND_ROBIN;

	/**
	 * Default content language.
	 */
	private String defaultLanguage = "en";

	/**
	 * Optional bound on each collaborator call.
	 */
	@Nullable
	private Duration jobTimeout;

	/**
	 * Delete previous output before generating.
	 */
	private boolean cleanOutput = false;

	/**
	 * Persist the batch report as JSON in the output directory.
	 */
	private boolean writeReport = true;

	/**
	 * Path of the regex database. Unset means the built-in database on the classpath.
	 */
	@Nullable
	private String regexDbPath;

	/**
	 * Enable verbose logging output.
	 */
	private boolean verbose = false;

	public String getOutputDir() {
		return outputDir;
	}

	public void setOutputDir(String outputDir) {
		this.outputDir = outputDir;
	}

	public int getBatchSize() {
		return batchSize;
	}

	public void setBatchSize(int batchSize) {
		this.batchSize = batchSize;
	}

	public String getEmbedStrategy() {
		return embedStrategy;
	}

	public void setEmbedStrategy(String embedStrategy) {
		this.embedStrategy = embedStrategy;
	}

	public boolean isConcurrent() {
		return concurrent;
	}

	public void setConcurrent(boolean concurrent) {
		this.concurrent = concurrent;
	}

	/**
	 * Returns the memory ceiling in bytes.
	 * @return the ceiling, or {@code null} when unset
	 */
	@Nullable
	public Long getMemoryLimitBytes() {
		return memoryLimitBytes;
	}

	/**
	 * Sets the memory ceiling for the worker pool.
	 * @param memoryLimitBytes ceiling in bytes, {@code null} to size by CPU count only
	 */
	public void setMemoryLimitBytes(@Nullable Long memoryLimitBytes) {
		this.memoryLimitBytes = memoryLimitBytes;
	}

	public long getPerWorkerMemoryBytes() {
		return perWorkerMemoryBytes;
	}

	public void setPerWorkerMemoryBytes(long perWorkerMemoryBytes) {
		this.perWorkerMemoryBytes = perWorkerMemoryBytes;
	}

	public int getMaxWorkers() {
		return maxWorkers;
	}

	public void setMaxWorkers(int maxWorkers) {
		this.maxWorkers = maxWorkers;
	}

	public int getCredentialsPerFile() {
		return credentialsPerFile;
	}

	public void setCredentialsPerFile(int credentialsPerFile) {
		this.credentialsPerFile = credentialsPerFile;
	}

	public int getMaxTopicsPerFile() {
		return maxTopicsPerFile;
	}

	public void setMaxTopicsPerFile(int maxTopicsPerFile) {
		this.maxTopicsPerFile = maxTopicsPerFile;
	}

	public SelectionPolicy getSelectionPolicy() {
		return selectionPolicy;
	}

	public void setSelectionPolicy(SelectionPolicy selectionPolicy) {
		this.selectionPolicy = selectionPolicy;
	}

	public String getDefaultLanguage() {
		return defaultLanguage;
	}

	public void setDefaultLanguage(String defaultLanguage) {
		this.defaultLanguage = defaultLanguage;
	}

	@Nullable
	public Duration getJobTimeout() {
		return jobTimeout;
	}

	/**
	 * Sets the optional per-call timeout applied to collaborator calls.
	 * @param jobTimeout timeout, {@code null} to wait indefinitely
	 */
	public void setJobTimeout(@Nullable Duration jobTimeout) {
		this.jobTimeout = jobTimeout;
	}

	public boolean isCleanOutput() {
		return cleanOutput;
	}

	public void setCleanOutput(boolean cleanOutput) {
		this.cleanOutput = cleanOutput;
	}

	public boolean isWriteReport() {
		return writeReport;
	}

	public void setWriteReport(boolean writeReport) {
		this.writeReport = writeReport;
	}

	@Nullable
	public String getRegexDbPath() {
		return regexDbPath;
	}

	public void setRegexDbPath(@Nullable String regexDbPath) {
		this.regexDbPath = regexDbPath;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

}
