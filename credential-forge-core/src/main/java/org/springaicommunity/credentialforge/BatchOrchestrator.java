package org.springaicommunity.credentialforge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.IntSupplier;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Runs a batch end to end: validate, size the worker pool, plan, execute and report.
 *
 * <p>
 * Configuration and resource errors are raised before any worker starts. After that,
 * job-level problems never abort the batch; they surface as failures in the
 * {@link BatchReport}. Collaborators are supplied as factories so each worker owns its
 * own instances.
 *
 * <p>
 * Instances are created by {@link CredentialForgeBuilder}.
 */
public class BatchOrchestrator {

	private static final Logger logger = LoggerFactory.getLogger(BatchOrchestrator.class);

	private final Supplier<CredentialGenerator> credentialGeneratorFactory;

	private final Supplier<List<ContentStrategy>> contentStrategiesFactory;

	private final Supplier<DocumentSynthesizer> synthesizerFactory;

	private final EmbeddingStrategyEngine embeddingEngine;

	private final JobPlanner planner;

	private final ReportRepository reportRepository;

	private final IntSupplier cpuCount;

	private final LongSupplier clock;

	BatchOrchestrator(Supplier<CredentialGenerator> credentialGeneratorFactory,
			Supplier<List<ContentStrategy>> contentStrategiesFactory, Supplier<DocumentSynthesizer> synthesizerFactory,
			EmbeddingStrategyEngine embeddingEngine, JobPlanner planner, ReportRepository reportRepository,
			IntSupplier cpuCount, LongSupplier clock) {
		this.credentialGeneratorFactory = credentialGeneratorFactory;
		this.contentStrategiesFactory = contentStrategiesFactory;
		this.synthesizerFactory = synthesizerFactory;
		this.embeddingEngine = embeddingEngine;
		this.planner = planner;
		this.reportRepository = reportRepository;
		this.cpuCount = cpuCount;
		this.clock = clock;
	}

	/**
	 * Run a batch to completion.
	 * @param config batch configuration
	 * @return the batch report
	 * @throws ConfigurationException if the configuration is invalid
	 * @throws ResourceExhaustionException if the memory ceiling cannot fund one worker
	 */
	public BatchReport run(BatchConfiguration config) {
		return run(config, new CancellationToken());
	}

	/**
	 * Run a batch that can be cancelled through the given token.
	 * @param config batch configuration
	 * @param token cancellation signal; cancelling stops dispatch of further jobs
	 * @return the batch report, marked cancelled if the token fired before all jobs were
	 * dispatched; returned even when persisting the report file fails
	 * @throws ConfigurationException if the configuration is invalid
	 * @throws ResourceExhaustionException if the memory ceiling cannot fund one worker
	 */
	public BatchReport run(BatchConfiguration config, CancellationToken token) {
		BatchConfiguration validated = config.validated();
		validateCredentialTypes(validated);

		ResourceBudgeter budgeter = new ResourceBudgeter(validated.maxWorkers());
		int budgeted = budgeter.workerCount(validated.memoryCeilingBytes(), validated.perWorkerEstimateBytes(),
				cpuCount.getAsInt());
		int workers = validated.concurrent() ? budgeted : 1;

		long batchStartTime = validated.batchStartTime() != null ? validated.batchStartTime() : clock.getAsLong();

		if (validated.cleanOutput()) {
			reportRepository.cleanOutputDirectory(validated.outputDirectory());
		}
		else {
			reportRepository.prepareOutputDirectory(validated.outputDirectory());
		}

		List<GenerationJob> jobs = planner.plan(validated, batchStartTime);
		int poolSize = Math.max(1, Math.min(workers, jobs.size()));
		logger.info("Starting batch of {} files with {} workers (budget {}, concurrent={})", jobs.size(), poolSize,
				budgeted, validated.concurrent());

		ResultAggregator aggregator = new ResultAggregator();
		long started = System.nanoTime();
		List<Integer> undispatched = List.of();
		if (!jobs.isEmpty()) {
			WorkerPool pool = new WorkerPool(poolSize, () -> newExecutor(validated, batchStartTime));
			undispatched = pool.run(jobs, aggregator, token, progressLogger(jobs.size(), validated.batchSize()));
		}
		Duration duration = Duration.ofNanos(System.nanoTime() - started);

		boolean cancelled = token.isCancelled() && !undispatched.isEmpty();
		BatchReport report = aggregator.snapshot(duration, jobs.size(), poolSize, batchStartTime, cancelled,
				undispatched);

		logResults(report);
		if (validated.writeReport()) {
			saveReport(validated.outputDirectory(), report);
		}
		return report;
	}

	private void saveReport(Path outputDirectory, BatchReport report) {
		// the report is returned even when the file cannot be written
		try {
			reportRepository.saveReport(outputDirectory, report);
		}
		catch (CredentialForgeException e) {
			logger.error("Failed to persist batch report in {}: {}", outputDirectory, e.getMessage(), e);
		}
	}

	private void validateCredentialTypes(BatchConfiguration config) {
		if (config.requestedFiles() == 0) {
			return;
		}
		Set<String> known = credentialGeneratorFactory.get().listCredentialTypes();
		List<String> unknown = new ArrayList<>();
		for (String type : config.credentialTypes()) {
			if (!known.contains(type)) {
				unknown.add(type);
			}
		}
		if (!unknown.isEmpty()) {
			throw new ConfigurationException(
					"Unknown credential types: " + String.join(", ", unknown) + " (known: " + known.size() + " types)");
		}
	}

	private JobExecutor newExecutor(BatchConfiguration config, long batchStartTime) {
		CollaboratorCallGuard guard = CollaboratorCallGuard.builder().timeout(config.jobTimeout()).build();
		return new JobExecutor(credentialGeneratorFactory.get(), contentStrategiesFactory.get(),
				synthesizerFactory.get(), embeddingEngine, guard, config.embedStrategy(), batchStartTime);
	}

	private Consumer<GenerationResult> progressLogger(int total, int batchSize) {
		AtomicInteger completed = new AtomicInteger();
		return result -> {
			int done = completed.incrementAndGet();
			if (done % batchSize == 0 || done == total) {
				logger.info("Progress: {}/{} files processed", done, total);
			}
			if (!result.succeeded()) {
				GenerationResult.Failure failure = (GenerationResult.Failure) result;
				logger.warn("Job {} failed at {} ({}): {}", failure.jobIndex(), failure.stage(), failure.errorKind(),
						failure.message());
			}
		};
	}

	private void logResults(BatchReport report) {
		logger.info("Batch finished in {}ms: {} files, {} credentials, {} failures{}", report.duration().toMillis(),
				report.totalFiles(), report.totalCredentials(), report.failures().size(),
				report.cancelled() ? " (cancelled, " + report.undispatchedJobs().size() + " jobs not started)" : "");
		if (!report.filesByFormat().isEmpty()) {
			logger.info("Files by format: {}", report.filesByFormat());
			logger.info("Credentials by type: {}", report.credentialsByType());
		}
	}

}
