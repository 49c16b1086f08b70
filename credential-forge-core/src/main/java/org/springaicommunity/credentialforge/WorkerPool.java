package org.springaicommunity.credentialforge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Fixed-size pool of workers draining one shared FIFO queue of jobs.
 *
 * <p>
 * Each worker creates its own {@link JobExecutor} from the factory when it starts and
 * closes it when the queue is empty. A worker checks the {@link CancellationToken} before
 * taking each job, so cancellation stops dispatch while jobs already taken run to
 * completion. A pool of one worker runs the batch sequentially through the same path.
 */
public class WorkerPool {

	private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

	private final int workerCount;

	private final Supplier<JobExecutor> executorFactory;

	public WorkerPool(int workerCount, Supplier<JobExecutor> executorFactory) {
		if (workerCount < 1) {
			throw new IllegalArgumentException("workerCount must be at least 1, got: " + workerCount);
		}
		this.workerCount = workerCount;
		this.executorFactory = executorFactory;
	}

	/**
	 * Run all jobs and block until every worker has finished.
	 * @param jobs jobs in dispatch order
	 * @param aggregator receives every result
	 * @param token cancellation signal
	 * @param listener notified after each result is aggregated
	 * @return indices of jobs left undispatched because of cancellation, in job order
	 */
	public List<Integer> run(List<GenerationJob> jobs, ResultAggregator aggregator, CancellationToken token,
			Consumer<GenerationResult> listener) {
		BlockingQueue<GenerationJob> queue = new LinkedBlockingQueue<>(jobs);
		ExecutorService pool = Executors.newFixedThreadPool(workerCount, workerThreads());

		List<Future<?>> workers = new ArrayList<>();
		for (int i = 0; i < workerCount; i++) {
			workers.add(pool.submit(() -> drain(queue, aggregator, token, listener)));
		}
		pool.shutdown();

		awaitWorkers(pool, workers, token);

		List<GenerationJob> remaining = new ArrayList<>();
		queue.drainTo(remaining);
		if (remaining.isEmpty()) {
			return List.of();
		}

		if (token.isCancelled()) {
			logger.info("Cancelled with {} jobs undispatched", remaining.size());
			return remaining.stream().map(GenerationJob::jobIndex).sorted().toList();
		}

		// every worker died before the queue was empty
		for (GenerationJob job : remaining) {
			GenerationResult.Failure failure = new GenerationResult.Failure(job.jobIndex(), JobStage.CONTENT,
					ErrorKind.UNEXPECTED, "No worker available to run the job");
			aggregator.accept(failure);
			listener.accept(failure);
		}
		return List.of();
	}

	public int getWorkerCount() {
		return workerCount;
	}

	private void drain(BlockingQueue<GenerationJob> queue, ResultAggregator aggregator, CancellationToken token,
			Consumer<GenerationResult> listener) {
		try (JobExecutor executor = executorFactory.get()) {
			while (!token.isCancelled()) {
				GenerationJob job = queue.poll();
				if (job == null) {
					return;
				}
				GenerationResult result;
				try {
					result = executor.execute(job);
				}
				catch (Error e) {
					// the worker dies with the error; the job it held still gets a result
					logger.error("Worker {} died running job {}", Thread.currentThread().getName(), job.jobIndex(), e);
					GenerationResult.Failure failure = new GenerationResult.Failure(job.jobIndex(), JobStage.CONTENT,
							ErrorKind.UNEXPECTED, "Worker died: " + e);
					aggregator.accept(failure);
					listener.accept(failure);
					throw e;
				}
				aggregator.accept(result);
				listener.accept(result);
			}
		}
	}

	private void awaitWorkers(ExecutorService pool, List<Future<?>> workers, CancellationToken token) {
		boolean interrupted = false;
		while (!pool.isTerminated()) {
			try {
				if (!pool.awaitTermination(1, TimeUnit.SECONDS)) {
					logger.trace("Waiting for workers to finish");
				}
			}
			catch (InterruptedException e) {
				if (!interrupted) {
					logger.warn("Interrupted while waiting for workers, cancelling batch after in-flight jobs");
					token.cancel();
				}
				interrupted = true;
			}
		}

		// all workers have terminated, so get() returns without blocking
		for (Future<?> worker : workers) {
			try {
				worker.get();
			}
			catch (ExecutionException e) {
				logger.error("Worker terminated abnormally", e.getCause());
			}
			catch (InterruptedException e) {
				interrupted = true;
			}
		}
		if (interrupted) {
			Thread.currentThread().interrupt();
		}
	}

	private static ThreadFactory workerThreads() {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> new Thread(runnable, "forge-worker-" + counter.incrementAndGet());
	}

}
