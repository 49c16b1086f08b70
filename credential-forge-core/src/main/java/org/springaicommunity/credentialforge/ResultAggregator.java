package org.springaicommunity.credentialforge;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects job results from all workers into a {@link BatchReport}.
 *
 * <p>
 * Results may arrive in any order and from any thread. Every accepted result is kept;
 * statistics are updated under the aggregator's monitor so counts always agree with the
 * result lists.
 */
public class ResultAggregator {

	private final List<GenerationResult.Success> successes = new ArrayList<>();

	private final List<GenerationResult.Failure> failures = new ArrayList<>();

	private final Map<String, Integer> filesByFormat = new TreeMap<>();

	private final Map<String, Integer> credentialsByType = new TreeMap<>();

	private int totalCredentials;

	/**
	 * Record one job result.
	 * @param result the result
	 */
	public synchronized void accept(GenerationResult result) {
		if (result instanceof GenerationResult.Success) {
			GenerationResult.Success success = (GenerationResult.Success) result;
			successes.add(success);
			filesByFormat.merge(success.format(), 1, Integer::sum);
			for (String type : success.credentialTypes()) {
				credentialsByType.merge(type, 1, Integer::sum);
			}
			totalCredentials += success.credentialsEmbeddedCount();
		}
		else if (result instanceof GenerationResult.Failure) {
			failures.add((GenerationResult.Failure) result);
		}
		else {
			throw new IllegalArgumentException("Unsupported result type: " + result.getClass().getName());
		}
	}

	/**
	 * Returns the number of results accepted so far.
	 */
	public synchronized int size() {
		return successes.size() + failures.size();
	}

	/**
	 * Freeze the collected results into a report. Later results do not affect a snapshot
	 * already taken.
	 * @param duration wall-clock duration of the batch
	 * @param requestedFiles number of jobs planned
	 * @param workerCount worker pool size
	 * @param batchStartTime batch start in epoch millis
	 * @param cancelled whether the batch was cancelled
	 * @param undispatchedJobs indices of jobs never started
	 * @return the report
	 */
	public synchronized BatchReport snapshot(Duration duration, int requestedFiles, int workerCount,
			long batchStartTime, boolean cancelled, List<Integer> undispatchedJobs) {
		return new BatchReport(successes, failures, successes.size(), totalCredentials, filesByFormat,
				credentialsByType, duration, requestedFiles, workerCount, batchStartTime, cancelled,
				undispatchedJobs);
	}

}
