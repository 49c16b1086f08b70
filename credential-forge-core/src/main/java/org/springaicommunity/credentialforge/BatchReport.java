package org.springaicommunity.credentialforge;

import java.time.Duration;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Final, frozen summary of a batch.
 *
 * <p>
 * The report owns copies of all result data and never references live job objects. For a
 * batch that ran to completion {@code successes().size() + failures().size()} equals the
 * requested file count. A cancelled batch covers only the jobs that finished and lists the
 * jobs that were never dispatched.
 *
 * @param successes documents written, in completion order
 * @param failures failed jobs, in completion order
 * @param totalFiles number of documents written
 * @param totalCredentials number of credentials embedded across all documents
 * @param filesByFormat documents written per format
 * @param credentialsByType credentials embedded per credential type
 * @param duration wall-clock duration of the batch
 * @param requestedFiles number of jobs planned
 * @param workerCount size of the worker pool
 * @param batchStartTime batch start in epoch millis, the basis of all job seeds
 * @param cancelled true if the batch was cancelled before every job was dispatched
 * @param undispatchedJobs indices of jobs never started because of cancellation
 */
public record BatchReport(List<GenerationResult.Success> successes, List<GenerationResult.Failure> failures,
		int totalFiles, int totalCredentials, Map<String, Integer> filesByFormat, Map<String, Integer> credentialsByType,
		Duration duration, int requestedFiles, int workerCount, long batchStartTime, boolean cancelled,
		List<Integer> undispatchedJobs) {

	public BatchReport {
		successes = List.copyOf(successes);
		failures = List.copyOf(failures);
		filesByFormat = Collections.unmodifiableMap(new TreeMap<>(filesByFormat));
		credentialsByType = Collections.unmodifiableMap(new TreeMap<>(credentialsByType));
		undispatchedJobs = List.copyOf(undispatchedJobs);
	}

	/**
	 * Returns the number of jobs that produced an outcome.
	 */
	public int completedJobs() {
		return successes.size() + failures.size();
	}

	public boolean hasFailures() {
		return !failures.isEmpty();
	}

	/**
	 * Returns true if every planned job ran and succeeded.
	 */
	public boolean allSucceeded() {
		return !cancelled && failures.isEmpty() && successes.size() == requestedFiles;
	}

	/**
	 * Returns the successes ordered by job index.
	 */
	public List<GenerationResult.Success> successesInJobOrder() {
		return successes.stream().sorted(Comparator.comparingInt(GenerationResult.Success::jobIndex)).toList();
	}

	/**
	 * Batch status for callers: 0 when every job succeeded, 2 when any job failed or the
	 * batch was cancelled.
	 */
	public int exitStatus() {
		return allSucceeded() ? 0 : 2;
	}

}
