package org.springaicommunity.credentialforge;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes a safe worker concurrency from CPU count and a memory ceiling.
 *
 * <p>
 * {@code workers = clamp(1, min(cpus, floor(ceiling / perWorker)), hardCap)}. Without a
 * memory ceiling the CPU count alone decides. The computation is pure; only
 * {@link #workerCountForHost} reads the host's processor count.
 */
public class ResourceBudgeter {

	private static final Logger logger = LoggerFactory.getLogger(ResourceBudgeter.class);

	private final int hardCap;

	public ResourceBudgeter() {
		this(ForgeProperties.DEFAULT_MAX_WORKERS);
	}

	public ResourceBudgeter(int hardCap) {
		if (hardCap <= 0) {
			throw new IllegalArgumentException("hardCap must be positive, got: " + hardCap);
		}
		this.hardCap = hardCap;
	}

	/**
	 * Compute the worker count.
	 * @param memoryCeilingBytes memory budget, {@code null} when unset
	 * @param perWorkerEstimateBytes static per-worker memory estimate
	 * @param logicalCpuCount number of logical CPUs
	 * @return a worker count between 1 and the hard cap
	 * @throws ResourceExhaustionException if the ceiling cannot fund a single worker
	 */
	public int workerCount(@Nullable Long memoryCeilingBytes, long perWorkerEstimateBytes, int logicalCpuCount) {
		if (perWorkerEstimateBytes <= 0) {
			throw new IllegalArgumentException("perWorkerEstimateBytes must be positive, got: " + perWorkerEstimateBytes);
		}

		int workers = Math.max(1, logicalCpuCount);

		if (memoryCeilingBytes != null) {
			long affordable = memoryCeilingBytes / perWorkerEstimateBytes;
			if (affordable < 1) {
				throw new ResourceExhaustionException(String.format(
						"Memory ceiling of %d bytes cannot fund a single worker (estimate: %d bytes per worker)",
						memoryCeilingBytes, perWorkerEstimateBytes));
			}
			workers = (int) Math.min(workers, affordable);
		}

		return Math.min(workers, hardCap);
	}

	/**
	 * Compute the worker count for the current host.
	 * @param memoryCeilingBytes memory budget, {@code null} when unset
	 * @param perWorkerEstimateBytes static per-worker memory estimate
	 * @return a worker count between 1 and the hard cap
	 */
	public int workerCountForHost(@Nullable Long memoryCeilingBytes, long perWorkerEstimateBytes) {
		int cpus = Runtime.getRuntime().availableProcessors();
		int workers = workerCount(memoryCeilingBytes, perWorkerEstimateBytes, cpus);
		logger.info("System: {} CPUs, memory ceiling {} -> {} workers", cpus,
				memoryCeilingBytes != null ? formatBytes(memoryCeilingBytes) : "unset", workers);
		return workers;
	}

	public int getHardCap() {
		return hardCap;
	}

	static String formatBytes(long bytes) {
		double gib = bytes / (1024.0 * 1024 * 1024);
		if (gib >= 1) {
			return String.format("%.1fGB", gib);
		}
		return String.format("%dMB", bytes / (1024 * 1024));
	}

}
