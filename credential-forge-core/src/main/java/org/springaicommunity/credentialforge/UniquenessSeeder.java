package org.springaicommunity.credentialforge;

import java.util.Random;

/**
 * Derives per-job uniqueness seeds.
 *
 * <p>
 * A seed combines the job index with a batch start time captured once per batch. The
 * combination is passed through a bijective 64-bit mixing function, so two job indices
 * of the same batch can never share a seed, a batch replayed with the same start time
 * reproduces every seed, and batches started at different times diverge even with
 * identical configurations.
 */
public final class UniquenessSeeder {

	private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

	/**
	 * Stream identifier for the job planner's random choices.
	 */
	public static final long PLANNING_STREAM = 1L;

	/**
	 * Stream identifier for the embedding engine's random choices.
	 */
	public static final long EMBEDDING_STREAM = 2L;

	private UniquenessSeeder() {
	}

	/**
	 * Compute the seed of one job.
	 * @param jobIndex zero-based job index
	 * @param batchStartTime batch start in epoch millis
	 * @return the job's uniqueness seed
	 */
	public static long seed(int jobIndex, long batchStartTime) {
		return mix64(batchStartTime * GOLDEN_GAMMA + jobIndex);
	}

	/**
	 * Derive an independent sub-seed so different consumers of the same job seed do not
	 * draw correlated values.
	 * @param seed the job seed
	 * @param stream consumer identifier
	 * @return derived seed
	 */
	public static long derive(long seed, long stream) {
		return mix64(seed + stream * GOLDEN_GAMMA);
	}

	/**
	 * Create a random source for one consumer of a job seed.
	 * @param seed the job seed
	 * @param stream consumer identifier
	 * @return a new, deterministic random source
	 */
	public static Random random(long seed, long stream) {
		return new Random(derive(seed, stream));
	}

	// SplitMix64 finalizer; a bijection on 64-bit values
	static long mix64(long z) {
		z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
		z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
		return z ^ (z >>> 31);
	}

}
