package org.springaicommunity.credentialforge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link UniquenessSeeder}.
 */
@DisplayName("UniquenessSeeder Tests")
class UniquenessSeederTest {

	@Test
	@DisplayName("Should never repeat a seed within one batch")
	void shouldNotRepeatWithinBatch() {
		Set<Long> seeds = new HashSet<>();
		for (int i = 0; i < 100_000; i++) {
			seeds.add(UniquenessSeeder.seed(i, 1_700_000_000_000L));
		}

		assertThat(seeds).hasSize(100_000);
	}

	@Test
	@DisplayName("Should reproduce seeds for a fixed start time")
	void shouldReproduceForFixedStartTime() {
		assertThat(UniquenessSeeder.seed(42, 123L)).isEqualTo(UniquenessSeeder.seed(42, 123L));
	}

	@Test
	@DisplayName("Should diverge for different start times")
	void shouldDivergeForDifferentStartTimes() {
		assertThat(UniquenessSeeder.seed(0, 1000L)).isNotEqualTo(UniquenessSeeder.seed(0, 1001L));
		assertThat(UniquenessSeeder.seed(1, 1000L)).isNotEqualTo(UniquenessSeeder.seed(0, 1001L));
	}

	@Test
	@DisplayName("Should derive independent streams from one seed")
	void shouldDeriveIndependentStreams() {
		long seed = UniquenessSeeder.seed(7, 99L);

		assertThat(UniquenessSeeder.derive(seed, UniquenessSeeder.PLANNING_STREAM))
			.isNotEqualTo(UniquenessSeeder.derive(seed, UniquenessSeeder.EMBEDDING_STREAM));
		assertThat(UniquenessSeeder.random(seed, 1L).nextLong())
			.isEqualTo(UniquenessSeeder.random(seed, 1L).nextLong());
	}

	@Test
	@DisplayName("Should mix bijectively on small inputs")
	void shouldMixBijectively() {
		Set<Long> mixed = new HashSet<>();
		for (long i = -500; i < 500; i++) {
			mixed.add(UniquenessSeeder.mix64(i));
		}

		assertThat(mixed).hasSize(1000);
	}

}
