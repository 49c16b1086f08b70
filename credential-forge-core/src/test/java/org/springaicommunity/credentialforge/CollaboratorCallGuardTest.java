package org.springaicommunity.credentialforge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link CollaboratorCallGuard}.
 */
@DisplayName("CollaboratorCallGuard Tests")
class CollaboratorCallGuardTest {

	@Test
	@DisplayName("Should run calls on the caller thread without a timeout")
	void shouldRunDirectlyWithoutTimeout() {
		try (CollaboratorCallGuard guard = CollaboratorCallGuard.builder().build()) {
			String thread = guard.call(() -> Thread.currentThread().getName(), "thread name");

			assertThat(thread).isEqualTo(Thread.currentThread().getName());
			assertThat(guard.getTimeout()).isNull();
		}
	}

	@Test
	@DisplayName("Should return results of calls that finish in time")
	void shouldReturnResultWithinTimeout() {
		try (CollaboratorCallGuard guard = CollaboratorCallGuard.builder().timeout(Duration.ofSeconds(5)).build()) {
			assertThat(guard.call(() -> "done", "quick call")).isEqualTo("done");
		}
	}

	@Test
	@DisplayName("Should abandon calls that exceed the timeout")
	void shouldTimeOut() {
		try (CollaboratorCallGuard guard = CollaboratorCallGuard.builder().timeout(Duration.ofMillis(50)).build()) {
			assertThatThrownBy(() -> guard.call(() -> {
				try {
					Thread.sleep(5_000);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				return "late";
			}, "slow call")).isInstanceOf(CollaboratorTimeoutException.class)
				.hasMessageContaining("slow call timed out after 50ms");
		}
	}

	@Test
	@DisplayName("Should rethrow the collaborator's own exception")
	void shouldRethrowCollaboratorException() {
		try (CollaboratorCallGuard guard = CollaboratorCallGuard.builder().timeout(Duration.ofSeconds(5)).build()) {
			assertThatThrownBy(() -> guard.call(() -> {
				throw new SynthesisException("disk full");
			}, "synthesis")).isInstanceOf(SynthesisException.class).hasMessage("disk full");
		}
	}

	@Test
	@DisplayName("Should reject non-positive timeouts")
	void shouldRejectNonPositiveTimeout() {
		assertThatThrownBy(() -> CollaboratorCallGuard.builder().timeout(Duration.ZERO))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> CollaboratorCallGuard.builder().timeout(Duration.ofSeconds(-1)))
			.isInstanceOf(IllegalArgumentException.class);
	}

}
