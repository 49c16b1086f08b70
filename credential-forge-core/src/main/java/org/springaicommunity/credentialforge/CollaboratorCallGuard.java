package org.springaicommunity.credentialforge;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounds the duration of collaborator calls.
 *
 * <p>
 * Without a timeout, calls run directly on the caller's thread. With a timeout, each call
 * runs on a daemon thread owned by the guard; a call that does not return in time is
 * interrupted and reported as a {@link CollaboratorTimeoutException}. A collaborator that
 * ignores interruption keeps its thread, but the worker moves on.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * // No timeout
 * CollaboratorCallGuard guard = CollaboratorCallGuard.builder().build();
 *
 * // Two minutes per call
 * CollaboratorCallGuard guard = CollaboratorCallGuard.builder()
 *     .timeout(Duration.ofMinutes(2))
 *     .build();
 *
 * String content = guard.call(() -> strategy.generate(topic, format, context), "content");
 * }
 * </pre>
 *
 * One guard belongs to one worker; {@link #close()} releases its threads.
 */
public final class CollaboratorCallGuard implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(CollaboratorCallGuard.class);

	private static final AtomicInteger GUARD_COUNTER = new AtomicInteger();

	@Nullable
	private final Duration timeout;

	@Nullable
	private final ExecutorService executor;

	private CollaboratorCallGuard(Builder builder) {
		this.timeout = builder.timeout;
		this.executor = timeout != null ? Executors.newCachedThreadPool(daemonThreads()) : null;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Run a collaborator call.
	 * @param call the call
	 * @param description short description used in logs and timeout messages
	 * @return the call's result
	 * @throws CollaboratorTimeoutException if the call exceeded the timeout
	 * @throws RuntimeException whatever the call itself threw
	 */
	public <T> T call(Supplier<T> call, String description) {
		if (timeout == null || executor == null) {
			return call.get();
		}

		Future<T> future = executor.submit(call::get);
		try {
			return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (TimeoutException e) {
			future.cancel(true);
			logger.warn("{} exceeded {}ms, abandoning call", description, timeout.toMillis());
			throw new CollaboratorTimeoutException(description, timeout);
		}
		catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new CredentialForgeException(description + " failed", cause);
		}
		catch (InterruptedException e) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			throw new CredentialForgeException(description + " interrupted", e);
		}
	}

	@Nullable
	public Duration getTimeout() {
		return timeout;
	}

	@Override
	public void close() {
		if (executor != null) {
			executor.shutdownNow();
		}
	}

	private static ThreadFactory daemonThreads() {
		int guardId = GUARD_COUNTER.incrementAndGet();
		AtomicInteger threadCounter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable,
					"forge-call-" + guardId + "-" + threadCounter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

	/**
	 * Builder for CollaboratorCallGuard.
	 */
	public static final class Builder {

		@Nullable
		private Duration timeout;

		private Builder() {
		}

		/**
		 * Set the per-call timeout.
		 * @param timeout maximum call duration, {@code null} for no limit
		 * @return this builder
		 * @throws IllegalArgumentException if timeout is zero or negative
		 */
		public Builder timeout(@Nullable Duration timeout) {
			if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
				throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
			}
			this.timeout = timeout;
			return this;
		}

		public CollaboratorCallGuard build() {
			return new CollaboratorCallGuard(this);
		}

	}

}
