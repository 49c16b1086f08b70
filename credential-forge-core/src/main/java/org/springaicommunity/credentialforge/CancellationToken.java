package org.springaicommunity.credentialforge;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Whole-batch cancellation signal. Once cancelled, no further jobs are dispatched; jobs
 * already running finish normally.
 */
public final class CancellationToken {

	private final AtomicBoolean cancelled = new AtomicBoolean();

	/**
	 * Request cancellation.
	 * @return true if this call cancelled the token, false if it was already cancelled
	 */
	public boolean cancel() {
		return cancelled.compareAndSet(false, true);
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

}
