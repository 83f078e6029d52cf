package org.springaicommunity.github.audit;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between the caller of an audit run and its
 * workers. Once cancelled it stays cancelled.
 */
public final class CancellationSignal {

	private final AtomicBoolean cancelled = new AtomicBoolean();

	/**
	 * Request cancellation.
	 * @return true if this call changed the state
	 */
	public boolean cancel() {
		return cancelled.compareAndSet(false, true);
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

}
