package org.springaicommunity.github.audit;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared rate limit state for one audit run.
 *
 * <p>
 * Every request passes through {@link #acquire()} before it is sent and reports the
 * quota it observed through {@link #record(RateLimitInfo)}. Each acquisition reserves one
 * request of the recorded quota, so concurrent workers cannot spend the same remaining
 * request twice. Once the reserved count reaches zero, the next worker to acquire the gate
 * sleeps until the reset while holding the lock; the other workers queue behind it, so the
 * decision to wait is made once rather than by every worker independently.
 *
 * <p>
 * If the reset lies further away than the configured ceiling, {@link #acquire()} fails
 * with {@link RateLimitExceededException} instead of waiting.
 */
public final class RateLimitGate {

	private static final Logger logger = LoggerFactory.getLogger(RateLimitGate.class);

	private final ReentrantLock lock = new ReentrantLock(true);

	private final Duration waitCeiling;

	private final Clock clock;

	private final Sleeper sleeper;

	// guarded by lock
	private @Nullable RateLimitInfo current;

	public RateLimitGate(Duration waitCeiling) {
		this(waitCeiling, Clock.systemUTC(), Sleeper.SYSTEM);
	}

	public RateLimitGate(Duration waitCeiling, Clock clock, Sleeper sleeper) {
		if (waitCeiling.isNegative()) {
			throw new IllegalArgumentException("waitCeiling must not be negative");
		}
		this.waitCeiling = waitCeiling;
		this.clock = clock;
		this.sleeper = sleeper;
	}

	/**
	 * Block until a request may be sent, then reserve it against the recorded quota.
	 * @throws RateLimitExceededException if the quota is exhausted and the reset is beyond
	 * the wait ceiling
	 * @throws CancellationException if interrupted while waiting
	 */
	public void acquire() {
		lock.lock();
		try {
			RateLimitInfo info = current;
			if (info == null) {
				return;
			}
			if (!info.isExceeded()) {
				current = info.reserve();
				return;
			}

			long waitMs = info.getResetTime().toEpochMilli() - clock.millis();
			if (waitMs <= 0) {
				current = null;
				return;
			}
			if (waitMs > waitCeiling.toMillis()) {
				throw new RateLimitExceededException("Rate limit exhausted; reset in " + (waitMs / 1000)
						+ "s exceeds wait ceiling of " + waitCeiling.toSeconds() + "s", info.reset());
			}

			logger.info("Rate limit exhausted. Waiting {}ms until reset at epoch {}", waitMs, info.reset());
			try {
				sleeper.sleep(waitMs);
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				CancellationException cancelled = new CancellationException("Interrupted waiting for rate limit reset");
				cancelled.initCause(e);
				throw cancelled;
			}
			// The new window's quota is unknown until the next response reports it.
			current = null;
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Record the quota reported by a response. Observations of an older window are ignored;
	 * within the same window the lowest remaining count wins, so a response that does not
	 * yet account for requests still in flight cannot release their reservations.
	 * @param info observed rate limit, or null if the response carried none
	 */
	public void record(@Nullable RateLimitInfo info) {
		if (info == null || info.remaining() < 0 || info.reset() <= 0) {
			return;
		}
		lock.lock();
		try {
			RateLimitInfo previous = current;
			if (previous == null || info.reset() > previous.reset()
					|| (info.reset() == previous.reset() && info.remaining() < previous.remaining())) {
				current = info;
			}
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Returns the most restrictive quota observed in the current window.
	 * @return the current observation, or null if unknown
	 */
	public @Nullable RateLimitInfo current() {
		lock.lock();
		try {
			return current;
		}
		finally {
			lock.unlock();
		}
	}

}
