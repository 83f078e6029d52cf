package org.springaicommunity.github.audit;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Decorator that adds rate limit gating and automatic retry to a {@link GitHubClient}.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Every attempt first passes the shared {@link RateLimitGate}, which blocks until the
 * quota resets (or fails once the reset is beyond the wait ceiling)</li>
 * <li>Capped exponential backoff for transient errors (5xx, network)</li>
 * <li>Reset-aware handling of rate limit errors: the reported reset is fed to the gate so
 * the next attempt waits for exactly that long</li>
 * <li>Proactive pacing: injects delays when remaining rate limit is low to avoid hitting
 * the wall</li>
 * <li>Other 4xx responses (404, 403 scope errors, 401) propagate immediately, as does
 * any exception outside the {@link GitHubApiException} hierarchy</li>
 * </ul>
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * GitHubClient client = RetryingGitHubClient.builder()
 *     .wrapping(new GitHubHttpClient(token))
 *     .rateLimitGate(new RateLimitGate(Duration.ofMinutes(15)))
 *     .maxRetries(2)
 *     .initialDelay(Duration.ofSeconds(1))
 *     .maxDelay(Duration.ofSeconds(30))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingGitHubClient.class);

	private final GitHubClient delegate;

	private final RateLimitGate rateLimitGate;

	private final int maxRetries;

	private final long initialDelayMs;

	private final long maxDelayMs;

	private final int pacingThreshold;

	private final Clock clock;

	private final Sleeper sleeper;

	private RetryingGitHubClient(Builder builder) {
		this.delegate = builder.delegate;
		this.rateLimitGate = builder.rateLimitGate;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
		this.maxDelayMs = builder.maxDelayMs;
		this.pacingThreshold = builder.pacingThreshold;
		this.clock = builder.clock;
		this.sleeper = builder.sleeper;
	}

	/**
	 * Create a new builder for RetryingGitHubClient.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String get(String path) {
		return executeWithRetry(() -> delegate.get(path), "GET " + path);
	}

	@Override
	public String getWithQuery(String path, @Nullable String queryString) {
		String desc = "GET " + path + (queryString != null ? "?" + queryString : "");
		return executeWithRetry(() -> delegate.getWithQuery(path, queryString), desc);
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return delegate.getLastRateLimitInfo();
	}

	private String executeWithRetry(RequestSupplier supplier, String description) {
		GitHubApiException lastException = null;
		long delay = initialDelayMs;

		for (int attempt = 0; attempt <= maxRetries; attempt++) {
			rateLimitGate.acquire();
			try {
				String result = supplier.get();
				rateLimitGate.record(delegate.getLastRateLimitInfo());

				// Proactive pacing after successful responses
				paceIfNeeded(description);

				return result;
			}
			catch (GitHubApiException e) {
				lastException = e;

				if (e.isRateLimitError()) {
					if (e.getResetEpochSeconds() > 0) {
						// The gate waits for the reset before the next attempt
						rateLimitGate.record(RateLimitInfo.exhausted(e.getResetEpochSeconds()));
						if (attempt < maxRetries) {
							logger.warn("{} rate limited (attempt {}/{}). Waiting for reset at epoch {}", description,
									attempt + 1, maxRetries + 1, e.getResetEpochSeconds());
						}
						continue;
					}
				}
				else if (!e.isTransient()) {
					throw e;
				}

				if (attempt < maxRetries) {
					logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms...", description, attempt + 1,
							maxRetries + 1, e.getMessage(), delay);
					sleep(delay);
					delay = Math.min(delay * 2, maxDelayMs);
				}
			}
		}

		logger.error("{} failed after {} attempts", description, maxRetries + 1);
		throw lastException;
	}

	/**
	 * Proactive pacing: after a successful request, check remaining rate limit and slow
	 * down to avoid hitting the wall. Spreads remaining requests evenly across time until
	 * reset.
	 */
	private void paceIfNeeded(String description) {
		RateLimitInfo info = delegate.getLastRateLimitInfo();
		if (info == null || info.remaining() <= 0) {
			return;
		}

		if (info.remaining() < pacingThreshold) {
			long secondsUntilReset = info.reset() - clock.instant().getEpochSecond();

			if (secondsUntilReset > 0) {
				long paceMs = (secondsUntilReset * 1000) / info.remaining();
				paceMs = Math.min(paceMs, 10_000); // cap at 10s
				paceMs = Math.max(paceMs, 100); // minimum 100ms

				logger.debug("Pacing: {}/{} remaining, sleeping {}ms ({})", info.remaining(), info.limit(), paceMs,
						description);
				sleep(paceMs);
			}
		}
	}

	private void sleep(long ms) {
		try {
			sleeper.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			CancellationException cancelled = new CancellationException("Retry interrupted");
			cancelled.initCause(e);
			throw cancelled;
		}
	}

	@FunctionalInterface
	private interface RequestSupplier {

		String get();

	}

	/**
	 * Builder for {@link RetryingGitHubClient}.
	 *
	 * <p>
	 * Provides sensible defaults:
	 * <ul>
	 * <li>maxRetries: 2 (three attempts in total)</li>
	 * <li>initialDelay: 1 second, doubling per retry</li>
	 * <li>maxDelay: 30 seconds</li>
	 * <li>pacingThreshold: 100 (start pacing when remaining drops below this)</li>
	 * <li>rateLimitGate: a private gate with a 15 minute wait ceiling</li>
	 * </ul>
	 */
	public static class Builder {

		private @Nullable GitHubClient delegate;

		private @Nullable RateLimitGate rateLimitGate;

		private int maxRetries = 2;

		private long initialDelayMs = 1000;

		private long maxDelayMs = 30_000;

		private int pacingThreshold = 100;

		private Clock clock = Clock.systemUTC();

		private Sleeper sleeper = Sleeper.SYSTEM;

		private Builder() {
		}

		/**
		 * Set the client to wrap with retry logic.
		 * @param client the GitHubClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(GitHubClient client) {
			this.delegate = client;
			return this;
		}

		/**
		 * Set the rate limit gate shared by every worker of the run.
		 * @param gate the shared gate
		 * @return this builder
		 */
		public Builder rateLimitGate(RateLimitGate gate) {
			this.rateLimitGate = gate;
			return this;
		}

		/**
		 * Set the maximum number of retry attempts.
		 * @param maxRetries maximum retries (default: 2)
		 * @return this builder
		 */
		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the initial delay between retries using Duration.
		 * @param delay initial delay (doubles on each retry, default: 1 second)
		 * @return this builder
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Set the initial delay between retries in milliseconds.
		 * @param delayMs initial delay in milliseconds (doubles on each retry, default:
		 * 1000)
		 * @return this builder
		 */
		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		/**
		 * Set the upper bound for the exponential backoff delay.
		 * @param delay maximum delay between retries (default: 30 seconds)
		 * @return this builder
		 */
		public Builder maxDelay(Duration delay) {
			this.maxDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Set the remaining request threshold for proactive pacing. When the number of
		 * remaining requests drops below this value, the client will start inserting
		 * delays to spread requests evenly until the rate limit resets. Zero disables
		 * pacing.
		 * @param threshold remaining request threshold (default: 100)
		 * @return this builder
		 */
		public Builder pacingThreshold(int threshold) {
			this.pacingThreshold = threshold;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Build the RetryingGitHubClient.
		 * @return configured RetryingGitHubClient
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingGitHubClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A GitHubClient to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			if (maxDelayMs < initialDelayMs) {
				throw new IllegalStateException("maxDelay must not be shorter than initialDelay");
			}
			if (rateLimitGate == null) {
				rateLimitGate = new RateLimitGate(Duration.ofMinutes(15), clock, sleeper);
			}
			return new RetryingGitHubClient(this);
		}

	}

}
