package org.springaicommunity.github.audit;

import java.time.Instant;

/**
 * Rate limit information reported by the GitHub API in the {@code X-RateLimit-*} response
 * headers.
 *
 * @param limit the maximum number of requests allowed per window, or -1 if unknown
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the rate limit resets (epoch seconds)
 * @param used the number of requests used in the current window, or -1 if unknown
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	/**
	 * Create an observation of an exhausted quota, as derived from a rate limit error.
	 * @param reset reset time in epoch seconds
	 * @return info with zero remaining requests
	 */
	public static RateLimitInfo exhausted(long reset) {
		return new RateLimitInfo(-1, 0, reset, -1);
	}

	/**
	 * Returns this observation with one more request spent.
	 * @return info with one fewer remaining request
	 */
	public RateLimitInfo reserve() {
		return new RateLimitInfo(limit, remaining - 1, reset, used < 0 ? used : used + 1);
	}

	/**
	 * Returns the reset time as an Instant.
	 * @return the reset time
	 */
	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	/**
	 * Returns true if the rate limit has been exceeded.
	 * @return true if no requests remaining
	 */
	public boolean isExceeded() {
		return remaining <= 0;
	}

}
