package org.springaicommunity.github.audit;

import org.jspecify.annotations.Nullable;

/**
 * Quota exhausted. Raised by the HTTP layer for 403 (remaining=0) and 429 responses, and
 * by {@link RateLimitGate} when the reset lies beyond the configured wait ceiling.
 *
 * <p>
 * Extends {@link ForbiddenException} so callers that only distinguish "access refused"
 * still see it as such.
 */
public class RateLimitExceededException extends ForbiddenException {

	public RateLimitExceededException(String message, int statusCode, @Nullable String responseBody,
			int rateLimitRemaining, long resetEpochSeconds) {
		super(message, statusCode, responseBody, rateLimitRemaining, resetEpochSeconds);
	}

	public RateLimitExceededException(String message, long resetEpochSeconds) {
		super(message, -1, null, 0, resetEpochSeconds);
	}

}
