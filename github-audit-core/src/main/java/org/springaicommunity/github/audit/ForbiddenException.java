package org.springaicommunity.github.audit;

import org.jspecify.annotations.Nullable;

/**
 * HTTP 403 that is not caused by rate limiting, typically a token lacking the required
 * scope. Never retried.
 */
public class ForbiddenException extends GitHubApiException {

	public ForbiddenException(String message, int statusCode, @Nullable String responseBody, int rateLimitRemaining,
			long resetEpochSeconds) {
		super(message, statusCode, responseBody, rateLimitRemaining, resetEpochSeconds);
	}

}
