package org.springaicommunity.github.audit;

import org.jspecify.annotations.Nullable;

/**
 * HTTP 404. Never retried.
 */
public class NotFoundException extends GitHubApiException {

	public NotFoundException(String message, int statusCode, @Nullable String responseBody, int rateLimitRemaining,
			long resetEpochSeconds) {
		super(message, statusCode, responseBody, rateLimitRemaining, resetEpochSeconds);
	}

}
