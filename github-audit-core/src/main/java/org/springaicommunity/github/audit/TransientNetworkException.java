package org.springaicommunity.github.audit;

import org.jspecify.annotations.Nullable;

/**
 * Network failure or 5xx response. Retried with capped exponential backoff and
 * propagated once retries are exhausted.
 */
public class TransientNetworkException extends GitHubApiException {

	public TransientNetworkException(String message, int statusCode, @Nullable String responseBody) {
		super(message, statusCode, responseBody);
	}

	public TransientNetworkException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public boolean isTransient() {
		return true;
	}

}
