package org.springaicommunity.github.audit;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when GitHub API calls fail.
 *
 * <p>
 * Carries rate limit information when available, enabling reset-aware waiting in
 * {@link RetryingGitHubClient}. Subclasses classify the failure; use
 * {@link #forStatus(int, String, String, int, long)} to map an HTTP status.
 */
public class GitHubApiException extends RuntimeException {

	private final int statusCode;

	private final @Nullable String responseBody;

	private final int rateLimitRemaining;

	private final long resetEpochSeconds;

	public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
		this(message, statusCode, responseBody, -1, -1);
	}

	public GitHubApiException(String message, int statusCode, @Nullable String responseBody, int rateLimitRemaining,
			long resetEpochSeconds) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
		this.rateLimitRemaining = rateLimitRemaining;
		this.resetEpochSeconds = resetEpochSeconds;
	}

	public GitHubApiException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = null;
		this.rateLimitRemaining = -1;
		this.resetEpochSeconds = -1;
	}

	/**
	 * Map a non-2xx response to the matching exception type.
	 * @param statusCode HTTP status code
	 * @param target request description used in the message
	 * @param body response body
	 * @param remaining value of {@code X-RateLimit-Remaining}, or -1
	 * @param reset value of {@code X-RateLimit-Reset} (epoch seconds), or -1
	 * @return the exception to throw
	 */
	public static GitHubApiException forStatus(int statusCode, String target, @Nullable String body, int remaining,
			long reset) {
		if (statusCode == 401) {
			return new AuthenticationException("Unauthorized: Bad credentials. Check your GitHub token.", statusCode,
					body);
		}
		if (statusCode == 429 || (statusCode == 403 && remaining == 0)) {
			return new RateLimitExceededException("Rate limit exceeded (" + statusCode + "). Resets at epoch: " + reset,
					statusCode, body, remaining, reset);
		}
		if (statusCode == 403) {
			return new ForbiddenException("Forbidden: " + target, statusCode, body, remaining, reset);
		}
		if (statusCode == 404) {
			return new NotFoundException("Not found: " + target, statusCode, body, remaining, reset);
		}
		if (statusCode >= 500) {
			return new TransientNetworkException("GitHub API error: " + statusCode + " for " + target, statusCode,
					body);
		}
		return new GitHubApiException("GitHub API error: " + statusCode + " for " + target, statusCode, body,
				remaining, reset);
	}

	public int getStatusCode() {
		return statusCode;
	}

	public @Nullable String getResponseBody() {
		return responseBody;
	}

	public int getRateLimitRemaining() {
		return rateLimitRemaining;
	}

	public long getResetEpochSeconds() {
		return resetEpochSeconds;
	}

	/**
	 * Returns true if this exception represents a rate limit error (either 403 with
	 * remaining=0 or 429).
	 */
	public boolean isRateLimitError() {
		return (statusCode == 429) || (statusCode == 403 && rateLimitRemaining == 0);
	}

	/**
	 * Returns true if the request may succeed when repeated: network failures and 5xx
	 * responses.
	 */
	public boolean isTransient() {
		return false;
	}

}
