package org.springaicommunity.github.audit;

import org.jspecify.annotations.Nullable;

/**
 * The token was rejected (HTTP 401). Fatal to the whole run.
 */
public class AuthenticationException extends GitHubApiException {

	public AuthenticationException(String message, int statusCode, @Nullable String responseBody) {
		super(message, statusCode, responseBody);
	}

}
