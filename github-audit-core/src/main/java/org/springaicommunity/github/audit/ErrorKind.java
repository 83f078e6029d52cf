package org.springaicommunity.github.audit;

import java.util.concurrent.CancellationException;

/**
 * Classification of a unit of work that could not be completed during an audit run.
 */
public enum ErrorKind {

	/**
	 * The token was rejected while the run was in progress.
	 */
	AUTHENTICATION,

	NOT_FOUND,

	FORBIDDEN,

	/**
	 * Quota was exhausted and the reset lies beyond the configured wait ceiling.
	 */
	RATE_LIMIT_EXCEEDED,

	/**
	 * Network failure or server error that persisted through every retry.
	 */
	TRANSIENT_NETWORK,

	/**
	 * A rule failed while evaluating an otherwise complete snapshot.
	 */
	RULE_EVALUATION,

	/**
	 * The repository was scheduled but the run was cancelled before it started.
	 */
	CANCELLED,

	UNEXPECTED;

	/**
	 * Classify a failure raised while fetching repository metadata.
	 * @param e the failure
	 * @return the matching kind
	 */
	public static ErrorKind of(Throwable e) {
		if (e instanceof AuthenticationException) {
			return AUTHENTICATION;
		}
		if (e instanceof NotFoundException) {
			return NOT_FOUND;
		}
		if (e instanceof RateLimitExceededException) {
			return RATE_LIMIT_EXCEEDED;
		}
		if (e instanceof ForbiddenException) {
			return FORBIDDEN;
		}
		if (e instanceof TransientNetworkException) {
			return TRANSIENT_NETWORK;
		}
		if (e instanceof CancellationException) {
			return CANCELLED;
		}
		return UNEXPECTED;
	}

}
