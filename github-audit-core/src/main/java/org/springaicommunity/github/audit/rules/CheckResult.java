package org.springaicommunity.github.audit.rules;

/**
 * Outcome of a single check.
 */
public enum CheckResult {

	/** The repository satisfies the check. */
	OK,

	/** The repository violates the check. */
	FAIL,

	/** The check does not apply to the repository. */
	SKIP;

	public static CheckResult failIf(boolean condition) {
		return condition ? FAIL : OK;
	}

}
