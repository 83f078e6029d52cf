package org.springaicommunity.github.audit;

import org.jspecify.annotations.Nullable;

/**
 * A unit of work that failed to complete during an audit run.
 *
 * <p>
 * Repository-level errors (failed fetch, cancellation) carry a {@code null} rule id;
 * rule-level errors name the rule that failed against the repository.
 *
 * @param repository the repository being audited
 * @param ruleId the failing rule, or null for a repository-level error
 * @param kind classification of the failure
 * @param message description of the failure
 */
public record AuditError(RepositoryRef repository, @Nullable String ruleId, ErrorKind kind, String message) {

	/**
	 * Create a repository-level error.
	 * @param repository the repository whose metadata could not be fetched
	 * @param kind classification of the failure
	 * @param message description of the failure
	 * @return the error record
	 */
	public static AuditError forRepository(RepositoryRef repository, ErrorKind kind, String message) {
		return new AuditError(repository, null, kind, message);
	}

	/**
	 * Create a rule-level error.
	 * @param repository the repository being evaluated
	 * @param ruleId the rule that failed
	 * @param message description of the failure
	 * @return the error record
	 */
	public static AuditError forRule(RepositoryRef repository, String ruleId, String message) {
		return new AuditError(repository, ruleId, ErrorKind.RULE_EVALUATION, message);
	}

	/**
	 * Returns true if the whole repository could not be evaluated.
	 * @return true for repository-level errors
	 */
	public boolean isRepositoryLevel() {
		return ruleId == null;
	}

}
