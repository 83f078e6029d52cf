package org.springaicommunity.github.audit;

import java.util.List;

/**
 * Outcome of an audit run.
 *
 * <p>
 * Every repository taken from the input sequence appears exactly once, either in
 * {@code evaluated} (its rules ran; it may have zero or more findings and rule-level
 * errors) or as a repository-level entry in {@code errors}.
 *
 * @param findings all findings, in repository order then rule order
 * @param errors repository-level and rule-level failures, in the same order
 * @param evaluated repositories whose snapshot was fetched and evaluated
 * @param cancelled whether the run stopped before the input was exhausted, on a
 * cancellation signal, a rejected token or a failure reading the input
 */
public record RunResult(List<Finding> findings, List<AuditError> errors, List<RepositoryRef> evaluated,
		boolean cancelled) {

	public RunResult {
		findings = List.copyOf(findings);
		errors = List.copyOf(errors);
		evaluated = List.copyOf(evaluated);
	}

	/**
	 * Create an empty result.
	 * @return a result with no repositories
	 */
	public static RunResult empty() {
		return new RunResult(List.of(), List.of(), List.of(), false);
	}

	public boolean hasFindings() {
		return !findings.isEmpty();
	}

	public boolean hasErrors() {
		return !errors.isEmpty();
	}

	/**
	 * Returns true if every repository was evaluated and no rule reported a violation.
	 * @return true when there are neither findings nor errors
	 */
	public boolean isClean() {
		return findings.isEmpty() && errors.isEmpty() && !cancelled;
	}

	/**
	 * Returns the repositories that could not be evaluated at all.
	 * @return repository-level errors
	 */
	public List<AuditError> repositoryErrors() {
		return errors.stream().filter(AuditError::isRepositoryLevel).toList();
	}

	/**
	 * Returns the (repository, rule) pairs that failed to evaluate.
	 * @return rule-level errors
	 */
	public List<AuditError> ruleErrors() {
		return errors.stream().filter(e -> !e.isRepositoryLevel()).toList();
	}

	/**
	 * Returns the number of repositories accounted for by this result.
	 * @return evaluated plus failed repositories
	 */
	public int repositoryCount() {
		return evaluated.size() + repositoryErrors().size();
	}

}
