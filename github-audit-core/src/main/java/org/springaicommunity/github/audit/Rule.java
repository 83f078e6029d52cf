package org.springaicommunity.github.audit;

import java.util.List;

/**
 * A single named check over one repository snapshot.
 *
 * <p>
 * Implementations are stateless: evaluating the same snapshot twice yields equal
 * findings, and nothing is retained between repositories. Any exception thrown from
 * {@link #evaluate} is recorded as a rule evaluation error for that repository only.
 */
public interface Rule {

	/**
	 * Stable identifier, unique within a {@link RuleRegistry}, e.g. {@code missing-readme}.
	 */
	String id();

	/**
	 * Human-readable description, also used as the finding message.
	 */
	String description();

	/**
	 * Evaluate the rule.
	 * @param snapshot the repository to check
	 * @return findings, empty when the check passes or does not apply
	 */
	List<Finding> evaluate(RepositorySnapshot snapshot);

}
