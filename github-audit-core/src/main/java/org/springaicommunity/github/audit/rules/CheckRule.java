package org.springaicommunity.github.audit.rules;

import org.springaicommunity.github.audit.Finding;
import org.springaicommunity.github.audit.RepositorySnapshot;
import org.springaicommunity.github.audit.Rule;
import org.springaicommunity.github.audit.Severity;

import java.util.List;
import java.util.function.Function;

/**
 * A {@link Rule} that reports at most one finding: its description, at a fixed severity,
 * whenever the check function returns {@link CheckResult#FAIL}.
 *
 * @param id the rule id
 * @param severity severity of the finding
 * @param description finding message
 * @param fixable whether the finding can be remediated by changing a repository setting
 * @param check the check function; must not retain state between invocations
 */
public record CheckRule(String id, Severity severity, String description, boolean fixable,
		Function<RepositorySnapshot, CheckResult> check) implements Rule {

	public static CheckRule error(String id, String description, Function<RepositorySnapshot, CheckResult> check) {
		return new CheckRule(id, Severity.ERROR, description, false, check);
	}

	public static CheckRule warning(String id, String description, Function<RepositorySnapshot, CheckResult> check) {
		return new CheckRule(id, Severity.WARNING, description, false, check);
	}

	/**
	 * Returns a copy of this rule whose findings are marked fixable.
	 */
	public CheckRule asFixable() {
		return new CheckRule(id, severity, description, true, check);
	}

	@Override
	public List<Finding> evaluate(RepositorySnapshot snapshot) {
		if (check.apply(snapshot) == CheckResult.FAIL) {
			return List.of(new Finding(id, snapshot.ref(), severity, description, fixable));
		}
		return List.of();
	}

	@Override
	public String toString() {
		return "CheckRule[" + id + "]";
	}

}
