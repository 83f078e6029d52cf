package org.springaicommunity.github.audit;

import java.util.List;

/**
 * Repository ruleset rules that apply to a branch.
 *
 * @param ruleTypes types of the active rules, e.g. {@code required_status_checks}
 * @param requiredStatusCheckContexts contexts named by {@code required_status_checks}
 * rules
 */
public record BranchRules(List<String> ruleTypes, List<String> requiredStatusCheckContexts) {

	public BranchRules {
		ruleTypes = List.copyOf(ruleTypes);
		requiredStatusCheckContexts = List.copyOf(requiredStatusCheckContexts);
	}

	public static BranchRules none() {
		return new BranchRules(List.of(), List.of());
	}

	public boolean requiresStatusChecks() {
		return ruleTypes.contains("required_status_checks");
	}

	/**
	 * Returns true if a required status check matches the job name, either exactly or as
	 * the prefix of a matrix job context such as {@code test (ubuntu-24.04)}.
	 * @param jobName workflow job name
	 * @return true if the job is a required check
	 */
	public boolean requiresCheck(String jobName) {
		return requiredStatusCheckContexts.stream()
			.anyMatch(context -> context.equals(jobName) || context.startsWith(jobName + " "));
	}

}
