package org.springaicommunity.github.audit;

import java.util.Map;

/**
 * A step of a workflow job. Absent {@code uses} or {@code run} keys are empty strings.
 *
 * @param name step name, or empty
 * @param uses referenced action, e.g. {@code actions/checkout@v4}
 * @param run shell script
 * @param with inputs passed to the action, rendered as strings
 * @param conditional whether the step declares an {@code if} condition
 */
public record WorkflowStep(String name, String uses, String run, Map<String, String> with, boolean conditional) {

	public WorkflowStep {
		with = Map.copyOf(with);
	}

	public boolean usesAction(String prefix) {
		return uses.startsWith(prefix);
	}

	public String input(String key) {
		return with.getOrDefault(key, "");
	}

}
