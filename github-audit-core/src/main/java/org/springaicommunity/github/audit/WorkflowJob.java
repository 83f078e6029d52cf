package org.springaicommunity.github.audit;

import java.util.List;
import java.util.Map;

/**
 * A job of a GitHub Actions workflow.
 *
 * @param id job key in the {@code jobs} map
 * @param runsOn runner labels from {@code runs-on}
 * @param matrixValues every scalar value listed under {@code strategy.matrix}
 * @param env job-level environment
 * @param permissions job-level token permissions
 * @param hasConcurrency whether the job declares a concurrency group
 * @param steps the job's steps in order
 */
public record WorkflowJob(String id, List<String> runsOn, List<String> matrixValues, Map<String, String> env,
		Map<String, String> permissions, boolean hasConcurrency, List<WorkflowStep> steps) {

	public WorkflowJob {
		runsOn = List.copyOf(runsOn);
		matrixValues = List.copyOf(matrixValues);
		env = Map.copyOf(env);
		permissions = Map.copyOf(permissions);
		steps = List.copyOf(steps);
	}

	public boolean runsGitPush() {
		return steps.stream().anyMatch(step -> step.run().contains("git push"));
	}

}
