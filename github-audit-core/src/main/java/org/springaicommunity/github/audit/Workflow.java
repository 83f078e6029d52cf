package org.springaicommunity.github.audit;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * A parsed GitHub Actions workflow file.
 *
 * @param path repository path, e.g. {@code .github/workflows/test.yml}
 * @param name workflow name, or empty
 * @param env workflow-level environment
 * @param permissions workflow-level token permissions
 * @param hasConcurrency whether the workflow declares a concurrency group
 * @param jobs jobs in declaration order
 */
public record Workflow(String path, String name, Map<String, String> env, Map<String, String> permissions,
		boolean hasConcurrency, List<WorkflowJob> jobs) {

	public Workflow {
		env = Map.copyOf(env);
		permissions = Map.copyOf(permissions);
		jobs = List.copyOf(jobs);
	}

	/**
	 * Placeholder for a workflow file that could not be parsed.
	 * @param path repository path of the file
	 * @return workflow without jobs
	 */
	public static Workflow empty(String path) {
		return new Workflow(path, "", Map.of(), Map.of(), false, List.of());
	}

	public Stream<WorkflowStep> steps() {
		return jobs.stream().flatMap(job -> job.steps().stream());
	}

}
