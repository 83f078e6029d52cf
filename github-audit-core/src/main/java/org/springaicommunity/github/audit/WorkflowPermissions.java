package org.springaicommunity.github.audit;

/**
 * Default {@code GITHUB_TOKEN} permissions granted to workflows.
 *
 * @param defaultWorkflowPermissions {@code read} or {@code write}
 * @param canApprovePullRequestReviews whether workflows may approve pull requests
 */
public record WorkflowPermissions(String defaultWorkflowPermissions, boolean canApprovePullRequestReviews) {

	public boolean defaultsToWrite() {
		return "write".equals(defaultWorkflowPermissions);
	}

}
