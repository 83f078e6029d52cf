package org.springaicommunity.github.audit.rules;

import org.jspecify.annotations.Nullable;
import org.springaicommunity.github.audit.ActionsPermissions;
import org.springaicommunity.github.audit.RepositorySnapshot;
import org.springaicommunity.github.audit.Rule;
import org.springaicommunity.github.audit.Workflow;
import org.springaicommunity.github.audit.WorkflowJob;
import org.springaicommunity.github.audit.WorkflowPermissions;
import org.springaicommunity.github.audit.WorkflowStep;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static org.springaicommunity.github.audit.rules.CheckResult.FAIL;
import static org.springaicommunity.github.audit.rules.CheckResult.OK;
import static org.springaicommunity.github.audit.rules.CheckResult.SKIP;
import static org.springaicommunity.github.audit.rules.CheckResult.failIf;

/**
 * GitHub Actions permission and workflow hygiene rules.
 */
public final class ActionsRules {

	static final List<String> TRUSTED_ACTION_OWNERS = List.of("astral-sh", "aws-actions", "dependabot", "docker",
			"DeterminateSystems", "cachix");

	static final List<String> OUTDATED_RUNNER_IMAGES = List.of("ubuntu-22.04", "ubuntu-20.04", "macos-12");

	private static final Pattern BOT_COMMIT_NAME = Pattern.compile("github-actions\\[bot\\]|outputs\\.app-slug");

	private static final Pattern BOT_COMMIT_EMAIL = Pattern
		.compile("41898282\\+github-actions\\[bot\\]@users\\.noreply\\.github\\.com|outputs\\.app-slug");

	private static final String SECRETS_EXPRESSION = "${{ secrets.";

	private static final String SETUP_PYTHON = "actions/setup-python";

	private static final String CHECKOUT = "actions/checkout";

	// checked-out branches whose pushes are exempt from git-push-pat
	private static final List<String> DATA_BRANCHES = List.of("secrets", "data");

	private ActionsRules() {
	}

	public static List<Rule> rules() {
		List<Rule> rules = new ArrayList<>();
		rules.add(CheckRule.error("disable-actions", "Repository without workflows should disable Actions",
				snapshot -> {
					if (!snapshot.workflows().isEmpty()) {
						return SKIP;
					}
					return failIf(snapshot.actionsPermissions().enabled());
				}));
		rules.add(CheckRule.warning("disable-all-actions", "Repository should not allow all actions", snapshot -> {
			if (snapshot.isPrivate() || !snapshot.actionsPermissions().enabled()) {
				return SKIP;
			}
			return failIf(snapshot.actionsPermissions().allowsAll());
		}));
		rules.add(CheckRule.error("allow-github-owned-actions", "Repository allow actions created by GitHub",
				snapshot -> actionsAllowed(snapshot, "actions/", ActionsPermissions::githubOwnedAllowed)));
		for (String owner : TRUSTED_ACTION_OWNERS) {
			rules.add(CheckRule.error("allow-" + ruleSuffix(owner) + "-owned-actions",
					"Repository allow actions created by " + owner, snapshot -> actionsAllowed(snapshot, owner + "/",
							permissions -> permissions.patternsAllowed().contains(owner + "/*"))));
		}
		rules.add(CheckRule.error("default-workflow-permissions", "Actions should default to read permissions",
				snapshot -> {
					WorkflowPermissions permissions = workflowPermissions(snapshot);
					if (permissions == null) {
						return SKIP;
					}
					return failIf(permissions.defaultsToWrite());
				}));
		rules.add(CheckRule.warning("allow-actions-approve-prs", "Allow Actions to approve pull request reviews",
				snapshot -> {
					WorkflowPermissions permissions = workflowPermissions(snapshot);
					if (permissions == null) {
						return SKIP;
					}
					return failIf(!permissions.canApprovePullRequestReviews());
				}));
		rules.add(CheckRule.warning("use-uv-pip", "Use uv to install pip dependencies", snapshot -> {
			if (!snapshot.hasRequirementsTxt()) {
				return SKIP;
			}
			return failIf(steps(snapshot)
				.anyMatch(step -> step.run().contains("pip install") && !step.run().contains("uv pip install")));
		}));
		rules.add(CheckRule.error("setup-uv", "Use astral-sh/setup-uv",
				snapshot -> failIf(steps(snapshot).anyMatch(step -> step.run().contains("pipx install uv")))));
		rules.add(CheckRule.error("uv-pip-install-with-requirements", "Use uv pip install with requirements.txt",
				snapshot -> {
					if (!snapshot.hasRequirementsTxt()) {
						return SKIP;
					}
					return failIf(steps(snapshot).anyMatch(
							step -> step.run().contains("uv pip install") && !step.run().contains("requirements.txt")));
				}));
		rules.add(CheckRule.error("setup-python-with-python-version-file", "setup-python should use pyproject.toml",
				snapshot -> failIf(steps(snapshot).filter(step -> step.usesAction(SETUP_PYTHON))
					.filter(step -> !step.input("python-version").contains("matrix"))
					.anyMatch(step -> !"pyproject.toml".equals(step.input("python-version-file"))))));
		rules.add(CheckRule.error("disable-setup-python-cache", "setup-python cache should be disabled when using uv",
				snapshot -> failIf(jobs(snapshot).filter(ActionsRules::usesUv)
					.flatMap(job -> job.steps().stream())
					.anyMatch(step -> step.usesAction(SETUP_PYTHON) && step.with().containsKey("cache")))));
		rules.add(CheckRule.warning("no-flake-checker-action", "Do not use DeterminateSystems/flake-checker-action",
				snapshot -> failIf(steps(snapshot)
					.anyMatch(step -> step.usesAction("DeterminateSystems/flake-checker-action")))));
		rules.add(CheckRule.error("git-commit-name", "Git commit name to github-actions",
				snapshot -> failIf(
						steps(snapshot).anyMatch(step -> configuresGitUser(step, "user.name", BOT_COMMIT_NAME)))));
		rules.add(CheckRule.error("git-commit-email", "Git commit email to github-actions", snapshot -> failIf(
				steps(snapshot).anyMatch(step -> configuresGitUser(step, "user.email", BOT_COMMIT_EMAIL)))));
		rules.add(CheckRule.warning("no-workflow-env-secrets", "Do not expose secrets to entire workflow environment",
				snapshot -> failIf(snapshot.workflows().stream().anyMatch(workflow -> exposesSecrets(workflow.env())))));
		rules.add(CheckRule.warning("no-job-env-secrets", "Do not expose secrets to entire job environment",
				snapshot -> failIf(jobs(snapshot).anyMatch(job -> exposesSecrets(job.env())))));
		rules.add(CheckRule.error("git-push-concurrency-group", "Jobs that use git push must be in a concurrency group",
				snapshot -> failIf(snapshot.workflows()
					.stream()
					.anyMatch(workflow -> workflow.jobs()
						.stream()
						.anyMatch(job -> job.runsGitPush() && !workflow.hasConcurrency() && !job.hasConcurrency())))));
		rules.add(CheckRule.error("git-push-if-commited", "git push step should only run if changes are commited",
				snapshot -> failIf(
						steps(snapshot).anyMatch(step -> step.run().contains("git push") && !step.conditional()))));
		rules.add(CheckRule.error("enable-write-contents-permission",
				"Workflows using git push must have contents write permission", ActionsRules::writeContentsPermission));
		rules.add(CheckRule.warning("git-push-pat", "Use PAT when git pushing",
				snapshot -> failIf(jobs(snapshot).anyMatch(job -> pushesWithDefaultToken(snapshot, job)))));
		rules.add(CheckRule.error("dependabot-github-actions",
				"Dependabot should be enabled for GitHub Actions if workflows are present", snapshot -> {
					if (!snapshot.hasWorkflowFiles()) {
						return SKIP;
					}
					return failIf(snapshot.dependabotConfig() == null
							|| !snapshot.dependabotConfig().hasEcosystem("github-actions"));
				}));
		rules.add(CheckRule.error("runner-os", "Lock GitHub Actions runner to a specific version",
				snapshot -> failIf(jobs(snapshot).anyMatch(job -> job.runsOn()
					.stream()
					.anyMatch(label -> label.contains("-latest"))
						|| job.matrixValues().stream().anyMatch(value -> value.endsWith("-latest"))))));
		rules.add(CheckRule.warning("runner-os-outdated", "Use latest runner image",
				snapshot -> failIf(jobs(snapshot).anyMatch(ActionsRules::usesOutdatedRunner))));
		rules.add(CheckRule.error("arm64-qemu", "Use native ARM64 runner instead of QEMU",
				snapshot -> failIf(steps(snapshot).anyMatch(step -> step.usesAction("docker/setup-qemu-action")
						&& step.input("platforms").contains("arm64")))));
		return List.copyOf(rules);
	}

	static Stream<WorkflowJob> jobs(RepositorySnapshot snapshot) {
		return snapshot.workflows().stream().flatMap(workflow -> workflow.jobs().stream());
	}

	static Stream<WorkflowStep> steps(RepositorySnapshot snapshot) {
		return snapshot.workflows().stream().flatMap(Workflow::steps);
	}

	private static String ruleSuffix(String owner) {
		return switch (owner) {
			case "astral-sh" -> "astral";
			case "aws-actions" -> "aws";
			case "DeterminateSystems" -> "determinate-systems";
			default -> owner;
		};
	}

	private static CheckResult actionsAllowed(RepositorySnapshot snapshot, String actionPrefix,
			Predicate<ActionsPermissions> selectedAllows) {
		if (steps(snapshot).noneMatch(step -> step.usesAction(actionPrefix))) {
			return SKIP;
		}
		ActionsPermissions permissions = snapshot.actionsPermissions();
		if (!permissions.enabled()) {
			return SKIP;
		}
		if (permissions.isLocalOnly()) {
			return FAIL;
		}
		if (permissions.isSelected()) {
			return failIf(!selectedAllows.test(permissions));
		}
		return OK;
	}

	private static @Nullable WorkflowPermissions workflowPermissions(RepositorySnapshot snapshot) {
		if (snapshot.fork() || !snapshot.actionsPermissions().enabled()) {
			return null;
		}
		return snapshot.workflowPermissions();
	}

	private static boolean configuresGitUser(WorkflowStep step, String key, Pattern allowedIdentity) {
		String run = step.run();
		return run.contains("git config") && run.contains(key) && !allowedIdentity.matcher(run).find();
	}

	private static boolean exposesSecrets(Map<String, String> env) {
		return env.values().stream().anyMatch(value -> value.contains(SECRETS_EXPRESSION));
	}

	private static CheckResult writeContentsPermission(RepositorySnapshot snapshot) {
		if (!snapshot.actionsPermissions().enabled()) {
			return SKIP;
		}
		for (Workflow workflow : snapshot.workflows()) {
			boolean workflowCanWrite = "write".equals(workflow.permissions().get("contents"));
			for (WorkflowJob job : workflow.jobs()) {
				boolean canWrite = workflowCanWrite || "write".equals(job.permissions().get("contents"));
				if (job.runsGitPush() && !canWrite) {
					return FAIL;
				}
			}
		}
		return OK;
	}

	private static boolean usesUv(WorkflowJob job) {
		return job.steps().stream().anyMatch(step -> step.run().contains("uv "));
	}

	/**
	 * A push made with the default {@code GITHUB_TOKEN} does not trigger further workflow
	 * runs. Pushes to data branches and to the Pages branch are exempt.
	 */
	private static boolean pushesWithDefaultToken(RepositorySnapshot snapshot, WorkflowJob job) {
		if (!job.runsGitPush()) {
			return false;
		}
		List<WorkflowStep> checkouts = job.steps().stream().filter(step -> step.usesAction(CHECKOUT)).toList();
		if (checkouts.stream().anyMatch(step -> !step.input("token").isEmpty())) {
			return false;
		}
		if (checkouts.stream().anyMatch(step -> DATA_BRANCHES.contains(step.input("ref")))) {
			return false;
		}
		String pagesBranch = snapshot.pagesBranch();
		if (pagesBranch != null && job.steps()
			.stream()
			.anyMatch(step -> step.run().contains("git push") && step.run().contains(pagesBranch))) {
			return false;
		}
		return true;
	}

	private static boolean usesOutdatedRunner(WorkflowJob job) {
		return Stream.concat(job.runsOn().stream(), job.matrixValues().stream())
			.anyMatch(label -> OUTDATED_RUNNER_IMAGES.stream().anyMatch(label::contains));
	}

}
