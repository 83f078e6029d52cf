package org.springaicommunity.github.audit.rules;

import org.springaicommunity.github.audit.RepositorySnapshot;
import org.springaicommunity.github.audit.Rule;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.springaicommunity.github.audit.rules.CheckResult.FAIL;
import static org.springaicommunity.github.audit.rules.CheckResult.OK;
import static org.springaicommunity.github.audit.rules.CheckResult.SKIP;
import static org.springaicommunity.github.audit.rules.CheckResult.failIf;

/**
 * Repository metadata and settings rules.
 */
public final class GeneralRules {

	static final String MERGE_WORKFLOW = ".github/workflows/merge.yml";

	static final Duration STABLE_QUIET_PERIOD = Duration.ofDays(90);

	private GeneralRules() {
	}

	public static List<Rule> rules() {
		return List.of(
				CheckRule.error("missing-description", "Missing repository description",
						snapshot -> failIf(!snapshot.hasDescription())),
				CheckRule.error("missing-license", "Missing license file", snapshot -> {
					if (snapshot.isPrivate()) {
						return SKIP;
					}
					return failIf(snapshot.license() == null);
				}), CheckRule.warning("non-mit-license", "Using non-MIT license", snapshot -> {
					if (snapshot.isPrivate()) {
						return SKIP;
					}
					return failIf(snapshot.license() != null && !snapshot.license().isMit());
				}), CheckRule.error("missing-readme", "Missing README file", snapshot -> failIf(!snapshot.hasReadme())),
				CheckRule.warning("missing-agents", "Missing AGENTS.md file",
						snapshot -> failIf(!snapshot.hasFile("AGENTS.md"))),
				CheckRule.error("missing-topics", "Missing topics", snapshot -> failIf(snapshot.topics().isEmpty())),
				CheckRule.warning("too-few-topics", "Only one topic", snapshot -> failIf(snapshot.topics().size() == 1)),
				CheckRule
					.warning("has-issues", "Repository doesn't have Issues enabled",
							snapshot -> failIf(!snapshot.hasIssues()))
					.asFixable(),
				CheckRule
					.warning("no-projects", "Repository has Projects enabled", snapshot -> failIf(snapshot.hasProjects()))
					.asFixable(),
				CheckRule.error("no-wiki", "Repository has Wiki enabled", snapshot -> failIf(snapshot.hasWiki()))
					.asFixable(),
				CheckRule
					.error("no-discussions", "Repository has Discussions enabled",
							snapshot -> failIf(snapshot.hasDiscussions()))
					.asFixable(),
				new GitSizeRule(),
				CheckRule
					.error("delete-branch-on-merge", "Repository should delete branches on merge",
							snapshot -> failIf(!snapshot.deleteBranchOnMerge()))
					.asFixable(),
				CheckRule
					.warning("enable-merge-commit", "Repository should allow merge commits",
							snapshot -> failIf(!snapshot.allowMergeCommit()))
					.asFixable(),
				CheckRule.warning("tag-stable-projects", "Tag latest repository release",
						GeneralRules::tagStableProject),
				CheckRule.error("default-branch-protection", "Default branch should be protected",
						GeneralRules::defaultBranchProtection),
				CheckRule.error("required-status-check", "Add Ruleset to require some status check",
						GeneralRules::requiredSomeStatusCheck),
				CheckRule.warning("required-test-status-check", "Add Ruleset to require 'test' status check",
						snapshot -> requiredStatusCheck(snapshot, "test")),
				CheckRule.warning("wip-gh-pages-branch", "Avoid using gh-pages branch",
						snapshot -> failIf("gh-pages".equals(snapshot.pagesBranch()))));
	}

	private static CheckResult defaultBranchProtection(RepositorySnapshot snapshot) {
		if (!snapshot.defaultBranchProtection().isAvailable()) {
			return SKIP;
		}
		if (snapshot.defaultBranchProtection().isProtected() || !snapshot.defaultBranchRules().ruleTypes().isEmpty()) {
			return OK;
		}
		return FAIL;
	}

	/**
	 * A public repository older than the quiet period whose owner has not committed within
	 * it should have a release covering its last owner commit.
	 */
	private static CheckResult tagStableProject(RepositorySnapshot snapshot) {
		Instant createdAt = snapshot.createdAt();
		if (snapshot.isPrivate() || createdAt == null) {
			return SKIP;
		}
		Instant quietSince = snapshot.fetchedAt().minus(STABLE_QUIET_PERIOD);
		if (createdAt.isAfter(quietSince)) {
			return SKIP;
		}
		Instant lastCommit = snapshot.lastOwnerCommitAt();
		if (lastCommit != null && !lastCommit.isBefore(quietSince)) {
			return SKIP;
		}
		Instant release = snapshot.latestReleaseAt();
		if (release == null) {
			return FAIL;
		}
		return failIf(lastCommit != null && !lastCommit.isBefore(release));
	}

	private static CheckResult requiredSomeStatusCheck(RepositorySnapshot snapshot) {
		if (!snapshot.allowAutoMerge() || !snapshot.hasFile(MERGE_WORKFLOW)) {
			return SKIP;
		}
		return failIf(!snapshot.defaultBranchRules().requiresStatusChecks());
	}

	/**
	 * Checks that a job defined in some workflow is a required status check of the
	 * default branch. Skipped when no workflow defines the job.
	 */
	static CheckResult requiredStatusCheck(RepositorySnapshot snapshot, String jobName) {
		boolean defined = snapshot.workflows()
			.stream()
			.flatMap(workflow -> workflow.jobs().stream())
			.anyMatch(job -> job.id().equals(jobName));
		if (!defined) {
			return SKIP;
		}
		return failIf(!snapshot.defaultBranchRules().requiresCheck(jobName));
	}

}
