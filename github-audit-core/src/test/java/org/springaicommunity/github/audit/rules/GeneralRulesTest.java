package org.springaicommunity.github.audit.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springaicommunity.github.audit.BranchProtection;
import org.springaicommunity.github.audit.BranchRules;
import org.springaicommunity.github.audit.Finding;
import org.springaicommunity.github.audit.LicenseInfo;
import org.springaicommunity.github.audit.RepositorySnapshot;
import org.springaicommunity.github.audit.Rule;
import org.springaicommunity.github.audit.Severity;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.springaicommunity.github.audit.rules.Snapshots.*;

@DisplayName("GeneralRules Tests")
class GeneralRulesTest {

	private final List<Rule> rules = GeneralRules.rules();

	@Test
	@DisplayName("A compliant repository should produce no findings")
	void compliantRepositoryShouldPass() {
		RepositorySnapshot snapshot = compliant().build();

		assertThat(rules.stream().flatMap(rule -> rule.evaluate(snapshot).stream())).isEmpty();
	}

	@Test
	@DisplayName("Evaluating the same snapshot twice should give the same findings")
	void evaluationShouldBeDeterministic() {
		RepositorySnapshot snapshot = compliant().description("").hasWiki(true).topics(List.of()).build();

		List<Finding> first = rules.stream().flatMap(rule -> rule.evaluate(snapshot).stream()).toList();
		List<Finding> second = rules.stream().flatMap(rule -> rule.evaluate(snapshot).stream()).toList();

		assertThat(first).isEqualTo(second).extracting(Finding::ruleId)
			.containsExactly("missing-description", "missing-topics", "no-wiki");
	}

	@Nested
	@DisplayName("Metadata Rules")
	class MetadataRulesTest {

		@Test
		@DisplayName("Should flag a missing description as an error")
		void missingDescription() {
			List<Finding> findings = evaluate(rules, "missing-description", compliant().description("  ").build());

			assertThat(findings).singleElement().satisfies(finding -> {
				assertThat(finding.severity()).isEqualTo(Severity.ERROR);
				assertThat(finding.message()).isEqualTo("Missing repository description");
				assertThat(finding.fixable()).isFalse();
			});
		}

		@Test
		@DisplayName("License rules should skip private repositories")
		void licenseRulesSkipPrivate() {
			RepositorySnapshot snapshot = compliant().visibility("private").license(null).build();

			assertThat(evaluate(rules, "missing-license", snapshot)).isEmpty();
			assertThat(evaluate(rules, "non-mit-license", snapshot)).isEmpty();
		}

		@Test
		@DisplayName("Should flag missing and non-MIT licenses on public repositories")
		void licenseRules() {
			assertThat(evaluate(rules, "missing-license", compliant().license(null).build())).hasSize(1);
			assertThat(evaluate(rules, "non-mit-license", compliant().license(null).build())).isEmpty();
			assertThat(evaluate(rules, "non-mit-license",
					compliant().license(new LicenseInfo("Apache-2.0", "Apache License 2.0")).build()))
				.singleElement()
				.extracting(Finding::severity)
				.isEqualTo(Severity.WARNING);
		}

		@Test
		@DisplayName("Should distinguish missing topics from a single topic")
		void topicRules() {
			RepositorySnapshot none = compliant().topics(List.of()).build();
			RepositorySnapshot one = compliant().topics(List.of("java")).build();

			assertThat(evaluate(rules, "missing-topics", none)).hasSize(1);
			assertThat(evaluate(rules, "too-few-topics", none)).isEmpty();
			assertThat(evaluate(rules, "missing-topics", one)).isEmpty();
			assertThat(evaluate(rules, "too-few-topics", one)).hasSize(1);
		}

		@Test
		@DisplayName("Should flag a missing README and AGENTS.md")
		void fileRules() {
			RepositorySnapshot snapshot = compliant().hasReadme(false).files(Set.of()).build();

			assertThat(evaluate(rules, "missing-readme", snapshot)).hasSize(1);
			assertThat(evaluate(rules, "missing-agents", snapshot)).hasSize(1);
		}

	}

	@Nested
	@DisplayName("Settings Rules")
	class SettingsRulesTest {

		@Test
		@DisplayName("Feature toggles should report fixable findings")
		void featureToggles() {
			RepositorySnapshot snapshot = compliant().hasIssues(false)
				.hasProjects(true)
				.hasWiki(true)
				.hasDiscussions(true)
				.deleteBranchOnMerge(false)
				.allowMergeCommit(false)
				.build();

			List<Finding> findings = rules.stream().flatMap(rule -> rule.evaluate(snapshot).stream()).toList();

			assertThat(findings).extracting(Finding::ruleId, Finding::severity)
				.containsExactly(tuple("has-issues", Severity.WARNING), tuple("no-projects", Severity.WARNING),
						tuple("no-wiki", Severity.ERROR), tuple("no-discussions", Severity.ERROR),
						tuple("delete-branch-on-merge", Severity.ERROR),
						tuple("enable-merge-commit", Severity.WARNING));
			assertThat(findings).allMatch(Finding::fixable);
		}

		@ParameterizedTest
		@CsvSource({ "1024, 0", "51201, 1", "1048576, 1", "1048577, 1" })
		@DisplayName("git-size should report one finding above 50 MiB")
		void gitSizeFindingCount(long sizeKb, int expected) {
			assertThat(evaluate(rules, "git-size", compliant().sizeKb(sizeKb).build())).hasSize(expected);
		}

		@Test
		@DisplayName("git-size should escalate to an error above 1 GiB")
		void gitSizeSeverity() {
			assertThat(evaluate(rules, "git-size", compliant().sizeKb(60 * 1024).build())).singleElement()
				.extracting(Finding::severity)
				.isEqualTo(Severity.WARNING);
			assertThat(evaluate(rules, "git-size", compliant().sizeKb(2 * 1024 * 1024).build())).singleElement()
				.extracting(Finding::severity)
				.isEqualTo(Severity.ERROR);
		}

		@Test
		@DisplayName("Should flag a gh-pages publishing branch")
		void ghPagesBranch() {
			assertThat(evaluate(rules, "wip-gh-pages-branch", compliant().pagesBranch("gh-pages").build()))
				.hasSize(1);
			assertThat(evaluate(rules, "wip-gh-pages-branch", compliant().pagesBranch("main").build())).isEmpty();
		}

	}

	@Nested
	@DisplayName("Branch Rules")
	class BranchRulesTest {

		@Test
		@DisplayName("An unprotected default branch without rulesets should be an error")
		void unprotectedDefaultBranch() {
			RepositorySnapshot snapshot = compliant().defaultBranchProtection(BranchProtection.unprotected()).build();

			List<Finding> findings = evaluate(rules, "default-branch-protection", snapshot);

			assertThat(findings).singleElement().satisfies(finding -> {
				assertThat(finding.repository()).isEqualTo(snapshot.ref());
				assertThat(finding.severity()).isEqualTo(Severity.ERROR);
				assertThat(finding.message()).isEqualTo("Default branch should be protected");
			});
		}

		@Test
		@DisplayName("A ruleset on the default branch counts as protection")
		void rulesetCountsAsProtection() {
			RepositorySnapshot snapshot = compliant().defaultBranchProtection(BranchProtection.unprotected())
				.defaultBranchRules(new BranchRules(List.of("deletion"), List.of()))
				.build();

			assertThat(evaluate(rules, "default-branch-protection", snapshot)).isEmpty();
		}

		@Test
		@DisplayName("Unreadable protection settings should be skipped")
		void unavailableProtectionIsSkipped() {
			RepositorySnapshot snapshot = compliant().defaultBranchProtection(BranchProtection.unavailable()).build();

			assertThat(evaluate(rules, "default-branch-protection", snapshot)).isEmpty();
		}

		@Test
		@DisplayName("Auto-merging repositories should require some status check")
		void requiredStatusCheck() {
			RepositorySnapshot.Builder autoMerging = compliant().allowAutoMerge(true).file(GeneralRules.MERGE_WORKFLOW);

			assertThat(evaluate(rules, "required-status-check", autoMerging.build())).hasSize(1);
			assertThat(evaluate(rules, "required-status-check",
					autoMerging.defaultBranchRules(new BranchRules(List.of("required_status_checks"), List.of()))
						.build()))
				.isEmpty();
			assertThat(evaluate(rules, "required-status-check", compliant().allowAutoMerge(true).build())).isEmpty();
		}

		@Test
		@DisplayName("A test job should be a required status check, matrix contexts included")
		void requiredTestStatusCheck() {
			RepositorySnapshot.Builder withTestJob = compliant().workflow(workflow("test.yml", job("test")));

			assertThat(evaluate(rules, "required-test-status-check", withTestJob.build())).hasSize(1);
			assertThat(evaluate(rules, "required-test-status-check",
					withTestJob
						.defaultBranchRules(new BranchRules(List.of("required_status_checks"),
								List.of("test (ubuntu-24.04)")))
						.build()))
				.isEmpty();
			assertThat(evaluate(rules, "required-test-status-check", compliant().build())).isEmpty();
		}

	}

	@Nested
	@DisplayName("Release Rules")
	class ReleaseRulesTest {

		private static final Instant NOW = Instant.parse("2026-06-01T00:00:00Z");

		private RepositorySnapshot.Builder stable() {
			return compliant().fetchedAt(NOW)
				.createdAt(NOW.minus(Duration.ofDays(400)))
				.lastOwnerCommitAt(NOW.minus(Duration.ofDays(200)));
		}

		@Test
		@DisplayName("A quiet project should have a release after its last owner commit")
		void tagStableProjects() {
			assertThat(evaluate(rules, "tag-stable-projects",
					stable().latestReleaseAt(NOW.minus(Duration.ofDays(150))).build()))
				.isEmpty();
			assertThat(evaluate(rules, "tag-stable-projects",
					stable().latestReleaseAt(NOW.minus(Duration.ofDays(250))).build()))
				.singleElement()
				.satisfies(finding -> {
					assertThat(finding.severity()).isEqualTo(Severity.WARNING);
					assertThat(finding.message()).isEqualTo("Tag latest repository release");
				});
		}

		@Test
		@DisplayName("A quiet project without any release should be flagged")
		void tagStableProjectsWithoutRelease() {
			assertThat(evaluate(rules, "tag-stable-projects", stable().build())).hasSize(1);
			assertThat(evaluate(rules, "tag-stable-projects", stable().lastOwnerCommitAt(null).build())).hasSize(1);
		}

		@Test
		@DisplayName("New, active or private projects should be skipped")
		void tagStableProjectsSkipped() {
			assertThat(evaluate(rules, "tag-stable-projects",
					stable().createdAt(NOW.minus(Duration.ofDays(30))).build()))
				.isEmpty();
			assertThat(evaluate(rules, "tag-stable-projects",
					stable().lastOwnerCommitAt(NOW.minus(Duration.ofDays(10))).build()))
				.isEmpty();
			assertThat(evaluate(rules, "tag-stable-projects", stable().visibility("private").build())).isEmpty();
			assertThat(evaluate(rules, "tag-stable-projects", stable().createdAt(null).build())).isEmpty();
		}

	}

}
