package org.springaicommunity.github.audit.rules;

import org.springaicommunity.github.audit.RepositorySnapshot;
import org.springaicommunity.github.audit.Rule;

import java.util.List;
import java.util.function.Predicate;

import static org.springaicommunity.github.audit.rules.CheckResult.SKIP;
import static org.springaicommunity.github.audit.rules.CheckResult.failIf;

/**
 * Rules for repositories that use Dependabot.
 */
public final class DependabotRules {

	private DependabotRules() {
	}

	public static List<Rule> rules() {
		return List.of(CheckRule.warning("allow-auto-merge", "Repository should allow auto-merge", snapshot -> {
			if (snapshot.fork() || snapshot.dependabotConfig() == null) {
				return SKIP;
			}
			return failIf(!snapshot.allowAutoMerge());
		}).asFixable(), CheckRule.warning("dependabot-auto-merge", "Set up Dependabot auto-merge", snapshot -> {
			if (snapshot.fork() || snapshot.dependabotConfig() == null) {
				return SKIP;
			}
			return failIf(!snapshot.hasFile(GeneralRules.MERGE_WORKFLOW));
		}), CheckRule.warning("dependabot-schedule-weekly", "Dependabot should be scheduled weekly", snapshot -> {
			if (snapshot.dependabotConfig() == null) {
				return SKIP;
			}
			return failIf(!snapshot.dependabotConfig().isScheduledWeekly());
		}), CheckRule.error("pip-dependabot", "Dependabot should be enabled for pip ecosystem", snapshot -> {
			if (!snapshot.hasRequirementsTxt()) {
				return SKIP;
			}
			return failIf(snapshot.dependabotConfig() == null || !snapshot.dependabotConfig().hasEcosystem("pip"));
		}), CheckRule.warning("pip-dependabot-ignore-types", "Dependabot should ignore types-* packages",
				snapshot -> pipIgnores(snapshot, line -> line.contains("types-"), "types-*")),
				CheckRule.warning("pip-dependabot-ignore-ruff-patches", "Dependabot should ignore ruff patches",
						snapshot -> pipIgnores(snapshot, line -> line.contains("ruff=="), "ruff")));
	}

	/**
	 * Checks that the pip update entry ignores a dependency that {@code requirements.txt}
	 * pins. Skipped when no requirement line matches.
	 */
	private static CheckResult pipIgnores(RepositorySnapshot snapshot, Predicate<String> requirement,
			String dependencyName) {
		if (snapshot.requirementLines().stream().noneMatch(requirement)) {
			return SKIP;
		}
		return failIf(snapshot.dependabotConfig() == null
				|| !snapshot.dependabotConfig().ignores("pip", dependencyName));
	}

}
