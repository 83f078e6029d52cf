package org.springaicommunity.github.audit.rules;

import org.springaicommunity.github.audit.RepositorySnapshot;
import org.springaicommunity.github.audit.Rule;
import org.springaicommunity.github.audit.WorkflowJob;

import java.util.List;

import static org.springaicommunity.github.audit.rules.CheckResult.SKIP;
import static org.springaicommunity.github.audit.rules.CheckResult.failIf;

/**
 * Rules for repositories with a Nix flake.
 */
public final class NixRules {

	static final String FLAKE = "flake.nix";

	private NixRules() {
	}

	public static List<Rule> rules() {
		return List.of(
				CheckRule.error("required-lockfile-drv-changed-status-check",
						"Add Ruleset to require 'lockfile-drv-changed' status check",
						snapshot -> GeneralRules.requiredStatusCheck(snapshot, "lockfile-drv-changed")),
				CheckRule.error("renovate-nix", "Configure Renovate for Nix updates", snapshot -> {
					if (!snapshot.hasFile(FLAKE)) {
						return SKIP;
					}
					return failIf(!snapshot.hasFile(".github/renovate.json"));
				}), CheckRule.warning("nix-flake-check-no-checkout",
						"Use direct repo URI instead of checkout for 'nix flake check'", NixRules::flakeCheckWithoutCheckout));
	}

	private static CheckResult flakeCheckWithoutCheckout(RepositorySnapshot snapshot) {
		if (!snapshot.hasFile(FLAKE)) {
			return SKIP;
		}
		return failIf(ActionsRules.jobs(snapshot).anyMatch(NixRules::checksOutAndRunsFlakeCheck));
	}

	private static boolean checksOutAndRunsFlakeCheck(WorkflowJob job) {
		boolean checkout = job.steps().stream().anyMatch(step -> step.usesAction("actions/checkout"));
		boolean flakeCheck = job.steps().stream().anyMatch(step -> step.run().contains("nix flake check"));
		return checkout && flakeCheck;
	}

}
