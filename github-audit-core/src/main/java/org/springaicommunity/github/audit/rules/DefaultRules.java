package org.springaicommunity.github.audit.rules;

import org.springaicommunity.github.audit.Rule;
import org.springaicommunity.github.audit.RuleRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * The compiled-in rule set, in registration order: general, Actions, Dependabot, Nix,
 * Python.
 */
public final class DefaultRules {

	private static final RuleRegistry REGISTRY = new RuleRegistry(all());

	private DefaultRules() {
	}

	/**
	 * Returns the process-wide registry of built-in rules.
	 * @return shared read-only registry
	 */
	public static RuleRegistry registry() {
		return REGISTRY;
	}

	static List<Rule> all() {
		List<Rule> rules = new ArrayList<>();
		rules.addAll(GeneralRules.rules());
		rules.addAll(ActionsRules.rules());
		rules.addAll(DependabotRules.rules());
		rules.addAll(NixRules.rules());
		rules.addAll(PythonRules.rules());
		return rules;
	}

}
