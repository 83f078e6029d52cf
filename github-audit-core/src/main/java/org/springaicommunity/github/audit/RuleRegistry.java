package org.springaicommunity.github.audit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed, ordered set of rules keyed by id. Read-only once constructed.
 */
public final class RuleRegistry {

	private final Map<String, Rule> rules;

	/**
	 * Create a registry preserving the given registration order.
	 * @param rules the rules to register
	 * @throws IllegalStateException if two rules share an id
	 */
	public RuleRegistry(List<? extends Rule> rules) {
		Map<String, Rule> byId = new LinkedHashMap<>();
		for (Rule rule : rules) {
			Rule previous = byId.putIfAbsent(rule.id(), rule);
			if (previous != null) {
				throw new IllegalStateException("Duplicate rule id: " + rule.id());
			}
		}
		this.rules = byId;
	}

	public List<Rule> allRules() {
		return List.copyOf(rules.values());
	}

	public boolean contains(String id) {
		return rules.containsKey(id);
	}

	public int size() {
		return rules.size();
	}

	/**
	 * Select rules by id. The result follows registration order, not the order of the
	 * requested names, and contains each rule once. An empty selection means all rules.
	 * @param names the requested rule ids
	 * @return the selected rules
	 * @throws UnknownRuleException if any name is not registered
	 */
	public List<Rule> filter(Collection<String> names) {
		if (names.isEmpty()) {
			return allRules();
		}
		Set<String> requested = new LinkedHashSet<>(names);
		List<String> unknown = new ArrayList<>();
		for (String name : requested) {
			if (!rules.containsKey(name)) {
				unknown.add(name);
			}
		}
		if (!unknown.isEmpty()) {
			throw new UnknownRuleException(unknown);
		}
		return rules.values().stream().filter(rule -> requested.contains(rule.id())).toList();
	}

}
