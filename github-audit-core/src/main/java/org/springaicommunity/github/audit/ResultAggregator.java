package org.springaicommunity.github.audit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Presentation-only groupings of a {@link RunResult}'s findings.
 *
 * <p>
 * Both projections keep every finding exactly once and unchanged. Keys appear in order of
 * their first finding, and findings keep their order within each group.
 */
public final class ResultAggregator {

	private ResultAggregator() {
	}

	/**
	 * Group findings by repository.
	 * @param result the run result
	 * @return findings per repository
	 */
	public static Map<RepositoryRef, List<Finding>> groupByRepository(RunResult result) {
		return group(result.findings(), Finding::repository);
	}

	/**
	 * Group findings by rule id. Each finding still names its repository.
	 * @param result the run result
	 * @return findings per rule id
	 */
	public static Map<String, List<Finding>> groupByRule(RunResult result) {
		return group(result.findings(), Finding::ruleId);
	}

	private static <K> Map<K, List<Finding>> group(List<Finding> findings, Function<Finding, K> key) {
		Map<K, List<Finding>> groups = new LinkedHashMap<>();
		for (Finding finding : findings) {
			groups.computeIfAbsent(key.apply(finding), k -> new ArrayList<>()).add(finding);
		}
		groups.replaceAll((k, v) -> List.copyOf(v));
		return Collections.unmodifiableMap(groups);
	}

}
