package org.springaicommunity.github.audit;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Parsed {@code .github/dependabot.yml}.
 *
 * @param updates configured update entries
 */
public record DependabotConfig(List<Update> updates) {

	public DependabotConfig {
		updates = List.copyOf(updates);
	}

	public boolean hasEcosystem(String ecosystem) {
		return updates.stream().anyMatch(update -> ecosystem.equals(update.ecosystem()));
	}

	/**
	 * Returns true if an update entry of the ecosystem ignores the dependency name.
	 * @param ecosystem value of {@code package-ecosystem}
	 * @param dependencyName exact {@code dependency-name} pattern, e.g. {@code types-*}
	 * @return whether the dependency is ignored
	 */
	public boolean ignores(String ecosystem, String dependencyName) {
		return updates.stream()
			.filter(update -> ecosystem.equals(update.ecosystem()))
			.anyMatch(update -> update.ignoredDependencies().contains(dependencyName));
	}

	/**
	 * Returns true if there is at least one update entry and every entry is scheduled
	 * weekly.
	 * @return whether all updates run weekly
	 */
	public boolean isScheduledWeekly() {
		return !updates.isEmpty() && updates.stream().allMatch(update -> "weekly".equals(update.interval()));
	}

	/**
	 * One entry of the {@code updates} list.
	 *
	 * @param ecosystem value of {@code package-ecosystem}
	 * @param interval value of {@code schedule.interval}, if any
	 * @param ignoredDependencies {@code dependency-name} values under {@code ignore}
	 */
	public record Update(String ecosystem, @Nullable String interval, List<String> ignoredDependencies) {

		public Update {
			ignoredDependencies = List.copyOf(ignoredDependencies);
		}

	}

}
