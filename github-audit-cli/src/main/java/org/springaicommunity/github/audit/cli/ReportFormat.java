package org.springaicommunity.github.audit.cli;

import java.util.Locale;

/**
 * Grouping used when printing findings.
 */
public enum ReportFormat {

	/** One block per repository. */
	REPO,

	/** One block per rule. */
	RULE;

	/**
	 * Parse a {@code --format} value.
	 * @param value {@code repo} or {@code rule}, case-insensitive
	 * @return the format
	 * @throws IllegalArgumentException for any other value
	 */
	public static ReportFormat fromOption(String value) {
		return switch (value.toLowerCase(Locale.ROOT)) {
			case "repo" -> REPO;
			case "rule" -> RULE;
			default -> throw new IllegalArgumentException("Invalid format '" + value + "': must be 'repo' or 'rule'");
		};
	}

}
