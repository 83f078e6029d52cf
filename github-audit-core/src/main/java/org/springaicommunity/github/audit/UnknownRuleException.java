package org.springaicommunity.github.audit;

import java.util.List;

/**
 * A requested rule id is not registered. Raised before any repository is fetched.
 */
public class UnknownRuleException extends IllegalArgumentException {

	private final List<String> unknownIds;

	public UnknownRuleException(List<String> unknownIds) {
		super("Unknown rule" + (unknownIds.size() > 1 ? "s" : "") + ": " + String.join(", ", unknownIds));
		this.unknownIds = List.copyOf(unknownIds);
	}

	public List<String> getUnknownIds() {
		return unknownIds;
	}

}
