package org.springaicommunity.github.audit;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * GitHub Actions permissions of a repository.
 *
 * @param enabled whether Actions may run at all
 * @param allowedActions {@code all}, {@code local_only} or {@code selected}; null when
 * Actions are disabled
 * @param githubOwnedAllowed with {@code selected}: actions owned by GitHub are allowed
 * @param verifiedAllowed with {@code selected}: actions from verified creators are allowed
 * @param patternsAllowed with {@code selected}: explicitly allowed action patterns
 */
public record ActionsPermissions(boolean enabled, @Nullable String allowedActions, boolean githubOwnedAllowed,
		boolean verifiedAllowed, List<String> patternsAllowed) {

	public ActionsPermissions {
		patternsAllowed = List.copyOf(patternsAllowed);
	}

	public static ActionsPermissions disabled() {
		return new ActionsPermissions(false, null, false, false, List.of());
	}

	public static ActionsPermissions allowingAll() {
		return new ActionsPermissions(true, "all", true, true, List.of());
	}

	public boolean allowsAll() {
		return "all".equals(allowedActions);
	}

	public boolean isLocalOnly() {
		return "local_only".equals(allowedActions);
	}

	public boolean isSelected() {
		return "selected".equals(allowedActions);
	}

}
