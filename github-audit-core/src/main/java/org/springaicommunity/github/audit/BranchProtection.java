package org.springaicommunity.github.audit;

/**
 * Classic branch protection state of a single branch.
 *
 * @param status whether the branch is protected, unprotected, or the settings could not be
 * read
 */
public record BranchProtection(Status status) {

	public static BranchProtection protectedBranch() {
		return new BranchProtection(Status.PROTECTED);
	}

	public static BranchProtection unprotected() {
		return new BranchProtection(Status.UNPROTECTED);
	}

	/**
	 * Protection settings that could not be read, e.g. because the repository plan does
	 * not support branch protection.
	 * @return placeholder with unknown settings
	 */
	public static BranchProtection unavailable() {
		return new BranchProtection(Status.UNAVAILABLE);
	}

	public boolean isProtected() {
		return status == Status.PROTECTED;
	}

	public boolean isAvailable() {
		return status != Status.UNAVAILABLE;
	}

	public enum Status {

		PROTECTED, UNPROTECTED, UNAVAILABLE

	}

}
