package org.springaicommunity.github.audit;

import java.util.regex.Pattern;

/**
 * Identifies a repository by owner and name.
 *
 * <p>
 * Used as the lookup key when fetching metadata and as the grouping key for findings.
 *
 * @param owner the owning user or organization login
 * @param name the repository name (without owner)
 */
public record RepositoryRef(String owner, String name) {

	private static final Pattern SEGMENT = Pattern.compile("^[a-zA-Z0-9._-]+$");

	public RepositoryRef {
		if (!SEGMENT.matcher(owner).matches()) {
			throw new IllegalArgumentException("Invalid repository owner: '" + owner + "'");
		}
		if (!SEGMENT.matcher(name).matches()) {
			throw new IllegalArgumentException("Invalid repository name: '" + name + "'");
		}
	}

	/**
	 * Parse an {@code owner/name} identifier.
	 * @param fullName repository in "owner/name" format
	 * @return the parsed reference
	 * @throws IllegalArgumentException if the identifier is not in "owner/name" format
	 */
	public static RepositoryRef parse(String fullName) {
		String[] parts = fullName.trim().split("/");
		if (parts.length != 2) {
			throw new IllegalArgumentException(
					"Repository must be in format 'owner/name' (e.g., 'spring-projects/spring-ai'): " + fullName);
		}
		return new RepositoryRef(parts[0], parts[1]);
	}

	/**
	 * Returns the repository in "owner/name" format.
	 * @return the full name
	 */
	public String fullName() {
		return owner + "/" + name;
	}

	/**
	 * Returns the REST API path of this repository.
	 * @return path such as {@code /repos/owner/name}
	 */
	public String apiPath() {
		return "/repos/" + owner + "/" + name;
	}

	@Override
	public String toString() {
		return fullName();
	}

}
