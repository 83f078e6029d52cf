package org.springaicommunity.github.audit;

import org.jspecify.annotations.Nullable;

import java.util.stream.Stream;

/**
 * Read-only access to repository metadata on GitHub.
 *
 * <p>
 * Implementations must be safe for use from several worker threads at once. All failures
 * surface as {@link GitHubApiException} subclasses.
 */
public interface RepositoryMetadataService {

	/**
	 * Fetch every attribute and sub-resource the rules depend on.
	 * @param ref the repository
	 * @return fully hydrated snapshot
	 * @throws NotFoundException if the repository does not exist or is not visible
	 * @throws ForbiddenException if the token lacks the required scope
	 * @throws RateLimitExceededException if quota is exhausted beyond the wait ceiling
	 */
	RepositorySnapshot fetch(RepositoryRef ref);

	/**
	 * List repositories owned by a user, walking all pages lazily.
	 * @param owner owner login, or null for the authenticated user
	 * @param activeOnly whether to exclude archived repositories and forks
	 * @return finite, non-restartable stream of repository references
	 */
	Stream<RepositoryRef> listRepositories(@Nullable String owner, boolean activeOnly);

	/**
	 * Resolve the login of the token owner, validating the token in the process.
	 * @return login name
	 * @throws AuthenticationException if the token is invalid or expired
	 */
	String authenticatedLogin();

}
