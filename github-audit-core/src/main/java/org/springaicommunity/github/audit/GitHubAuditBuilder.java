package org.springaicommunity.github.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

/**
 * Builder for wiring audit components without a dependency injection container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * GitHubAudit audit = GitHubAuditBuilder.create()
 *     .tokenFromEnv()
 *     .build();
 *
 * List<Rule> rules = DefaultRules.registry().filter(List.of("missing-readme"));
 * RunResult result = audit.engine()
 *     .run(audit.selector().select(List.of(RepositoryRef.parse("octocat/hello-world")), false), rules);
 *
 * // For testing with a mock HTTP client
 * GitHubClient mockClient = mock(GitHubClient.class);
 * GitHubAudit testAudit = GitHubAuditBuilder.create()
 *     .httpClient(mockClient)
 *     .build();
 * }
 * </pre>
 */
public class GitHubAuditBuilder {

	private @Nullable String token;

	private AuditProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private @Nullable RateLimitGate rateLimitGate;

	private GitHubAuditBuilder() {
		this.properties = new AuditProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubAuditBuilder
	 */
	public static GitHubAuditBuilder create() {
		return new GitHubAuditBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public GitHubAuditBuilder token(String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from {@code GITHUB_TOKEN} via {@link EnvironmentSupport}.
	 * @return this builder
	 * @throws IllegalStateException if GITHUB_TOKEN is not set
	 */
	public GitHubAuditBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.load().githubToken();
		if (this.token == null) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token.");
		}
		return this;
	}

	/**
	 * Set audit properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitHubAuditBuilder properties(@Nullable AuditProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper for API responses.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GitHubAuditBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. It is used as is, without the retrying
	 * decorator, and the token is then not required.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public GitHubAuditBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Share a rate limit gate, e.g. between several audits using the same token.
	 * @param rateLimitGate the gate (null to create one per build)
	 * @return this builder
	 */
	public GitHubAuditBuilder rateLimitGate(@Nullable RateLimitGate rateLimitGate) {
		this.rateLimitGate = rateLimitGate;
		return this;
	}

	/**
	 * Build the metadata service directly (for advanced usage).
	 * @return configured RepositoryMetadataService
	 */
	public RepositoryMetadataService buildMetadataService() {
		validateToken();
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		return new GitHubRepositoryMetadataService(buildClient(), mapper,
				new RepositoryFileParser(ObjectMapperFactory.createYaml(), ObjectMapperFactory.createToml()),
				properties.getPageSize());
	}

	/**
	 * Build all audit components.
	 * @return configured GitHubAudit
	 */
	public GitHubAudit build() {
		RepositoryMetadataService metadataService = buildMetadataService();
		return new GitHubAudit(metadataService, new RepositorySelector(metadataService),
				new AuditEngine(metadataService, properties.getWorkerThreads()));
	}

	private void validateToken() {
		// Skip token validation if a custom httpClient is provided
		if (httpClient != null) {
			return;
		}
		if (token == null || token.trim().isEmpty()) {
			throw new IllegalStateException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
	}

	private GitHubClient buildClient() {
		if (httpClient != null) {
			return httpClient;
		}
		RateLimitGate gate = this.rateLimitGate != null ? this.rateLimitGate
				: new RateLimitGate(properties.getRateLimitWaitCeiling());
		GitHubHttpClient client = new GitHubHttpClient(token, properties.getApiBaseUrl(),
				properties.getConnectTimeout(), properties.getRequestTimeout());
		return RetryingGitHubClient.builder()
			.wrapping(client)
			.rateLimitGate(gate)
			.maxRetries(properties.getMaxRetries())
			.initialDelay(properties.getInitialRetryDelay())
			.maxDelay(properties.getMaxRetryDelay())
			.pacingThreshold(properties.getPacingThreshold())
			.build();
	}

}
