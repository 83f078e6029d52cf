package org.springaicommunity.github.audit;

import java.time.Duration;

/**
 * Configuration properties for an audit run.
 *
 * <p>
 * Properties can be set directly via setters and passed to {@link GitHubAuditBuilder}.
 * The defaults suit a personal account with a few hundred repositories.
 */
public class AuditProperties {

	/**
	 * Number of repositories fetched and evaluated concurrently.
	 */
	private int workerThreads = 4;

	/**
	 * Retries after the first failed attempt of a request (2 means 3 attempts).
	 */
	private int maxRetries = 2;

	/**
	 * Delay before the first retry; doubled on each further retry.
	 */
	private Duration initialRetryDelay = Duration.ofSeconds(1);

	/**
	 * Upper bound of the retry delay.
	 */
	private Duration maxRetryDelay = Duration.ofSeconds(30);

	/**
	 * Longest time to wait for a rate limit reset before failing the request.
	 */
	private Duration rateLimitWaitCeiling = Duration.ofMinutes(15);

	/**
	 * Timeout of a single HTTP request.
	 */
	private Duration requestTimeout = Duration.ofSeconds(30);

	/**
	 * Timeout for establishing a connection.
	 */
	private Duration connectTimeout = Duration.ofSeconds(30);

	/**
	 * Remaining quota below which requests are spread out until the reset.
	 */
	private int pacingThreshold = 100;

	/**
	 * Items requested per page from paginated endpoints (max 100).
	 */
	private int pageSize = 100;

	/**
	 * Base URL of the GitHub REST API.
	 */
	private String apiBaseUrl = GitHubHttpClient.DEFAULT_API_BASE;

	public int getWorkerThreads() {
		return workerThreads;
	}

	public void setWorkerThreads(int workerThreads) {
		this.workerThreads = workerThreads;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public Duration getInitialRetryDelay() {
		return initialRetryDelay;
	}

	public void setInitialRetryDelay(Duration initialRetryDelay) {
		this.initialRetryDelay = initialRetryDelay;
	}

	public Duration getMaxRetryDelay() {
		return maxRetryDelay;
	}

	public void setMaxRetryDelay(Duration maxRetryDelay) {
		this.maxRetryDelay = maxRetryDelay;
	}

	/**
	 * Returns the longest time a request waits for a rate limit reset.
	 * @return the wait ceiling
	 */
	public Duration getRateLimitWaitCeiling() {
		return rateLimitWaitCeiling;
	}

	/**
	 * Sets the longest time a request waits for a rate limit reset. A reset further away
	 * than this fails the request with {@link RateLimitExceededException}.
	 * @param rateLimitWaitCeiling the wait ceiling
	 */
	public void setRateLimitWaitCeiling(Duration rateLimitWaitCeiling) {
		this.rateLimitWaitCeiling = rateLimitWaitCeiling;
	}

	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	public void setRequestTimeout(Duration requestTimeout) {
		this.requestTimeout = requestTimeout;
	}

	public Duration getConnectTimeout() {
		return connectTimeout;
	}

	public void setConnectTimeout(Duration connectTimeout) {
		this.connectTimeout = connectTimeout;
	}

	public int getPacingThreshold() {
		return pacingThreshold;
	}

	public void setPacingThreshold(int pacingThreshold) {
		this.pacingThreshold = pacingThreshold;
	}

	public int getPageSize() {
		return pageSize;
	}

	public void setPageSize(int pageSize) {
		this.pageSize = pageSize;
	}

	public String getApiBaseUrl() {
		return apiBaseUrl;
	}

	public void setApiBaseUrl(String apiBaseUrl) {
		this.apiBaseUrl = apiBaseUrl;
	}

	@Override
	public String toString() {
		return "AuditProperties{" + "workerThreads=" + workerThreads + ", maxRetries=" + maxRetries
				+ ", initialRetryDelay=" + initialRetryDelay + ", maxRetryDelay=" + maxRetryDelay
				+ ", rateLimitWaitCeiling=" + rateLimitWaitCeiling + ", requestTimeout=" + requestTimeout
				+ ", connectTimeout=" + connectTimeout + ", pacingThreshold=" + pacingThreshold + ", pageSize="
				+ pageSize + ", apiBaseUrl='" + apiBaseUrl + '\'' + '}';
	}

}
