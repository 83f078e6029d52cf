package org.springaicommunity.github.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RetryingGitHubClient}.
 *
 * Tests retry logic, exponential backoff, rate limit waits and error classification.
 * Sleeps are recorded instead of performed.
 */
@DisplayName("RetryingGitHubClient Tests")
@ExtendWith(MockitoExtension.class)
class RetryingGitHubClientTest {

	private static final long NOW = 1_700_000_000L;

	@Mock
	private GitHubClient mockDelegate;

	private final Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);

	private final List<Long> sleeps = new ArrayList<>();

	private RetryingGitHubClient retryingClient;

	@BeforeEach
	void setUp() {
		retryingClient = RetryingGitHubClient.builder()
			.wrapping(mockDelegate)
			.maxRetries(3)
			.initialDelayMs(1)
			.clock(clock)
			.sleeper(sleeps::add)
			.build();
	}

	@Nested
	@DisplayName("Delegation Tests")
	class DelegationTest {

		@Test
		@DisplayName("Should delegate get() to wrapped client")
		void shouldDelegateGet() {
			when(mockDelegate.get("/repos/owner/repo")).thenReturn("{\"name\":\"repo\"}");

			String result = retryingClient.get("/repos/owner/repo");

			assertThat(result).isEqualTo("{\"name\":\"repo\"}");
			verify(mockDelegate, times(1)).get("/repos/owner/repo");
		}

		@Test
		@DisplayName("Should delegate getWithQuery() to wrapped client")
		void shouldDelegateGetWithQuery() {
			when(mockDelegate.getWithQuery("/user/repos", "affiliation=owner")).thenReturn("[]");

			String result = retryingClient.getWithQuery("/user/repos", "affiliation=owner");

			assertThat(result).isEqualTo("[]");
			verify(mockDelegate, times(1)).getWithQuery("/user/repos", "affiliation=owner");
		}

		@Test
		@DisplayName("Should handle null query string in getWithQuery()")
		void shouldHandleNullQueryString() {
			when(mockDelegate.getWithQuery("/path", null)).thenReturn("response");

			String result = retryingClient.getWithQuery("/path", null);

			assertThat(result).isEqualTo("response");
			verify(mockDelegate).getWithQuery("/path", null);
		}

	}

	@Nested
	@DisplayName("Retry Behavior Tests")
	class RetryBehaviorTest {

		@Test
		@DisplayName("Should retry on server error (5xx)")
		void shouldRetryOnServerError() {
			TransientNetworkException serverError = new TransientNetworkException("Server Error", 500,
					"Internal Server Error");

			when(mockDelegate.get("/path")).thenThrow(serverError).thenThrow(serverError).thenReturn("success");

			String result = retryingClient.get("/path");

			assertThat(result).isEqualTo("success");
			verify(mockDelegate, times(3)).get("/path");
		}

		@Test
		@DisplayName("Should not retry an exception outside the API hierarchy")
		void shouldNotRetryUnclassifiedException() {
			when(mockDelegate.get("/path")).thenThrow(new IllegalArgumentException("Illegal character in path"));

			assertThatThrownBy(() -> retryingClient.get("/path")).isInstanceOf(IllegalArgumentException.class);

			verify(mockDelegate, times(1)).get("/path");
			assertThat(sleeps).isEmpty();
		}

		@Test
		@DisplayName("Should not retry an invalid request URL")
		void shouldNotRetryInvalidUrl() {
			when(mockDelegate.get("/path"))
				.thenThrow(new GitHubApiException("Invalid request URL", new IllegalArgumentException("bad")));

			assertThatThrownBy(() -> retryingClient.get("/path")).isInstanceOf(GitHubApiException.class)
				.hasMessageContaining("Invalid request URL");

			verify(mockDelegate, times(1)).get("/path");
			assertThat(sleeps).isEmpty();
		}

		@Test
		@DisplayName("Should NOT retry on 404 Not Found")
		void shouldNotRetryOnNotFound() {
			when(mockDelegate.get("/path")).thenThrow(new NotFoundException("Not found: /path", 404, null, 10, NOW));

			assertThatThrownBy(() -> retryingClient.get("/path")).isInstanceOf(NotFoundException.class)
				.hasMessageContaining("Not found");

			verify(mockDelegate, times(1)).get("/path");
		}

		@Test
		@DisplayName("Should NOT retry on 403 Forbidden with quota left")
		void shouldNotRetryOnForbidden() {
			when(mockDelegate.get("/path")).thenThrow(new ForbiddenException("Forbidden: /path", 403, null, 10, NOW));

			assertThatThrownBy(() -> retryingClient.get("/path")).isInstanceOf(ForbiddenException.class);

			verify(mockDelegate, times(1)).get("/path");
		}

		@Test
		@DisplayName("Should NOT retry on 401 Unauthorized")
		void shouldNotRetryOnUnauthorized() {
			when(mockDelegate.get("/path")).thenThrow(new AuthenticationException("Unauthorized", 401, null));

			assertThatThrownBy(() -> retryingClient.get("/path")).isInstanceOf(AuthenticationException.class);

			verify(mockDelegate, times(1)).get("/path");
		}

		@Test
		@DisplayName("Should throw after exhausting retries")
		void shouldThrowAfterExhaustingRetries() {
			TransientNetworkException serverError = new TransientNetworkException("Server Error", 503, null);

			when(mockDelegate.get("/path")).thenThrow(serverError);

			assertThatThrownBy(() -> retryingClient.get("/path")).isSameAs(serverError);

			// 1 initial + 3 retries = 4 total calls
			verify(mockDelegate, times(4)).get("/path");
		}

		@Test
		@DisplayName("Should not retry a cancelled request")
		void shouldNotRetryCancellation() {
			when(mockDelegate.get("/path")).thenThrow(new CancellationException("interrupted"));

			assertThatThrownBy(() -> retryingClient.get("/path")).isInstanceOf(CancellationException.class);

			verify(mockDelegate, times(1)).get("/path");
		}

	}

	@Nested
	@DisplayName("Backoff Tests")
	class BackoffTest {

		@Test
		@DisplayName("Should double the delay and cap it at maxDelay")
		void shouldUseCappedExponentialBackoff() {
			RetryingGitHubClient client = RetryingGitHubClient.builder()
				.wrapping(mockDelegate)
				.maxRetries(5)
				.initialDelay(Duration.ofSeconds(1))
				.maxDelay(Duration.ofSeconds(3))
				.clock(clock)
				.sleeper(sleeps::add)
				.build();
			when(mockDelegate.get("/path")).thenThrow(new TransientNetworkException("Server Error", 502, null));

			assertThatThrownBy(() -> client.get("/path")).isInstanceOf(TransientNetworkException.class);

			assertThat(sleeps).containsExactly(1000L, 2000L, 3000L, 3000L, 3000L);
		}

	}

	@Nested
	@DisplayName("Rate Limit Tests")
	class RateLimitTest {

		@Test
		@DisplayName("Should wait for the reported reset and then succeed")
		void shouldWaitForResetThenSucceed() {
			RateLimitExceededException rateLimited = new RateLimitExceededException("Rate limit exceeded", 403, null,
					0, NOW + 2);
			when(mockDelegate.get("/path")).thenThrow(rateLimited).thenReturn("success");

			String result = retryingClient.get("/path");

			assertThat(result).isEqualTo("success");
			assertThat(sleeps).containsExactly(2000L);
			verify(mockDelegate, times(2)).get("/path");
		}

		@Test
		@DisplayName("Should fail without waiting when the reset is beyond the ceiling")
		void shouldFailWhenResetBeyondCeiling() {
			RateLimitGate gate = new RateLimitGate(Duration.ofMinutes(1), clock, sleeps::add);
			RetryingGitHubClient client = RetryingGitHubClient.builder()
				.wrapping(mockDelegate)
				.rateLimitGate(gate)
				.initialDelayMs(1)
				.clock(clock)
				.sleeper(sleeps::add)
				.build();
			when(mockDelegate.get("/path"))
				.thenThrow(new RateLimitExceededException("Rate limit exceeded", 429, null, 0, NOW + 3600));

			assertThatThrownBy(() -> client.get("/path")).isInstanceOf(RateLimitExceededException.class)
				.hasMessageContaining("exceeds wait ceiling");

			assertThat(sleeps).isEmpty();
			verify(mockDelegate, times(1)).get("/path");
		}

		@Test
		@DisplayName("Should back off on a rate limit error without reset information")
		void shouldBackOffWithoutResetInformation() {
			when(mockDelegate.get("/path"))
				.thenThrow(new RateLimitExceededException("Rate limit exceeded", 429, null, -1, -1))
				.thenReturn("success");

			assertThat(retryingClient.get("/path")).isEqualTo("success");
			assertThat(sleeps).containsExactly(1L);
		}

		@Test
		@DisplayName("Should pace requests when remaining quota is low")
		void shouldPaceWhenQuotaIsLow() {
			when(mockDelegate.get("/path")).thenReturn("ok");
			when(mockDelegate.getLastRateLimitInfo()).thenReturn(new RateLimitInfo(5000, 50, NOW + 100, 4950));

			retryingClient.get("/path");

			// 100s until reset spread over 50 requests
			assertThat(sleeps).containsExactly(2000L);
		}

		@Test
		@DisplayName("Should not pace when quota is healthy")
		void shouldNotPaceWhenQuotaIsHealthy() {
			when(mockDelegate.get("/path")).thenReturn("ok");
			when(mockDelegate.getLastRateLimitInfo()).thenReturn(new RateLimitInfo(5000, 4000, NOW + 100, 1000));

			retryingClient.get("/path");

			assertThat(sleeps).isEmpty();
		}

	}

	@Nested
	@DisplayName("Builder Tests")
	class BuilderTest {

		@Test
		@DisplayName("Should require a delegate")
		void shouldRequireDelegate() {
			assertThatThrownBy(() -> RetryingGitHubClient.builder().build()).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("wrapping()");
		}

		@Test
		@DisplayName("Should reject negative maxRetries")
		void shouldRejectNegativeMaxRetries() {
			assertThatThrownBy(() -> RetryingGitHubClient.builder().wrapping(mockDelegate).maxRetries(-1).build())
				.isInstanceOf(IllegalStateException.class);
		}

		@Test
		@DisplayName("Should reject maxDelay shorter than initialDelay")
		void shouldRejectInconsistentDelays() {
			assertThatThrownBy(() -> RetryingGitHubClient.builder()
				.wrapping(mockDelegate)
				.initialDelay(Duration.ofSeconds(10))
				.maxDelay(Duration.ofSeconds(1))
				.build()).isInstanceOf(IllegalStateException.class);
		}

	}

}
