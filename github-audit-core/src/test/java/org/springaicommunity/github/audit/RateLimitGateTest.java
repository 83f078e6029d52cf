package org.springaicommunity.github.audit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RateLimitGate Tests")
class RateLimitGateTest {

	private static final long NOW = 1_700_000_000L;

	private final Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);

	private final List<Long> sleeps = new ArrayList<>();

	private final RateLimitGate gate = new RateLimitGate(Duration.ofMinutes(15), clock, sleeps::add);

	@Test
	@DisplayName("Should pass straight through when nothing is recorded")
	void shouldPassWhenNothingRecorded() {
		gate.acquire();

		assertThat(sleeps).isEmpty();
		assertThat(gate.current()).isNull();
	}

	@Test
	@DisplayName("Should pass straight through while quota remains")
	void shouldPassWhileQuotaRemains() {
		gate.record(new RateLimitInfo(5000, 10, NOW + 60, 4990));

		gate.acquire();

		assertThat(sleeps).isEmpty();
		assertThat(gate.current().remaining()).isEqualTo(9);
		assertThat(gate.current().used()).isEqualTo(4991);
	}

	@Test
	@DisplayName("Should not let more requests through than the recorded quota")
	void shouldReserveRemainingQuota() {
		gate.record(new RateLimitInfo(5000, 1, NOW + 2, 4999));

		gate.acquire();
		gate.acquire();
		gate.acquire();
		gate.acquire();

		assertThat(sleeps).containsExactly(2000L);
	}

	@Test
	@DisplayName("A later response should not release requests reserved in the same window")
	void shouldKeepReservationsAgainstStaleResponses() {
		gate.record(new RateLimitInfo(5000, 3, NOW + 60, 4997));
		gate.acquire();
		gate.acquire();

		gate.record(new RateLimitInfo(5000, 2, NOW + 60, 4998));

		assertThat(gate.current().remaining()).isEqualTo(1);
	}

	@Test
	@DisplayName("Concurrent workers should share the remaining quota and wait once")
	void shouldShareQuotaAcrossWorkers() throws Exception {
		List<Long> concurrentSleeps = Collections.synchronizedList(new ArrayList<>());
		RateLimitGate shared = new RateLimitGate(Duration.ofMinutes(15), clock, concurrentSleeps::add);
		shared.record(new RateLimitInfo(5000, 5, NOW + 2, 4995));
		int workers = 10;
		ExecutorService executor = Executors.newFixedThreadPool(workers);
		CountDownLatch start = new CountDownLatch(1);
		try {
			List<Future<?>> acquisitions = new ArrayList<>();
			for (int i = 0; i < workers; i++) {
				acquisitions.add(executor.submit(() -> {
					start.await();
					shared.acquire();
					return null;
				}));
			}
			start.countDown();
			for (Future<?> acquisition : acquisitions) {
				acquisition.get(10, TimeUnit.SECONDS);
			}
		}
		finally {
			executor.shutdownNow();
		}

		assertThat(concurrentSleeps).containsExactly(2000L);
	}

	@Test
	@DisplayName("Should sleep until reset when quota is exhausted")
	void shouldSleepUntilReset() {
		gate.record(RateLimitInfo.exhausted(NOW + 2));

		gate.acquire();

		assertThat(sleeps).containsExactly(2000L);
		assertThat(gate.current()).isNull();
	}

	@Test
	@DisplayName("Should wait only once for the same reset")
	void shouldWaitOnce() {
		gate.record(RateLimitInfo.exhausted(NOW + 5));

		gate.acquire();
		gate.acquire();
		gate.acquire();

		assertThat(sleeps).containsExactly(5000L);
	}

	@Test
	@DisplayName("Should not sleep when the reset has already passed")
	void shouldNotSleepForPastReset() {
		gate.record(RateLimitInfo.exhausted(NOW - 1));

		gate.acquire();

		assertThat(sleeps).isEmpty();
		assertThat(gate.current()).isNull();
	}

	@Test
	@DisplayName("Should fail without sleeping when reset is beyond the ceiling")
	void shouldFailBeyondCeiling() {
		gate.record(RateLimitInfo.exhausted(NOW + 3600));

		assertThatThrownBy(gate::acquire).isInstanceOf(RateLimitExceededException.class)
			.hasMessageContaining("exceeds wait ceiling of 900s")
			.satisfies(e -> assertThat(((RateLimitExceededException) e).getResetEpochSeconds()).isEqualTo(NOW + 3600));

		assertThat(sleeps).isEmpty();
	}

	@Test
	@DisplayName("Should convert an interrupt during the wait into cancellation")
	void shouldCancelOnInterrupt() {
		RateLimitGate interrupted = new RateLimitGate(Duration.ofMinutes(15), clock, ms -> {
			throw new InterruptedException();
		});
		interrupted.record(RateLimitInfo.exhausted(NOW + 2));

		try {
			assertThatThrownBy(interrupted::acquire).isInstanceOf(CancellationException.class)
				.hasCauseInstanceOf(InterruptedException.class);
			assertThat(Thread.currentThread().isInterrupted()).isTrue();
		}
		finally {
			Thread.interrupted();
		}
	}

	@Test
	@DisplayName("Should keep the lowest remaining count within a window")
	void shouldKeepLowestRemainingInWindow() {
		gate.record(new RateLimitInfo(5000, 30, NOW + 60, 4970));
		gate.record(new RateLimitInfo(5000, 40, NOW + 60, 4960));

		assertThat(gate.current().remaining()).isEqualTo(30);
	}

	@Test
	@DisplayName("Should ignore observations of an older window")
	void shouldIgnoreOlderWindow() {
		gate.record(new RateLimitInfo(5000, 4999, NOW + 3600, 1));
		gate.record(RateLimitInfo.exhausted(NOW + 60));

		assertThat(gate.current().reset()).isEqualTo(NOW + 3600);
		assertThat(gate.current().remaining()).isEqualTo(4999);
	}

	@Test
	@DisplayName("Should ignore observations without quota headers")
	void shouldIgnoreIncompleteObservations() {
		gate.record(null);
		gate.record(new RateLimitInfo(-1, -1, -1, -1));

		assertThat(gate.current()).isNull();
	}

	@Test
	@DisplayName("Should reject a negative ceiling")
	void shouldRejectNegativeCeiling() {
		assertThatThrownBy(() -> new RateLimitGate(Duration.ofSeconds(-1))).isInstanceOf(IllegalArgumentException.class);
	}

}
