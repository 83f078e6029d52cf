package org.springaicommunity.github.audit.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TokenResolver Tests")
class TokenResolverTest {

	private static TokenResolver resolver(Map<String, String> env, String ghToken) {
		return new TokenResolver(env::get, () -> ghToken);
	}

	@Test
	@DisplayName("Explicit token should win over every other source")
	void shouldPreferExplicitToken() {
		TokenResolver resolver = resolver(Map.of("GITHUB_TOKEN", "env-token"), "gh-token");

		assertThat(resolver.resolve("  cli-token ")).isEqualTo("cli-token");
	}

	@Test
	@DisplayName("Should fall back to GITHUB_TOKEN")
	void shouldUseEnvironment() {
		TokenResolver resolver = resolver(Map.of("GITHUB_TOKEN", "env-token\n"), "gh-token");

		assertThat(resolver.resolve(null)).isEqualTo("env-token");
		assertThat(resolver.resolve("   ")).isEqualTo("env-token");
	}

	@Test
	@DisplayName("Should fall back to the GitHub CLI only when nothing else is set")
	void shouldUseGhCli() {
		AtomicInteger ghCalls = new AtomicInteger();
		TokenResolver withEnv = new TokenResolver(Map.of("GITHUB_TOKEN", "env-token")::get, () -> {
			ghCalls.incrementAndGet();
			return "gh-token";
		});
		TokenResolver withoutEnv = resolver(Map.of("GITHUB_TOKEN", ""), "gh-token");

		assertThat(withEnv.resolve(null)).isEqualTo("env-token");
		assertThat(ghCalls).hasValue(0);
		assertThat(withoutEnv.resolve(null)).isEqualTo("gh-token");
	}

	@Test
	@DisplayName("Should explain every source when no token is found")
	void shouldFailWithoutToken() {
		TokenResolver resolver = resolver(Map.of(), null);

		assertThatThrownBy(() -> resolver.resolve(null)).isInstanceOf(IllegalStateException.class)
			.hasMessage("GitHub token is required. Pass --github-token, set GITHUB_TOKEN or log in with "
					+ "'gh auth login'.");
	}

	@Test
	@EnabledOnOs({ OS.LINUX, OS.MAC })
	@DisplayName("A token command that never exits should be abandoned after the timeout")
	void shouldTimeOutHungCommand() {
		long start = System.nanoTime();

		assertThat(TokenResolver.readToken(List.of("sleep", "30"), Duration.ofMillis(200))).isNull();
		assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(10));
	}

	@Test
	@EnabledOnOs({ OS.LINUX, OS.MAC })
	@DisplayName("Should read the trimmed output of a successful token command")
	void shouldReadCommandOutput() {
		assertThat(TokenResolver.readToken(List.of("echo", "gh-token"), Duration.ofSeconds(10)))
			.isEqualTo("gh-token");
		assertThat(TokenResolver.readToken(List.of("false"), Duration.ofSeconds(10))).isNull();
	}

	@Test
	@DisplayName("A missing token command should yield no token")
	void shouldIgnoreMissingCommand() {
		assertThat(TokenResolver.readToken(List.of("no-such-gh-binary-on-path"), Duration.ofSeconds(1))).isNull();
	}

}
