package org.springaicommunity.github.audit.cli;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.audit.EnvironmentSupport;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Resolves the GitHub token: the {@code --github-token} option, then {@code GITHUB_TOKEN}
 * through {@link EnvironmentSupport}, then the output of {@code gh auth token} when the
 * GitHub CLI is installed and logged in.
 */
public class TokenResolver {

	private static final Logger logger = LoggerFactory.getLogger(TokenResolver.class);

	private static final List<String> GH_AUTH_TOKEN = List.of("gh", "auth", "token");

	private static final Duration GH_TIMEOUT = Duration.ofSeconds(10);

	private final Function<String, @Nullable String> environment;

	private final Supplier<@Nullable String> ghCliToken;

	public TokenResolver() {
		this(EnvironmentSupport.load()::get, TokenResolver::readGhAuthToken);
	}

	TokenResolver(Function<String, @Nullable String> environment, Supplier<@Nullable String> ghCliToken) {
		this.environment = environment;
		this.ghCliToken = ghCliToken;
	}

	/**
	 * Resolve the token.
	 * @param explicitToken value of {@code --github-token}, if given
	 * @return the token
	 * @throws IllegalStateException if no source provides a token
	 */
	public String resolve(@Nullable String explicitToken) {
		if (explicitToken != null && !explicitToken.isBlank()) {
			logger.debug("Using GitHub token from --github-token");
			return explicitToken.trim();
		}
		String fromEnv = environment.apply(EnvironmentSupport.GITHUB_TOKEN);
		if (fromEnv != null && !fromEnv.isBlank()) {
			logger.debug("Using GitHub token from {}", EnvironmentSupport.GITHUB_TOKEN);
			return fromEnv.trim();
		}
		String fromGh = ghCliToken.get();
		if (fromGh != null && !fromGh.isBlank()) {
			logger.debug("Using GitHub token from 'gh auth token'");
			return fromGh.trim();
		}
		throw new IllegalStateException("GitHub token is required. Pass --github-token, set "
				+ EnvironmentSupport.GITHUB_TOKEN + " or log in with 'gh auth login'.");
	}

	static @Nullable String readGhAuthToken() {
		return readToken(GH_AUTH_TOKEN, GH_TIMEOUT);
	}

	/**
	 * Run a command that prints a token. The output is drained on another thread so a
	 * command that never exits is still bounded by the timeout.
	 * @return the trimmed output, or {@code null} if the command is missing, fails, prints
	 * nothing or does not finish in time
	 */
	static @Nullable String readToken(List<String> command, Duration timeout) {
		Process process;
		try {
			process = new ProcessBuilder(command).redirectError(ProcessBuilder.Redirect.DISCARD).start();
		}
		catch (IOException e) {
			logger.debug("'{}' not available: {}", command.get(0), e.getMessage());
			return null;
		}
		CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> {
			try (InputStream stdout = process.getInputStream()) {
				return new String(stdout.readAllBytes(), StandardCharsets.UTF_8).trim();
			}
			catch (IOException e) {
				throw new UncheckedIOException(e);
			}
		});
		try {
			if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
				process.destroyForcibly();
				output.cancel(true);
				logger.debug("'{}' timed out after {}", String.join(" ", command), timeout);
				return null;
			}
			String token = output.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
			return process.exitValue() == 0 && !token.isEmpty() ? token : null;
		}
		catch (ExecutionException | TimeoutException e) {
			logger.debug("Failed to read '{}' output: {}", String.join(" ", command), e.getMessage());
			return null;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			process.destroyForcibly();
			return null;
		}
	}

}
