package org.springaicommunity.github.audit;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Looks up settings such as {@code GITHUB_TOKEN} in {@code .env} files and the process
 * environment.
 *
 * <p>
 * Lookup order, first non-blank value wins:
 * <ol>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>System environment variable ({@link System#getenv})</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 * The files are read once, when the instance is created by {@link #load()}.
 */
public final class EnvironmentSupport {

	private static final Logger logger = LoggerFactory.getLogger(EnvironmentSupport.class);

	/**
	 * Variable holding the GitHub token when {@code --github-token} is not given.
	 */
	public static final String GITHUB_TOKEN = "GITHUB_TOKEN";

	private final List<Function<String, @Nullable String>> sources;

	EnvironmentSupport(List<Function<String, @Nullable String>> sources) {
		this.sources = List.copyOf(sources);
	}

	/**
	 * Read the {@code .env} files of the working directory and the home directory.
	 * @return environment lookup in the documented order
	 */
	public static EnvironmentSupport load() {
		return load(Path.of("").toAbsolutePath(), System::getenv, System.getProperty("user.home"));
	}

	static EnvironmentSupport load(Path workingDirectory, Function<String, @Nullable String> systemEnvironment,
			@Nullable String homeDirectory) {
		List<Function<String, @Nullable String>> sources = new ArrayList<>();
		sources.add(dotenvFile(workingDirectory));
		sources.add(systemEnvironment);
		if (homeDirectory != null) {
			sources.add(dotenvFile(Path.of(homeDirectory)));
		}
		return new EnvironmentSupport(sources);
	}

	// only keys written in the file; Dotenv.get would consult the system environment first
	private static Function<String, @Nullable String> dotenvFile(Path directory) {
		Dotenv dotenv = Dotenv.configure()
			.directory(directory.toString())
			.ignoreIfMissing()
			.ignoreIfMalformed()
			.load();
		Map<String, String> entries = new HashMap<>();
		for (DotenvEntry entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
			entries.put(entry.getKey(), entry.getValue());
		}
		if (!entries.isEmpty()) {
			logger.debug("Loaded {} entries from {}", entries.size(), directory.resolve(".env"));
		}
		return entries::get;
	}

	/**
	 * Get a variable value.
	 * @param name the variable name
	 * @return the trimmed value, or {@code null} if no source has a non-blank value
	 */
	public @Nullable String get(String name) {
		for (Function<String, @Nullable String> source : sources) {
			String value = source.apply(name);
			if (value != null && !value.isBlank()) {
				return value.trim();
			}
		}
		return null;
	}

	public @Nullable String githubToken() {
		return get(GITHUB_TOKEN);
	}

}
