package org.springaicommunity.github.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EnvironmentSupport Tests")
class EnvironmentSupportTest {

	@TempDir
	Path tempDir;

	private Path workingDirectory;

	private Path homeDirectory;

	@BeforeEach
	void setUp() throws IOException {
		workingDirectory = Files.createDirectory(tempDir.resolve("project"));
		homeDirectory = Files.createDirectory(tempDir.resolve("home"));
	}

	private EnvironmentSupport load(Map<String, String> systemEnvironment) {
		return EnvironmentSupport.load(workingDirectory, systemEnvironment::get, homeDirectory.toString());
	}

	@Test
	@DisplayName("The working directory .env should win over the process environment")
	void shouldPreferWorkingDirectoryFile() throws IOException {
		Files.writeString(workingDirectory.resolve(".env"), "GITHUB_TOKEN=from-project\n");
		Files.writeString(homeDirectory.resolve(".env"), "GITHUB_TOKEN=from-home\n");

		EnvironmentSupport environment = load(Map.of("GITHUB_TOKEN", "from-process"));

		assertThat(environment.githubToken()).isEqualTo("from-project");
	}

	@Test
	@DisplayName("The process environment should win over the home directory .env")
	void shouldPreferProcessEnvironmentOverHome() throws IOException {
		Files.writeString(homeDirectory.resolve(".env"), "GITHUB_TOKEN=from-home\n");

		assertThat(load(Map.of("GITHUB_TOKEN", "from-process")).githubToken()).isEqualTo("from-process");
		assertThat(load(Map.of()).githubToken()).isEqualTo("from-home");
	}

	@Test
	@DisplayName("Blank values should fall through to the next source")
	void shouldSkipBlankValues() throws IOException {
		Files.writeString(workingDirectory.resolve(".env"), "GITHUB_TOKEN=\nOTHER=x\n");

		EnvironmentSupport environment = load(Map.of("GITHUB_TOKEN", "  from-process "));

		assertThat(environment.githubToken()).isEqualTo("from-process");
		assertThat(environment.get("OTHER")).isEqualTo("x");
	}

	@Test
	@DisplayName("Missing .env files should leave only the process environment")
	void shouldTolerateMissingFiles() {
		EnvironmentSupport environment = EnvironmentSupport.load(workingDirectory, Map.of("GITHUB_TOKEN", "t")::get,
				null);

		assertThat(environment.githubToken()).isEqualTo("t");
		assertThat(environment.get("UNSET")).isNull();
	}

}
