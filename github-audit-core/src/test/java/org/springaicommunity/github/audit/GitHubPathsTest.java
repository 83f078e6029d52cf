package org.springaicommunity.github.audit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GitHubPaths Tests")
class GitHubPathsTest {

	@Test
	@DisplayName("Should encode reserved characters in a segment")
	void shouldEncodeSegment() {
		assertThat(GitHubPaths.segment("ci build.yml")).isEqualTo("ci%20build.yml");
		assertThat(GitHubPaths.segment("a#b?c%d")).isEqualTo("a%23b%3Fc%25d");
		assertThat(GitHubPaths.segment("a/b")).isEqualTo("a%2Fb");
	}

	@Test
	@DisplayName("Should keep separators when encoding a path")
	void shouldKeepSeparators() {
		assertThat(GitHubPaths.path(".github/workflows/ci build.yml")).isEqualTo(".github/workflows/ci%20build.yml");
		assertThat(GitHubPaths.path("release/1.x")).isEqualTo("release/1.x");
	}

	@Test
	@DisplayName("Should leave plain names untouched")
	void shouldLeavePlainNames() {
		assertThat(GitHubPaths.path("main")).isEqualTo("main");
		assertThat(GitHubPaths.segment("octo-cat_1.2")).isEqualTo("octo-cat_1.2");
	}

}
