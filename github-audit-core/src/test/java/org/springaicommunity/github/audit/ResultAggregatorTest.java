package org.springaicommunity.github.audit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ResultAggregator Tests")
class ResultAggregatorTest {

	private static final RepositoryRef ALPHA = new RepositoryRef("octocat", "alpha");

	private static final RepositoryRef BETA = new RepositoryRef("octocat", "beta");

	private final Finding alphaReadme = finding("missing-readme", ALPHA);

	private final Finding alphaWiki = finding("no-wiki", ALPHA);

	private final Finding betaReadme = finding("missing-readme", BETA);

	private final RunResult result = new RunResult(List.of(alphaReadme, alphaWiki, betaReadme), List.of(),
			List.of(ALPHA, BETA), false);

	@Test
	@DisplayName("Should group findings by repository in order of first appearance")
	void shouldGroupByRepository() {
		Map<RepositoryRef, List<Finding>> grouped = ResultAggregator.groupByRepository(result);

		assertThat(grouped.keySet()).containsExactly(ALPHA, BETA);
		assertThat(grouped.get(ALPHA)).containsExactly(alphaReadme, alphaWiki);
		assertThat(grouped.get(BETA)).containsExactly(betaReadme);
	}

	@Test
	@DisplayName("Should group findings by rule, keeping both repositories of a shared rule")
	void shouldGroupByRule() {
		Map<String, List<Finding>> grouped = ResultAggregator.groupByRule(result);

		assertThat(grouped.keySet()).containsExactly("missing-readme", "no-wiki");
		assertThat(grouped.get("missing-readme")).extracting(Finding::repository).containsExactly(ALPHA, BETA);
		assertThat(grouped.get("no-wiki")).containsExactly(alphaWiki);
	}

	@Test
	@DisplayName("Both groupings should partition the findings")
	void shouldPartitionFindings() {
		assertThat(ResultAggregator.groupByRepository(result).values().stream().flatMap(List::stream))
			.containsExactlyInAnyOrderElementsOf(result.findings());
		assertThat(ResultAggregator.groupByRule(result).values().stream().flatMap(List::stream))
			.containsExactlyInAnyOrderElementsOf(result.findings());
	}

	@Test
	@DisplayName("Should return empty, read-only groupings for a clean run")
	void shouldHandleCleanRun() {
		Map<String, List<Finding>> grouped = ResultAggregator.groupByRule(RunResult.empty());

		assertThat(grouped).isEmpty();
		assertThatThrownBy(() -> grouped.put("x", List.of())).isInstanceOf(UnsupportedOperationException.class);
	}

	private static Finding finding(String ruleId, RepositoryRef repository) {
		return new Finding(ruleId, repository, Severity.ERROR, ruleId + " message", false);
	}

}
