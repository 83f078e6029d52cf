package org.springaicommunity.github.audit.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springaicommunity.github.audit.Finding;
import org.springaicommunity.github.audit.RepositorySnapshot;
import org.springaicommunity.github.audit.Rule;
import org.springaicommunity.github.audit.RuleRegistry;
import org.springaicommunity.github.audit.Severity;
import org.springaicommunity.github.audit.UnknownRuleException;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.springaicommunity.github.audit.rules.Snapshots.*;

@DisplayName("DefaultRules Tests")
class DefaultRulesTest {

	private final RuleRegistry registry = DefaultRules.registry();

	@Test
	@DisplayName("Should register every built-in rule once, in group order")
	void shouldRegisterAllRules() {
		List<String> ids = registry.allRules().stream().map(Rule::id).toList();

		assertThat(ids).doesNotHaveDuplicates()
			.hasSize(GeneralRules.rules().size() + ActionsRules.rules().size() + DependabotRules.rules().size()
					+ NixRules.rules().size() + PythonRules.rules().size());
		assertThat(ids).startsWith("missing-description", "missing-license", "non-mit-license", "missing-readme")
			.endsWith("missing-mypy", "required-mypy-status-check");
		assertThat(ids.indexOf("nix-flake-check-no-checkout")).isLessThan(ids.indexOf("missing-pyproject"));
		assertThat(ids.indexOf("pip-dependabot")).isLessThan(ids.indexOf("required-lockfile-drv-changed-status-check"));
		assertThat(ids.indexOf("wip-gh-pages-branch")).isLessThan(ids.indexOf("disable-actions"));
		assertThat(ids.indexOf("arm64-qemu")).isLessThan(ids.indexOf("allow-auto-merge"));
	}

	@Test
	@DisplayName("Every rule should carry a description")
	void shouldDescribeEveryRule() {
		assertThat(registry.allRules()).allSatisfy(rule -> assertThat(rule.description()).isNotBlank());
	}

	@Test
	@DisplayName("A compliant repository should pass every built-in rule")
	void compliantRepositoryShouldPass() {
		RepositorySnapshot snapshot = compliant().build();

		assertThat(registry.allRules().stream().flatMap(rule -> rule.evaluate(snapshot).stream())).isEmpty();
	}

	@Test
	@DisplayName("Should select rules by name and reject unknown names")
	void shouldFilterByName() {
		assertThat(registry.filter(List.of("no-wiki", "missing-readme"))).extracting(Rule::id)
			.containsExactly("missing-readme", "no-wiki");
		assertThatThrownBy(() -> registry.filter(List.of("missing-readmee"))).isInstanceOf(UnknownRuleException.class)
			.hasMessageContaining("missing-readmee");
	}

	@Test
	@DisplayName("A check rule should report its description at its severity")
	void checkRuleShouldReportDescription() {
		CheckRule rule = CheckRule.warning("example", "Example message", snapshot -> CheckResult.FAIL);
		RepositorySnapshot snapshot = compliant().build();

		assertThat(rule.evaluate(snapshot)).containsExactly(
				new Finding("example", snapshot.ref(), Severity.WARNING, "Example message", false));
		assertThat(rule.asFixable().evaluate(snapshot)).extracting(Finding::fixable).containsExactly(true);
		assertThat(CheckRule.error("skipped", "Skipped", s -> CheckResult.SKIP).evaluate(snapshot)).isEmpty();
	}

}
