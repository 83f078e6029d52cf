package org.springaicommunity.github.audit.rules;

import org.springaicommunity.github.audit.LicenseInfo;
import org.springaicommunity.github.audit.PythonProject;
import org.springaicommunity.github.audit.RepositorySnapshot;
import org.springaicommunity.github.audit.Rule;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.springaicommunity.github.audit.rules.CheckResult.SKIP;
import static org.springaicommunity.github.audit.rules.CheckResult.failIf;

/**
 * Python packaging rules over {@code pyproject.toml}, {@code requirements.txt} and the
 * lint and type-check jobs of Python repositories.
 */
public final class PythonRules {

	static final String MIT_LICENSE_CLASSIFIER = "License :: OSI Approved :: MIT License";

	private static final List<String> LOWER_BOUND_OPERATORS = List.of("==", ">", "~=", "@");

	private PythonRules() {
	}

	public static List<Rule> rules() {
		List<Rule> rules = new ArrayList<>();
		rules.add(CheckRule.error("missing-pyproject", "Missing pyproject.toml", snapshot -> {
			if (!isPython(snapshot)) {
				return SKIP;
			}
			return failIf(snapshot.pyproject() == null);
		}));
		rules.add(CheckRule.error("missing-pyproject-project-name", "project.name missing in pyproject.toml",
				pyproject(project -> failIf(project.name() == null))));
		rules.add(CheckRule.error("pyproject-mit-license-classifier", "License classifier missing in pyproject.toml",
				snapshot -> {
					if (snapshot.pyproject() == null || !hasMitLicense(snapshot)) {
						return SKIP;
					}
					return failIf(!snapshot.pyproject().classifiers().contains(MIT_LICENSE_CLASSIFIER));
				}));
		rules.add(CheckRule.warning("pyproject-omit-license",
				"License classifier should be omitted when using MIT License", snapshot -> {
					if (snapshot.pyproject() == null || !hasMitLicense(snapshot)) {
						return SKIP;
					}
					return failIf(snapshot.pyproject().declaresLicense());
				}));
		rules.add(CheckRule.warning("pyproject-author-name", "project.authors[0].name missing in pyproject.toml",
				pyproject(project -> failIf(project.authorNames().isEmpty()))));
		rules.add(CheckRule.warning("pyproject-omit-author-email",
				"project.authors[0].email should be omitted for privacy",
				pyproject(project -> failIf(!project.authorEmails().isEmpty()))));
		rules.add(CheckRule.error("pyproject-readme", "project.readme missing in pyproject.toml",
				pyproject(project -> failIf(!project.hasReadme()))));
		rules.add(CheckRule.error("missing-pyproject-requires-python",
				"project.requires-python missing in pyproject.toml",
				pyproject(project -> failIf(project.requiresPython().isEmpty()))));
		rules.add(CheckRule.error("pyproject-dependency-lower-bound", "Dependencies should have lower bound",
				pyproject(project -> failIf(
						project.allDependencies().stream().anyMatch(dependency -> !hasLowerBound(dependency))))));
		rules.add(CheckRule.warning("pyproject-optional-dependencies-name",
				"pyproject optional-dependencies should be named 'dev'", pyproject(project -> {
					List<String> groups = project.optionalDependencyGroups();
					return failIf(!groups.isEmpty() && !groups.equals(List.of("dev")));
				})));
		rules.add(CheckRule.warning("pyproject-depends-on-requests", "Avoid requests dependency",
				pyproject(project -> failIf(
						project.allDependencies().stream().anyMatch(dependency -> dependency.startsWith("requests"))))));
		rules.add(CheckRule.error("missing-pyproject-ruff-isort-rules",
				"tool.ruff.lint.extend-select missing 'I' to enable isort rules",
				pyproject(project -> failIf(!project.ruffExtendSelect().contains("I")))));
		rules.add(CheckRule.error("missing-pyproject-ruff-pyupgrade-rules",
				"tool.ruff.lint.extend-select missing 'UP' to enable pyupgrade rules",
				pyproject(project -> failIf(!project.ruffExtendSelect().contains("UP")))));
		rules.add(CheckRule.error("mypy-strict-declared", "mypy strict mode is not declared",
				pyproject(project -> failIf(project.mypyStrict() == null))));
		rules.add(CheckRule.warning("mypy-strict", "mypy strict mode is not enabled",
				pyproject(project -> failIf(Boolean.FALSE.equals(project.mypyStrict())))));
		rules.add(CheckRule.error("requirements-txt-exact", "Use exact versions in requirements.txt", snapshot -> {
			if (!snapshot.hasRequirementsTxt()) {
				return SKIP;
			}
			return failIf(snapshot.requirementLines()
				.stream()
				.filter(line -> !line.isBlank() && !line.contains("@"))
				.anyMatch(line -> !line.contains("==")));
		}));
		rules.add(CheckRule.warning("requirements-txt-uv-compiled", "requirements.txt is not compiled by uv",
				snapshot -> {
					if (!snapshot.hasRequirementsTxt()) {
						return SKIP;
					}
					return failIf(!snapshot.requirementsTxt().contains("uv pip compile"));
				}));
		rules.add(CheckRule.warning("prefer-uv-lock", "Prefer uv.lock instead of requirements.txt", snapshot -> {
			if (!snapshot.hasRequirementsTxt()) {
				return SKIP;
			}
			return failIf(!snapshot.hasFile("uv.lock"));
		}));
		rules.add(CheckRule.error("missing-ruff", "Missing GitHub Actions workflow for ruff linting",
				snapshot -> toolRunInWorkflows(snapshot, "ruff ")));
		rules.add(CheckRule.warning("required-ruff-status-check", "Add Ruleset to require 'ruff' status check",
				snapshot -> GeneralRules.requiredStatusCheck(snapshot, "ruff")));
		rules.add(CheckRule.error("missing-mypy", "Missing GitHub Actions workflow for mypy type checking",
				snapshot -> toolRunInWorkflows(snapshot, "mypy ")));
		rules.add(CheckRule.warning("required-mypy-status-check", "Add Ruleset to require 'mypy' status check",
				snapshot -> GeneralRules.requiredStatusCheck(snapshot, "mypy")));
		return List.copyOf(rules);
	}

	private static boolean isPython(RepositorySnapshot snapshot) {
		return "Python".equals(snapshot.language());
	}

	private static boolean hasMitLicense(RepositorySnapshot snapshot) {
		LicenseInfo license = snapshot.license();
		return license != null && "MIT License".equals(license.name());
	}

	private static boolean hasLowerBound(String dependency) {
		return LOWER_BOUND_OPERATORS.stream().anyMatch(dependency::contains);
	}

	/**
	 * Adapts a check on the parsed {@code pyproject.toml}. Skipped when the file is absent.
	 */
	private static Function<RepositorySnapshot, CheckResult> pyproject(Function<PythonProject, CheckResult> check) {
		return snapshot -> {
			PythonProject project = snapshot.pyproject();
			return project != null ? check.apply(project) : SKIP;
		};
	}

	private static CheckResult toolRunInWorkflows(RepositorySnapshot snapshot, String command) {
		if (!isPython(snapshot)) {
			return SKIP;
		}
		return failIf(ActionsRules.steps(snapshot).noneMatch(step -> step.run().contains(command)));
	}

}
