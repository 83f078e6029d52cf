package org.springaicommunity.github.audit;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * The parts of a {@code pyproject.toml} that packaging rules inspect.
 *
 * @param name {@code project.name}, if declared
 * @param hasReadme whether {@code project.readme} is declared
 * @param requiresPython {@code project.requires-python}, empty when unset
 * @param classifiers {@code project.classifiers}
 * @param authorNames names of {@code project.authors} entries that declare one
 * @param authorEmails emails of {@code project.authors} entries that declare one
 * @param declaresLicense whether {@code project.license} is present
 * @param dependencies {@code project.dependencies}
 * @param optionalDependencies {@code project.optional-dependencies}, group name to
 * requirement strings, in file order
 * @param ruffExtendSelect {@code tool.ruff.lint.extend-select}
 * @param mypyStrict {@code tool.mypy.strict}, null when not declared
 */
public record PythonProject(@Nullable String name, boolean hasReadme, String requiresPython,
		List<String> classifiers, List<String> authorNames, List<String> authorEmails, boolean declaresLicense,
		List<String> dependencies, List<OptionalDependencies> optionalDependencies, List<String> ruffExtendSelect,
		@Nullable Boolean mypyStrict) {

	public PythonProject {
		classifiers = List.copyOf(classifiers);
		authorNames = List.copyOf(authorNames);
		authorEmails = List.copyOf(authorEmails);
		dependencies = List.copyOf(dependencies);
		optionalDependencies = List.copyOf(optionalDependencies);
		ruffExtendSelect = List.copyOf(ruffExtendSelect);
	}

	/**
	 * Returns the required and every optional dependency.
	 * @return requirement strings
	 */
	public List<String> allDependencies() {
		List<String> all = new ArrayList<>(dependencies);
		optionalDependencies.forEach(group -> all.addAll(group.requirements()));
		return all;
	}

	public List<String> optionalDependencyGroups() {
		return optionalDependencies.stream().map(OptionalDependencies::group).toList();
	}

	/**
	 * One {@code project.optional-dependencies} entry.
	 *
	 * @param group extra name
	 * @param requirements requirement strings of the extra
	 */
	public record OptionalDependencies(String group, List<String> requirements) {

		public OptionalDependencies {
			requirements = List.copyOf(requirements);
		}

	}

}
