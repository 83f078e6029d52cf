package org.springaicommunity.github.audit.cli;

import org.springaicommunity.github.audit.AuditError;
import org.springaicommunity.github.audit.Finding;
import org.springaicommunity.github.audit.RepositoryRef;
import org.springaicommunity.github.audit.ResultAggregator;
import org.springaicommunity.github.audit.RunResult;
import org.springaicommunity.github.audit.Severity;

import java.util.List;
import java.util.Map;

/**
 * Renders a {@link RunResult} as plain text: one line per finding in the requested
 * grouping, then the failed units of work, then a summary line.
 */
public class ReportRenderer {

	private static final String RED = "\033[31m";

	private static final String YELLOW = "\033[33m";

	private static final String RESET = "\033[0m";

	private final boolean color;

	public ReportRenderer(boolean color) {
		this.color = color;
	}

	public String render(RunResult result, ReportFormat format) {
		StringBuilder out = new StringBuilder();
		if (format == ReportFormat.RULE) {
			for (Map.Entry<String, List<Finding>> group : ResultAggregator.groupByRule(result).entrySet()) {
				for (Finding finding : group.getValue()) {
					out.append(group.getKey())
						.append(": ")
						.append(level(finding.severity()))
						.append(' ')
						.append(finding.message())
						.append(" [")
						.append(finding.repository())
						.append("]\n");
				}
			}
		}
		else {
			for (Map.Entry<RepositoryRef, List<Finding>> group : ResultAggregator.groupByRepository(result)
				.entrySet()) {
				for (Finding finding : group.getValue()) {
					out.append(group.getKey())
						.append(": ")
						.append(level(finding.severity()))
						.append(' ')
						.append(finding.message())
						.append(" [")
						.append(finding.ruleId())
						.append("]\n");
				}
			}
		}

		if (result.hasErrors()) {
			out.append('\n');
			for (AuditError error : result.errors()) {
				out.append(error.repository());
				if (error.isRepositoryLevel()) {
					out.append(": could not be audited (").append(error.kind()).append("): ");
				}
				else {
					out.append(": rule ").append(error.ruleId()).append(" failed: ");
				}
				out.append(error.message()).append('\n');
			}
		}

		out.append('\n').append(summary(result)).append('\n');
		return out.toString();
	}

	/**
	 * One-line summary that never reports an incomplete audit as free of violations.
	 * @param result the run result
	 * @return the summary
	 */
	public String summary(RunResult result) {
		StringBuilder summary = new StringBuilder();
		int repositories = result.repositoryCount();
		if (result.hasFindings()) {
			summary.append(result.findings().size())
				.append(result.findings().size() == 1 ? " finding" : " findings")
				.append(" in ")
				.append(ResultAggregator.groupByRepository(result).size())
				.append(" of ")
				.append(repositories)
				.append(repositories == 1 ? " repository" : " repositories");
		}
		else if (result.errors().isEmpty()) {
			summary.append("No violations found in ")
				.append(repositories)
				.append(repositories == 1 ? " repository" : " repositories");
		}
		else {
			summary.append("No violations found in the parts that could be audited");
		}

		if (result.hasErrors()) {
			int failedRepositories = result.repositoryErrors().size();
			int failedRules = result.ruleErrors().size();
			summary.append("; audit could not complete for ")
				.append(failedRepositories)
				.append(failedRepositories == 1 ? " repository" : " repositories")
				.append(" and ")
				.append(failedRules)
				.append(failedRules == 1 ? " rule evaluation" : " rule evaluations");
		}
		if (result.cancelled()) {
			summary.append(" (run stopped early, results are partial)");
		}
		return summary.toString();
	}

	private String level(Severity severity) {
		String label = severity.label() + ":";
		if (!color) {
			return label;
		}
		return (severity == Severity.ERROR ? RED : YELLOW) + label + RESET;
	}

}
