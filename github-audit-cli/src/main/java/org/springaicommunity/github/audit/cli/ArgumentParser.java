package org.springaicommunity.github.audit.cli;

import org.springaicommunity.github.audit.AuditProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Command-line argument parser for the audit CLI. Pure Java implementation with no
 * framework dependencies for maximum testability.
 */
public class ArgumentParser {

	private static final int MAX_WORKERS = 32;

	// a bare name refers to a repository of the authenticated user
	private static final Pattern REPOSITORY_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]+(/[a-zA-Z0-9._-]+)?$");

	private final AuditProperties defaultProperties;

	public ArgumentParser(AuditProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "--active":
					config.active = true;
					break;

				case "--github-token":
					config.githubToken = getRequiredValue(args, i, "github-token");
					i++; // Skip next argument since we consumed it
					break;

				case "--rule":
					config.rules.add(getRequiredValue(args, i, "rule"));
					i++;
					break;

				case "--format":
					config.format = ReportFormat.fromOption(getRequiredValue(args, i, "format"));
					i++;
					break;

				case "--workers":
					String workersStr = getRequiredValue(args, i, "workers");
					try {
						config.workers = Integer.parseInt(workersStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid worker count '" + workersStr + "': must be a positive integer");
					}
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				case "--list-rules":
					config.listRules = true;
					break;

				case "--version":
					config.versionRequested = true;
					break;

				default:
					if (arg.startsWith("--github-token=")) {
						config.githubToken = arg.substring("--github-token=".length());
					}
					else if (arg.startsWith("--rule=")) {
						config.rules.add(arg.substring("--rule=".length()));
					}
					else if (arg.startsWith("--format=")) {
						config.format = ReportFormat.fromOption(arg.substring("--format=".length()));
					}
					else if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					else {
						config.repositories.add(arg);
					}
					break;
			}
		}

		// Informational modes need no repository selection
		if (!config.helpRequested && !config.listRules && !config.versionRequested) {
			validateConfiguration(config);
		}

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: github-audit [OPTIONS] [REPOSITORY]...\n");
		help.append("\n");
		help.append("Audit GitHub repositories against a fixed set of configuration rules.\n");
		help.append("\n");
		help.append("ARGUMENTS:\n");
		help.append("    REPOSITORY              Repository as owner/name, or name for your own (repeatable)\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    --active                Audit all non-archived, non-fork repositories you own\n");
		help.append("    --github-token TOKEN    GitHub token (default: GITHUB_TOKEN, then 'gh auth token')\n");
		help.append("    --rule RULE             Only evaluate the given rule (repeatable)\n");
		help.append("    --format FORMAT         Group output by 'repo' or 'rule' (default: repo)\n");
		help.append("    --workers N             Repositories audited concurrently (default: ")
			.append(defaultProperties.getWorkerThreads())
			.append(")\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("    --list-rules            List available rules and exit\n");
		help.append("    --version               Print the version and exit\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0    No findings and no errors\n");
		help.append("    1    Findings reported\n");
		help.append("    2    Audit could not complete for some repositories or rules\n");
		help.append("    3    Usage, rule selection or authentication error\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-audit octocat/hello-world\n");
		help.append("    github-audit --active --format rule\n");
		help.append("    github-audit --active --rule missing-readme --rule no-wiki\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.repositories.isEmpty() && !config.active) {
			errors.add("Either give at least one repository or use --active");
		}

		for (String repository : config.repositories) {
			if (!REPOSITORY_PATTERN.matcher(repository).matches()) {
				errors.add("Repository must be in format 'owner/name' or 'name' (got: " + repository + ")");
			}
		}

		if (config.workers <= 0) {
			errors.add("Worker count must be positive (got: " + config.workers + ")");
		}
		else if (config.workers > MAX_WORKERS) {
			errors.add("Worker count too large (got: " + config.workers + ", max: " + MAX_WORKERS + ")");
		}

		if (config.githubToken != null && config.githubToken.isBlank()) {
			errors.add("GitHub token cannot be empty");
		}

		// Report validation errors
		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
