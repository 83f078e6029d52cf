package org.springaicommunity.github.audit.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.audit.AuditProperties;
import org.springaicommunity.github.audit.AuthenticationException;
import org.springaicommunity.github.audit.CancellationSignal;
import org.springaicommunity.github.audit.GitHubApiException;
import org.springaicommunity.github.audit.GitHubAudit;
import org.springaicommunity.github.audit.GitHubAuditBuilder;
import org.springaicommunity.github.audit.RepositoryRef;
import org.springaicommunity.github.audit.Rule;
import org.springaicommunity.github.audit.RuleRegistry;
import org.springaicommunity.github.audit.RunResult;
import org.springaicommunity.github.audit.UnknownRuleException;
import org.springaicommunity.github.audit.rules.DefaultRules;

import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.stream.Stream;

/**
 * GitHub Audit CLI Application
 *
 * Plain Java command-line application that audits repositories against the built-in rule
 * set. Uses GitHubAuditBuilder for service wiring.
 *
 * Usage: java -jar github-audit-cli.jar [OPTIONS] [REPOSITORY]...
 *
 * Environment Variables: GITHUB_TOKEN - GitHub token, used when --github-token is not
 * given
 *
 * Examples: java -jar github-audit-cli.jar octocat/hello-world java -jar
 * github-audit-cli.jar --active --format rule java -jar github-audit-cli.jar --active
 * --rule missing-readme
 */
public class GitHubAuditCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubAuditCli.class);

	static final int EXIT_CLEAN = 0;

	static final int EXIT_FINDINGS = 1;

	static final int EXIT_INCOMPLETE = 2;

	static final int EXIT_FATAL = 3;

	private static final String LOGGER_ROOT = "org.springaicommunity.github.audit";

	private static final long SHUTDOWN_WAIT_SECONDS = 10;

	private final PrintStream out;

	private final PrintStream err;

	private final TokenResolver tokenResolver;

	private final BiFunction<String, AuditProperties, GitHubAudit> auditFactory;

	private final RuleRegistry registry;

	private final boolean color;

	GitHubAuditCli(PrintStream out, PrintStream err, TokenResolver tokenResolver,
			BiFunction<String, AuditProperties, GitHubAudit> auditFactory, RuleRegistry registry, boolean color) {
		this.out = out;
		this.err = err;
		this.tokenResolver = tokenResolver;
		this.auditFactory = auditFactory;
		this.registry = registry;
		this.color = color;
	}

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Audit failed: {}", e.getMessage());
			System.exit(EXIT_FATAL);
		}
	}

	public static int run(String[] args) {
		boolean color = System.console() != null && System.getenv("NO_COLOR") == null;
		GitHubAuditCli cli = new GitHubAuditCli(System.out, System.err, new TokenResolver(),
				(token, properties) -> GitHubAuditBuilder.create().token(token).properties(properties).build(),
				DefaultRules.registry(), color);
		return cli.execute(args);
	}

	int execute(String[] args) {
		AuditProperties properties = new AuditProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			out.print(argumentParser.generateHelpText());
			return EXIT_CLEAN;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			err.println(e.getMessage());
			err.println("Use --help for usage information.");
			return EXIT_FATAL;
		}

		if (config.versionRequested) {
			out.println("github-audit " + version());
			return EXIT_CLEAN;
		}
		if (config.listRules) {
			for (Rule rule : registry.allRules()) {
				out.printf("%-45s %s%n", rule.id(), rule.description());
			}
			return EXIT_CLEAN;
		}
		if (config.verbose) {
			enableVerboseLogging();
		}
		logger.debug("Configuration: {}", config);

		// Rule selection fails before any network access
		List<Rule> rules;
		try {
			rules = registry.filter(config.rules);
		}
		catch (UnknownRuleException e) {
			err.println(e.getMessage());
			err.println("Use --list-rules to see the available rules.");
			return EXIT_FATAL;
		}

		String token;
		try {
			token = tokenResolver.resolve(config.githubToken);
		}
		catch (IllegalStateException e) {
			err.println(e.getMessage());
			return EXIT_FATAL;
		}

		properties.setWorkerThreads(config.workers);
		GitHubAudit audit = auditFactory.apply(token, properties);

		String login;
		try {
			login = audit.metadataService().authenticatedLogin();
		}
		catch (AuthenticationException e) {
			err.println("Authentication failed: the GitHub token is invalid or expired.");
			return EXIT_FATAL;
		}
		catch (GitHubApiException e) {
			err.println("Could not reach GitHub: " + e.getMessage());
			return EXIT_FATAL;
		}
		logger.info("Authenticated as {}", login);

		List<RepositoryRef> explicit = config.repositories.stream()
			.map(name -> name.contains("/") ? RepositoryRef.parse(name) : new RepositoryRef(login, name))
			.toList();
		Stream<RepositoryRef> selection = audit.selector().select(explicit, config.active);

		RunResult result = runWithInterruptHandling(audit, selection, rules);
		out.print(new ReportRenderer(color).render(result, config.format));
		out.flush();
		return exitCodeFor(result);
	}

	private RunResult runWithInterruptHandling(GitHubAudit audit, Stream<RepositoryRef> selection, List<Rule> rules) {
		CancellationSignal cancellation = new CancellationSignal();
		CountDownLatch finished = new CountDownLatch(1);
		Thread hook = new Thread(() -> {
			if (cancellation.cancel()) {
				err.println("Interrupted, finishing repositories in progress...");
			}
			try {
				finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}, "audit-shutdown");
		Runtime.getRuntime().addShutdownHook(hook);
		try {
			return audit.engine().run(selection, rules, cancellation);
		}
		finally {
			finished.countDown();
			removeShutdownHook(hook);
		}
	}

	private static void removeShutdownHook(Thread hook) {
		try {
			Runtime.getRuntime().removeShutdownHook(hook);
		}
		catch (IllegalStateException e) {
			// JVM is already shutting down; the hook is running
			logger.debug("Shutdown in progress, keeping interrupt hook");
		}
	}

	/**
	 * Map a run result to the process exit code: errors and early stops take precedence
	 * over findings.
	 * @param result the run result
	 * @return exit code
	 */
	static int exitCodeFor(RunResult result) {
		if (result.hasErrors() || result.cancelled()) {
			return EXIT_INCOMPLETE;
		}
		if (result.hasFindings()) {
			return EXIT_FINDINGS;
		}
		return EXIT_CLEAN;
	}

	private static void enableVerboseLogging() {
		if (LoggerFactory.getLogger(LOGGER_ROOT) instanceof ch.qos.logback.classic.Logger auditLogger) {
			auditLogger.setLevel(Level.DEBUG);
		}
	}

	private static String version() {
		String version = GitHubAuditCli.class.getPackage().getImplementationVersion();
		return version != null ? version : "development";
	}

}
