package org.springaicommunity.github.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Runs a set of rules over a sequence of repositories.
 *
 * <p>
 * Repositories are fetched and evaluated on a bounded worker pool, while results are
 * collected strictly in input order. A failed fetch becomes a repository-level error and a
 * failing rule becomes a rule-level error; neither stops the run. Only a rejected token
 * or the caller's {@link CancellationSignal} stops the run early, and then every
 * repository already taken from the input is still accounted for. Interrupting the
 * calling thread cancels the run the same way; audits already in progress finish and the
 * interrupt status is restored before {@code run} returns.
 */
public class AuditEngine {

	private static final Logger logger = LoggerFactory.getLogger(AuditEngine.class);

	private final RepositoryMetadataService metadataService;

	private final int workerThreads;

	public AuditEngine(RepositoryMetadataService metadataService, int workerThreads) {
		if (workerThreads < 1) {
			throw new IllegalArgumentException("workerThreads must be at least 1");
		}
		this.metadataService = metadataService;
		this.workerThreads = workerThreads;
	}

	public RunResult run(Stream<RepositoryRef> repositories, List<Rule> rules) {
		return run(repositories, rules, new CancellationSignal());
	}

	/**
	 * Audit the repositories. Never throws for per-repository or per-rule failures.
	 * @param repositories the repositories, consumed lazily and at most once
	 * @param rules the rules to evaluate, in evaluation order
	 * @param cancellation checked before each repository is taken from the input and
	 * before each scheduled repository starts
	 * @return the accumulated result
	 */
	public RunResult run(Stream<RepositoryRef> repositories, List<Rule> rules, CancellationSignal cancellation) {
		List<Rule> ruleList = List.copyOf(rules);
		int maxInFlight = workerThreads * 2;
		logger.info("Starting audit with {} rules on {} workers", ruleList.size(), workerThreads);
		long start = System.currentTimeMillis();

		List<Finding> findings = new ArrayList<>();
		List<AuditError> errors = new ArrayList<>();
		List<RepositoryRef> evaluated = new ArrayList<>();
		boolean inputFailed = false;
		boolean interrupted = false;

		ExecutorService executor = Executors.newFixedThreadPool(workerThreads, new WorkerThreadFactory());
		Deque<Pending> inFlight = new ArrayDeque<>();
		Iterator<RepositoryRef> input = repositories.iterator();
		try {
			while (true) {
				while (!inputFailed && inFlight.size() < maxInFlight && !cancellation.isCancelled()) {
					RepositoryRef ref;
					try {
						if (!input.hasNext()) {
							break;
						}
						ref = input.next();
					}
					catch (RuntimeException e) {
						logger.error("Failed to read the repository selection: {}", e.getMessage());
						inputFailed = true;
						break;
					}
					inFlight.addLast(
							new Pending(ref, executor.submit(() -> evaluate(ref, ruleList, cancellation))));
				}
				Pending next = inFlight.pollFirst();
				if (next == null) {
					break;
				}
				Outcome outcome = null;
				while (outcome == null) {
					try {
						outcome = await(next);
					}
					catch (InterruptedException e) {
						if (!interrupted) {
							logger.info("Interrupted; cancelling remaining repositories");
						}
						interrupted = true;
						cancellation.cancel();
					}
				}
				findings.addAll(outcome.findings());
				errors.addAll(outcome.errors());
				if (outcome.evaluated()) {
					evaluated.add(next.ref());
				}
			}
		}
		finally {
			executor.shutdownNow();
			if (interrupted) {
				Thread.currentThread().interrupt();
			}
		}

		boolean stoppedEarly = cancellation.isCancelled() || inputFailed;
		RunResult result = new RunResult(findings, errors, evaluated, stoppedEarly);
		logger.info("Audited {} repositories in {}ms: {} findings, {} repository errors, {} rule errors{}",
				result.repositoryCount(), System.currentTimeMillis() - start, findings.size(),
				result.repositoryErrors().size(), result.ruleErrors().size(), stoppedEarly ? " (stopped early)" : "");
		return result;
	}

	private Outcome evaluate(RepositoryRef ref, List<Rule> rules, CancellationSignal cancellation) {
		if (cancellation.isCancelled()) {
			return Outcome.failed(AuditError.forRepository(ref, ErrorKind.CANCELLED,
					"Run cancelled before the repository was audited"));
		}
		logger.debug("Auditing {}", ref);

		RepositorySnapshot snapshot;
		try {
			snapshot = metadataService.fetch(ref);
		}
		catch (RuntimeException e) {
			ErrorKind kind = ErrorKind.of(e);
			logger.warn("Failed to fetch {}: {} ({})", ref, describe(e), kind);
			if (kind == ErrorKind.AUTHENTICATION && cancellation.cancel()) {
				logger.error("Token rejected while auditing {}; cancelling remaining repositories", ref);
			}
			return Outcome.failed(AuditError.forRepository(ref, kind, describe(e)));
		}

		List<Finding> findings = new ArrayList<>();
		List<AuditError> errors = new ArrayList<>();
		for (Rule rule : rules) {
			try {
				findings.addAll(rule.evaluate(snapshot));
			}
			catch (RuntimeException e) {
				logger.warn("Rule {} failed on {}: {}", rule.id(), ref, describe(e));
				logger.debug("Rule {} failure on {}", rule.id(), ref, e);
				errors.add(AuditError.forRule(ref, rule.id(), describe(e)));
			}
		}
		logger.debug("Audited {}: {} findings, {} rule errors", ref, findings.size(), errors.size());
		return new Outcome(true, findings, errors);
	}

	private Outcome await(Pending pending) throws InterruptedException {
		try {
			return pending.future().get();
		}
		catch (ExecutionException e) {
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			logger.warn("Audit of {} failed unexpectedly", pending.ref(), cause);
			return Outcome.failed(AuditError.forRepository(pending.ref(), ErrorKind.of(cause), describe(cause)));
		}
	}

	private static String describe(Throwable e) {
		return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
	}

	private record Pending(RepositoryRef ref, Future<Outcome> future) {
	}

	private record Outcome(boolean evaluated, List<Finding> findings, List<AuditError> errors) {

		static Outcome failed(AuditError error) {
			return new Outcome(false, List.of(), List.of(error));
		}

	}

	private static final class WorkerThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "audit-worker-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}

	}

}
