package com.github.dfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.dfa.AutomatonException.Code;

/**
 * Runs lists of expected-positive and expected-negative inputs through an automaton and reports a
 * verdict per input.
 *
 * Notes for users:<br>
 * 1. verdicts are ordered positive list first, negative list second, each in input order. That
 * holds in PARALLEL mode too, where ordering is rebuilt from input position rather than completion
 * order<br>
 *
 * 2. a line equal to the configured epsilon marker is verified as the empty input; every other line
 * is split into one symbol per character<br>
 *
 * 3. the verifier does not aggregate an overall status, {@link VerificationSummary} does<br>
 *
 * 4. the automaton is only ever read, so the same instance may be verified from many threads<br>
 */
public final class BatchVerifier {
  private static final Logger logger = LogManager.getLogger(BatchVerifier.class.getSimpleName());

  private final VerifierConfiguration config;

  public BatchVerifier() {
    this(VerifierConfiguration.defaults());
  }

  public BatchVerifier(final VerifierConfiguration config) {
    this.config = config;
  }

  public VerifierConfiguration getConfiguration() {
    return config;
  }

  public List<Verdict> verify(final Automaton automaton, final List<String> expectedPositive,
      final List<String> expectedNegative) throws AutomatonException {
    final List<String> inputs = new ArrayList<>(expectedPositive.size() + expectedNegative.size());
    final List<Expectation> expectations = new ArrayList<>(inputs.size());
    for (final String input : expectedPositive) {
      inputs.add(input);
      expectations.add(Expectation.ACCEPT);
    }
    for (final String input : expectedNegative) {
      inputs.add(input);
      expectations.add(Expectation.REJECT);
    }
    logInfo(automaton, String.format("Verifying %d positive and %d negative inputs, %s",
        expectedPositive.size(), expectedNegative.size(), config));

    final List<Verdict> verdicts;
    switch (config.getVerificationMode()) {
      case CALLER_THREAD:
        verdicts = new ArrayList<>(inputs.size());
        for (int iter = 0; iter < inputs.size(); iter++) {
          verdicts.add(verify(automaton, inputs.get(iter), expectations.get(iter)));
        }
        break;
      case PARALLEL:
        verdicts = verifyInParallel(automaton, inputs, expectations);
        break;
      default:
        throw new AutomatonException(Code.INVALID_CONFIG,
            "Unsupported verification mode " + config.getVerificationMode());
    }

    logInfo(automaton, VerificationSummary.of(verdicts).toString());
    return Collections.unmodifiableList(verdicts);
  }

  /**
   * Verify a single input line against the expectation it was listed under.
   */
  public Verdict verify(final Automaton automaton, final String input,
      final Expectation expectation) {
    final List<String> symbols =
        config.getEpsilonMarker().equals(input) ? Collections.emptyList()
            : Simulator.symbolsOf(input);
    final SimulationTrace trace = Simulator.trace(automaton, symbols);
    final Verdict verdict = new Verdict(input, expectation, trace.isAccepted());
    if (!verdict.isPassed()) {
      logWarning(automaton, String.format("Input '%s' expected to %s but was %s, route: %s", input,
          expectation, trace.getOutcome(), trace.getRoute()));
    } else if (logger.isDebugEnabled()) {
      logDebug(automaton, String.format("Input '%s' %s, route: %s", input, trace.getOutcome(),
          trace.getRoute()));
    }
    return verdict;
  }

  private List<Verdict> verifyInParallel(final Automaton automaton, final List<String> inputs,
      final List<Expectation> expectations) throws AutomatonException {
    final List<Callable<Verdict>> tasks = new ArrayList<>(inputs.size());
    for (int iter = 0; iter < inputs.size(); iter++) {
      final String input = inputs.get(iter);
      final Expectation expectation = expectations.get(iter);
      tasks.add(() -> verify(automaton, input, expectation));
    }
    final ExecutorService workers =
        Executors.newFixedThreadPool(config.getWorkerCount(), new VerifierThreadFactory());
    try {
      // invokeAll hands futures back in task order, whatever order they complete in
      final List<Future<Verdict>> futures = workers.invokeAll(tasks);
      final List<Verdict> verdicts = new ArrayList<>(futures.size());
      for (final Future<Verdict> future : futures) {
        verdicts.add(future.get());
      }
      return verdicts;
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new AutomatonException(Code.INTERRUPTED, "Interrupted while verifying inputs",
          exception);
    } catch (ExecutionException exception) {
      logError(automaton, "Verification worker failed", exception.getCause());
      throw new AutomatonException(Code.VERIFICATION_FAILURE, "Verification worker failed",
          exception.getCause());
    } finally {
      workers.shutdownNow();
    }
  }

  private final static class VerifierThreadFactory implements ThreadFactory {
    private final AtomicInteger threadCount = new AtomicInteger();

    @Override
    public Thread newThread(final Runnable runnable) {
      final Thread worker =
          new Thread(runnable, "dfa-verifier-worker-" + threadCount.getAndIncrement());
      worker.setDaemon(true);
      return worker;
    }
  }

  private static void logError(final Automaton automaton, final String message,
      final Throwable error) {
    logger.error(new StringBuilder().append("[a:").append(automaton.getId()).append("] ")
        .append(message).toString(), error);
  }

  private static void logWarning(final Automaton automaton, final String message) {
    logger.warn(new StringBuilder().append("[a:").append(automaton.getId()).append("] ")
        .append(message).toString());
  }

  private static void logInfo(final Automaton automaton, final String message) {
    logger.info(new StringBuilder().append("[a:").append(automaton.getId()).append("] ")
        .append(message).toString());
  }

  private static void logDebug(final Automaton automaton, final String message) {
    logger.debug(new StringBuilder().append("[a:").append(automaton.getId()).append("] ")
        .append(message).toString());
  }

}
