package com.github.dfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregate view over a batch of verdicts. The verifier itself never decides an overall status;
 * callers that want one (a process exit code, say) derive it from here.
 */
public final class VerificationSummary {
  private final int total;
  private final int passed;
  private final List<Verdict> failures;

  private VerificationSummary(final int total, final int passed, final List<Verdict> failures) {
    this.total = total;
    this.passed = passed;
    this.failures = Collections.unmodifiableList(failures);
  }

  public static VerificationSummary of(final List<Verdict> verdicts) {
    int passed = 0;
    final List<Verdict> failures = new ArrayList<>();
    for (final Verdict verdict : verdicts) {
      if (verdict.isPassed()) {
        passed++;
      } else {
        failures.add(verdict);
      }
    }
    return new VerificationSummary(verdicts.size(), passed, failures);
  }

  public int getTotal() {
    return total;
  }

  public int getPassed() {
    return passed;
  }

  public int getFailed() {
    return failures.size();
  }

  /**
   * Failed verdicts, in the order they were verified.
   */
  public List<Verdict> getFailures() {
    return failures;
  }

  public boolean allPassed() {
    return failures.isEmpty();
  }

  @Override
  public String toString() {
    return "VerificationSummary [total=" + total + ", passed=" + passed + ", failed="
        + failures.size() + "]";
  }
}
