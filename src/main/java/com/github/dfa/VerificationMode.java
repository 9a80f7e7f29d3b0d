package com.github.dfa;

/**
 * This represents the mode to be used by the batch verifier when running inputs through an
 * automaton.
 */
public enum VerificationMode {
  // verify inputs one after another on the caller thread.
  CALLER_THREAD,
  // fan inputs out across a worker pool; verdicts are still reported in input order.
  PARALLEL;
}
