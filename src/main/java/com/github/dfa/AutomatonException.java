package com.github.dfa;

/**
 * Unified single exception that's thrown while building, loading or verifying an automaton. The
 * code enum encapsulates the various failure conditions. Parse and validation failures also carry
 * the 1-based line of the definition that caused them, or -1 when no single line is to blame.
 *
 * Simulation never throws this: an input that falls off the transition table is a plain reject.
 */
public final class AutomatonException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;
  private final int lineNumber;

  public AutomatonException(final Code code) {
    super(code.getDescription());
    this.code = code;
    this.lineNumber = -1;
  }

  public AutomatonException(final Code code, final String message) {
    super(message);
    this.code = code;
    this.lineNumber = -1;
  }

  public AutomatonException(final Code code, final String message, final int lineNumber) {
    super(message);
    this.code = code;
    this.lineNumber = lineNumber;
  }

  public AutomatonException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
    this.lineNumber = -1;
  }

  public AutomatonException(final Code code, final String message, final int lineNumber,
      final Throwable throwable) {
    super(message, throwable);
    this.code = code;
    this.lineNumber = lineNumber;
  }

  public Code getCode() {
    return code;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  public static enum Code {
    // 1.
    DEFINITION_IO_FAILURE("Failed to read automaton definition"),
    // 2.
    TEST_LIST_IO_FAILURE("Failed to read test list"),
    // 3.
    MALFORMED_DEFINITION("Automaton definition is syntactically malformed"),
    // 4.
    INVALID_ALPHABET("Alphabet declaration is invalid"),
    // 5.
    INVALID_FINAL_STATES("Final state declaration is invalid"),
    // 6.
    UNKNOWN_SYMBOL("Transition uses a symbol that is not part of the alphabet"),
    // 7.
    CONFLICTING_TRANSITION(
        "Two transitions share the same source state and symbol but lead to different states"),
    // 8.
    DANGLING_FINAL_STATE("Final state is not used by any transition"),
    // 9.
    EMPTY_DEFINITION("Automaton definition has no transitions"),
    // 10.
    INVALID_STATE("State identifier must be a non-negative integer"),
    // 11.
    INVALID_CONFIG("Verifier configuration is invalid"),
    // 12.
    VERIFICATION_FAILURE(
        "Batch verification failed. Check exception stacktrace for more details of the failure"),
    // 13.
    INTERRUPTED("Batch verification was interrupted");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
