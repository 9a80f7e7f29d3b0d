package com.github.dfa;

/**
 * This class encapsulates all the configuration parameters for the BatchVerifier. Use the
 * {@code VerifierConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. if the verification mode is not set, inputs are verified on the caller thread.<br>
 * 2. workerCount only matters in PARALLEL mode; if it is not set, it defaults to the number of
 * available processors.<br>
 * 3. the epsilon marker is the literal test-list line that stands for the empty input. It
 * defaults to {@value #DEFAULT_EPSILON_MARKER}.<br>
 */
public final class VerifierConfiguration {
  public static final String DEFAULT_EPSILON_MARKER = "ε";

  private final VerificationMode verificationMode;
  private final int workerCount;
  private final String epsilonMarker;

  public VerificationMode getVerificationMode() {
    return verificationMode;
  }

  public int getWorkerCount() {
    return workerCount;
  }

  public String getEpsilonMarker() {
    return epsilonMarker;
  }

  public static VerifierConfiguration defaults() {
    return new VerifierConfiguration(VerificationMode.CALLER_THREAD,
        Runtime.getRuntime().availableProcessors(), DEFAULT_EPSILON_MARKER);
  }

  public final static class VerifierConfigurationBuilder {
    private VerificationMode verificationMode = VerificationMode.CALLER_THREAD;
    private int workerCount = Runtime.getRuntime().availableProcessors();
    private String epsilonMarker = DEFAULT_EPSILON_MARKER;

    public static VerifierConfigurationBuilder newBuilder() {
      return new VerifierConfigurationBuilder();
    }

    public VerifierConfigurationBuilder verificationMode(final VerificationMode verificationMode) {
      this.verificationMode = verificationMode;
      return this;
    }

    public VerifierConfigurationBuilder workerCount(final int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    public VerifierConfigurationBuilder epsilonMarker(final String epsilonMarker) {
      this.epsilonMarker = epsilonMarker;
      return this;
    }

    public VerifierConfiguration build() throws AutomatonException {
      final VerifierConfiguration config =
          new VerifierConfiguration(verificationMode, workerCount, epsilonMarker);
      config.validate();
      return config;
    }

    private VerifierConfigurationBuilder() {}
  }

  private void validate() throws AutomatonException {
    StringBuilder messages = new StringBuilder();
    if (verificationMode == null) {
      messages.append("VerificationMode cannot be null. ");
    }
    if (workerCount < 1) {
      messages.append("workerCount must be at least 1 but was ").append(workerCount)
          .append(". ");
    }
    if (epsilonMarker == null || epsilonMarker.isBlank()) {
      messages.append("epsilonMarker cannot be null or blank. ");
    }
    if (messages.length() > 0) {
      throw new AutomatonException(AutomatonException.Code.INVALID_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "VerifierConfiguration [verificationMode=" + verificationMode + ", workerCount="
        + workerCount + ", epsilonMarker=" + epsilonMarker + "]";
  }

  private VerifierConfiguration(final VerificationMode verificationMode, final int workerCount,
      final String epsilonMarker) {
    this.verificationMode = verificationMode;
    this.workerCount = workerCount;
    this.epsilonMarker = epsilonMarker;
  }

}
