package com.github.dfa.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import com.beust.jcommander.Parameter;

import com.github.dfa.AutomatonException;
import com.github.dfa.VerificationMode;
import com.github.dfa.VerifierConfiguration;
import com.github.dfa.VerifierConfiguration.VerifierConfigurationBuilder;

/**
 * Command line arguments of {@link DfaBatch}.
 */
final class DfaBatchArguments {

  @Parameter(required = true, arity = 3,
      description = "<dfa_file> <positive_test_file> <negative_test_file>")
  List<String> files = new ArrayList<>();

  @Parameter(names = "--epsilon-marker",
      description = "Test-list line that stands for the empty input")
  String epsilonMarker;

  @Parameter(names = "--mode", converter = VerificationModeConverter.class,
      description = "Verification mode: caller_thread or parallel")
  VerificationMode verificationMode;

  @Parameter(names = "--workers", description = "Worker threads used in parallel mode")
  Integer workerCount;

  @Parameter(names = "--help", help = true, description = "Displays help")
  boolean help;

  Path definitionFile() {
    return Paths.get(files.get(0));
  }

  Path positiveTestFile() {
    return Paths.get(files.get(1));
  }

  Path negativeTestFile() {
    return Paths.get(files.get(2));
  }

  /**
   * Options left out on the command line keep the builder defaults.
   */
  VerifierConfiguration configuration() throws AutomatonException {
    final VerifierConfigurationBuilder builder = VerifierConfigurationBuilder.newBuilder();
    if (epsilonMarker != null) {
      builder.epsilonMarker(epsilonMarker);
    }
    if (verificationMode != null) {
      builder.verificationMode(verificationMode);
    }
    if (workerCount != null) {
      builder.workerCount(workerCount);
    }
    return builder.build();
  }

}
