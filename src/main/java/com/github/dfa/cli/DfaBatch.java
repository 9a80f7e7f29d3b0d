package com.github.dfa.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;

import com.github.dfa.Automaton;
import com.github.dfa.AutomatonException;
import com.github.dfa.BatchVerifier;
import com.github.dfa.DefinitionLoader;
import com.github.dfa.Expectation;
import com.github.dfa.Verdict;
import com.github.dfa.VerificationSummary;
import com.github.dfa.VerifierConfiguration;

/**
 * Command line front end: loads an automaton definition, runs an expected-positive and an
 * expected-negative test list through it and prints both result tables.
 *
 * Exit codes:<br>
 * 0 - every input was classified as expected<br>
 * 1 - wrong number of arguments or an unparseable option<br>
 * 2 - at least one input was misclassified<br>
 * 3 - the definition or a test list could not be read, or the configuration is invalid<br>
 *
 * The positive list is verified and printed before the negative list is opened, so a broken
 * negative list still leaves the positive table in the report.
 */
public final class DfaBatch {
  private static final Logger logger = LogManager.getLogger(DfaBatch.class.getSimpleName());

  public static final int EXIT_SUCCESS = 0;
  public static final int EXIT_USAGE = 1;
  public static final int EXIT_MISMATCH = 2;
  public static final int EXIT_FAILURE = 3;

  static final String PROGRAM_NAME = "DfaBatch";

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  public static int run(final String[] args, final PrintStream out, final PrintStream err) {
    final DfaBatchArguments arguments = new DfaBatchArguments();
    final JCommander jCommander =
        JCommander.newBuilder().addObject(arguments).programName(PROGRAM_NAME).build();
    try {
      jCommander.parse(args);
    } catch (ParameterException exception) {
      err.println("Error: " + exception.getMessage());
      printUsage(jCommander, err);
      return EXIT_USAGE;
    }
    if (arguments.help) {
      printUsage(jCommander, out);
      return EXIT_SUCCESS;
    }

    final List<Verdict> verdicts = new ArrayList<>();
    try {
      final VerifierConfiguration config = arguments.configuration();
      final Automaton automaton =
          new DefinitionLoader(config.getEpsilonMarker()).load(arguments.definitionFile());
      final ReportPrinter printer = new ReportPrinter(out);
      printer.printAutomaton(automaton);

      final BatchVerifier verifier = new BatchVerifier(config);
      final List<String> positives = TestListReader.read(arguments.positiveTestFile());
      verdicts.addAll(verifier.verify(automaton, positives, Collections.emptyList()));
      printer.printVerdicts("Positive Tests", Expectation.ACCEPT, verdicts);

      final List<String> negatives = TestListReader.read(arguments.negativeTestFile());
      final List<Verdict> negativeVerdicts =
          verifier.verify(automaton, Collections.emptyList(), negatives);
      verdicts.addAll(negativeVerdicts);
      printer.printVerdicts("Negative Tests", Expectation.REJECT, negativeVerdicts);

      final VerificationSummary summary = VerificationSummary.of(verdicts);
      printer.printSummary(summary);
      return summary.allPassed() ? EXIT_SUCCESS : EXIT_MISMATCH;
    } catch (AutomatonException problem) {
      logger.error("Batch run failed with " + problem.getCode() + " after " + verdicts.size()
          + " verdicts", problem);
      err.println("Error: " + problem.getMessage());
      return EXIT_FAILURE;
    }
  }

  private static void printUsage(final JCommander jCommander, final PrintStream stream) {
    final StringBuilder usage = new StringBuilder();
    jCommander.getUsageFormatter().usage(usage);
    stream.print(usage);
  }

  private DfaBatch() {}
}
