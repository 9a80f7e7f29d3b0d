package com.github.dfa.cli;

import java.io.PrintStream;
import java.util.List;

import com.github.dfa.Automaton;
import com.github.dfa.Expectation;
import com.github.dfa.Verdict;
import com.github.dfa.VerificationSummary;

/**
 * Plain text rendering of a batch run: a banner describing the automaton, one grid per test list
 * and a closing summary.
 */
final class ReportPrinter {
  private static final String INPUT_HEADER = "String";
  private static final String ACCEPTED_HEADER = "Is Accepted";
  private static final String REJECTED_HEADER = "Is Rejected";

  private final PrintStream out;

  ReportPrinter(final PrintStream out) {
    this.out = out;
  }

  void printAutomaton(final Automaton automaton) {
    out.println("DFA loaded successfully.");
    out.println("Number of states: " + automaton.getStates().size());
    out.println("Final states: " + automaton.getFinalStates());
    out.println("Alphabet: " + automaton.getAlphabet());
  }

  /**
   * Positive lists report whether each input was accepted, negative lists whether it was rejected,
   * so a column of all true reads as a clean run either way.
   */
  void printVerdicts(final String title, final Expectation expectation,
      final List<Verdict> verdicts) {
    final String resultHeader =
        expectation == Expectation.ACCEPT ? ACCEPTED_HEADER : REJECTED_HEADER;
    int inputWidth = width(INPUT_HEADER);
    int resultWidth = width(resultHeader);
    for (final Verdict verdict : verdicts) {
      if (verdict.getExpectation() == expectation) {
        inputWidth = Math.max(inputWidth, width(verdict.getInput()));
        resultWidth = Math.max(resultWidth, width(result(verdict)));
      }
    }

    out.println();
    out.println(title + ":");
    out.println(border('-', inputWidth, resultWidth));
    out.println(row(INPUT_HEADER, inputWidth, resultHeader, resultWidth));
    out.println(border('=', inputWidth, resultWidth));
    for (final Verdict verdict : verdicts) {
      if (verdict.getExpectation() == expectation) {
        out.println(row(verdict.getInput(), inputWidth, result(verdict), resultWidth));
        out.println(border('-', inputWidth, resultWidth));
      }
    }
  }

  void printSummary(final VerificationSummary summary) {
    out.println();
    out.println(String.format("Summary: %d/%d passed, %d failed", summary.getPassed(),
        summary.getTotal(), summary.getFailed()));
    for (final Verdict failure : summary.getFailures()) {
      out.println("  FAILED: '" + failure.getInput() + "' expected " + failure.getExpectation());
    }
  }

  // "Is Accepted" on a positive list and "Is Rejected" on a negative one both mean passed
  private static String result(final Verdict verdict) {
    return String.valueOf(verdict.isPassed());
  }

  private static String border(final char fill, final int inputWidth, final int resultWidth) {
    return "+" + repeat(fill, inputWidth + 2) + "+" + repeat(fill, resultWidth + 2) + "+";
  }

  private static String row(final String input, final int inputWidth, final String result,
      final int resultWidth) {
    return "| " + pad(input, inputWidth) + " | " + pad(result, resultWidth) + " |";
  }

  private static String pad(final String text, final int width) {
    return text + repeat(' ', width - width(text));
  }

  private static String repeat(final char fill, final int count) {
    return String.valueOf(fill).repeat(Math.max(0, count));
  }

  // code points, so that the epsilon marker lines up
  private static int width(final String text) {
    return text.codePointCount(0, text.length());
  }
}
