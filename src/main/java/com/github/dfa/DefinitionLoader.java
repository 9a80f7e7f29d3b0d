package com.github.dfa;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.dfa.Automaton.AutomatonBuilder;
import com.github.dfa.AutomatonException.Code;

/**
 * Parses a textual automaton definition into a validated {@link Automaton}.
 *
 * The definition is line oriented, UTF-8:<br>
 * 1. blank lines and lines starting with '#' are ignored anywhere<br>
 * 2. the first significant line is {@code alphabet: a b c}, one or more single-character symbols
 * separated by whitespace and/or commas<br>
 * 3. the second significant line is {@code final: 2 3}, zero or more state identifiers in the same
 * style<br>
 * 4. every further line is a transition {@code source symbol destination}, whitespace separated,
 * with non-negative decimal state identifiers<br>
 *
 * Header keywords are case-insensitive. Every failure is reported as an
 * {@link AutomatonException} carrying the offending line, and no automaton is returned.
 */
public final class DefinitionLoader {
  private static final Logger logger = LogManager.getLogger(DefinitionLoader.class.getSimpleName());

  private static final String ALPHABET_HEADER = "alphabet";
  private static final String FINAL_HEADER = "final";
  private static final String LIST_SEPARATOR = "[\\s,]+";
  private static final String TRANSITION_SEPARATOR = "\\s+";
  private static final String LEADING_SEPARATORS = "^[\\s,]+";
  private static final Pattern STATE_ID = Pattern.compile("-?\\d+");
  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private final String reservedSymbol;

  public DefinitionLoader() {
    this(VerifierConfiguration.DEFAULT_EPSILON_MARKER);
  }

  /**
   * @param reservedSymbol the epsilon marker of the test lists; it may not appear in an alphabet
   */
  public DefinitionLoader(final String reservedSymbol) {
    this.reservedSymbol = reservedSymbol;
  }

  public Automaton load(final Path path) throws AutomatonException {
    final Reader reader;
    try {
      reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
    } catch (IOException exception) {
      throw new AutomatonException(Code.DEFINITION_IO_FAILURE,
          "Could not open automaton definition '" + path + "'", exception);
    }
    return load(reader, path.toString());
  }

  /**
   * Reads the whole source and closes it, on success and on failure alike.
   */
  public Automaton load(final Reader source, final String sourceName) throws AutomatonException {
    logger.info("Loading automaton definition from " + sourceName);
    final Parse parse = new Parse(sourceName);
    try (BufferedReader reader = new BufferedReader(source)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
          line = line.substring(1);
        }
        parse.line(line, lineNumber);
      }
    } catch (IOException exception) {
      throw new AutomatonException(Code.DEFINITION_IO_FAILURE,
          "Could not read automaton definition '" + sourceName + "'", exception);
    }
    return parse.finish();
  }

  /**
   * Parse state of a single load() call.
   */
  private final class Parse {
    private final String sourceName;
    private final Set<String> alphabet = new LinkedHashSet<>();
    private final Set<State> finalStates = new LinkedHashSet<>();
    private final List<Transition> transitions = new ArrayList<>();
    private int alphabetLine = -1;
    private int finalLine = -1;

    private Parse(final String sourceName) {
      this.sourceName = sourceName;
    }

    private void line(final String rawLine, final int lineNumber) throws AutomatonException {
      final String line = rawLine.strip();
      if (line.isEmpty() || line.startsWith("#")) {
        return;
      }
      if (alphabetLine < 0) {
        alphabet(headerBody(line, ALPHABET_HEADER, lineNumber), lineNumber);
        alphabetLine = lineNumber;
      } else if (finalLine < 0) {
        finalStates(headerBody(line, FINAL_HEADER, lineNumber), lineNumber);
        finalLine = lineNumber;
      } else {
        transition(line, lineNumber);
      }
    }

    private String headerBody(final String line, final String header, final int lineNumber)
        throws AutomatonException {
      final int colon = line.indexOf(':');
      if (colon < 0 || !line.substring(0, colon).strip().toLowerCase(Locale.ROOT).equals(header)) {
        throw fail(Code.MALFORMED_DEFINITION,
            "Expected '" + header + ":' header but found '" + line + "'", lineNumber);
      }
      return line.substring(colon + 1).replaceFirst(LEADING_SEPARATORS, "").strip();
    }

    private void alphabet(final String body, final int lineNumber) throws AutomatonException {
      if (body.isEmpty()) {
        throw fail(Code.INVALID_ALPHABET, "Alphabet must declare at least one symbol",
            lineNumber);
      }
      for (final String symbol : body.split(LIST_SEPARATOR)) {
        if (symbol.codePointCount(0, symbol.length()) != 1) {
          throw fail(Code.INVALID_ALPHABET,
              "Symbol '" + symbol + "' must be exactly one character", lineNumber);
        }
        if (symbol.equals(reservedSymbol)) {
          throw fail(Code.INVALID_ALPHABET,
              "Symbol '" + symbol + "' is reserved as the epsilon marker", lineNumber);
        }
        if (!alphabet.add(symbol)) {
          throw fail(Code.INVALID_ALPHABET, "Symbol '" + symbol + "' is declared twice",
              lineNumber);
        }
      }
    }

    private void finalStates(final String body, final int lineNumber)
        throws AutomatonException {
      if (body.isEmpty()) {
        return;
      }
      for (final String token : body.split(LIST_SEPARATOR)) {
        final State state = state(token, Code.INVALID_FINAL_STATES, lineNumber);
        if (!finalStates.add(state)) {
          throw fail(Code.INVALID_FINAL_STATES, "Final state " + state + " is declared twice",
              lineNumber);
        }
      }
    }

    private void transition(final String line, final int lineNumber) throws AutomatonException {
      final String[] tokens = line.split(TRANSITION_SEPARATOR);
      if (tokens.length != 3) {
        throw fail(Code.MALFORMED_DEFINITION,
            "Expected 'source symbol destination' but found '" + line + "'", lineNumber);
      }
      final State fromState = state(tokens[0], Code.MALFORMED_DEFINITION, lineNumber);
      final String symbol = tokens[1];
      final State toState = state(tokens[2], Code.MALFORMED_DEFINITION, lineNumber);
      if (!alphabet.contains(symbol)) {
        throw fail(Code.UNKNOWN_SYMBOL,
            "Symbol '" + symbol + "' is not part of the alphabet " + alphabet, lineNumber);
      }
      transitions.add(new Transition(fromState, symbol, toState, lineNumber));
    }

    private State state(final String token, final Code code, final int lineNumber)
        throws AutomatonException {
      if (!STATE_ID.matcher(token).matches()) {
        throw fail(code, "'" + token + "' is not a valid state identifier", lineNumber);
      }
      final int id;
      try {
        id = Integer.parseInt(token);
      } catch (NumberFormatException exception) {
        throw fail(code, "'" + token + "' is not a valid state identifier", lineNumber);
      }
      if (id < 0) {
        throw fail(Code.INVALID_STATE, "State identifier must be non-negative but was " + id,
            lineNumber);
      }
      return State.of(id);
    }

    private Automaton finish() throws AutomatonException {
      if (alphabetLine < 0) {
        throw fail(Code.MALFORMED_DEFINITION, "Missing '" + ALPHABET_HEADER + ":' header", -1);
      }
      if (finalLine < 0) {
        throw fail(Code.MALFORMED_DEFINITION, "Missing '" + FINAL_HEADER + ":' header", -1);
      }
      try {
        return AutomatonBuilder.newBuilder().alphabet(alphabet).finalStates(finalStates)
            .transitions(transitions).build();
      } catch (AutomatonException problem) {
        // builder failures are located here, dangling final states belong to the header line
        final int lineNumber =
            problem.getCode() == Code.DANGLING_FINAL_STATE ? finalLine : problem.getLineNumber();
        final AutomatonException located =
            new AutomatonException(problem.getCode(), locate(lineNumber) + problem.getMessage(),
                lineNumber, problem);
        logger.error(located.getMessage());
        throw located;
      }
    }

    private AutomatonException fail(final Code code, final String message,
        final int lineNumber) {
      final AutomatonException problem =
          new AutomatonException(code, locate(lineNumber) + message, lineNumber);
      logger.error(problem.getMessage());
      return problem;
    }

    private String locate(final int lineNumber) {
      return lineNumber > 0 ? sourceName + ":" + lineNumber + ": " : sourceName + ": ";
    }
  }

}
