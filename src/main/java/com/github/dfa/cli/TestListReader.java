package com.github.dfa.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.github.dfa.AutomatonException;
import com.github.dfa.AutomatonException.Code;

/**
 * Reads a test list: one candidate input per line, UTF-8. Line terminators are dropped and lines
 * that are blank after trimming are skipped. Everything else is kept verbatim, including the
 * epsilon marker, which only the verifier interprets.
 */
public final class TestListReader {
  private static final char BYTE_ORDER_MARK = '\uFEFF';

  public static List<String> read(final Path path) throws AutomatonException {
    final List<String> inputs = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String line;
      boolean first = true;
      while ((line = reader.readLine()) != null) {
        if (first && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
          line = line.substring(1);
        }
        first = false;
        if (!line.isBlank()) {
          inputs.add(line);
        }
      }
    } catch (IOException exception) {
      throw new AutomatonException(Code.TEST_LIST_IO_FAILURE,
          "Could not open test file '" + path + "'", exception);
    }
    return inputs;
  }

  private TestListReader() {}
}
