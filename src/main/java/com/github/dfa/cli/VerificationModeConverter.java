package com.github.dfa.cli;

import java.util.Arrays;
import java.util.Locale;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;

import com.github.dfa.VerificationMode;

/**
 * Case-insensitive {@link VerificationMode} option values.
 */
public class VerificationModeConverter implements IStringConverter<VerificationMode> {
  @Override
  public VerificationMode convert(String value) {
    try {
      return VerificationMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException exception) {
      throw new ParameterException("Unknown verification mode '" + value + "', expected one of "
          + Arrays.toString(VerificationMode.values()));
    }
  }
}
