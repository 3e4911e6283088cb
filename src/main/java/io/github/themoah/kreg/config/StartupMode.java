package io.github.themoah.kreg.config;

import java.util.Locale;

/**
 * How registry initialization reacts to brokers that fail to connect.
 */
public enum StartupMode {
  /** Keep the brokers that connected and report the failures. */
  PARTIAL,
  /** Fail the whole startup if any broker fails. */
  ALL_OR_NOTHING;

  /**
   * Parses values such as {@code partial} or {@code all-or-nothing}.
   *
   * @param value configured value
   * @return the startup mode
   * @throws IllegalArgumentException if the value is unknown
   */
  public static StartupMode parse(String value) {
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    return StartupMode.valueOf(normalized);
  }
}
