package com.github.simbo1905.nfp.strings;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Builder for creating DedupStringStore instances with a fluent API.
///
/// Example usage:
/// <pre>
/// DedupStringStore store = new DedupStringStoreBuilder()
///     .textOrder(TextOrder.UTF8_BYTES)
///     .maxTextLength(256)
///     .initialCapacity(1000)
///     .open();
/// </pre>
public class DedupStringStoreBuilder {

  private static final Logger logger = Logger.getLogger(DedupStringStoreBuilder.class.getName());

  /// Name of the environment variable or system property, prefixed with the store class name,
  /// that overrides the default maximum text length. The system property wins.
  public static final String MAX_TEXT_LENGTH_PROPERTY = "MAX_TEXT_LENGTH";

  /// Default maximum text length in characters: no practical limit.
  public static final int DEFAULT_MAX_TEXT_LENGTH = Integer.MAX_VALUE;

  /// Default number of records to size the arena for.
  public static final int DEFAULT_INITIAL_CAPACITY = 16;

  private TextOrder textOrder = TextOrder.UTF8_BYTES;
  private int maxTextLength = getMaxTextLengthOrDefault();
  private int initialCapacity = DEFAULT_INITIAL_CAPACITY;

  /// Sets the lexical order of the text index.
  ///
  /// @param textOrder the ordering, UTF8_BYTES by default
  /// @return this builder for chaining
  public DedupStringStoreBuilder textOrder(TextOrder textOrder) {
    this.textOrder = Objects.requireNonNull(textOrder, "textOrder");
    return this;
  }

  /// Sets the longest text, in characters, that add accepts. Longer texts are reported as FAILED.
  ///
  /// @param maxTextLength the maximum length, at least 1
  /// @return this builder for chaining
  public DedupStringStoreBuilder maxTextLength(int maxTextLength) {
    if (maxTextLength < 1) {
      throw new IllegalArgumentException("maxTextLength must be at least 1, got " + maxTextLength);
    }
    this.maxTextLength = maxTextLength;
    return this;
  }

  /// Sets the number of records the store is sized for up front.
  ///
  /// @param initialCapacity the expected record count, non-negative
  /// @return this builder for chaining
  public DedupStringStoreBuilder initialCapacity(int initialCapacity) {
    if (initialCapacity < 0) {
      throw new IllegalArgumentException(
          "initialCapacity must be non-negative, got " + initialCapacity);
    }
    this.initialCapacity = initialCapacity;
    return this;
  }

  /// Resolves the settings into an immutable configuration.
  Config build() {
    final var config = new Config(textOrder, maxTextLength, initialCapacity);
    logger.log(Level.FINE, () -> String.format("Resolved %s", config));
    return config;
  }

  /// Package-private record to hold resolved settings. A copied store reuses its source's.
  record Config(TextOrder textOrder, int maxTextLength, int initialCapacity) {}

  /// Creates a new empty store.
  ///
  /// @return an open store
  public DedupStringStore open() {
    return new DedupStringStore(build());
  }

  static int getMaxTextLengthOrDefault() {
    final String key =
        String.format("%s.%s", DedupStringStore.class.getName(), MAX_TEXT_LENGTH_PROPERTY);
    final String fromEnv =
        System.getenv(key) == null
            ? Integer.toString(DEFAULT_MAX_TEXT_LENGTH)
            : System.getenv(key);
    final String value = System.getProperty(key, fromEnv);
    try {
      final int parsed = Integer.parseInt(value.trim());
      if (parsed >= 1) {
        return parsed;
      }
      logger.warning(() -> String.format("Ignoring %s=%s, must be at least 1", key, value));
    } catch (NumberFormatException e) {
      logger.log(Level.WARNING, e, () -> String.format("Ignoring %s=%s", key, value));
    }
    return DEFAULT_MAX_TEXT_LENGTH;
  }
}
