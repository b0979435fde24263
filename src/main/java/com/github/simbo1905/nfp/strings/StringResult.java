package com.github.simbo1905.nfp.strings;

/// Outcome of a store operation. Callers branch on the value; none of these are thrown.
///
/// @see DedupStringStore
public enum StringResult {
  /// The operation succeeded or the entry was located
  FOUND("FOUND"),

  /// A lookup did not locate an entry. Reserved for lookup-only APIs.
  NOT_FOUND("NOT FOUND"),

  /// Invalid input, an absent entry on removal, id exhaustion or an index rejecting an insert
  FAILED("FAILED");

  final String label;

  StringResult(String label) {
    this.label = label;
  }

  /// Returns the display label: `FOUND`, `NOT FOUND` or `FAILED`.
  public String label() {
    return label;
  }

  /// Maps a display label back to its result. Anything that is not an exact label maps to FAILED.
  ///
  /// @param label the display label, may be null
  /// @return the matching result or FAILED
  public static StringResult fromLabel(String label) {
    if (label == null) return FAILED;
    for (StringResult result : values()) {
      if (result.label.equals(label)) {
        return result;
      }
    }
    return FAILED;
  }

  @Override
  public String toString() {
    return label;
  }
}
