package com.github.simbo1905.nfp.strings;

/// Selects which index a walk traverses.
///
/// @see DedupStringStore#walk(StringKey, StringVisitor)
public enum StringKey {
  /// Ascending numeric id order
  ID,

  /// Ascending lexical text order
  TEXT
}
