package com.github.simbo1905.nfp.strings;

import java.util.Comparator;

/// Lexical ordering used by the text index. Fixed for the lifetime of a store.
public enum TextOrder {
  /// Unsigned comparison of the UTF-8 encoding, the same order C `strcmp` gives
  UTF8_BYTES {
    @Override
    Comparator<String> comparator() {
      return TextOrder::compareUtf8;
    }
  },

  /// [String#compareTo] order over UTF-16 code units
  UTF16 {
    @Override
    Comparator<String> comparator() {
      return Comparator.naturalOrder();
    }
  };

  abstract Comparator<String> comparator();

  /// Compares two strings code point by code point. For well-formed text this is the order of
  /// their UTF-8 bytes treated as unsigned. An unpaired surrogate compares as its own code point
  /// so distinct strings never compare equal.
  static int compareUtf8(String a, String b) {
    final int n = Math.min(a.length(), b.length());
    int i = 0;
    while (i < n) {
      final int ca = a.codePointAt(i);
      final int cb = b.codePointAt(i);
      if (ca != cb) {
        return ca < cb ? -1 : 1;
      }
      i += Character.charCount(ca);
    }
    return Integer.signum(a.length() - b.length());
  }
}
