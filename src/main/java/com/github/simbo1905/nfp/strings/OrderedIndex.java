package com.github.simbo1905.nfp.strings;

import java.util.OptionalInt;
import java.util.function.IntConsumer;

/// An ordered map from a key to a record handle, kept in ascending order of a comparator fixed
/// at creation. The store keeps two of these over the same records.
///
/// @param <K> the key type
interface OrderedIndex<K> {

  /// Looks up the handle stored under `key` without mutating the index.
  OptionalInt find(K key);

  /// Stores `handle` under `key`. When the key is already present the index is unchanged, the
  /// handle is not retained and the caller remains responsible for it.
  ///
  /// @return true if the entry was inserted
  boolean insert(K key, int handle);

  /// Removes the entry for `key` and releases its handle.
  ///
  /// @return true if an entry was removed, false if none matched
  boolean delete(K key);

  /// Invokes `visitor` once per entry in ascending key order. The visitor must not insert or
  /// delete; implementations reject such calls with an [IllegalStateException].
  void walk(IntConsumer visitor);

  /// Releases every entry and leaves the index empty.
  void teardown();

  /// Number of entries.
  int size();
}
