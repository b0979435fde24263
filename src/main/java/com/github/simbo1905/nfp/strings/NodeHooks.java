package com.github.simbo1905.nfp.strings;

/// Lifecycle callbacks an [OrderedIndex] invokes on the handles it stores.
interface NodeHooks {

  /// Called once when the index takes ownership of `handle` on a successful insert.
  void retain(int handle);

  /// Called exactly once for every entry the index discards, by delete or teardown.
  void release(int handle);
}
