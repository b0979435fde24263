package com.github.simbo1905.nfp.strings;

/// Callback invoked once per record during an ordered walk. Must not mutate the store.
@FunctionalInterface
public interface StringVisitor {
  void visit(long id, String text, long refCount);
}
