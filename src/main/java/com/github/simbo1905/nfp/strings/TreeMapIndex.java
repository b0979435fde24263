package com.github.simbo1905.nfp.strings;

import java.util.Comparator;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.function.IntConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// [OrderedIndex] backed by the red-black [TreeMap], so balance and ordered traversal come from
/// the JDK.
final class TreeMapIndex<K> implements OrderedIndex<K> {

  private static final Logger logger = Logger.getLogger(TreeMapIndex.class.getName());

  private final String name;
  private final TreeMap<K, Integer> entries;
  private final NodeHooks hooks;
  private boolean walking;

  TreeMapIndex(String name, Comparator<? super K> comparator, NodeHooks hooks) {
    this.name = name;
    this.entries = new TreeMap<>(comparator);
    this.hooks = hooks;
  }

  @Override
  public OptionalInt find(K key) {
    final Integer handle = entries.get(key);
    return handle == null ? OptionalInt.empty() : OptionalInt.of(handle);
  }

  @Override
  public boolean insert(K key, int handle) {
    ensureNotWalking("insert");
    final Integer existing = entries.putIfAbsent(key, handle);
    if (existing != null) {
      logger.log(
          Level.FINE,
          () ->
              String.format(
                  "%s insert rejected key:%s handle:%d already holds handle:%d",
                  name, key, handle, existing));
      return false;
    }
    hooks.retain(handle);
    return true;
  }

  @Override
  public boolean delete(K key) {
    ensureNotWalking("delete");
    final Integer handle = entries.remove(key);
    if (handle == null) {
      return false;
    }
    hooks.release(handle);
    return true;
  }

  @Override
  public void walk(IntConsumer visitor) {
    final boolean nested = walking;
    walking = true;
    try {
      for (Integer handle : entries.values()) {
        visitor.accept(handle);
      }
    } finally {
      walking = nested;
    }
  }

  @Override
  public void teardown() {
    ensureNotWalking("teardown");
    logger.log(Level.FINEST, () -> String.format("%s teardown entries:%d", name, entries.size()));
    for (Map.Entry<K, Integer> entry : entries.entrySet()) {
      hooks.release(entry.getValue());
    }
    entries.clear();
  }

  @Override
  public int size() {
    return entries.size();
  }

  private void ensureNotWalking(String operation) {
    if (walking) {
      throw new IllegalStateException(
          String.format("%s cannot %s while a walk is in progress", name, operation));
    }
  }

  @Override
  public String toString() {
    return String.format("TreeMapIndex[%s, size=%d]", name, entries.size());
  }
}
