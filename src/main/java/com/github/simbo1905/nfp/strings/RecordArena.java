package com.github.simbo1905.nfp.strings;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Holds each canonical [StringRecord] exactly once, addressed by a stable integer handle.
/// The text index and the id index both map their keys to a handle, so a change made through
/// one index is visible through the other.
///
/// Each index that stores a handle is a holder of its slot. [#release(int)] is the release hook
/// the indices call whenever they discard an entry; the slot is recycled when the last holder
/// lets go, however many times the hook fires for the same record.
final class RecordArena implements NodeHooks {

  private static final Logger logger = Logger.getLogger(RecordArena.class.getName());

  private final List<StringRecord> records;
  private final List<Integer> holders;
  private final Deque<Integer> freeHandles = new ArrayDeque<>();

  RecordArena(int initialCapacity) {
    this.records = new ArrayList<>(initialCapacity);
    this.holders = new ArrayList<>(initialCapacity);
  }

  /// Stores `record` in a free slot with no holders yet and returns its handle.
  int allocate(StringRecord record) {
    final Integer recycled = freeHandles.pollFirst();
    final int handle;
    if (recycled != null) {
      handle = recycled;
      records.set(handle, record);
      holders.set(handle, 0);
    } else {
      handle = records.size();
      records.add(record);
      holders.add(0);
    }
    logger.log(
        Level.FINEST, () -> String.format("allocate handle:%d record:%s", handle, record));
    return handle;
  }

  /// Returns the live record behind `handle`.
  ///
  /// @throws IllegalStateException if the slot has been released
  StringRecord get(int handle) {
    final StringRecord record = handle < records.size() ? records.get(handle) : null;
    if (record == null) {
      throw new IllegalStateException("no live record at handle " + handle);
    }
    return record;
  }

  /// Registers one more index as holding `handle`.
  @Override
  public void retain(int handle) {
    get(handle);
    holders.set(handle, holders.get(handle) + 1);
  }

  /// Drops one holder of `handle` and frees the slot once no holder remains. A slot allocated
  /// but never retained is freed by the first release.
  @Override
  public void release(int handle) {
    final StringRecord record = get(handle);
    final int remaining = Math.max(0, holders.get(handle) - 1);
    holders.set(handle, remaining);
    if (remaining == 0) {
      records.set(handle, null);
      freeHandles.addFirst(handle);
      logger.log(
          Level.FINEST, () -> String.format("free handle:%d record:%s", handle, record));
    }
  }

  /// Number of live records.
  int size() {
    return records.size() - freeHandles.size();
  }

  /// Frees every slot.
  void clear() {
    records.clear();
    holders.clear();
    freeHandles.clear();
  }
}
