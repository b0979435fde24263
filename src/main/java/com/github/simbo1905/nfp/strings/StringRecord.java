package com.github.simbo1905.nfp.strings;

import java.util.Objects;
import lombok.Getter;
import lombok.ToString;

/// One interned string: its text, its numeric id and how many times it has been added.
/// The text never changes after creation. The id only changes during
/// [DedupStringStore#renumber()] and the reference count only grows through
/// [DedupStringStore#add(String)]; both are written by the store alone.
@Getter
@ToString
public final class StringRecord {

  /// Largest id the store hands out. Ids are unsigned 32-bit values.
  public static final long MAX_ID = 0xFFFFFFFFL;

  private final String text;
  private long id;
  private long refCount;

  StringRecord(String text, long id, long refCount) {
    this.text = Objects.requireNonNull(text, "text");
    this.id = id;
    this.refCount = refCount;
  }

  void setId(long id) {
    assert id >= 0 && id <= MAX_ID : "id out of range " + id;
    this.id = id;
  }

  void incrementRefCount() {
    refCount++;
  }

  /// Returns an independent copy carrying the same text, id and reference count.
  StringRecord duplicate() {
    return new StringRecord(text, id, refCount);
  }
}
