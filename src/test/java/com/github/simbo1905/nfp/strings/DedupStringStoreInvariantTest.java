package com.github.simbo1905.nfp.strings;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Level;
import org.junit.Test;

/// Drives a store with long random sequences of add, remove, renumber and copy and checks after
/// every step that both indices still describe the same records and agree with a simple model
/// of expected reference counts.
public class DedupStringStoreInvariantTest extends JulLoggingConfig {

  private static final String[] VOCABULARY = {
    "a", "ab", "abc", "b", "ba", "Zed", "zed", "0", "9", "mid", "été", "😀",
    "￿", "long text with spaces", "tail"
  };

  @Test
  public void testRandomOperationsPreserveInvariants() {
    for (long seed = 1; seed <= 20; seed++) {
      runSequence(seed, 400);
    }
  }

  private void runSequence(long seed, int steps) {
    final Random random = new Random(seed);
    final TreeMap<String, Long> expectedRefCounts = new TreeMap<>();
    try (DedupStringStore store = DedupStringStore.Builder().open()) {
      for (int step = 0; step < steps; step++) {
        final int choice = random.nextInt(10);
        final String text = VOCABULARY[random.nextInt(VOCABULARY.length)];
        if (choice < 6) {
          final long lastIdBefore = store.getLastId();
          assertEquals(StringResult.FOUND, store.add(text));
          final boolean existed = expectedRefCounts.containsKey(text);
          expectedRefCounts.merge(text, 1L, Long::sum);
          if (existed) {
            assertEquals(lastIdBefore, store.getLastId());
          } else {
            assertEquals(lastIdBefore, store.findByText(text).getId());
            assertEquals(lastIdBefore + 1, store.getLastId());
          }
        } else if (choice < 9) {
          final StringResult expected =
              expectedRefCounts.remove(text) != null ? StringResult.FOUND : StringResult.FAILED;
          assertEquals(expected, store.remove(text));
        } else if (random.nextBoolean()) {
          store.renumber();
          assertEquals(expectedRefCounts.size(), store.getLastId());
        } else {
          try (DedupStringStore copy = store.copy()) {
            assertSameRecords(store, copy);
          }
        }
        assertMatchesModel(seed, step, store, expectedRefCounts);
      }
      logger.log(Level.FINE, () -> String.format("seed %d finished with %s", seed, store));
    }
  }

  private static void assertMatchesModel(
      long seed, int step, DedupStringStore store, TreeMap<String, Long> expectedRefCounts) {
    final String where = String.format("seed %d step %d", seed, step);
    store.checkConsistency();
    assertEquals(where, expectedRefCounts.size(), store.size());
    assertEquals(where, expectedRefCounts.size(), store.idIndexSize());

    final Set<String> byText = new HashSet<>();
    final Set<String> byId = new HashSet<>();
    final Set<Long> ids = new HashSet<>();
    store.walk(
        StringKey.TEXT,
        (id, text, refCount) -> {
          byText.add(text);
          assertTrue(where + " duplicate id " + id, ids.add(id));
          assertTrue(where + " id below counter", id < store.getLastId());
          assertEquals(
              where + " refCount of " + text, expectedRefCounts.get(text).longValue(), refCount);
        });
    store.walk(
        StringKey.ID,
        (id, text, refCount) -> {
          byId.add(text);
          assertEquals(where, expectedRefCounts.get(text).longValue(), refCount);
        });
    assertEquals(where, expectedRefCounts.keySet(), byText);
    assertEquals(where, byText, byId);
  }

  private static void assertSameRecords(DedupStringStore expected, DedupStringStore actual) {
    final List<String> expectedRows = new ArrayList<>();
    final List<String> actualRows = new ArrayList<>();
    expected.walk(StringKey.ID, (id, text, refCount) -> expectedRows.add(row(id, text, refCount)));
    actual.walk(StringKey.ID, (id, text, refCount) -> actualRows.add(row(id, text, refCount)));
    assertEquals(expectedRows, actualRows);
    assertEquals(expected.getLastId(), actual.getLastId());
    actual.checkConsistency();
  }

  private static String row(long id, String text, long refCount) {
    return id + ":" + text + ":" + refCount;
  }
}
