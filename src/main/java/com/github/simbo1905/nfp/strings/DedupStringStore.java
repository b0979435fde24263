package com.github.simbo1905.nfp.strings;

import static com.github.simbo1905.nfp.strings.StringRecord.MAX_ID;

import java.util.Comparator;
import java.util.HashSet;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.AccessLevel;
import lombok.Getter;

/// A store that interns strings. Each distinct text gets one record with a unique numeric id
/// and a count of how many times it was added. Records are reachable through two ordered
/// indices, one keyed by text and one keyed by id, so either key finds a record in
/// logarithmic time.
///
/// Both indices map their keys to a handle into a [RecordArena] that holds the canonical
/// record once, so the id and reference count read through either index always agree.
/// Every mutation touches the text index first and the id index second; if the second step
/// fails the first is unwound before FAILED is reported.
///
/// Not thread safe. Callers sharing a store between threads must guard every call with a
/// single lock covering both indices.
public class DedupStringStore implements AutoCloseable {

  private static final Logger logger = Logger.getLogger(DedupStringStore.class.getName());

  static final String TEXT_INDEX = "text-index";
  static final String ID_INDEX = "id-index";

  /// Store state tracking for proper lifecycle management
  /// <ul>
  ///   <li><b>NEW</b> - store created but indices not yet built</li>
  ///   <li><b>OPEN</b> - store operational</li>
  ///   <li><b>CLOSED</b> - indices torn down via close()</li>
  /// </ul>
  enum StoreState {
    NEW,
    OPEN,
    CLOSED
  }

  /// The settings this store was opened with. Copies are opened with the same settings.
  @Getter(AccessLevel.PACKAGE)
  private final DedupStringStoreBuilder.Config config;

  private final RecordArena arena;

  /// Index ordered by text. Package-private so tests can wrap it with failure injection.
  /*default*/ OrderedIndex<String> textIndex;

  /// Index ordered by id. Replaced wholesale by [#renumber()].
  /*default*/ OrderedIndex<Long> idIndex;

  /// The next id to hand out. Strictly greater than every id in use.
  @Getter private long lastId;

  private StoreState state = StoreState.NEW;

  /// Set while a walk is visiting records so that visitors cannot mutate the store.
  private boolean walking;

  DedupStringStore(DedupStringStoreBuilder.Config config) {
    this.config = Objects.requireNonNull(config, "config");
    this.arena = new RecordArena(config.initialCapacity());
    this.textIndex = new TreeMapIndex<>(TEXT_INDEX, config.textOrder().comparator(), arena);
    this.idIndex = newIdIndex();
    this.state = StoreState.OPEN;
    logger.log(Level.FINE, () -> String.format("opened %s", config));
  }

  /// Creates an empty id index with the comparator and hooks every id index of this store uses.
  private OrderedIndex<Long> newIdIndex() {
    return new TreeMapIndex<>(ID_INDEX, Comparator.<Long>naturalOrder(), arena);
  }

  /// Adds `text` to the store. An existing record has its reference count incremented;
  /// otherwise a new record is created with the next id and a reference count of one.
  ///
  /// @param text the text to intern, non-empty
  /// @return FOUND on success, FAILED for null, empty or over-long text, when the id space is
  /// exhausted or when an index rejects the new record
  public StringResult add(String text) {
    ensureMutable();
    if (!isValidText(text)) {
      logger.log(Level.FINE, () -> String.format("add rejected text:%s", describe(text)));
      return StringResult.FAILED;
    }
    final OptionalInt found = textIndex.find(text);
    if (found.isPresent()) {
      final StringRecord record = arena.get(found.getAsInt());
      record.incrementRefCount();
      logger.log(Level.FINE, () -> String.format("add existing %s", record));
      return StringResult.FOUND;
    }
    if (lastId > MAX_ID) {
      logger.warning(() -> String.format("add '%s' failed: id space exhausted", text));
      return StringResult.FAILED;
    }
    final StringRecord record = new StringRecord(text, lastId, 1);
    ++lastId;
    final StringResult result = insert(record);
    if (result != StringResult.FOUND) {
      --lastId;
      return result;
    }
    logger.log(Level.FINE, () -> String.format("add new %s", record));
    return result;
  }

  /// Places `record` in both indices, text index first. The record's id must be unused.
  /// Shared by [#add(String)] and [#copy()].
  private StringResult insert(StringRecord record) {
    final int handle = arena.allocate(record);
    if (!textIndex.insert(record.getText(), handle)) {
      // never retained so this frees the slot
      arena.release(handle);
      logger.warning(() -> String.format("%s rejected %s", TEXT_INDEX, record));
      return StringResult.FAILED;
    }
    if (!idIndex.insert(record.getId(), handle)) {
      final boolean unwound = textIndex.delete(record.getText());
      assert unwound : "text index lost " + record;
      logger.warning(
          () -> String.format("%s rejected %s, removed it from %s", ID_INDEX, record, TEXT_INDEX));
      return StringResult.FAILED;
    }
    assert textIndex.size() == idIndex.size()
        : String.format("%s:%d, %s:%d", TEXT_INDEX, textIndex.size(), ID_INDEX, idIndex.size());
    return StringResult.FOUND;
  }

  /// Removes the record for `text` from both indices whatever its reference count.
  ///
  /// @param text the text to remove
  /// @return FOUND if the record was removed, FAILED if there was none or text was invalid
  public StringResult remove(String text) {
    ensureMutable();
    if (!isValidText(text)) {
      logger.log(Level.FINE, () -> String.format("remove rejected text:%s", describe(text)));
      return StringResult.FAILED;
    }
    final OptionalInt found = textIndex.find(text);
    if (found.isEmpty()) {
      logger.log(Level.FINE, () -> String.format("remove '%s' not present", text));
      return StringResult.FAILED;
    }
    // the id index still holds the slot after the text index lets go
    final StringRecord record = arena.get(found.getAsInt());
    final long id = record.getId();
    textIndex.delete(text);
    final boolean deleted = idIndex.delete(id);
    assert deleted : String.format("%s had no entry for %s", ID_INDEX, record);
    assert textIndex.size() == idIndex.size()
        : String.format("%s:%d, %s:%d", TEXT_INDEX, textIndex.size(), ID_INDEX, idIndex.size());
    logger.log(Level.FINE, () -> String.format("remove %s", record));
    return StringResult.FOUND;
  }

  /// Looks up a record by its text.
  ///
  /// @return the record or null if no record has that text
  public StringRecord findByText(String text) {
    ensureOpen();
    if (text == null) return null;
    final OptionalInt found = textIndex.find(text);
    return found.isPresent() ? arena.get(found.getAsInt()) : null;
  }

  /// Looks up a record by its id.
  ///
  /// @return the record or null if no record has that id
  public StringRecord findById(long id) {
    ensureOpen();
    final OptionalInt found = idIndex.find(id);
    return found.isPresent() ? arena.get(found.getAsInt()) : null;
  }

  /// Visits every record in ascending order of the chosen index. The visitor must not mutate
  /// the store; attempts to do so throw [IllegalStateException].
  ///
  /// @param order TEXT for lexical order, ID for numeric order
  /// @param visitor called once per record with its id, text and reference count
  public void walk(StringKey order, StringVisitor visitor) {
    ensureOpen();
    Objects.requireNonNull(order, "order");
    Objects.requireNonNull(visitor, "visitor");
    final OrderedIndex<?> index = order == StringKey.TEXT ? textIndex : idIndex;
    final boolean nested = walking;
    walking = true;
    try {
      index.walk(
          handle -> {
            final StringRecord record = arena.get(handle);
            visitor.visit(record.getId(), record.getText(), record.getRefCount());
          });
    } finally {
      walking = nested;
    }
  }

  /// Scratch state for one renumber pass.
  private static final class Renumbering {
    final OrderedIndex<Long> index;
    long nextId;

    Renumbering(OrderedIndex<Long> index) {
      this.index = index;
    }
  }

  /// Reassigns ids `0..n-1` in lexical text order and rebuilds the id index from scratch.
  /// Ids are only rewritten once the old id index has been discarded, so no record changes
  /// its key while it is live in an index ordered by that key.
  public void renumber() {
    ensureMutable();
    final long before = lastId;
    idIndex.teardown();
    final var pass = new Renumbering(newIdIndex());
    textIndex.walk(
        handle -> {
          final StringRecord record = arena.get(handle);
          record.setId(pass.nextId);
          if (!pass.index.insert(pass.nextId, handle)) {
            throw new IllegalStateException(
                String.format("renumber assigned duplicate id %d to %s", pass.nextId, record));
          }
          ++pass.nextId;
        });
    idIndex = pass.index;
    lastId = pass.nextId;
    assert textIndex.size() == idIndex.size()
        : String.format("%s:%d, %s:%d", TEXT_INDEX, textIndex.size(), ID_INDEX, idIndex.size());
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "renumber records:%d lastId %d -> %d", textIndex.size(), before, lastId));
  }

  /// Creates an independent store holding the same texts, ids and reference counts. The copy
  /// is opened with this store's settings and continues numbering from the same counter.
  /// A record the copy rejects is logged and skipped; the copy stays consistent.
  ///
  /// @return a new open store sharing no mutable state with this one
  public DedupStringStore copy() {
    return copy(UnaryOperator.identity());
  }

  /// Copies into a store whose id index is first passed through `idIndexWrapper`.
  DedupStringStore copy(UnaryOperator<OrderedIndex<Long>> idIndexWrapper) {
    ensureOpen();
    final var destination = new DedupStringStore(config);
    destination.idIndex = idIndexWrapper.apply(destination.idIndex);
    idIndex.walk(
        handle -> {
          final StringRecord source = arena.get(handle);
          if (destination.insert(source.duplicate()) != StringResult.FOUND) {
            logger.warning(() -> String.format("copy skipped %s", source));
          }
        });
    destination.lastId = lastId;
    logger.log(
        Level.FINE,
        () -> String.format("copy records:%d lastId:%d", destination.size(), destination.lastId));
    return destination;
  }

  /// Returns the number of distinct texts in the store.
  public int size() {
    ensureOpen();
    return textIndex.size();
  }

  /// Returns the number of entries in the id index. Equal to [#size()] between operations.
  int idIndexSize() {
    return idIndex.size();
  }

  /// Checks if the store contains no records.
  public boolean isEmpty() {
    return size() == 0;
  }

  /// Checks if the store has been closed.
  ///
  /// @return true if close() has been called
  public boolean isClosed() {
    return state != StoreState.OPEN;
  }

  /// Gets the current state of the store.
  StoreState getState() {
    return state;
  }

  /// Releases every record held by both indices. Further calls other than close throw
  /// [IllegalStateException].
  @Override
  public void close() {
    if (state == StoreState.CLOSED) {
      return;
    }
    ensureNotWalking();
    logger.log(Level.FINE, () -> String.format("close called on %s", this));
    textIndex.teardown();
    idIndex.teardown();
    assert arena.size() == 0 : "arena still holds " + arena.size() + " records after teardown";
    arena.clear();
    state = StoreState.CLOSED;
  }

  /// Verifies that both indices describe the same records: equal sizes, every text record is
  /// reachable by its id, ids are distinct and below the id counter, and the id index walks
  /// in strictly ascending id order.
  ///
  /// @throws IllegalStateException describing the first violation found
  public void checkConsistency() {
    ensureOpen();
    if (textIndex.size() != idIndex.size()) {
      throw new IllegalStateException(
          String.format(
              "index sizes differ %s:%d, %s:%d",
              TEXT_INDEX, textIndex.size(), ID_INDEX, idIndex.size()));
    }
    final Set<Long> ids = new HashSet<>();
    walk(
        StringKey.TEXT,
        (id, text, refCount) -> {
          if (!ids.add(id)) {
            throw new IllegalStateException(String.format("id %d used twice, at '%s'", id, text));
          }
          if (id >= lastId) {
            throw new IllegalStateException(
                String.format("id %d of '%s' is not below lastId %d", id, text, lastId));
          }
          if (refCount < 1) {
            throw new IllegalStateException(
                String.format("'%s' has reference count %d", text, refCount));
          }
          final StringRecord byId = findById(id);
          if (byId == null || !byId.getText().equals(text)) {
            throw new IllegalStateException(
                String.format("%s maps id %d to %s not '%s'", ID_INDEX, id, byId, text));
          }
        });
    final long[] previous = {-1};
    walk(
        StringKey.ID,
        (id, text, refCount) -> {
          if (id <= previous[0]) {
            throw new IllegalStateException(
                String.format("%s out of order at id %d after %d", ID_INDEX, id, previous[0]));
          }
          previous[0] = id;
        });
  }

  /// Logs every record in text order then in id order.
  ///
  /// @param level the logging level to use
  public void logAll(Level level) {
    ensureOpen();
    if (!logger.isLoggable(level)) {
      return;
    }
    logger.log(
        level,
        () ->
            String.format(
                "Records=%d, IdIndexRecords=%d, LastId=%d", size(), idIndexSize(), lastId));
    for (StringKey order : new StringKey[] {StringKey.TEXT, StringKey.ID}) {
      logger.log(level, () -> String.format("strings (by %s order):", order));
      walk(
          order,
          (id, text, refCount) ->
              logger.log(
                  level, () -> String.format("id=%d,ref_cnt=%d,text='%s'", id, refCount, text)));
    }
  }

  /// Sample words loaded by [#main(String[])].
  static final String[] SAMPLE_TEXTS = {
    "hello", "world", "this is fun", "another string", "123456", "my", "name", "is", "Kid", "Rock"
  };

  /// Command-line demonstration. Loads the sample words, optionally looks up `args[0]` by text
  /// and then by id, removes two words and renumbers, logging the store after each step.
  ///
  /// @param args optional text to look up
  public static void main(String[] args) {
    try (DedupStringStore store = DedupStringStore.Builder().open()) {
      demo(store, args.length > 0 ? args[0] : null);
    }
  }

  /// Runs the demonstration steps against `store`, which should start empty.
  ///
  /// @param store the store to load
  /// @param lookup text to look up after loading, or null to skip the lookup
  static void demo(DedupStringStore store, String lookup) {
    for (String text : SAMPLE_TEXTS) {
      final StringResult result = store.add(text);
      logger.info(() -> String.format("add(\"%s\")=%s", text, result.label()));
    }
    logger.info(
        () ->
            String.format(
                "number of nodes in text index = %d, in id index = %d",
                store.size(), store.idIndexSize()));

    if (lookup != null) {
      final StringRecord byText = store.findByText(lookup);
      if (byText == null) {
        logger.info(() -> String.format("findByText('%s'): %s", lookup, StringResult.FAILED));
      } else {
        logger.info(() -> String.format("findByText('%s') returned %s", lookup, byText));
        final StringRecord byId = store.findById(byText.getId());
        logger.info(
            () ->
                byId == null
                    ? String.format("findById(%d): %s", byText.getId(), StringResult.FAILED)
                    : String.format("findById(%d) returned %s", byText.getId(), byId));
      }
    }
    store.logAll(Level.INFO);

    for (String text : new String[] {"my", "Kid"}) {
      final StringResult result = store.remove(text);
      logger.info(() -> String.format("remove(\"%s\")=%s", text, result.label()));
      store.logAll(Level.INFO);
    }

    store.renumber();
    logger.info("after renumber()");
    store.logAll(Level.INFO);
  }

  /// Builder for creating DedupStringStore instances with a fluent API.
  /// Example usage:
  /// <pre>
  /// DedupStringStore store = DedupStringStore.Builder()
  ///     .maxTextLength(256)
  ///     .open();
  /// </pre>
  public static DedupStringStoreBuilder Builder() {
    return new DedupStringStoreBuilder();
  }

  private boolean isValidText(String text) {
    return text != null && !text.isEmpty() && text.length() <= config.maxTextLength();
  }

  private static String describe(String text) {
    if (text == null) return "null";
    if (text.length() > 32) {
      return String.format("'%s...' (%d chars)", text.substring(0, 32), text.length());
    }
    return "'" + text + "'";
  }

  /// Ensures the store is open, throwing IllegalStateException if not in OPEN state.
  private void ensureOpen() {
    if (state != StoreState.OPEN) {
      throw new IllegalStateException("Store is in state " + state + ", expected OPEN");
    }
  }

  private void ensureNotWalking() {
    if (walking) {
      throw new IllegalStateException("Store cannot be modified while a walk is in progress");
    }
  }

  private void ensureMutable() {
    ensureOpen();
    ensureNotWalking();
  }

  @Override
  public String toString() {
    return String.format(
        "DedupStringStore[state=%s, records=%d, lastId=%d]", state, textIndex.size(), lastId);
  }
}
