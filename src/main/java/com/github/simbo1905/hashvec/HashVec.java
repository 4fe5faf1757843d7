package com.github.simbo1905.hashvec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import lombok.Getter;
import org.jetbrains.annotations.TestOnly;

/// A hash map whose entries are kept in an explicit order and can also be read by position.
///
/// Entries are appended in insertion order. The order only changes through `push` (moves the
/// entry to the end), `remove`/`removeAt`/`pop` (close the gap, keeping relative order),
/// `insertAt` and the two swap operations. Lookup by key and read by position are both O(1);
/// removing or inserting in the middle is O(n) because every later entry is renumbered.
///
/// Internally an OrderedStore holds the entries and a PositionIndex maps each key to its
/// position. Every mutating method updates both so that after it returns:
/// <ul>
///   <li>the index and the store have the same size,</li>
///   <li>every indexed key points at a valid position holding that key,</li>
///   <li>every stored entry is indexed at its own position,</li>
///   <li>no two entries share a key.</li>
/// </ul>
///
/// Absence is reported with Optional results. Out of range positions throw
/// IndexOutOfBoundsException. Keys and values must not be null.
///
/// This class is not thread safe. Iterators and ValueRef handles fail fast with
/// ConcurrentModificationException once the container is structurally modified.
///
/// @param <K> key type, must have consistent equals and hashCode
/// @param <V> value type
public class HashVec<K, V> implements Iterable<Entry<K, V>> {

  private static final Logger logger = Logger.getLogger(HashVec.class.getName());

  private final OrderedStore<K, V> store;

  private final PositionIndex<K> index;

  /// The capacity this container was created with.
  @Getter private final int initialCapacity;

  /// Whether the full invariant check runs after every structural mutation.
  @Getter private final boolean validateInvariants;

  /// Bumped on every structural mutation so iterators and value handles can detect staleness.
  private int modCount;

  /// Creates an empty container with the default capacity.
  public HashVec() {
    this(HashVecBuilder.DEFAULT_INITIAL_CAPACITY, HashVecBuilder.validateInvariantsOrDefault());
  }

  /// Creates an empty container with space reserved for `initialCapacity` entries.
  ///
  /// @param initialCapacity the expected number of entries
  /// @throws IllegalArgumentException if initialCapacity is negative
  public HashVec(int initialCapacity) {
    this(checkCapacity(initialCapacity), HashVecBuilder.validateInvariantsOrDefault());
  }

  HashVec(int initialCapacity, boolean validateInvariants) {
    this.store = new OrderedStore<>(initialCapacity);
    this.index = new PositionIndex<>(initialCapacity);
    this.initialCapacity = initialCapacity;
    this.validateInvariants = validateInvariants;
  }

  /// @return a builder for configuring a new HashVec
  public static HashVecBuilder builder() {
    return new HashVecBuilder();
  }

  /// Creates a container from literal pairs, pushing each one in order.
  ///
  /// @param pairs the entries in order
  /// @return a new container
  @SafeVarargs
  public static <K, V> HashVec<K, V> of(Entry<K, V>... pairs) {
    return builder()
        .initialCapacity(Math.max(pairs.length, HashVecBuilder.DEFAULT_INITIAL_CAPACITY))
        .from(Arrays.asList(pairs));
  }

  /// Creates a container from a sequence of pairs, pushing each one in order. A key that repeats
  /// keeps its last value at the position of its last occurrence.
  ///
  /// @param pairs the entries in order
  /// @return a new container
  public static <K, V> HashVec<K, V> fromPairs(
      Iterable<? extends Entry<? extends K, ? extends V>> pairs) {
    return builder().from(pairs);
  }

  /// Inserts an entry, or overwrites the value of an existing one in place.
  /// An existing key keeps its position; a new key is appended at the end.
  ///
  /// @param key the key
  /// @param value the value
  /// @return the previous value, or empty if the key was new
  public Optional<V> insert(K key, V value) {
    requireKey(key);
    requireValue(value);
    logger.log(Level.FINE, () -> String.format("insert key:%s", key));
    final var position = index.lookup(key);
    if (position.isPresent()) {
      return Optional.of(store.writeValue(position.getAsInt(), value));
    }
    index.set(key, store.append(key, value));
    structurallyModified();
    return Optional.empty();
  }

  /// Appends an entry to the end. If the key was already present its old entry is removed first,
  /// so the key always ends up at the last position.
  ///
  /// @param key the key
  /// @param value the value
  /// @return the previous value, or empty if the key was new
  public Optional<V> push(K key, V value) {
    requireKey(key);
    requireValue(value);
    logger.log(Level.FINE, () -> String.format("push key:%s", key));
    final var position = index.lookup(key);
    Optional<V> previous = Optional.empty();
    if (position.isPresent()) {
      previous = Optional.of(removeAtPosition(position.getAsInt()).value);
    }
    index.set(key, store.append(key, value));
    structurallyModified();
    return previous;
  }

  /// Appends an entry to the end, moving an existing key to the end.
  ///
  /// @param entry the pair to push
  /// @return the previous value, or empty if the key was new
  public Optional<V> push(Entry<K, V> entry) {
    if (entry == null) {
      throw new IllegalArgumentException("Entry cannot be null");
    }
    return push(entry.key(), entry.value());
  }

  /// Inserts a new entry at `position`, moving every entry at or after it one place later.
  ///
  /// @param position the position for the new entry, 0 to size() inclusive
  /// @param key the key, must not already be present
  /// @param value the value
  /// @throws IndexOutOfBoundsException if position is outside 0..size()
  /// @throws KeyExistsException if the key is already present
  public void insertAt(int position, K key, V value) {
    requireKey(key);
    requireValue(value);
    Objects.checkIndex(position, store.length() + 1);
    final var existing = index.lookup(key);
    if (existing.isPresent()) {
      throw new KeyExistsException(key, existing.getAsInt());
    }
    logger.log(Level.FINE, () -> String.format("insertAt position:%d key:%s", position, key));
    logState("before");
    store.insertAt(position, key, value);
    index.shiftPositionsAbove(position - 1, 1);
    index.set(key, position);
    logState("after");
    structurallyModified();
  }

  /// @param key the key to look up
  /// @return the value, or empty if the key is absent
  public Optional<V> get(K key) {
    requireKey(key);
    final var position = index.lookup(key);
    return position.isPresent()
        ? Optional.of(store.read(position.getAsInt()).value)
        : Optional.empty();
  }

  /// Returns a mutable handle on the value for `key`. The handle is invalidated by the next
  /// structural mutation of this container.
  ///
  /// @param key the key to look up
  /// @return a handle on the value, or empty if the key is absent
  public Optional<ValueRef<V>> getMut(K key) {
    requireKey(key);
    final var position = index.lookup(key);
    return position.isPresent()
        ? Optional.of(new ValueRef<>(this, store.read(position.getAsInt())))
        : Optional.empty();
  }

  /// @param key the key to check
  /// @return true if an entry has this key
  public boolean containsKey(K key) {
    requireKey(key);
    return index.containsKey(key);
  }

  /// @param key the key to look up
  /// @return the current position of the key, or empty if it is absent
  public OptionalInt index(K key) {
    requireKey(key);
    return index.lookup(key);
  }

  /// Reads the entry at a position.
  ///
  /// @param position a position in 0..size()-1
  /// @return a copy of the pair at that position
  /// @throws IndexOutOfBoundsException if position is out of range
  public Entry<K, V> entryAt(int position) {
    return store.read(position).toEntry();
  }

  /// @throws IndexOutOfBoundsException if position is out of range
  public K keyAt(int position) {
    return store.read(position).key;
  }

  /// @throws IndexOutOfBoundsException if position is out of range
  public V valueAt(int position) {
    return store.read(position).value;
  }

  /// Overwrites the value at a position. The key and position are unchanged.
  ///
  /// @return the previous value
  /// @throws IndexOutOfBoundsException if position is out of range
  public V setValueAt(int position, V value) {
    requireValue(value);
    return store.writeValue(position, value);
  }

  /// @return the number of entries
  public int size() {
    return store.length();
  }

  public boolean isEmpty() {
    return store.length() == 0;
  }

  /// Changes the key of an entry in place. The entry keeps its position and value.
  /// Renaming a key to itself is a no-op.
  ///
  /// @param oldKey the current key
  /// @param newKey the replacement key
  /// @return the entry's value, or empty (and no change) if oldKey is absent
  /// @throws KeyExistsException if newKey belongs to another entry; nothing is changed
  public Optional<V> rename(K oldKey, K newKey) {
    requireKey(oldKey);
    requireKey(newKey);
    logger.log(Level.FINE, () -> String.format("rename oldKey:%s newKey:%s", oldKey, newKey));
    final var position = index.lookup(oldKey);
    if (position.isEmpty()) {
      return Optional.empty();
    }
    final int i = position.getAsInt();
    if (oldKey.equals(newKey)) {
      return Optional.of(store.read(i).value);
    }
    final var collision = index.lookup(newKey);
    if (collision.isPresent()) {
      throw new KeyExistsException(newKey, collision.getAsInt());
    }
    store.writeKey(i, newKey);
    index.remove(oldKey);
    index.set(newKey, i);
    structurallyModified();
    return Optional.of(store.read(i).value);
  }

  /// Removes the entry for `key`, closing the gap so later entries move one place earlier.
  ///
  /// @param key the key to remove
  /// @return the removed value, or empty if the key was absent
  public Optional<V> remove(K key) {
    return removeEntry(key).map(Entry::value);
  }

  /// Removes the entry for `key`, closing the gap so later entries move one place earlier.
  ///
  /// @param key the key to remove
  /// @return the removed pair, or empty if the key was absent
  public Optional<Entry<K, V>> removeEntry(K key) {
    requireKey(key);
    logger.log(Level.FINE, () -> String.format("remove key:%s", key));
    final var position = index.lookup(key);
    if (position.isEmpty()) {
      return Optional.empty();
    }
    logState("before");
    final var removed = removeAtPosition(position.getAsInt());
    logState("after");
    structurallyModified();
    return Optional.of(removed.toEntry());
  }

  /// Removes the entry at a position, closing the gap.
  ///
  /// @return the removed pair
  /// @throws IndexOutOfBoundsException if position is out of range
  public Entry<K, V> removeAt(int position) {
    Objects.checkIndex(position, store.length());
    logger.log(Level.FINE, () -> String.format("removeAt position:%d", position));
    final var removed = removeAtPosition(position);
    structurallyModified();
    return removed.toEntry();
  }

  /// Swaps the positions of the entries for two keys.
  ///
  /// @return false, with nothing changed, if either key is absent
  public boolean swapKeys(K keyA, K keyB) {
    requireKey(keyA);
    requireKey(keyB);
    final var positionA = index.lookup(keyA);
    final var positionB = index.lookup(keyB);
    if (positionA.isEmpty() || positionB.isEmpty()) {
      logger.log(
          Level.FINE, () -> String.format("swapKeys absent keyA:%s keyB:%s", keyA, keyB));
      return false;
    }
    swapIndices(positionA.getAsInt(), positionB.getAsInt());
    return true;
  }

  /// Swaps the entries at two positions. Swapping a position with itself does nothing.
  ///
  /// @throws IndexOutOfBoundsException if either position is out of range
  public void swapIndices(int a, int b) {
    Objects.checkIndex(a, store.length());
    Objects.checkIndex(b, store.length());
    logger.log(Level.FINE, () -> String.format("swapIndices a:%d b:%d", a, b));
    if (a == b) {
      return;
    }
    store.swap(a, b);
    index.set(store.read(a).key, a);
    index.set(store.read(b).key, b);
    structurallyModified();
  }

  /// Removes and returns the last entry.
  ///
  /// @return the last pair, or empty if the container is empty
  public Optional<Entry<K, V>> pop() {
    final int length = store.length();
    if (length == 0) {
      return Optional.empty();
    }
    final var removed = store.removeAt(length - 1);
    index.remove(removed.key);
    logger.log(Level.FINE, () -> String.format("pop key:%s", removed.key));
    structurallyModified();
    return Optional.of(removed.toEntry());
  }

  /// Removes every entry.
  public void clear() {
    logger.log(Level.FINE, () -> String.format("clear size:%d", store.length()));
    store.clear();
    index.clear();
    structurallyModified();
  }

  /// Moves every entry of `other` onto the end of this container in order, with push semantics,
  /// leaving `other` empty.
  ///
  /// @param other the container to drain
  /// @throws IllegalArgumentException if other is null or is this container
  public void append(HashVec<? extends K, ? extends V> other) {
    if (other == null) {
      throw new IllegalArgumentException("other cannot be null");
    }
    if (other == this) {
      throw new IllegalArgumentException("Cannot append a HashVec to itself");
    }
    logger.log(Level.FINE, () -> String.format("append size:%d", other.size()));
    store.ensureCapacity(store.length() + other.size());
    for (int i = 0; i < other.size(); i++) {
      push(other.keyAt(i), other.valueAt(i));
    }
    other.clear();
  }

  /// Reserves space so that at least `minCapacity` entries fit without growing the store.
  public void ensureCapacity(int minCapacity) {
    store.ensureCapacity(minCapacity);
  }

  /// Releases spare store capacity.
  public void trimToSize() {
    store.trimToSize();
  }

  /// Shrinks the store capacity to the larger of `minCapacity` and size(). A store that is
  /// already smaller than `minCapacity` is regrown to it. The key index is a HashMap and cannot
  /// be trimmed; it keeps the table it has grown to.
  ///
  /// @param minCapacity the lower limit for the remaining capacity
  /// @throws IllegalArgumentException if minCapacity is negative
  public void shrinkTo(int minCapacity) {
    checkCapacity(minCapacity);
    logger.log(
        Level.FINE,
        () -> String.format("shrinkTo minCapacity:%d size:%d", minCapacity, store.length()));
    store.shrinkTo(minCapacity);
  }

  /// @return the keys in positional order, as an immutable snapshot
  public List<K> keys() {
    return snapshot(slot -> slot.key);
  }

  /// @return the values in positional order, as an immutable snapshot
  public List<V> values() {
    return snapshot(slot -> slot.value);
  }

  /// @return the pairs in positional order, as an immutable snapshot
  public List<Entry<K, V>> entries() {
    return snapshot(OrderedStore.Slot::toEntry);
  }

  /// Hands every entry over to the caller in positional order and empties this container.
  ///
  /// @return the former contents
  public List<Entry<K, V>> drain() {
    final var drained = entries();
    clear();
    return drained;
  }

  /// Iterates the entries in positional order. The iterator fails fast with
  /// ConcurrentModificationException if the container is structurally modified while it is in use.
  @Override
  public Iterator<Entry<K, V>> iterator() {
    return new EntryIterator();
  }

  @Override
  public Spliterator<Entry<K, V>> spliterator() {
    return Spliterators.spliterator(
        iterator(), store.length(), Spliterator.ORDERED | Spliterator.NONNULL);
  }

  /// @return a sequential stream of the entries in positional order
  public Stream<Entry<K, V>> stream() {
    return StreamSupport.stream(spliterator(), false);
  }

  /// Logs every entry with its position at the given level.
  ///
  /// @param level the logging level to use
  public void logAll(Level level) {
    logger.log(
        level,
        () -> String.format("Entries=%d, IndexSize=%d", store.length(), index.size()));
    for (int position = 0; position < store.length(); position++) {
      final var slot = store.read(position);
      final int finalPosition = position;
      final var indexed = index.lookup(slot.key);
      logger.log(
          level,
          () ->
              String.format(
                  "%d key=%s, indexPosition=%s, value=%s",
                  finalPosition,
                  slot.key,
                  indexed.isPresent() ? indexed.getAsInt() : "absent",
                  slot.value));
    }
  }

  /// Verifies that the index and the store agree.
  ///
  /// @throws IllegalStateException describing the first violation found
  void checkInvariants() {
    final int length = store.length();
    if (index.size() != length) {
      throw new IllegalStateException(
          String.format("index size %d does not match store length %d", index.size(), length));
    }
    index.forEach(
        (key, position) -> {
          if (position < 0 || position >= length) {
            throw new IllegalStateException(
                String.format("key %s indexed at %d outside 0..%d", key, position, length - 1));
          }
          final var stored = store.read(position).key;
          if (!stored.equals(key)) {
            throw new IllegalStateException(
                String.format("key %s indexed at %d which holds %s", key, position, stored));
          }
        });
    // a duplicated key would leave one of its positions unindexed, so this also covers uniqueness
    for (int position = 0; position < length; position++) {
      final var key = store.read(position).key;
      final var indexed = index.lookup(key);
      if (indexed.isEmpty() || indexed.getAsInt() != position) {
        throw new IllegalStateException(
            String.format("entry %s at %d is indexed at %s", key, position, indexed));
      }
    }
  }

  int modCount() {
    return modCount;
  }

  @TestOnly
  OrderedStore<K, V> store() {
    return store;
  }

  @TestOnly
  PositionIndex<K> positionIndex() {
    return index;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof HashVec<?, ?> other)) return false;
    if (size() != other.size()) return false;
    for (int position = 0; position < size(); position++) {
      if (!keyAt(position).equals(other.keyAt(position))
          || !valueAt(position).equals(other.valueAt(position))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int hash = 1;
    for (int position = 0; position < store.length(); position++) {
      final var slot = store.read(position);
      hash = 31 * hash + (slot.key.hashCode() ^ slot.value.hashCode());
    }
    return hash;
  }

  @Override
  public String toString() {
    if (store.length() == 0) return "{}";
    final var buffer = new StringBuilder(32);
    buffer.append('{');
    for (int position = 0; position < store.length(); position++) {
      if (position > 0) buffer.append(", ");
      buffer.append(store.read(position));
    }
    buffer.append('}');
    return buffer.toString();
  }

  /// Removes the slot at a valid position and renumbers every later key. Does not bump modCount.
  private OrderedStore.Slot<K, V> removeAtPosition(int position) {
    final var removed = store.removeAt(position);
    index.remove(removed.key);
    index.shiftPositionsAbove(position, -1);
    return removed;
  }

  private void structurallyModified() {
    modCount++;
    assert index.size() == store.length()
        : String.format("index:%d, store:%d", index.size(), store.length());
    if (validateInvariants) {
      checkInvariants();
    }
  }

  private void logState(String label) {
    logger.log(
        Level.FINEST,
        () -> String.format("%s maps: %s | %s", label, store.toString(), index.toString()));
  }

  private <T> List<T> snapshot(Function<OrderedStore.Slot<K, V>, T> extractor) {
    final var result = new ArrayList<T>(store.length());
    for (int position = 0; position < store.length(); position++) {
      result.add(extractor.apply(store.read(position)));
    }
    return Collections.unmodifiableList(result);
  }

  private static int checkCapacity(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("capacity must be non-negative, got " + capacity);
    }
    return capacity;
  }

  private static void requireKey(Object key) {
    if (key == null) {
      throw new IllegalArgumentException("Key cannot be null");
    }
  }

  private static void requireValue(Object value) {
    if (value == null) {
      throw new IllegalArgumentException("Value cannot be null");
    }
  }

  private final class EntryIterator implements Iterator<Entry<K, V>> {
    private int cursor;
    private final int expectedModCount = modCount;

    @Override
    public boolean hasNext() {
      checkForComodification();
      return cursor < store.length();
    }

    @Override
    public Entry<K, V> next() {
      checkForComodification();
      if (cursor >= store.length()) {
        throw new NoSuchElementException();
      }
      return store.read(cursor++).toEntry();
    }

    private void checkForComodification() {
      if (modCount != expectedModCount) {
        throw new ConcurrentModificationException(
            "HashVec was structurally modified during iteration");
      }
    }
  }
}
