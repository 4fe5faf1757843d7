package com.github.simbo1905.hashvec;

import java.util.ArrayList;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Dense positional store of key/value slots, positions 0..length-1 with no gaps.
/// Knows nothing about key lookup; HashVec pairs it with a PositionIndex.
final class OrderedStore<K, V> {

  private static final Logger logger = Logger.getLogger(OrderedStore.class.getName());

  /// Mutable holder for one entry. Only the owning HashVec ever writes to it.
  static final class Slot<K, V> {
    K key;
    V value;

    Slot(K key, V value) {
      this.key = key;
      this.value = value;
    }

    Entry<K, V> toEntry() {
      return new Entry<>(key, value);
    }

    @Override
    public String toString() {
      return key + "=" + value;
    }
  }

  private final ArrayList<Slot<K, V>> slots;

  OrderedStore(int initialCapacity) {
    this.slots = new ArrayList<>(initialCapacity);
  }

  /// Adds a slot at the end.
  ///
  /// @return the position of the new slot
  int append(K key, V value) {
    final int position = slots.size();
    slots.add(new Slot<>(key, value));
    return position;
  }

  Slot<K, V> read(int position) {
    return slots.get(Objects.checkIndex(position, slots.size()));
  }

  /// Overwrites the value at a position.
  ///
  /// @return the previous value
  V writeValue(int position, V value) {
    final var slot = read(position);
    final var previous = slot.value;
    slot.value = value;
    return previous;
  }

  /// Overwrites the key at a position.
  ///
  /// @return the previous key
  K writeKey(int position, K key) {
    final var slot = read(position);
    final var previous = slot.key;
    slot.key = key;
    return previous;
  }

  /// Inserts a slot so that it ends up at `position`, moving every slot at or after it one later.
  /// Valid positions are 0..length inclusive.
  void insertAt(int position, K key, V value) {
    Objects.checkIndex(position, slots.size() + 1);
    slots.add(position, new Slot<>(key, value));
    logger.log(
        Level.FINEST, () -> String.format("insertAt position:%d shifted:%d", position,
            slots.size() - 1 - position));
  }

  /// Removes the slot at `position`, moving every later slot one earlier.
  ///
  /// @return the removed slot
  Slot<K, V> removeAt(int position) {
    Objects.checkIndex(position, slots.size());
    final var removed = slots.remove(position);
    logger.log(
        Level.FINEST, () -> String.format("removeAt position:%d shifted:%d", position,
            slots.size() - position));
    return removed;
  }

  void swap(int a, int b) {
    Objects.checkIndex(a, slots.size());
    Objects.checkIndex(b, slots.size());
    final var slotA = slots.get(a);
    slots.set(a, slots.get(b));
    slots.set(b, slotA);
  }

  int length() {
    return slots.size();
  }

  void clear() {
    slots.clear();
  }

  void ensureCapacity(int minCapacity) {
    slots.ensureCapacity(minCapacity);
  }

  void trimToSize() {
    slots.trimToSize();
  }

  /// Trims then re-reserves so capacity ends at max(minCapacity, length).
  void shrinkTo(int minCapacity) {
    slots.trimToSize();
    slots.ensureCapacity(Math.max(minCapacity, slots.size()));
  }

  @Override
  public String toString() {
    return slots.toString();
  }
}
