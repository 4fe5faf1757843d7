package com.github.simbo1905.hashvec;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.function.ObjIntConsumer;

/// Maps each key to its current position in the OrderedStore.
/// Positions are opaque ints here; keeping them correct after the store shifts is the caller's job,
/// which is what shiftPositionsAbove is for.
final class PositionIndex<K> {

  private final HashMap<K, Integer> positions;

  PositionIndex(int initialCapacity) {
    this.positions = new HashMap<>(Math.max(16, (int) (initialCapacity / 0.75f) + 1));
  }

  OptionalInt lookup(K key) {
    final Integer position = positions.get(key);
    return position == null ? OptionalInt.empty() : OptionalInt.of(position);
  }

  boolean containsKey(K key) {
    return positions.containsKey(key);
  }

  void set(K key, int position) {
    positions.put(key, position);
  }

  /// @return the position the key was mapped to, or empty if it was not present
  OptionalInt remove(K key) {
    final Integer position = positions.remove(key);
    return position == null ? OptionalInt.empty() : OptionalInt.of(position);
  }

  /// Adds `delta` to every recorded position strictly greater than `threshold`.
  /// Scans the whole index.
  void shiftPositionsAbove(int threshold, int delta) {
    if (delta == 0) {
      return;
    }
    positions.replaceAll((key, position) -> position > threshold ? position + delta : position);
  }

  int size() {
    return positions.size();
  }

  void clear() {
    positions.clear();
  }

  void forEach(ObjIntConsumer<K> action) {
    for (Map.Entry<K, Integer> e : positions.entrySet()) {
      action.accept(e.getKey(), e.getValue());
    }
  }

  @Override
  public String toString() {
    return positions.toString();
  }
}
