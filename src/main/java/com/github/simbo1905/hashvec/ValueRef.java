package com.github.simbo1905.hashvec;

import java.util.ConcurrentModificationException;

/// A mutable handle on one value inside a HashVec, returned by `HashVec.getMut`.
///
/// The handle is only valid until the next structural mutation of the container that issued it
/// (insert of a new key, push, remove, rename, swap, pop, clear and so on). Using it after such a
/// mutation throws ConcurrentModificationException. Value-only updates through other handles,
/// `insert` on an existing key or `setValueAt` do not invalidate it.
///
/// @param <V> value type
public final class ValueRef<V> {

  private final HashVec<?, V> owner;
  private final OrderedStore.Slot<?, V> slot;
  private final int expectedModCount;

  ValueRef(HashVec<?, V> owner, OrderedStore.Slot<?, V> slot) {
    this.owner = owner;
    this.slot = slot;
    this.expectedModCount = owner.modCount();
  }

  /// @return the current value
  public V get() {
    ensureValid();
    return slot.value;
  }

  /// Replaces the value in place. The entry keeps its key and position.
  ///
  /// @param value the new value, must not be null
  /// @return the previous value
  public V set(V value) {
    ensureValid();
    if (value == null) {
      throw new IllegalArgumentException("Value cannot be null");
    }
    final var previous = slot.value;
    slot.value = value;
    return previous;
  }

  /// @return true if the container has not been structurally modified since this handle was issued
  public boolean isValid() {
    return owner.modCount() == expectedModCount;
  }

  private void ensureValid() {
    if (!isValid()) {
      throw new ConcurrentModificationException(
          "Value reference used after a structural modification of the HashVec");
    }
  }

  @Override
  public String toString() {
    return isValid() ? "ValueRef[" + slot.value + "]" : "ValueRef[stale]";
  }
}
