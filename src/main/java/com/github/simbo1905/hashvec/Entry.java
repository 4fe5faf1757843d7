package com.github.simbo1905.hashvec;

/// Immutable key/value pair handed out by HashVec.
/// The container keeps its own mutable slots internally so a returned Entry is a copy of the
/// pair at the moment it was read and is unaffected by later mutations.
///
/// @param key the entry key
/// @param value the entry value
/// @param <K> key type
/// @param <V> value type
/// @see HashVec
public record Entry<K, V>(K key, V value) {

  /// Creates an entry. Convenience for literal construction with `HashVec.of(...)`.
  ///
  /// @param key the key
  /// @param value the value
  /// @return a new entry
  public static <K, V> Entry<K, V> of(K key, V value) {
    return new Entry<>(key, value);
  }

  @Override
  public String toString() {
    return key + "=" + value;
  }
}
