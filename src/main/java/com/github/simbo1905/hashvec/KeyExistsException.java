package com.github.simbo1905.hashvec;

import lombok.Getter;

/// Thrown when an operation would give an entry a key that another entry already holds.
/// The container is left unchanged when this is thrown.
public class KeyExistsException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  /// The key that is already in use.
  @Getter private final transient Object key;

  public KeyExistsException(Object key, int position) {
    super(String.format("Key exists: %s at position %d", key, position));
    this.key = key;
  }
}
