package com.github.simbo1905.hashvec;

import java.util.logging.Level;
import java.util.logging.Logger;

/// Builder for creating HashVec instances with a fluent API.
///
/// Example usage:
/// <pre>
/// HashVec&lt;String, Integer&gt; scores = HashVec.builder()
///     .initialCapacity(1000)
///     .validateInvariants(true)
///     .build();
/// </pre>
public class HashVecBuilder {

  private static final Logger logger = Logger.getLogger(HashVecBuilder.class.getName());

  /// Default number of entries space is reserved for.
  public static final int DEFAULT_INITIAL_CAPACITY = 16;

  /// System property or environment variable that switches on invariant validation by default.
  public static final String VALIDATE_INVARIANTS_PROPERTY =
      HashVec.class.getName() + ".VALIDATE_INVARIANTS";

  private int initialCapacity = DEFAULT_INITIAL_CAPACITY;
  private boolean validateInvariants = validateInvariantsOrDefault();

  /// Sets the number of entries to reserve space for.
  ///
  /// @param initialCapacity the expected number of entries, must not be negative
  /// @return this builder for chaining
  public HashVecBuilder initialCapacity(int initialCapacity) {
    if (initialCapacity < 0) {
      throw new IllegalArgumentException(
          "initialCapacity must be non-negative, got " + initialCapacity);
    }
    this.initialCapacity = initialCapacity;
    return this;
  }

  /// Enables a full check of the index/store invariants after every structural mutation.
  /// This makes every mutation O(n) and is meant for debugging and tests.
  ///
  /// @param validateInvariants true to check after every structural mutation
  /// @return this builder for chaining
  public HashVecBuilder validateInvariants(boolean validateInvariants) {
    this.validateInvariants = validateInvariants;
    return this;
  }

  /// Creates an empty HashVec.
  ///
  /// @return a new empty container
  public <K, V> HashVec<K, V> build() {
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "build initialCapacity=%d validateInvariants=%b",
                initialCapacity, validateInvariants));
    return new HashVec<>(initialCapacity, validateInvariants);
  }

  /// Creates a HashVec holding the given pairs. Each pair is pushed in order, so for a repeated
  /// key the last value wins and sits at the position of its last occurrence.
  ///
  /// @param pairs the initial entries in order
  /// @return a new populated container
  /// @throws IllegalArgumentException if pairs, any pair, or any key or value is null
  public <K, V> HashVec<K, V> from(Iterable<? extends Entry<? extends K, ? extends V>> pairs) {
    if (pairs == null) {
      throw new IllegalArgumentException("pairs cannot be null");
    }
    final HashVec<K, V> hashVec = build();
    for (Entry<? extends K, ? extends V> pair : pairs) {
      if (pair == null) {
        throw new IllegalArgumentException("Entry cannot be null");
      }
      hashVec.push(pair.key(), pair.value());
    }
    return hashVec;
  }

  static boolean validateInvariantsOrDefault() {
    final String key = VALIDATE_INVARIANTS_PROPERTY;
    String validate = System.getenv(key) == null ? Boolean.FALSE.toString() : System.getenv(key);
    validate = System.getProperty(key, validate);
    return Boolean.parseBoolean(validate);
  }
}
