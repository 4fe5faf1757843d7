package com.github.simbo1905.hashvec;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import net.jqwik.api.*;

/// Property-based tests. Random operation sequences are replayed against a HashVec and against a
/// plain list model; after every step the two must agree and the invariants must hold.
public class HashVecPropertiesTest extends JulLoggingConfig {

  enum Kind {
    INSERT,
    PUSH,
    INSERT_AT,
    REMOVE,
    REMOVE_AT,
    RENAME,
    SWAP_KEYS,
    SWAP_INDICES,
    SET_VALUE_AT,
    POP,
    CLEAR
  }

  record Op(Kind kind, String key, String otherKey, int i, int j) {}

  /// Brute force reference: parallel key and value lists searched linearly.
  static final class Model {
    final List<String> keys = new ArrayList<>();
    final List<Integer> values = new ArrayList<>();

    int indexOf(String key) {
      return keys.indexOf(key);
    }

    void removeAt(int position) {
      keys.remove(position);
      values.remove(position);
    }

    void add(int position, String key, int value) {
      keys.add(position, key);
      values.add(position, value);
    }
  }

  @Property(tries = 300)
  void invariantsHoldAfterEveryOperation(@ForAll("operations") List<Op> ops) {
    final HashVec<String, Integer> hashVec = HashVec.builder().initialCapacity(0).build();
    final var model = new Model();
    for (Op op : ops) {
      apply(op, hashVec, model);
      hashVec.checkInvariants();
      assertEquals(op.toString(), model.keys, hashVec.keys());
      assertEquals(op.toString(), model.values, hashVec.values());
      assertEquals(new HashSet<>(model.keys).size(), hashVec.size());
    }
  }

  private static void apply(Op op, HashVec<String, Integer> hashVec, Model model) {
    final String key = op.key();
    final int existing = model.indexOf(key);
    final int size = model.keys.size();
    switch (op.kind()) {
      case INSERT -> {
        final var previous = hashVec.insert(key, op.i());
        if (existing >= 0) {
          assertEquals(Optional.of(model.values.get(existing)), previous);
          model.values.set(existing, op.i());
        } else {
          assertEquals(Optional.empty(), previous);
          model.add(size, key, op.i());
        }
      }
      case PUSH -> {
        final var previous = hashVec.push(key, op.i());
        if (existing >= 0) {
          assertEquals(Optional.of(model.values.get(existing)), previous);
          model.removeAt(existing);
        }
        model.add(model.keys.size(), key, op.i());
      }
      case INSERT_AT -> {
        if (existing >= 0) {
          assertThrows(KeyExistsException.class, () -> hashVec.insertAt(0, key, op.j()));
        } else if (op.i() > size) {
          assertThrows(
              IndexOutOfBoundsException.class, () -> hashVec.insertAt(op.i(), key, op.j()));
        } else {
          hashVec.insertAt(op.i(), key, op.j());
          model.add(op.i(), key, op.j());
        }
      }
      case REMOVE -> {
        final var removed = hashVec.remove(key);
        if (existing >= 0) {
          assertEquals(Optional.of(model.values.get(existing)), removed);
          model.removeAt(existing);
        } else {
          assertEquals(Optional.empty(), removed);
        }
      }
      case REMOVE_AT -> {
        if (op.i() < size) {
          assertEquals(model.keys.get(op.i()), hashVec.removeAt(op.i()).key());
          model.removeAt(op.i());
        } else {
          assertThrows(IndexOutOfBoundsException.class, () -> hashVec.removeAt(op.i()));
        }
      }
      case RENAME -> {
        final String newKey = op.otherKey();
        final int collision = model.indexOf(newKey);
        if (existing < 0) {
          assertEquals(Optional.empty(), hashVec.rename(key, newKey));
        } else if (collision >= 0 && collision != existing) {
          assertThrows(KeyExistsException.class, () -> hashVec.rename(key, newKey));
        } else {
          assertEquals(Optional.of(model.values.get(existing)), hashVec.rename(key, newKey));
          model.keys.set(existing, newKey);
        }
      }
      case SWAP_KEYS -> {
        final int other = model.indexOf(op.otherKey());
        final boolean swapped = hashVec.swapKeys(key, op.otherKey());
        assertEquals(existing >= 0 && other >= 0, swapped);
        if (swapped) {
          swapModel(model, existing, other);
        }
      }
      case SWAP_INDICES -> {
        if (op.i() < size && op.j() < size) {
          hashVec.swapIndices(op.i(), op.j());
          swapModel(model, op.i(), op.j());
        } else {
          assertThrows(
              IndexOutOfBoundsException.class, () -> hashVec.swapIndices(op.i(), op.j()));
        }
      }
      case SET_VALUE_AT -> {
        if (op.i() < size) {
          hashVec.setValueAt(op.i(), op.j());
          model.values.set(op.i(), op.j());
        } else {
          assertThrows(IndexOutOfBoundsException.class, () -> hashVec.setValueAt(op.i(), 0));
        }
      }
      case POP -> {
        final var popped = hashVec.pop();
        if (size == 0) {
          assertEquals(Optional.empty(), popped);
        } else {
          assertEquals(
              Optional.of(Entry.of(model.keys.get(size - 1), model.values.get(size - 1))), popped);
          model.removeAt(size - 1);
        }
      }
      case CLEAR -> {
        hashVec.clear();
        model.keys.clear();
        model.values.clear();
      }
    }
  }

  private static void swapModel(Model model, int a, int b) {
    final var key = model.keys.get(a);
    final var value = model.values.get(a);
    model.keys.set(a, model.keys.get(b));
    model.values.set(a, model.values.get(b));
    model.keys.set(b, key);
    model.values.set(b, value);
  }

  @Provide
  Arbitrary<List<Op>> operations() {
    Arbitrary<Kind> kinds =
        Arbitraries.frequencyOf(
            Tuple.of(6, Arbitraries.of(Kind.INSERT, Kind.PUSH, Kind.INSERT_AT)),
            Tuple.of(5, Arbitraries.of(Kind.values())),
            Tuple.of(1, Arbitraries.just(Kind.CLEAR)));
    // a small alphabet keeps collisions between keys frequent
    Arbitrary<String> keys = Arbitraries.strings().withCharRange('a', 'h').ofLength(1);
    Arbitrary<Integer> positions = Arbitraries.integers().between(0, 10);
    return Combinators.combine(kinds, keys, keys, positions, positions)
        .as(Op::new)
        .list()
        .ofMaxSize(80);
  }

  @Provide
  Arbitrary<List<String>> uniqueKeys() {
    return Arbitraries.strings()
        .alpha()
        .ofMinLength(1)
        .ofMaxLength(4)
        .list()
        .uniqueElements()
        .ofMinSize(1)
        .ofMaxSize(30);
  }

  /// Picks a position in 0..size-1 other than `position`. Needs size of at least 2.
  private static int distinctFrom(int position, int random, int size) {
    return (position + 1 + Math.floorMod(random, size - 1)) % size;
  }

  private static HashVec<String, Integer> numbered(List<String> keys) {
    final HashVec<String, Integer> hashVec = new HashVec<>();
    for (int i = 0; i < keys.size(); i++) {
      hashVec.push(keys.get(i), i);
    }
    return hashVec;
  }

  @Property
  void keysAreUnique(@ForAll("operations") List<Op> ops) {
    final HashVec<String, Integer> hashVec = new HashVec<>();
    for (Op op : ops) {
      if (op.kind() == Kind.INSERT) {
        hashVec.insert(op.key(), op.i());
      } else {
        hashVec.push(op.key(), op.i());
      }
    }
    assertEquals(hashVec.size(), new HashSet<>(hashVec.keys()).size());
  }

  @Property
  void pushMovesExistingKeyToEnd(@ForAll("uniqueKeys") List<String> keys, @ForAll int pick) {
    final var hashVec = numbered(keys);
    final var key = keys.get(Math.floorMod(pick, keys.size()));
    final int sizeBefore = hashVec.size();

    hashVec.push(key, -1);

    assertEquals(sizeBefore, hashVec.size());
    assertEquals(OptionalInt.of(hashVec.size() - 1), hashVec.index(key));
  }

  @Property
  void insertKeepsExistingPosition(@ForAll("uniqueKeys") List<String> keys, @ForAll int pick) {
    final var hashVec = numbered(keys);
    final var key = keys.get(Math.floorMod(pick, keys.size()));
    final var before = hashVec.index(key);

    hashVec.insert(key, -1);

    assertEquals(before, hashVec.index(key));
    assertEquals(Optional.of(-1), hashVec.get(key));
    assertEquals(keys, hashVec.keys());
  }

  @Property
  void removeThenAbsent(@ForAll("uniqueKeys") List<String> keys, @ForAll int pick) {
    final var hashVec = numbered(keys);
    final var key = keys.get(Math.floorMod(pick, keys.size()));
    final int sizeBefore = hashVec.size();

    hashVec.remove(key);

    assertEquals(Optional.empty(), hashVec.get(key));
    assertEquals(sizeBefore - 1, hashVec.size());
  }

  @Property
  void swapIndicesIsSelfInverse(
      @ForAll("uniqueKeys") List<String> keys, @ForAll int a, @ForAll int b) {
    Assume.that(keys.size() >= 2);
    final int i = Math.floorMod(a, keys.size());
    final int j = distinctFrom(i, b, keys.size());
    final var hashVec = numbered(keys);

    hashVec.swapIndices(i, j);
    assertEquals(keys.get(i), hashVec.keyAt(j));
    hashVec.swapIndices(i, j);

    assertEquals(keys, hashVec.keys());
    hashVec.checkInvariants();
  }

  @Property
  void renameKeepsPositionAndValue(@ForAll("uniqueKeys") List<String> keys, @ForAll int pick) {
    final var hashVec = numbered(keys);
    final var oldKey = keys.get(Math.floorMod(pick, keys.size()));
    // digits never appear in the alpha keys so this is unused
    final var newKey = oldKey + "1";
    final var position = hashVec.index(oldKey);
    final var value = hashVec.get(oldKey);

    hashVec.rename(oldKey, newKey);

    assertEquals(position, hashVec.index(newKey));
    assertEquals(value, hashVec.get(newKey));
    assertEquals(Optional.empty(), hashVec.get(oldKey));
  }

  @Property
  void renameOntoAnotherKeyChangesNothing(
      @ForAll("uniqueKeys") List<String> keys, @ForAll int a, @ForAll int b) {
    Assume.that(keys.size() >= 2);
    final int i = Math.floorMod(a, keys.size());
    final var oldKey = keys.get(i);
    final var newKey = keys.get(distinctFrom(i, b, keys.size()));
    final var hashVec = numbered(keys);
    final var before = hashVec.entries();

    assertThrows(KeyExistsException.class, () -> hashVec.rename(oldKey, newKey));

    assertEquals(before, hashVec.entries());
    hashVec.checkInvariants();
  }

  @Property
  void pushThenPopRoundTrips(@ForAll("uniqueKeys") List<String> keys, @ForAll int value) {
    final var hashVec = numbered(keys);
    final var before = hashVec.entries();
    final var pair = Entry.of("#unused", value);

    hashVec.push(pair);

    assertEquals(Optional.of(pair), hashVec.pop());
    assertEquals(before, hashVec.entries());
  }

  @Property
  void fromPairsMatchesRepeatedPush(@ForAll("operations") List<Op> ops) {
    final List<Entry<String, Integer>> pairs = new ArrayList<>();
    for (Op op : ops) {
      pairs.add(Entry.of(op.key(), op.i()));
    }
    final HashVec<String, Integer> pushed = new HashVec<>();
    pairs.forEach(pushed::push);

    final HashVec<String, Integer> built = HashVec.fromPairs(pairs);

    assertEquals(pushed, built);
    built.checkInvariants();
  }
}
