package org.jbb.ovs;

import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * Per-sequence overlap counts, indexed by sequence identifier.
 *
 * The backing array grows by a quarter at a time and never shrinks.
 * Slots past the largest identifier seen are zero.
 *
 * @since 17/10/26
 */
public class CountArray {
  static final int INITIAL_CAPACITY = 128 * 1024;
  /** Largest array length the JVM reliably allocates. */
  static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

  private int[] counts;
  /** Largest identifier seen so far. */
  private int last;

  public CountArray() {
    this(INITIAL_CAPACITY);
  }

  public CountArray(final int initialCapacity) {
    Preconditions.checkArgument(initialCapacity >= 4,
                                "initial capacity too small: %s", initialCapacity);
    counts = new int[initialCapacity];
  }

  /**
   * Makes room for identifiers up to and including {@code id}, growing
   * geometrically.
   */
  public void ensureCapacity(final int id) {
    checkId(id);
    if (id < counts.length) {
      return;
    }

    long newCapacity = counts.length;
    while (newCapacity <= id) {
      newCapacity += newCapacity / 4;
    }

    counts = Arrays.copyOf(counts, (int) Math.min(newCapacity, MAX_CAPACITY));
  }

  /**
   * Counts one overlap between {@code aId} and {@code bId}. Both slots are
   * bumped, so a self-overlap counts twice.
   */
  public void add(final int aId, final int bId) {
    checkId(aId);
    checkId(bId);
    ensureCapacity(Math.max(aId, bId));
    counts[aId]++;
    counts[bId]++;
    last = Math.max(last, Math.max(aId, bId));
  }

  public int get(final int id) {
    checkId(id);
    return id < counts.length ? counts[id] : 0;
  }

  /** Number of slots up to the largest identifier seen, at least one. */
  public int size() {
    return last + 1;
  }

  public int capacity() {
    return counts.length;
  }

  /** Returns a copy of the first {@link #size()} counts. */
  public int[] toArray() {
    return Arrays.copyOf(counts, size());
  }

  private static void checkId(final int id) {
    Preconditions.checkArgument(id >= 0 && id < MAX_CAPACITY, "identifier out of range: %s",
                                Integer.toUnsignedString(id));
  }
}
