package org.jbb.ovs;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * A fixed-capacity run of words with a fill mark and a read cursor.
 *
 * Always {@code pos <= len <= max}.
 *
 * @since 17/10/26
 */
class WordBuffer {
  final int[] words;
  /** Valid words present. */
  int len;
  /** Next word to consume. */
  int pos;

  WordBuffer(final int max) {
    Preconditions.checkArgument(max > 0, "capacity must be positive: %s", max);
    words = new int[max];
  }

  int max() {
    return words.length;
  }

  boolean isFull() {
    return len == words.length;
  }

  boolean isEmpty() {
    return len == 0;
  }

  /** True if nothing is left to consume. */
  boolean isDrained() {
    return pos >= len;
  }

  /** Discards buffered words so the next read goes to the file. */
  void invalidate() {
    pos = len;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("len", len)
        .add("pos", pos)
        .add("max", words.length)
        .toString();
  }
}
