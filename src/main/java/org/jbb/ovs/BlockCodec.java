package org.jbb.ovs;

import org.jetbrains.annotations.NotNull;

import java.io.Closeable;
import java.io.IOException;

/**
 * Moves whole buffers of words between memory and a file.
 *
 * @see BlockCompression
 *
 * @since 17/10/26
 */
interface BlockCodec extends Closeable {
  /** Persists {@code words[0, len)}. */
  void writeBlock(@NotNull SeekableDataOutput out, @NotNull int[] words, int len)
      throws IOException;

  /**
   * Loads the next block into {@code words}, never more than
   * {@code words.length} words.
   *
   * @return the number of words loaded, zero at end of file.
   */
  int readBlock(@NotNull SeekableDataInput in, @NotNull int[] words) throws IOException;

  /** True if record boundaries map to fixed byte offsets in the file. */
  boolean isRandomAccess();

  @Override
  default void close() {}
}
