package org.jbb.ovs;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;

/**
 * Dumps words as is. Short reads are expected at the end of the file,
 * but only on a word boundary.
 *
 * @since 17/10/26
 */
class RawBlockCodec implements BlockCodec {
  @Override
  public void writeBlock(@NotNull final SeekableDataOutput out, @NotNull final int[] words,
                         final int len) throws IOException {
    out.writeInts(words, 0, len);
  }

  @Override
  public int readBlock(@NotNull final SeekableDataInput in, @NotNull final int[] words)
      throws IOException {
    final int len = in.readInts(words, 0, words.length);
    if (in.danglingBytes() != 0) {
      throw new OverlapFileException(
          String.format("file ends with %d bytes of a partial word", in.danglingBytes()));
    }

    return len;
  }

  @Override
  public boolean isRandomAccess() {
    return true;
  }
}
