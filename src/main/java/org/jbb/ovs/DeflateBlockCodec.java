package org.jbb.ovs;

import com.google.common.primitives.Ints;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Compresses each buffer as a single ZLIB block, prefixed with its
 * compressed length as a 64-bit integer in the file's byte order.
 *
 * @since 17/10/26
 */
class DeflateBlockCodec implements BlockCodec {
  private final Deflater deflater = new Deflater();
  private final Inflater inflater = new Inflater();
  /** Uncompressed image of the word buffer. */
  private byte[] plain = new byte[0];
  /** Compressed frame being written or read. */
  private byte[] packed = new byte[0];

  @Override
  public void writeBlock(@NotNull final SeekableDataOutput out, @NotNull final int[] words,
                         final int len) throws IOException {
    final int plainLen = len * Integer.BYTES;
    ensurePlain(plainLen);
    ByteBuffer.wrap(plain, 0, plainLen).order(out.order()).asIntBuffer().put(words, 0, len);

    deflater.reset();
    deflater.setInput(plain, 0, plainLen);
    deflater.finish();

    if (packed.length < plainLen + 64) {
      packed = new byte[plainLen + 64];
    }

    int packedLen = 0;
    while (!deflater.finished()) {
      if (packedLen == packed.length) {
        packed = Arrays.copyOf(packed, packed.length + packed.length / 2);
      }

      packedLen += deflater.deflate(packed, packedLen, packed.length - packedLen);
    }

    out.writeLong(packedLen);
    out.write(packed, 0, packedLen);
  }

  @Override
  public int readBlock(@NotNull final SeekableDataInput in, @NotNull final int[] words)
      throws IOException {
    final byte[] prefix = new byte[Long.BYTES];
    final int prefixLen = Math.max(in.read(prefix, 0, prefix.length), 0);
    if (prefixLen == 0) {
      return 0;
    } else if (prefixLen < prefix.length) {
      throw new OverlapFileException(
          String.format("short read of frame length: read %d bytes, expected %d",
                        prefixLen, prefix.length));
    }

    final long frameLen = ByteBuffer.wrap(prefix).order(in.order()).getLong();
    if (frameLen <= 0 || frameLen > Integer.MAX_VALUE) {
      throw new OverlapFileException("invalid frame length " + frameLen);
    }

    final int packedLen = Ints.checkedCast(frameLen);
    if (packed.length < packedLen) {
      packed = new byte[packedLen];
    }

    final int read = Math.max(in.read(packed, 0, packedLen), 0);
    if (read != packedLen) {
      throw new OverlapFileException(
          String.format("short read of frame: read %d bytes, expected %d", read, packedLen));
    }

    // One spare byte tells an overflowing frame from one that fills the buffer exactly.
    final int capacity = words.length * Integer.BYTES;
    ensurePlain(capacity + 1);

    inflater.reset();
    inflater.setInput(packed, 0, packedLen);
    final int plainLen;
    try {
      int n = 0;
      while (!inflater.finished() && n <= capacity) {
        final int k = inflater.inflate(plain, n, capacity + 1 - n);
        if (k == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
          break;
        }

        n += k;
      }

      plainLen = n;
    } catch (final DataFormatException e) {
      throw new OverlapFileException("corrupt frame", e);
    }

    if (plainLen > capacity) {
      throw new OverlapFileException(
          "frame does not fit a buffer of " + words.length + " words");
    } else if (!inflater.finished()) {
      throw new OverlapFileException("truncated frame");
    }

    if (inflater.getRemaining() != 0) {
      throw new OverlapFileException(
          "frame has " + inflater.getRemaining() + " trailing bytes");
    }

    if (plainLen % Integer.BYTES != 0) {
      throw new OverlapFileException("frame holds a partial word: " + plainLen + " bytes");
    }

    final int len = plainLen / Integer.BYTES;
    ByteBuffer.wrap(plain, 0, plainLen).order(in.order()).asIntBuffer().get(words, 0, len);
    return len;
  }

  @Override
  public boolean isRandomAccess() {
    return false;
  }

  @Override
  public void close() {
    deflater.end();
    inflater.end();
  }

  private void ensurePlain(final int size) {
    if (plain.length < size) {
      plain = new byte[size];
    }
  }
}
