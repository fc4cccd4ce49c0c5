package org.jbb.ovs;

import com.google.common.base.Preconditions;
import com.google.common.io.ByteStreams;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.Channels;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.zip.GZIPInputStream;

/**
 * A byte order-aware input over a plain or gzip-compressed file.
 *
 * Plain files are backed by a {@link RandomAccessFile} and support
 * {@link #seek(long)}; compressed ones are forward-only.
 *
 * @since 17/10/26
 */
public class SeekableDataInput extends InputStream implements AutoCloseable {
  private static final int GZIP_BUFFER_SIZE = 64 * 1024;

  /**
   * Defaults byte order to {@code ByteOrder.LITTLE_ENDIAN}.
   *
   * @see #of(Path, ByteOrder)
   */
  public static SeekableDataInput of(final Path path) throws IOException {
    return of(path, ByteOrder.LITTLE_ENDIAN);
  }

  public static SeekableDataInput of(final Path path, final ByteOrder order)
      throws IOException {
    if (CompressedFiles.isCompressed(path)) {
      final InputStream raw = Files.newInputStream(path);
      try {
        return new SeekableDataInput(
            null, new GZIPInputStream(new BufferedInputStream(raw), GZIP_BUFFER_SIZE), order);
      } catch (final IOException e) {
        raw.close();
        throw e;
      }
    }

    final RandomAccessFile file;
    try {
      file = new RandomAccessFile(path.toFile(), "r");
    } catch (final FileNotFoundException e) {
      throw new FileNotFoundException(path + ": " + e.getMessage());
    }

    return new SeekableDataInput(file, Channels.newInputStream(file.getChannel()), order);
  }

  @Nullable private final RandomAccessFile file;
  @NotNull private final InputStream in;
  private ByteOrder order;
  /** Bytes consumed so far, only maintained for compressed input. */
  private long position;
  private byte[] scratch = new byte[0];
  /** Bytes of a partial word left over by the last {@link #readInts}. */
  private int danglingBytes;

  private SeekableDataInput(@Nullable final RandomAccessFile file,
                            @NotNull final InputStream in,
                            final ByteOrder order) {
    this.file = file;
    this.in = Objects.requireNonNull(in);
    this.order = Objects.requireNonNull(order);
  }

  public ByteOrder order() {
    return order;
  }

  public void order(final ByteOrder order) {
    this.order = Objects.requireNonNull(order);
  }

  /** False if the file is compressed and can only be read front to back. */
  public boolean isSeekable() {
    return file != null;
  }

  public void seek(final long pos) throws IOException {
    Preconditions.checkState(file != null, "compressed input is not seekable");
    file.seek(pos);
  }

  public long tell() throws IOException {
    return file != null ? file.getFilePointer() : position;
  }

  @Override
  public int read() throws IOException {
    final int b = in.read();
    if (b != -1) {
      position++;
    }

    return b;
  }

  /**
   * Reads up to {@code len} bytes, stopping early only at end of file.
   *
   * @return the number of bytes actually read.
   */
  @Override
  public int read(@NotNull final byte[] buf, final int offset, final int len) throws IOException {
    final int n = ByteStreams.read(in, buf, offset, len);
    position += n;
    return n == 0 && len > 0 ? -1 : n;
  }

  public void readFully(@NotNull final byte[] buf, final int offset, final int len)
      throws IOException {
    if (ByteStreams.read(in, buf, offset, len) != len) {
      throw new EOFException();
    }

    position += len;
  }

  public int readInt() throws IOException {
    final byte[] b = new byte[Integer.BYTES];
    readFully(b, 0, b.length);
    return order == ByteOrder.BIG_ENDIAN
           ? Ints.fromBytes(b[0], b[1], b[2], b[3])
           : Ints.fromBytes(b[3], b[2], b[1], b[0]);
  }

  public long readUnsignedInt() throws IOException {
    return Integer.toUnsignedLong(readInt());
  }

  public long readLong() throws IOException {
    final byte[] b = new byte[Long.BYTES];
    readFully(b, 0, b.length);
    return order == ByteOrder.BIG_ENDIAN
           ? Longs.fromBytes(b[0], b[1], b[2], b[3], b[4], b[5], b[6], b[7])
           : Longs.fromBytes(b[7], b[6], b[5], b[4], b[3], b[2], b[1], b[0]);
  }

  /**
   * Reads up to {@code len} 32-bit words into {@code dst}. A short count
   * means end of file; the bytes of a trailing partial word are dropped
   * and counted by {@link #danglingBytes()}.
   *
   * @return the number of whole words read.
   */
  public int readInts(@NotNull final int[] dst, final int offset, final int len)
      throws IOException {
    final int bytes = len * Integer.BYTES;
    if (scratch.length < bytes) {
      scratch = new byte[bytes];
    }

    final int n = ByteStreams.read(in, scratch, 0, bytes);
    position += n;

    final int words = n / Integer.BYTES;
    danglingBytes = n % Integer.BYTES;
    ByteBuffer.wrap(scratch, 0, words * Integer.BYTES)
        .order(order)
        .asIntBuffer()
        .get(dst, offset, words);
    return words;
  }

  /** Bytes dropped at the end of the last {@link #readInts} call. */
  public int danglingBytes() {
    return danglingBytes;
  }

  @Override
  public void close() throws IOException {
    try {
      in.close();
    } finally {
      if (file != null) {
        file.close();
      }
    }
  }
}
