package org.jbb.ovs;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.Channels;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.zip.GZIPOutputStream;

/**
 * A byte order-aware complement to {@link SeekableDataInput}.
 *
 * Opening truncates an existing file. Names ending in {@code .gz} are
 * written through a gzip stream and cannot be seeked.
 *
 * @since 17/10/26
 */
public class SeekableDataOutput extends OutputStream implements AutoCloseable {
  private static final int GZIP_BUFFER_SIZE = 64 * 1024;

  /**
   * Defaults byte order to {@code ByteOrder.LITTLE_ENDIAN}.
   *
   * @see #of(Path, ByteOrder)
   */
  public static SeekableDataOutput of(final Path path) throws IOException {
    return of(path, ByteOrder.LITTLE_ENDIAN);
  }

  public static SeekableDataOutput of(final Path path, final ByteOrder order)
      throws IOException {
    if (CompressedFiles.isCompressed(path)) {
      final OutputStream raw = Files.newOutputStream(path);
      try {
        return new SeekableDataOutput(
            null,
            new GZIPOutputStream(new BufferedOutputStream(raw, GZIP_BUFFER_SIZE),
                                 GZIP_BUFFER_SIZE),
            order);
      } catch (final IOException e) {
        raw.close();
        throw e;
      }
    }

    final RandomAccessFile file = new RandomAccessFile(path.toFile(), "rw");
    try {
      file.setLength(0);
    } catch (final IOException e) {
      file.close();
      throw e;
    }

    return new SeekableDataOutput(file, Channels.newOutputStream(file.getChannel()), order);
  }

  @Nullable private final RandomAccessFile file;
  @NotNull private final OutputStream out;
  private ByteOrder order;
  private long position;
  private byte[] scratch = new byte[0];

  private SeekableDataOutput(@Nullable final RandomAccessFile file,
                             @NotNull final OutputStream out,
                             final ByteOrder order) {
    this.file = file;
    this.out = Objects.requireNonNull(out);
    this.order = Objects.requireNonNull(order);
  }

  public ByteOrder order() {
    return order;
  }

  public void order(final ByteOrder order) {
    this.order = Objects.requireNonNull(order);
  }

  public boolean isSeekable() {
    return file != null;
  }

  public void seek(final long pos) throws IOException {
    Preconditions.checkState(file != null, "compressed output is not seekable");
    file.seek(pos);
  }

  public long tell() throws IOException {
    return file != null ? file.getFilePointer() : position;
  }

  @Override
  public void write(final int b) throws IOException {
    out.write(b);
    position++;
  }

  @Override
  public void write(@NotNull final byte[] b, final int off, final int len) throws IOException {
    out.write(b, off, len);
    position += len;
  }

  public void writeInt(final int v) throws IOException {
    final byte[] b = Ints.toByteArray(v);
    if (order == ByteOrder.LITTLE_ENDIAN) {
      write(new byte[] {b[3], b[2], b[1], b[0]}, 0, b.length);
    } else {
      write(b, 0, b.length);
    }
  }

  public void writeUnsignedInt(final long v) throws IOException {
    Preconditions.checkArgument(v >= 0 && v <= 0xffffffffL, "not an unsigned int: %s", v);
    writeInt((int) v);
  }

  public void writeLong(final long v) throws IOException {
    final byte[] b = Longs.toByteArray(v);
    if (order == ByteOrder.LITTLE_ENDIAN) {
      write(new byte[] {b[7], b[6], b[5], b[4], b[3], b[2], b[1], b[0]}, 0, b.length);
    } else {
      write(b, 0, b.length);
    }
  }

  /** Writes {@code len} 32-bit words from {@code src}. */
  public void writeInts(@NotNull final int[] src, final int offset, final int len)
      throws IOException {
    final int bytes = len * Integer.BYTES;
    if (scratch.length < bytes) {
      scratch = new byte[bytes];
    }

    ByteBuffer.wrap(scratch, 0, bytes).order(order).asIntBuffer().put(src, offset, len);
    write(scratch, 0, bytes);
  }

  @Override
  public void flush() throws IOException {
    out.flush();
  }

  @Override
  public void close() throws IOException {
    try {
      out.close();
    } finally {
      if (file != null) {
        file.close();
      }
    }
  }
}
