package org.jbb.ovs;

import com.google.common.base.Preconditions;
import com.google.common.io.ByteStreams;

import org.jetbrains.annotations.NotNull;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

/**
 * A pull-style byte source over a gzip file.
 *
 * Decoded bytes are served from a fixed-size buffer: {@link #current()}
 * peeks, {@link #advance()} moves on. Offsets count decoded bytes. Seeking
 * forward decodes and discards; seeking backward restarts from the top of
 * the file.
 *
 * @since 17/10/26
 */
public class CompressedByteSource implements Closeable {
  public static final int DEFAULT_BUFFER_SIZE = 32 * 1024;

  public static CompressedByteSource of(final Path path) throws IOException {
    return new CompressedByteSource(path, DEFAULT_BUFFER_SIZE);
  }

  public static CompressedByteSource of(final Path path, final int bufferSize)
      throws IOException {
    return new CompressedByteSource(path, bufferSize);
  }

  @NotNull private final Path path;
  @NotNull private final byte[] buf;
  private InputStream in;
  /** Valid bytes in {@link #buf}. */
  private int len;
  private int pos;
  /** Decoded offset of {@code buf[pos]}. */
  private long offset;
  private boolean eof;

  private CompressedByteSource(@NotNull final Path path, final int bufferSize)
      throws IOException {
    Preconditions.checkArgument(bufferSize > 0, "buffer size must be positive: %s", bufferSize);
    this.path = path;
    this.buf = new byte[bufferSize];
    reopen();
  }

  public boolean eof() {
    return eof;
  }

  /**
   * Moves to the next byte.
   *
   * @return true if that runs off the end of the data.
   */
  public boolean advance() throws IOException {
    if (eof) {
      return true;
    }

    pos++;
    offset++;
    if (pos >= len) {
      fillBuffer();
    }

    return eof;
  }

  /** The byte under the cursor; undefined at end of file. */
  public byte current() {
    return eof ? 0 : buf[pos];
  }

  /** Returns the current byte and advances past it. */
  public byte next() throws IOException {
    final byte b = current();
    advance();
    return b;
  }

  public long tell() {
    return offset;
  }

  /**
   * Positions the cursor at decoded offset {@code target}.
   *
   * @return false if the data ends before {@code target}.
   */
  public boolean seek(final long target) throws IOException {
    Preconditions.checkArgument(target >= 0, "negative offset: %s", target);
    long bufferStart = offset - pos;
    if (target < bufferStart) {
      reopen();
      bufferStart = 0;
    }

    if (target < bufferStart + len) {
      pos = (int) (target - bufferStart);
      offset = target;
      return true;
    }

    // Past the buffer: drop it and decode up to the target.
    final long gap = target - (bufferStart + len);
    final long skipped = skip(gap);
    offset = bufferStart + len + skipped;
    fillBuffer();
    return skipped == gap && !eof;
  }

  /**
   * Copies up to {@code length} bytes into {@code dst}.
   *
   * @return the number of bytes copied, short only at end of file.
   */
  public int read(@NotNull final byte[] dst, final int length) throws IOException {
    Preconditions.checkPositionIndex(length, dst.length);

    int copied = 0;
    while (copied < length && !eof) {
      final int n = Math.min(length - copied, len - pos);
      System.arraycopy(buf, pos, dst, copied, n);
      copied += n;
      pos += n;
      offset += n;
      if (pos >= len) {
        fillBuffer();
      }
    }

    return copied;
  }

  @Override
  public void close() throws IOException {
    in.close();
  }

  private void reopen() throws IOException {
    if (in != null) {
      in.close();
    }

    final InputStream raw = new BufferedInputStream(Files.newInputStream(path));
    try {
      in = new GZIPInputStream(raw);
    } catch (final IOException e) {
      raw.close();
      throw e;
    }

    len = 0;
    pos = 0;
    offset = 0;
    eof = false;
    fillBuffer();
  }

  private void fillBuffer() throws IOException {
    pos = 0;
    len = ByteStreams.read(in, buf, 0, buf.length);
    eof = len == 0;
  }

  private long skip(final long n) throws IOException {
    long skipped = 0;
    while (skipped < n) {
      final int k = ByteStreams.read(in, buf, 0, (int) Math.min(n - skipped, buf.length));
      if (k == 0) {
        break;
      }

      skipped += k;
    }

    return skipped;
  }
}
