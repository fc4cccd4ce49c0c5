package org.jbb.ovs;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.io.Closer;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A file of fixed-width overlap records.
 *
 * Records are staged in a word buffer whose capacity is a multiple of both
 * the normal and the full record size, so a buffer never ends in the middle
 * of a record. Each buffer goes to disk either as raw words or as a single
 * deflated frame, see {@link BlockCompression}. Only raw files opened from
 * an uncompressed path support {@link #seekRecord(long)}.
 *
 * When opened as {@link OverlapFileType#FULL_WRITE} the number of overlaps
 * per sequence is tracked and written to {@link OverlapCounts#pathFor(Path)}
 * on {@link #close()}.
 *
 * Instances are not thread-safe.
 *
 * @since 17/10/26
 */
public class OverlapFile implements Closeable, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(OverlapFile.class);

  /** Default buffer size in bytes. */
  public static final int DEFAULT_BUFFER_SIZE = 1024 * 1024;
  /** Smaller buffer sizes are rounded up to this. */
  public static final int MIN_BUFFER_SIZE = 16 * 1024;

  public static class Builder {
    private final Path path;
    private final OverlapFileType type;
    private PayloadWidth width = PayloadWidth.MEDIUM;
    @Nullable private BlockCompression compression;
    private int bufferSize = DEFAULT_BUFFER_SIZE;
    private ByteOrder order = ByteOrder.LITTLE_ENDIAN;

    private Builder(final Path path, final OverlapFileType type) {
      this.path = Objects.requireNonNull(path);
      this.type = Objects.requireNonNull(type);
    }

    public Builder width(final PayloadWidth width) {
      this.width = Objects.requireNonNull(width);
      return this;
    }

    /** Overrides {@link OverlapFileType#defaultCompression}. */
    public Builder compression(final BlockCompression compression) {
      this.compression = Objects.requireNonNull(compression);
      return this;
    }

    /** Buffer size in bytes, see {@link #capacityFor(PayloadWidth, int)}. */
    public Builder bufferSize(final int bufferSize) {
      Preconditions.checkArgument(bufferSize > 0, "buffer size must be positive: %s", bufferSize);
      this.bufferSize = bufferSize;
      return this;
    }

    public Builder order(final ByteOrder order) {
      this.order = Objects.requireNonNull(order);
      return this;
    }

    public OverlapFile open() throws IOException {
      return new OverlapFile(this);
    }
  }

  public static Builder builder(final Path path, final OverlapFileType type) {
    return new Builder(path, type);
  }

  /**
   * Opens a file with the default width, compression, buffer size and
   * byte order.
   */
  public static OverlapFile open(final Path path, final OverlapFileType type)
      throws IOException {
    return builder(path, type).open();
  }

  /**
   * Buffer capacity in words: the largest multiple of the normal/full
   * alignment fitting {@code bufferSize} bytes, the latter taken to be at
   * least {@link #MIN_BUFFER_SIZE}.
   */
  public static int capacityFor(final PayloadWidth width, final int bufferSize) {
    final int alignment = RecordLayout.of(RecordShape.NORMAL, width).alignment();
    final int bytes = Math.max(bufferSize, MIN_BUFFER_SIZE);
    return bytes / (alignment * Integer.BYTES) * alignment;
  }

  @NotNull private final Path path;
  @NotNull private final OverlapFileType type;
  @NotNull private final RecordLayout layout;
  @NotNull private final BlockCodec codec;
  @NotNull private final ByteOrder order;
  @NotNull private final WordBuffer buffer;
  @Nullable private final SeekableDataInput input;
  @Nullable private final SeekableDataOutput output;
  @Nullable private final CountArray counts;
  private boolean closed;

  private OverlapFile(final Builder builder) throws IOException {
    path = builder.path;
    type = builder.type;
    layout = RecordLayout.of(type.shape, builder.width);
    order = builder.order;

    final BlockCompression compression = builder.compression != null
                                         ? builder.compression
                                         : type.defaultCompression;
    buffer = new WordBuffer(capacityFor(builder.width, builder.bufferSize));
    counts = type.tracksCounts ? new CountArray() : null;

    if (type.isOutput) {
      output = SeekableDataOutput.of(path, order);
      input = null;
    } else {
      input = SeekableDataInput.of(path, order);
      output = null;
    }

    codec = compression.newCodec();

    if (LOG.isDebugEnabled()) {
      LOG.debug("Opened {} as {}: {}, {}, {} words per buffer",
                path, type, layout, compression, buffer.max());
    }
  }

  @NotNull
  public Path path() {
    return path;
  }

  @NotNull
  public OverlapFileType type() {
    return type;
  }

  @NotNull
  public RecordLayout layout() {
    return layout;
  }

  /** Size of a record on disk, in bytes. */
  public int recordSize() {
    return layout.byteSize();
  }

  /** True if {@link #seekRecord(long)} is allowed. */
  public boolean isSeekable() {
    return input != null && input.isSeekable() && codec.isRandomAccess();
  }

  @VisibleForTesting
  int bufferCapacity() {
    return buffer.max();
  }

  @VisibleForTesting
  @Nullable
  CountArray counts() {
    return counts;
  }

  public void writeRecord(@NotNull final OverlapRecord record) throws IOException {
    ensureWritable();
    if (counts != null) {
      Preconditions.checkArgument(record.aId >= 0 && record.bId >= 0,
                                  "identifier out of range: %s", record);
      counts.ensureCapacity(Math.max(record.aId, record.bId));
    }

    flush(false);
    append(record);
  }

  /**
   * Writes records in order. The counts array, if any, is resized once
   * for the whole batch.
   */
  public void writeRecords(@NotNull final List<? extends OverlapRecord> records)
      throws IOException {
    ensureWritable();
    if (counts != null) {
      int maxId = 0;
      for (final OverlapRecord record : records) {
        maxId = Math.max(maxId, Math.max(record.aId, record.bId));
        Preconditions.checkArgument(record.aId >= 0 && record.bId >= 0,
                                    "identifier out of range: %s", record);
      }

      counts.ensureCapacity(maxId);
    }

    for (final OverlapRecord record : records) {
      flush(false);
      append(record);
    }
  }

  /**
   * Reads the next record.
   *
   * @return the record or {@code Optional.empty()} at end of file.
   */
  public Optional<OverlapRecord> readRecord() throws IOException {
    ensureReadable();
    fill();
    if (buffer.isEmpty()) {
      return Optional.empty();
    }

    return Optional.of(consume());
  }

  /**
   * Defaults {@code offset} to {@code 0} and {@code length} to
   * {@code records.length}.
   */
  public int readRecords(@NotNull final OverlapRecord[] records) throws IOException {
    return readRecords(records, 0, records.length);
  }

  /**
   * Reads up to {@code length} records into {@code records}.
   *
   * @return the number of records read; less than {@code length} only at
   *         end of file.
   */
  public int readRecords(@NotNull final OverlapRecord[] records, final int offset,
                         final int length) throws IOException {
    Preconditions.checkPositionIndexes(offset, offset + length, records.length);
    ensureReadable();

    int loaded = 0;
    while (loaded < length) {
      fill();
      if (buffer.isEmpty()) {
        break;
      }

      records[offset + loaded] = consume();
      loaded++;
    }

    return loaded;
  }

  /**
   * Positions the file so that the next read returns the {@code index}-th
   * record (0-based).
   *
   * @throws IllegalStateException if the file is not {@link #isSeekable() seekable}.
   */
  public void seekRecord(final long index) throws IOException {
    Preconditions.checkArgument(index >= 0, "negative record index: %s", index);
    ensureOpen();
    Preconditions.checkState(isSeekable(), "%s can't seek", path);

    input.seek(index * layout.byteSize());
    buffer.invalidate();
  }

  /**
   * Writes out the buffer. Unless {@code force} is set this only happens
   * when the buffer is full. Does nothing for files open for reading.
   */
  public void flush(final boolean force) throws IOException {
    if (output == null) {
      return;
    }

    if ((!force && !buffer.isFull()) || buffer.isEmpty()) {
      return;
    }

    LOG.debug("Flushing {} words to {}", buffer.len, path);
    codec.writeBlock(output, buffer.words, buffer.len);
    buffer.len = 0;
  }

  /**
   * Loads the next block if everything buffered has been consumed. An
   * empty buffer afterwards means end of file.
   */
  @VisibleForTesting
  void fill() throws IOException {
    if (!buffer.isDrained()) {
      return;
    }

    buffer.pos = 0;
    buffer.len = 0;
    final int len = codec.readBlock(input, buffer.words);
    if (len % layout.words() != 0) {
      throw new OverlapFileException(
          String.format("%s: block of %d words does not hold whole %d-word records",
                        path, len, layout.words()));
    }

    buffer.len = len;
    LOG.debug("Loaded {} words from {}", len, path);
  }

  /**
   * Flushes what is left in the buffer, writes the counts file if
   * required and releases the underlying file, in that order.
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }

    closed = true;

    final Closer closer = Closer.create();
    closer.register(input);
    closer.register(output);
    closer.register(codec);
    try {
      flush(true);
      if (counts != null) {
        final Path countsPath = OverlapCounts.pathFor(path);
        OverlapCounts.write(countsPath, counts, order);
        LOG.info("Wrote counts file '{}' for sequences up to id {}",
                 countsPath, counts.size() - 1);
      }
    } catch (final Throwable e) {
      LOG.warn("Failed to finish {}", path, e);
      throw closer.rethrow(e);
    } finally {
      closer.close();
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("path", path)
        .add("type", type)
        .add("layout", layout)
        .add("buffer", buffer)
        .toString();
  }

  private void append(final OverlapRecord record) {
    final int end = layout.encode(record, buffer.words, buffer.len);
    if (counts != null) {
      counts.add(record.aId, record.bId);
    }

    buffer.len = end;
  }

  private OverlapRecord consume() {
    final OverlapRecord record = layout.decode(buffer.words, buffer.pos);
    buffer.pos += layout.words();
    return record;
  }

  private void ensureOpen() {
    Preconditions.checkState(!closed, "%s is closed", path);
  }

  private void ensureWritable() {
    ensureOpen();
    Preconditions.checkState(output != null, "%s is not open for writing", path);
  }

  private void ensureReadable() {
    ensureOpen();
    Preconditions.checkState(input != null, "%s is not open for reading", path);
  }
}
