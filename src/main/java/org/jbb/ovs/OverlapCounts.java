package org.jbb.ovs;

import com.google.common.primitives.Ints;

import org.jetbrains.annotations.NotNull;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.file.Path;

/**
 * Reads and writes the counts file kept next to a full overlap dump.
 *
 * Layout: {@code [n: u32][count: u32] x n}, in the dump's byte order.
 *
 * @since 17/10/26
 */
public class OverlapCounts {
  public static final String SUFFIX = ".counts";

  private OverlapCounts() {}

  /**
   * Counts file for a given overlap file: the file name is cut at its first
   * dot, so both {@code dir/reads.ovb} and {@code dir/reads.ovb.gz} map to
   * {@code dir/reads.counts}.
   */
  @NotNull
  public static Path pathFor(@NotNull final Path path) {
    final String name = path.getFileName().toString();
    final int dot = name.indexOf('.');
    final String prefix = dot == -1 ? name : name.substring(0, dot);
    return path.resolveSibling(prefix + SUFFIX);
  }

  public static void write(@NotNull final Path path, @NotNull final CountArray counts,
                           @NotNull final ByteOrder order) throws IOException {
    final int[] values = counts.toArray();
    final SeekableDataOutput out;
    try {
      out = SeekableDataOutput.of(path, order);
    } catch (final IOException e) {
      throw new OverlapFileException(
          "failed to open counts file '" + path + "' for writing", e);
    }

    try (final SeekableDataOutput output = out) {
      output.writeInt(values.length);
      output.writeInts(values, 0, values.length);
    }
  }

  @NotNull
  public static int[] read(@NotNull final Path path) throws IOException {
    return read(path, ByteOrder.LITTLE_ENDIAN);
  }

  @NotNull
  public static int[] read(@NotNull final Path path, @NotNull final ByteOrder order)
      throws IOException {
    try (final SeekableDataInput in = SeekableDataInput.of(path, order)) {
      final int n;
      try {
        n = Ints.checkedCast(in.readUnsignedInt());
      } catch (final EOFException e) {
        throw new OverlapFileException("counts file '" + path + "' is empty", e);
      } catch (final IllegalArgumentException e) {
        throw new OverlapFileException("counts file '" + path + "' is malformed", e);
      }

      final int[] values = new int[n];
      final int read = in.readInts(values, 0, n);
      if (read != n) {
        throw new OverlapFileException(
            String.format("short read on counts file '%s': read %d counts, expected %d",
                          path, read, n));
      }

      return values;
    }
  }
}
