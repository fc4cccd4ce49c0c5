package org.jbb.ovs;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.math.IntMath;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Maps {@link OverlapRecord}s to and from a run of 32-bit words.
 *
 * Record layout, in words:
 * <pre>
 *   [aId]     FULL shape only
 *   bId
 *   payload   NARROW: hi(dat[0]) lo(dat[0]) hi(dat[1]) lo(dat[1]) hi(dat[2]) lo(dat[2])
 *             MEDIUM: dat[0] .. dat[4]
 *             WIDE:   dat[0] .. dat[7]
 * </pre>
 *
 * @since 17/10/26
 */
public class RecordLayout {
  private static final long WORD_MASK = 0xffffffffL;

  public final RecordShape shape;
  public final PayloadWidth width;

  public RecordLayout(final RecordShape shape, final PayloadWidth width) {
    this.shape = Objects.requireNonNull(shape);
    this.width = Objects.requireNonNull(width);
  }

  public static RecordLayout of(final RecordShape shape, final PayloadWidth width) {
    return new RecordLayout(shape, width);
  }

  /** Words per record. */
  public int words() {
    return shape.idWords + width.words();
  }

  /** Bytes per record, the stride used for seeking. */
  public int byteSize() {
    return words() * Integer.BYTES;
  }

  /**
   * Smallest number of words holding a whole number of records of
   * either shape for this payload width.
   */
  public int alignment() {
    final int normal = RecordShape.NORMAL.idWords + width.words();
    final int full = RecordShape.FULL.idWords + width.words();
    return normal / IntMath.gcd(normal, full) * full;
  }

  /**
   * Writes {@code record} into {@code buf} starting at {@code pos}.
   *
   * @return the position just past the encoded record.
   */
  public int encode(@NotNull final OverlapRecord record, @NotNull final int[] buf, int pos) {
    Preconditions.checkArgument(record.datLength() == width.fields,
                                "expected %s payload fields, got %s",
                                width.fields, record.datLength());

    if (shape == RecordShape.FULL) {
      buf[pos++] = record.aId;
    }

    buf[pos++] = record.bId;

    switch (width) {
      case NARROW:
        for (int i = 0; i < width.fields; i++) {
          final long v = record.dat(i);
          buf[pos++] = (int) (v >>> 32);
          buf[pos++] = (int) v;
        }
        break;
      case MEDIUM:
      case WIDE:
        for (int i = 0; i < width.fields; i++) {
          final long v = record.dat(i);
          Preconditions.checkArgument((v & ~WORD_MASK) == 0,
                                      "payload field %s does not fit 32 bits: %s", i, v);
          buf[pos++] = (int) v;
        }
        break;
      default:
        throw new IllegalStateException("unknown payload width " + width);
    }

    return pos;
  }

  /**
   * Reads a record from {@code buf} starting at {@code pos}. For
   * {@link RecordShape#NORMAL} records {@code aId} is zero.
   */
  @NotNull
  public OverlapRecord decode(@NotNull final int[] buf, int pos) {
    final int aId = shape == RecordShape.FULL ? buf[pos++] : 0;
    final int bId = buf[pos++];
    final long[] dat = new long[width.fields];

    switch (width) {
      case NARROW:
        for (int i = 0; i < width.fields; i++) {
          final long hi = buf[pos++] & WORD_MASK;
          final long lo = buf[pos++] & WORD_MASK;
          dat[i] = (hi << 32) | lo;
        }
        break;
      case MEDIUM:
      case WIDE:
        for (int i = 0; i < width.fields; i++) {
          dat[i] = buf[pos++] & WORD_MASK;
        }
        break;
      default:
        throw new IllegalStateException("unknown payload width " + width);
    }

    return new OverlapRecord(aId, bId, dat);
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    } else if (obj == null || getClass() != obj.getClass()) {
      return false;
    }

    final RecordLayout other = (RecordLayout) obj;
    return shape == other.shape && width == other.width;
  }

  @Override
  public int hashCode() {
    return Objects.hash(shape, width);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("shape", shape)
        .add("width", width)
        .toString();
  }
}
