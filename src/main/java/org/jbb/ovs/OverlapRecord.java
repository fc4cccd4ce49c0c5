package org.jbb.ovs;

import com.google.common.base.MoreObjects;
import com.google.common.primitives.Longs;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Objects;

/**
 * A pairwise overlap between two sequences.
 *
 * Identifiers are unsigned 32-bit values kept in an {@code int}. The payload
 * is opaque to this package; its length is dictated by {@link PayloadWidth}.
 *
 * @since 17/10/26
 */
public class OverlapRecord {
  /** First sequence, only stored for {@link RecordShape#FULL} records. */
  public final int aId;
  /** Second sequence. */
  public final int bId;
  @NotNull private final long[] dat;

  public OverlapRecord(final int aId, final int bId, @NotNull final long[] dat) {
    this.aId = aId;
    this.bId = bId;
    this.dat = dat.clone();
  }

  public static OverlapRecord of(final int aId, final int bId, final long... dat) {
    return new OverlapRecord(aId, bId, dat);
  }

  /** Returns a copy of the payload fields. */
  @NotNull
  public long[] dat() {
    return dat.clone();
  }

  public long dat(final int i) {
    return dat[i];
  }

  public int datLength() {
    return dat.length;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    } else if (obj == null || getClass() != obj.getClass()) {
      return false;
    }

    final OverlapRecord other = (OverlapRecord) obj;
    return aId == other.aId && bId == other.bId && Arrays.equals(dat, other.dat);
  }

  @Override
  public int hashCode() {
    return Objects.hash(aId, bId, Arrays.hashCode(dat));
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("aId", Integer.toUnsignedString(aId))
        .add("bId", Integer.toUnsignedString(bId))
        .add("dat", Longs.join(",", dat))
        .toString();
  }
}
