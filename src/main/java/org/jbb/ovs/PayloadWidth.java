package org.jbb.ovs;

/**
 * Layout of the fixed-size overlap metadata.
 *
 * Reader and writer have to agree on the width, the files themselves
 * don't record it.
 *
 * @since 17/10/26
 */
public enum PayloadWidth {
  /** Three 64-bit fields, each stored high word first. */
  NARROW(3, 64),
  /** Five 32-bit fields. */
  MEDIUM(5, 32),
  /** Eight 32-bit fields. */
  WIDE(8, 32);

  /** Number of fields in {@link OverlapRecord#dat}. */
  public final int fields;
  /** Bits per field, either 32 or 64. */
  public final int fieldBits;

  PayloadWidth(final int fields, final int fieldBits) {
    this.fields = fields;
    this.fieldBits = fieldBits;
  }

  /** Number of 32-bit words the payload occupies on disk. */
  public int words() {
    return fields * fieldBits / Integer.SIZE;
  }
}
