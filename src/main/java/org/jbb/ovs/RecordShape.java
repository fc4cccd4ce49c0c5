package org.jbb.ovs;

/**
 * Whether a record carries its first identifier on disk.
 *
 * @since 17/10/26
 */
public enum RecordShape {
  /** Only {@code bId}, the {@code aId} is implied by the store. */
  NORMAL(1),
  /** Both identifiers, as produced by the overlapper. */
  FULL(2);

  public final int idWords;

  RecordShape(final int idWords) {
    this.idWords = idWords;
  }
}
