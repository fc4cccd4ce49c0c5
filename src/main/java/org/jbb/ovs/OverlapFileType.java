package org.jbb.ovs;

/**
 * The ways an {@link OverlapFile} can be opened.
 *
 * Normal files are store files and are stored uncompressed by default;
 * full files are overlapper dumps and are deflated by default.
 *
 * @since 17/10/26
 */
public enum OverlapFileType {
  NORMAL(RecordShape.NORMAL, false, false, BlockCompression.NONE),
  FULL(RecordShape.FULL, false, false, BlockCompression.DEFLATE),
  NORMAL_WRITE(RecordShape.NORMAL, true, false, BlockCompression.NONE),
  /** Also writes a {@link OverlapCounts counts file} on close. */
  FULL_WRITE(RecordShape.FULL, true, true, BlockCompression.DEFLATE),
  FULL_WRITE_NO_COUNTS(RecordShape.FULL, true, false, BlockCompression.DEFLATE);

  public final RecordShape shape;
  public final boolean isOutput;
  public final boolean tracksCounts;
  public final BlockCompression defaultCompression;

  OverlapFileType(final RecordShape shape, final boolean isOutput, final boolean tracksCounts,
                  final BlockCompression defaultCompression) {
    this.shape = shape;
    this.isOutput = isOutput;
    this.tracksCounts = tracksCounts;
    this.defaultCompression = defaultCompression;
  }
}
