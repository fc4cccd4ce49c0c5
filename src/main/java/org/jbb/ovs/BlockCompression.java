package org.jbb.ovs;

/**
 * How buffers are framed on disk.
 *
 * @since 17/10/26
 */
public enum BlockCompression {
  /** Words are written back to back; the file can be seeked by record. */
  NONE {
    @Override
    BlockCodec newCodec() {
      return new RawBlockCodec();
    }
  },
  /**
   * Each buffer is deflated and written as {@code [length: u64][bytes]}.
   * Forward-only.
   */
  DEFLATE {
    @Override
    BlockCodec newCodec() {
      return new DeflateBlockCodec();
    }
  };

  abstract BlockCodec newCodec();
}
