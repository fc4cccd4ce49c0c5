package org.jbb.ovs;

import java.io.IOException;

/**
 * Signals an overlap file or its counts file is unusable: truncated or
 * malformed frames, partial records, or an index that could not be written.
 *
 * @since 17/10/26
 */
public class OverlapFileException extends IOException {
  public OverlapFileException(final String message) {
    super(message);
  }

  public OverlapFileException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
