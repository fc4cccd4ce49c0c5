package org.jbb.ovs;

import java.nio.file.Path;

/**
 * Helpers for files which may be compressed as a whole.
 *
 * Only gzip is understood; the decision is made from the file name.
 *
 * @since 17/10/26
 */
public class CompressedFiles {
  public static final String GZIP_SUFFIX = ".gz";

  private CompressedFiles() {}

  public static boolean isCompressed(final Path path) {
    final Path name = path.getFileName();
    return name != null && name.toString().endsWith(GZIP_SUFFIX);
  }
}
