package org.jbb.ovs;

import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;

import junit.framework.TestCase;

import org.junit.Assert;

import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

public class OverlapFileTest extends TestCase {
  private static final int NUM_RECORDS = 2000;
  private static final int MAX_ID = 500;

  private final Random random = new Random(11);
  private Path dir;

  @Override
  protected void setUp() throws Exception {
    dir = Files.createTempDirectory("ovs");
  }

  @Override
  protected void tearDown() throws Exception {
    MoreFiles.deleteRecursively(dir);
  }

  public void testEndToEnd() throws IOException {
    final Path path = dir.resolve("reads.ovb");
    final List<OverlapRecord> records = ImmutableList.of(
        OverlapRecord.of(1, 2, 10, 20, 30, 40, 50),
        OverlapRecord.of(1, 3, 0, 0, 0, 0, 0),
        OverlapRecord.of(2, 3, 1, 1, 1, 1, 1));

    try (final OverlapFile file = OverlapFile.builder(path, OverlapFileType.FULL_WRITE)
        .width(PayloadWidth.MEDIUM)
        .compression(BlockCompression.NONE)
        .open()) {
      assertEquals(28, file.recordSize());
      for (final OverlapRecord record : records) {
        file.writeRecord(record);
      }
    }

    assertEquals(3 * 28, Files.size(path));

    try (final OverlapFile file = OverlapFile.builder(path, OverlapFileType.FULL)
        .width(PayloadWidth.MEDIUM)
        .compression(BlockCompression.NONE)
        .open()) {
      assertEquals(records, readAll(file));
    }

    Assert.assertArrayEquals(new int[] {0, 2, 2, 2},
                             OverlapCounts.read(dir.resolve("reads.counts")));
  }

  public void testRoundTrip() throws IOException {
    for (final RecordShape shape : RecordShape.values()) {
      for (final PayloadWidth width : PayloadWidth.values()) {
        for (final BlockCompression compression : BlockCompression.values()) {
          final Path path = dir.resolve(shape + "-" + width + "-" + compression + ".ovb");
          final List<OverlapRecord> records = Records.random(random, width, MAX_ID, NUM_RECORDS);
          write(path, shape, width, compression, records);

          final List<OverlapRecord> expected = new ArrayList<>();
          for (final OverlapRecord record : records) {
            expected.add(Records.as(shape, record));
          }

          try (final OverlapFile file = reader(path, shape, width, compression)) {
            assertEquals(expected, readAll(file));
          }
        }
      }
    }
  }

  public void testGzipPrimaryFile() throws IOException {
    final Path path = dir.resolve("reads.ovb.gz");
    final List<OverlapRecord> records = Records.random(random, PayloadWidth.WIDE, MAX_ID, 1000);
    try (final OverlapFile file = OverlapFile.builder(path, OverlapFileType.FULL_WRITE)
        .width(PayloadWidth.WIDE)
        .compression(BlockCompression.NONE)
        .bufferSize(OverlapFile.MIN_BUFFER_SIZE)
        .open()) {
      file.writeRecords(records);
    }

    assertTrue(Files.exists(dir.resolve("reads.counts")));

    try (final OverlapFile file = OverlapFile.builder(path, OverlapFileType.FULL)
        .width(PayloadWidth.WIDE)
        .compression(BlockCompression.NONE)
        .open()) {
      assertFalse(file.isSeekable());
      assertEquals(records, readAll(file));
    }
  }

  public void testBigEndian() throws IOException {
    final Path path = dir.resolve("big.ovb");
    final List<OverlapRecord> records = Records.random(random, PayloadWidth.NARROW, MAX_ID, 100);
    for (final BlockCompression compression : BlockCompression.values()) {
      try (final OverlapFile file = OverlapFile.builder(path, OverlapFileType.FULL_WRITE_NO_COUNTS)
          .width(PayloadWidth.NARROW)
          .compression(compression)
          .order(ByteOrder.BIG_ENDIAN)
          .open()) {
        file.writeRecords(records);
      }

      try (final OverlapFile file = OverlapFile.builder(path, OverlapFileType.FULL)
          .width(PayloadWidth.NARROW)
          .compression(compression)
          .order(ByteOrder.BIG_ENDIAN)
          .open()) {
        assertEquals(records, readAll(file));
      }
    }
  }

  public void testBatchWriteMatchesSingleWrites() throws IOException {
    final List<OverlapRecord> records = Records.random(random, PayloadWidth.MEDIUM, MAX_ID, NUM_RECORDS);
    final Path single = dir.resolve("single.ovb");
    final Path batch = dir.resolve("batch.ovb");

    write(single, RecordShape.FULL, PayloadWidth.MEDIUM, BlockCompression.NONE, records);
    try (final OverlapFile file = writer(batch, RecordShape.FULL, PayloadWidth.MEDIUM,
                                         BlockCompression.NONE)) {
      file.writeRecords(records.subList(0, 7));
      file.writeRecords(records.subList(7, records.size()));
    }

    Assert.assertArrayEquals(Files.readAllBytes(single), Files.readAllBytes(batch));
  }

  public void testRawFileHoldsWholeRecords() throws IOException {
    for (final RecordShape shape : RecordShape.values()) {
      for (final PayloadWidth width : PayloadWidth.values()) {
        for (final int n : new int[] {0, 1, 581, 582, 583, 1500}) {
          final Path path = dir.resolve("aligned.ovb");
          write(path, shape, width, BlockCompression.NONE,
                Records.random(random, width, MAX_ID, n));
          assertEquals(n * (long) RecordLayout.of(shape, width).byteSize(), Files.size(path));
        }
      }
    }
  }

  public void testBufferCapacity() throws IOException {
    for (final PayloadWidth width : PayloadWidth.values()) {
      for (final int bufferSize : new int[] {1, 16 * 1024, 100_000, OverlapFile.DEFAULT_BUFFER_SIZE}) {
        final int capacity = OverlapFile.capacityFor(width, bufferSize);
        assertTrue(capacity > 0);
        assertEquals(0, capacity % RecordLayout.of(RecordShape.NORMAL, width).words());
        assertEquals(0, capacity % RecordLayout.of(RecordShape.FULL, width).words());
        assertTrue(capacity * 4 <= Math.max(bufferSize, OverlapFile.MIN_BUFFER_SIZE));
      }
    }

    assertEquals(4074, OverlapFile.capacityFor(PayloadWidth.MEDIUM, 1));

    final Path path = dir.resolve("capacity.ovb");
    try (final OverlapFile file = OverlapFile.builder(path, OverlapFileType.NORMAL_WRITE)
        .bufferSize(1)
        .open()) {
      assertEquals(4074, file.bufferCapacity());
    }
  }

  public void testSeek() throws IOException {
    final Path path = dir.resolve("seek.ovb");
    final List<OverlapRecord> records = Records.random(random, PayloadWidth.MEDIUM, MAX_ID, 1500);
    write(path, RecordShape.FULL, PayloadWidth.MEDIUM, BlockCompression.NONE, records);

    try (final OverlapFile file = reader(path, RecordShape.FULL, PayloadWidth.MEDIUM,
                                         BlockCompression.NONE)) {
      assertTrue(file.isSeekable());

      // Prime the buffer so seeking has something to invalidate.
      assertEquals(records.get(0), file.readRecord().get());

      for (int k = 0; k < records.size(); k += 37) {
        file.seekRecord(k);
        assertEquals(records.get(k), file.readRecord().get());
      }

      for (final int k : new int[] {581, 582, 583, 1499, 0}) {
        file.seekRecord(k);
        assertEquals(records.get(k), file.readRecord().get());
        if (k + 1 < records.size()) {
          assertEquals(records.get(k + 1), file.readRecord().get());
        }
      }

      file.seekRecord(records.size());
      assertFalse(file.readRecord().isPresent());
    }
  }

  public void testSeekMatchesSkipping() throws IOException {
    final Path path = dir.resolve("skip.ovb");
    final List<OverlapRecord> records = Records.random(random, PayloadWidth.WIDE, MAX_ID, 300);
    write(path, RecordShape.NORMAL, PayloadWidth.WIDE, BlockCompression.NONE, records);

    for (int k = 0; k < records.size(); k += 13) {
      final OverlapRecord skipped;
      try (final OverlapFile file = reader(path, RecordShape.NORMAL, PayloadWidth.WIDE,
                                           BlockCompression.NONE)) {
        file.readRecords(new OverlapRecord[k]);
        skipped = file.readRecord().get();
      }

      try (final OverlapFile file = reader(path, RecordShape.NORMAL, PayloadWidth.WIDE,
                                           BlockCompression.NONE)) {
        file.seekRecord(k);
        assertEquals(skipped, file.readRecord().get());
      }
    }
  }

  public void testSeekRejectedOnCompressedBlocks() throws IOException {
    final Path path = dir.resolve("dump.ovb");
    write(path, RecordShape.FULL, PayloadWidth.MEDIUM, BlockCompression.DEFLATE,
          Records.random(random, PayloadWidth.MEDIUM, MAX_ID, 10));

    try (final OverlapFile file = OverlapFile.open(path, OverlapFileType.FULL)) {
      assertFalse(file.isSeekable());
      file.seekRecord(1);
      fail();
    } catch (final IllegalStateException e) {
      assertTrue(e.getMessage().contains("can't seek"));
    }
  }

  public void testSeekRejectedOnWriter() throws IOException {
    try (final OverlapFile file = OverlapFile.open(dir.resolve("w.ovb"),
                                                   OverlapFileType.NORMAL_WRITE)) {
      file.seekRecord(0);
      fail();
    } catch (final IllegalStateException e) {
      // expected
    }
  }

  public void testExhaustion() throws IOException {
    for (final BlockCompression compression : BlockCompression.values()) {
      final Path path = dir.resolve("short.ovb");
      final List<OverlapRecord> records = Records.random(random, PayloadWidth.MEDIUM, MAX_ID, 10);
      write(path, RecordShape.FULL, PayloadWidth.MEDIUM, compression, records);

      try (final OverlapFile file = reader(path, RecordShape.FULL, PayloadWidth.MEDIUM,
                                           compression)) {
        final OverlapRecord[] batch = new OverlapRecord[25];
        assertEquals(10, file.readRecords(batch));
        for (int i = 0; i < 10; i++) {
          assertEquals(records.get(i), batch[i]);
        }

        assertNull(batch[10]);
        assertEquals(0, file.readRecords(batch));
        assertFalse(file.readRecord().isPresent());
      }
    }
  }

  public void testBatchReadsAcrossBuffers() throws IOException {
    for (final BlockCompression compression : BlockCompression.values()) {
      final Path path = dir.resolve("batches.ovb");
      final List<OverlapRecord> records = Records.random(random, PayloadWidth.MEDIUM, MAX_ID,
                                                         NUM_RECORDS);
      write(path, RecordShape.FULL, PayloadWidth.MEDIUM, compression, records);

      final List<OverlapRecord> back = new ArrayList<>();
      try (final OverlapFile file = reader(path, RecordShape.FULL, PayloadWidth.MEDIUM,
                                           compression)) {
        final OverlapRecord[] batch = new OverlapRecord[300];
        int n;
        while ((n = file.readRecords(batch, 50, 250)) > 0) {
          for (int i = 0; i < n; i++) {
            back.add(batch[50 + i]);
          }
        }
      }

      assertEquals(records, back);
    }
  }

  public void testCounts() throws IOException {
    final Path path = dir.resolve("counted.1.ovb");
    final List<OverlapRecord> records = Records.random(random, PayloadWidth.NARROW, 200_000,
                                                       NUM_RECORDS);
    final int[] expected = new int[200_000];
    int maxId = 0;
    for (final OverlapRecord record : records) {
      expected[record.aId]++;
      expected[record.bId]++;
      maxId = Math.max(maxId, Math.max(record.aId, record.bId));
    }

    try (final OverlapFile file = OverlapFile.builder(path, OverlapFileType.FULL_WRITE)
        .width(PayloadWidth.NARROW)
        .open()) {
      for (final OverlapRecord record : records.subList(0, 100)) {
        file.writeRecord(record);
      }

      file.writeRecords(records.subList(100, records.size()));
      assertTrue(file.counts().capacity() > maxId);
    }

    final int[] counts = OverlapCounts.read(dir.resolve("counted.counts"));
    assertEquals(maxId + 1, counts.length);
    for (int id = 0; id < counts.length; id++) {
      assertEquals(expected[id], counts[id]);
    }
  }

  public void testEmptyCountsFile() throws IOException {
    final Path path = dir.resolve("empty.ovb");
    OverlapFile.open(path, OverlapFileType.FULL_WRITE).close();

    Assert.assertArrayEquals(new int[] {0}, OverlapCounts.read(dir.resolve("empty.counts")));
    try (final OverlapFile file = OverlapFile.open(path, OverlapFileType.FULL)) {
      assertFalse(file.readRecord().isPresent());
    }
  }

  public void testCountsOnlyForFullWrite() throws IOException {
    for (final OverlapFileType type : new OverlapFileType[] {
        OverlapFileType.NORMAL_WRITE, OverlapFileType.FULL_WRITE_NO_COUNTS}) {
      final Path path = dir.resolve("nocounts.ovb");
      try (final OverlapFile file = OverlapFile.open(path, type)) {
        assertNull(file.counts());
        file.writeRecord(OverlapRecord.of(1, 2, 1, 2, 3, 4, 5));
      }

      assertFalse(Files.exists(dir.resolve("nocounts.counts")));
    }
  }

  public void testCountsFileFailureIsReported() throws IOException {
    final Path path = dir.resolve("blocked.ovb");
    Files.createDirectory(dir.resolve("blocked.counts"));

    final OverlapFile file = OverlapFile.open(path, OverlapFileType.FULL_WRITE);
    file.writeRecord(OverlapRecord.of(1, 2, 1, 2, 3, 4, 5));
    try {
      file.close();
      fail();
    } catch (final OverlapFileException e) {
      assertTrue(e.getMessage().contains("counts file"));
    }

    // The records made it out before the counts file was attempted.
    try (final OverlapFile reader = OverlapFile.open(path, OverlapFileType.FULL)) {
      assertEquals(1, readAll(reader).size());
    }
  }

  public void testModeMisuse() throws IOException {
    final Path path = dir.resolve("modes.ovb");
    try (final OverlapFile file = OverlapFile.open(path, OverlapFileType.NORMAL_WRITE)) {
      try {
        file.readRecord();
        fail();
      } catch (final IllegalStateException e) {
        // expected
      }
    }

    try (final OverlapFile file = OverlapFile.open(path, OverlapFileType.NORMAL)) {
      try {
        file.writeRecord(OverlapRecord.of(1, 2, 1, 2, 3, 4, 5));
        fail();
      } catch (final IllegalStateException e) {
        // expected
      }

      file.flush(true);
    }
  }

  public void testClose() throws IOException {
    final Path path = dir.resolve("closed.ovb");
    final OverlapFile file = OverlapFile.open(path, OverlapFileType.NORMAL_WRITE);
    file.writeRecord(OverlapRecord.of(0, 2, 1, 2, 3, 4, 5));
    file.close();
    file.close();

    assertEquals(24, Files.size(path));
    try {
      file.writeRecord(OverlapRecord.of(0, 2, 1, 2, 3, 4, 5));
      fail();
    } catch (final IllegalStateException e) {
      // expected
    }
  }

  public void testTrailingPartialRecord() throws IOException {
    final Path path = dir.resolve("partial.ovb");
    write(path, RecordShape.FULL, PayloadWidth.MEDIUM, BlockCompression.NONE,
          Records.random(random, PayloadWidth.MEDIUM, MAX_ID, 3));
    Files.write(path, new byte[8], StandardOpenOption.APPEND);

    try (final OverlapFile file = reader(path, RecordShape.FULL, PayloadWidth.MEDIUM,
                                         BlockCompression.NONE)) {
      file.readRecord();
      fail();
    } catch (final OverlapFileException e) {
      // expected
    }
  }

  public void testTrailingPartialWord() throws IOException {
    final Path path = dir.resolve("partial-word.ovb");
    write(path, RecordShape.FULL, PayloadWidth.MEDIUM, BlockCompression.NONE,
          Records.random(random, PayloadWidth.MEDIUM, MAX_ID, 3));
    Files.write(path, new byte[2], StandardOpenOption.APPEND);

    try (final OverlapFile file = reader(path, RecordShape.FULL, PayloadWidth.MEDIUM,
                                         BlockCompression.NONE)) {
      file.readRecord();
      fail();
    } catch (final OverlapFileException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("partial word"));
    }
  }

  public void testRejectsNegativeIdentifier() throws IOException {
    final Path path = dir.resolve("negative.ovb");
    try (final OverlapFile file = OverlapFile.open(path, OverlapFileType.FULL_WRITE)) {
      try {
        file.writeRecord(OverlapRecord.of(0x80000001, 5, 1, 2, 3, 4, 5));
        fail();
      } catch (final IllegalArgumentException e) {
        // expected
      }

      file.writeRecord(OverlapRecord.of(1, 5, 1, 2, 3, 4, 5));
    }

    try (final OverlapFile file = OverlapFile.open(path, OverlapFileType.FULL)) {
      assertEquals(ImmutableList.of(OverlapRecord.of(1, 5, 1, 2, 3, 4, 5)), readAll(file));
    }

    Assert.assertArrayEquals(new int[] {0, 1, 0, 0, 0, 1},
                             OverlapCounts.read(OverlapCounts.pathFor(path), ByteOrder.LITTLE_ENDIAN));
  }

  private static OverlapFile writer(final Path path, final RecordShape shape,
                                    final PayloadWidth width, final BlockCompression compression)
      throws IOException {
    final OverlapFileType type = shape == RecordShape.FULL
                                 ? OverlapFileType.FULL_WRITE_NO_COUNTS
                                 : OverlapFileType.NORMAL_WRITE;
    return OverlapFile.builder(path, type)
        .width(width)
        .compression(compression)
        .bufferSize(OverlapFile.MIN_BUFFER_SIZE)
        .open();
  }

  private static OverlapFile reader(final Path path, final RecordShape shape,
                                    final PayloadWidth width, final BlockCompression compression)
      throws IOException {
    final OverlapFileType type = shape == RecordShape.FULL
                                 ? OverlapFileType.FULL
                                 : OverlapFileType.NORMAL;
    return OverlapFile.builder(path, type)
        .width(width)
        .compression(compression)
        .bufferSize(OverlapFile.MIN_BUFFER_SIZE)
        .open();
  }

  private static void write(final Path path, final RecordShape shape, final PayloadWidth width,
                            final BlockCompression compression, final List<OverlapRecord> records)
      throws IOException {
    try (final OverlapFile file = writer(path, shape, width, compression)) {
      for (final OverlapRecord record : records) {
        file.writeRecord(record);
      }
    }
  }

  private static List<OverlapRecord> readAll(final OverlapFile file) throws IOException {
    final List<OverlapRecord> result = new ArrayList<>();
    Optional<OverlapRecord> record;
    while ((record = file.readRecord()).isPresent()) {
      result.add(record.get());
    }

    return result;
  }
}
