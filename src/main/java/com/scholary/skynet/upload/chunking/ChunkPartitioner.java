package com.scholary.skynet.upload.chunking;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits an upload into chunk-aligned parts for parallel resumable sessions.
 *
 * <p>The portal checks chunk boundaries per session, so every part except one must be a whole
 * number of chunks. That way an interrupted part can always resume on a chunk boundary.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Deal whole chunks round-robin across the parts
 *   <li>Add the unaligned leftover to part {@code min(fullChunks, partCount - 1)}
 *   <li>Turn the sizes into contiguous ranges starting at offset 0
 * </ol>
 */
@Component
public class ChunkPartitioner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkPartitioner.class);

  /**
   * Partition {@code totalSize} bytes into {@code partCount} contiguous ranges.
   *
   * @param totalSize the number of bytes to cover
   * @param partCount the number of parts, at least 1
   * @param chunkSize the chunk size parts are aligned to, at least 1
   * @return the partition plan
   * @throws IllegalArgumentException if {@code partCount < 1}, {@code chunkSize < 1}, or the total
   *     does not exceed one chunk while more than one part was requested
   */
  public PartitionPlan partition(long totalSize, int partCount, long chunkSize) {
    if (partCount < 1) {
      throw new IllegalArgumentException(
          "Expected parameter 'partCount' to be greater than or equal to 1, was " + partCount);
    }
    if (chunkSize < 1) {
      throw new IllegalArgumentException(
          "Expected parameter 'chunkSize' to be greater than or equal to 1, was " + chunkSize);
    }
    if (totalSize < 0) {
      throw new IllegalArgumentException("Total size cannot be negative, was " + totalSize);
    }
    // A single chunk cannot be split between sessions.
    if (totalSize <= chunkSize && partCount > 1) {
      throw new IllegalArgumentException(
          String.format(
              "Expected parameter 'totalSize' to be greater than the size of a chunk ('%d'), was %d",
              chunkSize, totalSize));
    }

    long[] sizes = new long[partCount];

    long fullChunks = totalSize / chunkSize;
    for (long i = 0; i < fullChunks; i++) {
      sizes[(int) (i % partCount)] += chunkSize;
    }

    long leftover = totalSize % chunkSize;
    if (leftover > 0) {
      // The part after the last one visited, or the last part once every part had a chunk.
      int leftoverIndex = (int) Math.min(fullChunks, partCount - 1);
      sizes[leftoverIndex] += leftover;
    }

    List<ByteRange> parts = new ArrayList<>(partCount);
    long boundary = 0;
    for (long size : sizes) {
      parts.add(new ByteRange(boundary, boundary + size));
      boundary += size;
    }

    LOGGER.debug(
        "Partitioned {} bytes into {} parts: chunkSize={}, fullChunks={}, leftover={}",
        totalSize,
        partCount,
        chunkSize,
        fullChunks,
        leftover);

    return new PartitionPlan(parts, chunkSize);
  }
}
