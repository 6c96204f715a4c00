package com.scholary.skynet.upload.chunking;

/**
 * A half-open byte range {@code [start, end)}.
 *
 * <p>Used for upload part boundaries. Zero-length ranges are legal.
 */
public record ByteRange(long start, long end) {

  public ByteRange {
    if (start < 0) {
      throw new IllegalArgumentException("Start offset cannot be negative");
    }
    if (end < start) {
      throw new IllegalArgumentException("End offset must be >= start offset");
    }
  }

  public long length() {
    return end - start;
  }

  public boolean isEmpty() {
    return start == end;
  }

  /**
   * Check whether this range's length is a whole number of chunks.
   *
   * @param chunkSize the chunk size in bytes
   * @return true if {@code length() % chunkSize == 0}
   */
  public boolean isChunkAligned(long chunkSize) {
    return length() % chunkSize == 0;
  }
}
