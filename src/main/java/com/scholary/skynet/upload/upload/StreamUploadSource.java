package com.scholary.skynet.upload.upload;

import java.io.InputStream;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wraps a caller-supplied stream.
 *
 * <p>One pass, one reader: it can back a single session over the whole payload and nothing else.
 */
final class StreamUploadSource implements UploadSource {

  private final InputStream stream;
  private final long size;
  private final AtomicBoolean opened = new AtomicBoolean();

  StreamUploadSource(InputStream stream, long size) {
    if (size < 0) {
      throw new IllegalArgumentException("Stream size cannot be negative, was " + size);
    }
    this.stream = stream;
    this.size = size;
  }

  @Override
  public long size() {
    return size;
  }

  @Override
  public boolean supportsRangeReads() {
    return false;
  }

  @Override
  public InputStream openRange(long start, long end) {
    if (start != 0 || end != size) {
      throw new IllegalStateException(
          String.format("Stream source can only be read in full, requested [%d, %d)", start, end));
    }
    if (!opened.compareAndSet(false, true)) {
      throw new IllegalStateException("Stream source has already been consumed");
    }
    return stream;
  }
}
