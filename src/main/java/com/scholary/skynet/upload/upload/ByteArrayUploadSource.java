package com.scholary.skynet.upload.upload;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

/** In-memory source. Range reads are free, so any parallelism works. */
final class ByteArrayUploadSource implements UploadSource {

  private final byte[] data;

  ByteArrayUploadSource(byte[] data) {
    this.data = data;
  }

  @Override
  public long size() {
    return data.length;
  }

  @Override
  public boolean supportsRangeReads() {
    return true;
  }

  @Override
  public InputStream openRange(long start, long end) {
    checkRange(start, end, data.length);
    return new ByteArrayInputStream(data, (int) start, (int) (end - start));
  }

  static void checkRange(long start, long end, long size) {
    if (start < 0 || end < start || end > size) {
      throw new IllegalArgumentException(
          String.format("Range [%d, %d) is outside source of %d bytes", start, end, size));
    }
  }
}
