package com.scholary.skynet.upload.upload;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * The bytes being uploaded.
 *
 * <p>Parallel sessions each read their own part, so a source used with more than one session must
 * hand out independent readers for arbitrary ranges ({@link #supportsRangeReads()}). A plain
 * stream can only back a single session reading it front to back.
 */
public interface UploadSource {

  /** Total number of bytes. */
  long size();

  /** Whether {@link #openRange} may be called for any range, any number of times, concurrently. */
  boolean supportsRangeReads();

  /**
   * Open a reader over {@code [start, end)}.
   *
   * <p>The caller closes the stream.
   *
   * @throws IOException if the underlying data cannot be opened
   */
  InputStream openRange(long start, long end) throws IOException;

  static UploadSource ofBytes(byte[] data) {
    return new ByteArrayUploadSource(data);
  }

  static UploadSource ofPath(Path path) throws IOException {
    return new FileUploadSource(path);
  }

  static UploadSource ofStream(InputStream stream, long size) {
    return new StreamUploadSource(stream, size);
  }
}
