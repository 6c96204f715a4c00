package com.scholary.skynet.upload.upload;

import java.util.concurrent.atomic.AtomicLongArray;

/** Sums per-part progress into one figure for the caller's listener. */
final class ProgressTracker {

  private final AtomicLongArray partBytes;
  private final long totalBytes;
  private final UploadProgressListener listener;

  ProgressTracker(int partCount, long totalBytes, UploadProgressListener listener) {
    this.partBytes = new AtomicLongArray(partCount);
    this.totalBytes = totalBytes;
    this.listener = listener;
  }

  /** Record that {@code bytes} of part {@code partIndex} are sent or in flight. */
  void update(int partIndex, long bytes) {
    partBytes.set(partIndex, bytes);
    listener.onProgress(uploaded(), totalBytes);
  }

  long uploaded() {
    long sum = 0;
    for (int i = 0; i < partBytes.length(); i++) {
      sum += partBytes.get(i);
    }
    return sum;
  }
}
