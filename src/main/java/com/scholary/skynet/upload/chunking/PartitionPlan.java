package com.scholary.skynet.upload.chunking;

import java.util.List;

/**
 * Contiguous, ordered byte ranges covering an upload, one per concurrent session.
 *
 * @param parts the ranges in part order; {@code parts[i].end == parts[i+1].start}
 * @param chunkSize the effective chunk size the parts were aligned to
 */
public record PartitionPlan(List<ByteRange> parts, long chunkSize) {

  public PartitionPlan {
    parts = List.copyOf(parts);
    for (int i = 1; i < parts.size(); i++) {
      if (parts.get(i - 1).end() != parts.get(i).start()) {
        throw new IllegalArgumentException(
            String.format("Parts %d and %d are not contiguous", i - 1, i));
      }
    }
  }

  public int partCount() {
    return parts.size();
  }

  public ByteRange part(int index) {
    return parts.get(index);
  }

  public long totalSize() {
    return parts.isEmpty() ? 0 : parts.get(parts.size() - 1).end() - parts.get(0).start();
  }
}
