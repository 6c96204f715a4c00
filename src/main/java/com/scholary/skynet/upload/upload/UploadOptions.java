package com.scholary.skynet.upload.upload;

import java.time.Duration;
import java.util.List;

/**
 * Fully resolved options for one upload call.
 *
 * <p>Built once per call with {@link #merge} and read-only afterwards. Construction only
 * normalizes; {@link #validate()} is what enforces the ranges, and the coordinator runs it before
 * touching the network.
 *
 * @param largeFileSize payloads of at least this many bytes take the resumable path
 * @param baseChunkSize the portal's resumable chunk size
 * @param chunkSizeMultiplier chunks are sent in multiples of the base size
 * @param numParallelUploads requested concurrent sessions; clamped to the number of base chunks
 * @param staggerPercent delay between session starts as a percentage of the previous session's
 *     first chunk, or {@code null} for no stagger
 * @param retryDelays waits between retries of a failed session, consumed in order
 * @param dryRun ask the portal to compute the skylink without storing (single-request path)
 * @param customFilename name to upload under instead of the source's own
 */
public record UploadOptions(
    long largeFileSize,
    int baseChunkSize,
    int chunkSizeMultiplier,
    int numParallelUploads,
    Integer staggerPercent,
    List<Duration> retryDelays,
    boolean dryRun,
    String customFilename) {

  /** Chunk size the portal's resumable endpoint expects: 40 MiB. */
  public static final int TUS_CHUNK_SIZE = (1 << 22) * 10;

  static final long MAX_CHUNK_SIZE = Integer.MAX_VALUE - 8;

  public static final UploadOptions DEFAULTS =
      new UploadOptions(
          TUS_CHUNK_SIZE + 1L,
          TUS_CHUNK_SIZE,
          1,
          2,
          50,
          List.of(
              Duration.ZERO,
              Duration.ofSeconds(5),
              Duration.ofSeconds(15),
              Duration.ofSeconds(60),
              Duration.ofSeconds(300),
              Duration.ofSeconds(600)),
          false,
          null);

  public UploadOptions {
    retryDelays = retryDelays == null ? List.of() : List.copyOf(retryDelays);
  }

  /**
   * Merge option layers. Later layers win field by field: built-in defaults, then the client's
   * configuration, then the call's own overrides.
   */
  public static UploadOptions merge(
      UploadOptions defaults, UploadOptionsOverride clientLayer, UploadOptionsOverride callLayer) {
    return callLayer.applyTo(clientLayer.applyTo(defaults));
  }

  /** Chunk size actually sent per request. */
  public long effectiveChunkSize() {
    return (long) baseChunkSize * chunkSizeMultiplier;
  }

  /**
   * Check every option is in range.
   *
   * @throws IllegalArgumentException naming the first offending option
   */
  public void validate() {
    if (largeFileSize < 1) {
      throw invalid("largeFileSize", largeFileSize, "greater than or equal to 1");
    }
    if (baseChunkSize < 1) {
      throw invalid("baseChunkSize", baseChunkSize, "greater than or equal to 1");
    }
    if (chunkSizeMultiplier < 1) {
      throw invalid("chunkSizeMultiplier", chunkSizeMultiplier, "greater than or equal to 1");
    }
    // Sessions buffer one chunk in a byte array.
    if (effectiveChunkSize() > MAX_CHUNK_SIZE) {
      throw invalid(
          "chunkSizeMultiplier",
          chunkSizeMultiplier,
          "small enough for a chunk of at most " + MAX_CHUNK_SIZE + " bytes");
    }
    if (numParallelUploads < 1) {
      throw invalid("numParallelUploads", numParallelUploads, "greater than or equal to 1");
    }
    if (staggerPercent != null && (staggerPercent < 0 || staggerPercent > 100)) {
      throw invalid("staggerPercent", staggerPercent, "between 0 and 100");
    }
    for (Duration delay : retryDelays) {
      if (delay == null || delay.isNegative()) {
        throw invalid("retryDelays", retryDelays, "a list of non-negative durations");
      }
    }
  }

  private static IllegalArgumentException invalid(String option, Object value, String expected) {
    return new IllegalArgumentException(
        String.format("Expected option '%s' to be %s, was '%s'", option, expected, value));
  }
}
