package com.scholary.skynet.upload.upload;

import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;

/**
 * One layer of option overrides. {@code null} fields inherit from the layer below.
 *
 * <p>{@code staggerPercent} has three states: {@code null} inherits, an empty {@link OptionalInt}
 * turns stagger off, and a present value replaces it.
 */
public record UploadOptionsOverride(
    Long largeFileSize,
    Integer chunkSizeMultiplier,
    Integer numParallelUploads,
    OptionalInt staggerPercent,
    List<Duration> retryDelays,
    Boolean dryRun,
    String customFilename) {

  public static final UploadOptionsOverride NONE = builder().build();

  public static Builder builder() {
    return new Builder();
  }

  UploadOptions applyTo(UploadOptions base) {
    Integer stagger = base.staggerPercent();
    if (staggerPercent != null) {
      stagger = staggerPercent.isPresent() ? staggerPercent.getAsInt() : null;
    }
    return new UploadOptions(
        largeFileSize != null ? largeFileSize : base.largeFileSize(),
        base.baseChunkSize(),
        chunkSizeMultiplier != null ? chunkSizeMultiplier : base.chunkSizeMultiplier(),
        numParallelUploads != null ? numParallelUploads : base.numParallelUploads(),
        stagger,
        retryDelays != null ? retryDelays : base.retryDelays(),
        dryRun != null ? dryRun : base.dryRun(),
        customFilename != null ? customFilename : base.customFilename());
  }

  public static final class Builder {
    private Long largeFileSize;
    private Integer chunkSizeMultiplier;
    private Integer numParallelUploads;
    private OptionalInt staggerPercent;
    private List<Duration> retryDelays;
    private Boolean dryRun;
    private String customFilename;

    private Builder() {}

    public Builder largeFileSize(Long largeFileSize) {
      this.largeFileSize = largeFileSize;
      return this;
    }

    public Builder chunkSizeMultiplier(Integer chunkSizeMultiplier) {
      this.chunkSizeMultiplier = chunkSizeMultiplier;
      return this;
    }

    public Builder numParallelUploads(Integer numParallelUploads) {
      this.numParallelUploads = numParallelUploads;
      return this;
    }

    public Builder staggerPercent(Integer staggerPercent) {
      this.staggerPercent = staggerPercent == null ? null : OptionalInt.of(staggerPercent);
      return this;
    }

    public Builder noStagger() {
      this.staggerPercent = OptionalInt.empty();
      return this;
    }

    public Builder retryDelays(List<Duration> retryDelays) {
      this.retryDelays = retryDelays;
      return this;
    }

    public Builder dryRun(Boolean dryRun) {
      this.dryRun = dryRun;
      return this;
    }

    public Builder customFilename(String customFilename) {
      this.customFilename = customFilename;
      return this;
    }

    public UploadOptionsOverride build() {
      return new UploadOptionsOverride(
          largeFileSize,
          chunkSizeMultiplier,
          numParallelUploads,
          staggerPercent,
          retryDelays,
          dryRun,
          customFilename);
    }
  }
}
