package com.scholary.skynet.upload.config;

import com.scholary.skynet.upload.upload.UploadOptionsOverride;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Skynet portal client.
 *
 * <p>These map to the "skynet.*" keys in application.yml. The {@code upload} block is the
 * client-level layer of upload options: keys left unset fall through to the built-in defaults.
 */
@ConfigurationProperties(prefix = "skynet")
@Validated
public record SkynetProperties(
    @NotBlank String portalUrl,
    String apiKey,
    String skynetApiKey,
    String customUserAgent,
    String customCookie,
    @NotBlank String endpointUpload,
    @NotBlank String endpointLargeUpload,
    @NotBlank String portalFileFieldname,
    @Positive int connectTimeoutSeconds,
    @Positive int readTimeoutSeconds,
    @Valid UploadDefaults upload) {

  public record UploadDefaults(
      @Positive Long largeFileSize,
      @Min(1) Integer chunkSizeMultiplier,
      @Min(1) Integer numParallelUploads,
      @Min(0) @Max(100) Integer staggerPercent,
      List<Duration> retryDelays,
      Boolean dryRun) {

    public UploadOptionsOverride toOverride() {
      return UploadOptionsOverride.builder()
          .largeFileSize(largeFileSize)
          .chunkSizeMultiplier(chunkSizeMultiplier)
          .numParallelUploads(numParallelUploads)
          .staggerPercent(staggerPercent)
          .retryDelays(retryDelays)
          .dryRun(dryRun)
          .build();
    }
  }

  public UploadOptionsOverride uploadOverride() {
    return upload == null ? UploadOptionsOverride.NONE : upload.toOverride();
  }
}
