package com.scholary.skynet.upload.strategy;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.skynet.upload.upload.UploadOptions;
import org.junit.jupiter.api.Test;

class UploadStrategySelectorTest {

  private final UploadStrategySelector selector = new UploadStrategySelector();

  @Test
  void select_shouldUseSingleRequestBelowThreshold() {
    assertThat(selector.select(0, 100)).isEqualTo(UploadStrategy.SMALL_FILE);
    assertThat(selector.select(99, 100)).isEqualTo(UploadStrategy.SMALL_FILE);
  }

  @Test
  void select_shouldUseResumablePathAtThreshold() {
    assertThat(selector.select(100, 100)).isEqualTo(UploadStrategy.LARGE_FILE);
    assertThat(selector.select(101, 100)).isEqualTo(UploadStrategy.LARGE_FILE);
  }

  @Test
  void select_shouldKeepExactlyOneDefaultChunkOnSingleRequestPath() {
    long threshold = UploadOptions.DEFAULTS.largeFileSize();

    assertThat(selector.select(UploadOptions.TUS_CHUNK_SIZE, threshold))
        .isEqualTo(UploadStrategy.SMALL_FILE);
    assertThat(selector.select(UploadOptions.TUS_CHUNK_SIZE + 1L, threshold))
        .isEqualTo(UploadStrategy.LARGE_FILE);
  }
}
