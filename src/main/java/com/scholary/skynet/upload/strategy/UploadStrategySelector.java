package com.scholary.skynet.upload.strategy;

import org.springframework.stereotype.Component;

/**
 * Routes uploads by size.
 *
 * <p>Anything strictly below the threshold goes as a single request; a payload exactly at the
 * threshold already takes the resumable path.
 */
@Component
public class UploadStrategySelector {

  public UploadStrategy select(long sizeInBytes, long largeFileSize) {
    return sizeInBytes < largeFileSize ? UploadStrategy.SMALL_FILE : UploadStrategy.LARGE_FILE;
  }
}
