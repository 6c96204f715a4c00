package com.scholary.skynet.upload.upload;

/**
 * Receives upload progress, aggregated across all sessions.
 *
 * <p>Called from session threads, so implementations must be thread-safe.
 */
@FunctionalInterface
public interface UploadProgressListener {

  UploadProgressListener NONE = (uploaded, total) -> {};

  void onProgress(long bytesUploaded, long bytesTotal);
}
