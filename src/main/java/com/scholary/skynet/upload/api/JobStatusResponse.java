package com.scholary.skynet.upload.api;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async upload and includes the skylink once it has completed.
 */
public record JobStatusResponse(
    String jobId, Status status, Integer progress, UploadResponse result, String error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
      return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
  }
}
