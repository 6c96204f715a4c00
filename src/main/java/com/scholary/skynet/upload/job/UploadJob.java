package com.scholary.skynet.upload.job;

import com.scholary.skynet.upload.api.JobStatusResponse.Status;
import com.scholary.skynet.upload.api.UploadResponse;
import com.scholary.skynet.upload.upload.CancellationToken;
import java.time.Instant;

/**
 * Represents an async upload job.
 *
 * <p>Tracks the job's state, progress, and result. Stored in memory using Caffeine cache. Fields
 * are written by the job thread and read by request threads, hence volatile.
 */
public class UploadJob {

  private final String jobId;
  private final String filename;
  private final long size;
  private final Instant createdAt;
  private final CancellationToken cancellation;

  private volatile Status status;
  private volatile Integer progress; // 0-100
  private volatile UploadResponse result;
  private volatile String error;

  public UploadJob(String jobId, String filename, long size) {
    this.jobId = jobId;
    this.filename = filename;
    this.size = size;
    this.createdAt = Instant.now();
    this.cancellation = CancellationToken.create();
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public String getFilename() {
    return filename;
  }

  public long getSize() {
    return size;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public CancellationToken getCancellation() {
    return cancellation;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public Integer getProgress() {
    return progress;
  }

  public void setProgress(Integer progress) {
    this.progress = progress;
  }

  public UploadResponse getResult() {
    return result;
  }

  public void setResult(UploadResponse result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
