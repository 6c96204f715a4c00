package com.scholary.skynet.upload.upload;

/** Thrown when an upload is cancelled through its {@link CancellationToken}. */
public class UploadCancelledException extends SkynetException {

  public UploadCancelledException(String message) {
    super(message);
  }

  public UploadCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
