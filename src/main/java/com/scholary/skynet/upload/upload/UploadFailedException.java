package com.scholary.skynet.upload.upload;

/**
 * Thrown when one session of a large upload fails for good and takes the whole upload down.
 *
 * <p>No partial result survives this: the other sessions are cancelled and nothing is returned.
 * The cause is usually the session's {@link com.scholary.skynet.upload.transport.TransportException}.
 */
public class UploadFailedException extends SkynetException {

  private final int partIndex;

  public UploadFailedException(int partIndex, String message, Throwable cause) {
    super(message, cause);
    this.partIndex = partIndex;
  }

  /** Index of the part whose session failed. */
  public int getPartIndex() {
    return partIndex;
  }
}
