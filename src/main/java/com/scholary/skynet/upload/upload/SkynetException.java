package com.scholary.skynet.upload.upload;

/**
 * Base class for failures raised while talking to a Skynet portal.
 *
 * <p>Unchecked. Retryable failures have already been retried by the time one of these surfaces.
 */
public class SkynetException extends RuntimeException {

  public SkynetException(String message) {
    super(message);
  }

  public SkynetException(String message, Throwable cause) {
    super(message, cause);
  }
}
