package com.scholary.skynet.upload.transport;

import com.scholary.skynet.upload.upload.SkynetException;

/**
 * Thrown when a request to the portal fails.
 *
 * <p>The message is the portal's own error body when it sent one, since that is far more useful
 * than a bare status code. {@link #getStatusCode()} is {@value #NO_STATUS} for failures that never
 * produced a response (connection refused, reset, timeout).
 */
public class TransportException extends SkynetException {

  public static final int NO_STATUS = -1;

  private final int statusCode;

  public TransportException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = NO_STATUS;
  }

  public TransportException(int statusCode, String message) {
    super(message);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }

  /**
   * Whether a resumable session should try again after this failure.
   *
   * <p>Network failures and anything outside the 4xx range are retried. Of the 4xx codes only 409
   * (offset mismatch) and 423 (upload locked) are, because both clear up once the session
   * re-reads its offset.
   */
  public boolean isRetryable() {
    if (statusCode == NO_STATUS) {
      return true;
    }
    boolean clientError = statusCode >= 400 && statusCode < 500;
    return !clientError || statusCode == 409 || statusCode == 423;
  }
}
