package com.scholary.skynet.upload.skylink;

import com.scholary.skynet.upload.upload.SkynetException;

/**
 * Thrown when a string cannot be decoded into a 34-byte skylink.
 *
 * <p>Decoding is purely local, so this is never retried.
 */
public class MalformedSkylinkException extends SkynetException {

  public MalformedSkylinkException(String message) {
    super(message);
  }

  public MalformedSkylinkException(String message, Throwable cause) {
    super(message, cause);
  }
}
