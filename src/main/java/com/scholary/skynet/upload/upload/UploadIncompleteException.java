package com.scholary.skynet.upload.upload;

/** Thrown when every session finished but the portal did not hand back a location or skylink. */
public class UploadIncompleteException extends SkynetException {

  public UploadIncompleteException(String message) {
    super(message);
  }
}
