package com.scholary.skynet.upload.api;

import com.scholary.skynet.upload.upload.UploadOutcome;

/** Response for a finished upload. */
public record UploadResponse(String skylink, String skylinkUri) {

  public static UploadResponse from(UploadOutcome outcome) {
    return new UploadResponse(outcome.skylink(), outcome.skylinkUri());
  }
}
