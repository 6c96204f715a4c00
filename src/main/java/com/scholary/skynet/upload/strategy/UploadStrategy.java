package com.scholary.skynet.upload.strategy;

/** How an upload is sent to the portal. */
public enum UploadStrategy {
  /** One multipart request to the skyfile endpoint. */
  SMALL_FILE,

  /** One or more resumable sessions, concatenated when there is more than one. */
  LARGE_FILE
}
