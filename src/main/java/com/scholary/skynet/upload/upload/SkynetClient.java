package com.scholary.skynet.upload.upload;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Upload capability of a configured portal client.
 *
 * <p>Implementations are built once with validated client-level options; every call merges its
 * own overrides on top and never changes the client.
 */
public interface SkynetClient {

  /**
   * Upload in-memory data.
   *
   * @param data the bytes to upload
   * @param filename the name to store them under
   * @param overrides call-level option overrides
   * @return the skylink
   */
  UploadOutcome uploadData(byte[] data, String filename, UploadOptionsOverride overrides);

  /**
   * Upload a local file, named by {@code customFilename} when set and by the file name otherwise.
   *
   * @throws IOException if the file cannot be read
   */
  UploadOutcome uploadFile(Path path, UploadOptionsOverride overrides) throws IOException;

  /**
   * Upload any source, with progress and cancellation.
   *
   * @param source the bytes to upload
   * @param filename the name to store them under unless {@code customFilename} is set
   * @param overrides call-level option overrides
   * @param cancellation cancels the upload when cancelled
   * @param listener receives progress as bytes go out
   * @return the skylink
   */
  UploadOutcome upload(
      UploadSource source,
      String filename,
      UploadOptionsOverride overrides,
      CancellationToken cancellation,
      UploadProgressListener listener);
}
