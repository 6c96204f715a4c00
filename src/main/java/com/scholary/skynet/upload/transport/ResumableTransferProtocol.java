package com.scholary.skynet.upload.transport;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongConsumer;

/**
 * The portal's resumable-transfer endpoint.
 *
 * <p>Sessions drive it one request at a time: create an upload, push chunks at increasing offsets,
 * re-read the offset after a failure, and finally stitch partial uploads together.
 *
 * <p>Every method throws {@link TransportException} when the request fails.
 */
public interface ResumableTransferProtocol {

  /**
   * Create an upload session.
   *
   * @param uploadLength total bytes the session will carry
   * @param metadata key/value metadata stored with the upload
   * @param partial true when the session is one part of a parallel upload
   * @return the session's location
   */
  URI createUpload(long uploadLength, Map<String, String> metadata, boolean partial);

  /** Read how many bytes the portal has accepted for a session. */
  long getOffset(URI location);

  /**
   * Send {@code length} bytes of {@code data}, starting at {@code from}, to the given offset.
   *
   * @param progress told the cumulative number of bytes of this call sent so far
   * @return the session's new offset as reported by the portal
   */
  long writeChunk(
      URI location, long offset, byte[] data, int from, int length, LongConsumer progress);

  /**
   * Concatenate finished partial uploads, in order, into one final upload.
   *
   * @return the final upload's location
   */
  URI concatenate(List<URI> partials, Map<String, String> metadata);

  /** Probe a finished upload's metadata for the skylink the portal assigned to it. */
  Optional<String> probeSkylink(URI location);
}
