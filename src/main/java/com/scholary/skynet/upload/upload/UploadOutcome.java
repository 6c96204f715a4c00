package com.scholary.skynet.upload.upload;

import com.scholary.skynet.upload.skylink.SkylinkCodec;

/**
 * The result of a successful upload.
 *
 * @param skylink the bare 46-character skylink
 * @param skylinkUri the same skylink behind the {@code sia://} scheme
 */
public record UploadOutcome(String skylink, String skylinkUri) {

  /**
   * Build an outcome from whatever form the portal returned.
   *
   * @throws com.scholary.skynet.upload.skylink.MalformedSkylinkException if it is not a skylink
   */
  public static UploadOutcome fromPortalSkylink(String returned) {
    String bare = SkylinkCodec.format(returned);
    SkylinkCodec.decode(bare);
    return new UploadOutcome(bare, SkylinkCodec.toUri(bare));
  }
}
