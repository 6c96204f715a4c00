package com.scholary.skynet.upload.skylink;

import java.util.Base64;

/**
 * Converts skylinks between their raw, bare-encoded and URI forms.
 *
 * <p>The bare form is the 34 raw bytes in unpadded URL-safe base64, which always comes out at 46
 * characters. The URI form is the bare form behind the {@value #URI_SKYNET_PREFIX} scheme.
 */
public final class SkylinkCodec {

  /** Canonical scheme prefix for skylink URIs. */
  public static final String URI_SKYNET_PREFIX = "sia://";

  /** Shorter prefix some portals and users write. Recognized on input, never produced. */
  static final String URI_SKYNET_SHORT_PREFIX = "sia:";

  public static final int BASE64_ENCODED_SKYLINK_SIZE = 46;

  public static final int RAW_SKYLINK_SIZE = 34;

  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

  private SkylinkCodec() {}

  /**
   * Decode a bare skylink into its raw bytes.
   *
   * @param encoded the 46-character URL-safe base64 form
   * @return the 34 raw bytes
   * @throws MalformedSkylinkException if the input is not exactly 46 characters or does not decode
   *     to exactly 34 bytes
   */
  public static RawSkylink decode(String encoded) {
    if (encoded == null || encoded.length() != BASE64_ENCODED_SKYLINK_SIZE) {
      throw new MalformedSkylinkException(
          String.format(
              "Skylink must be %d characters long, was %s",
              BASE64_ENCODED_SKYLINK_SIZE, encoded == null ? "null" : encoded.length()));
    }

    String standard = (encoded + "==").replace('-', '+').replace('_', '/');

    byte[] raw;
    try {
      raw = Base64.getDecoder().decode(standard);
    } catch (IllegalArgumentException e) {
      throw new MalformedSkylinkException("Skylink is not valid base64: " + encoded, e);
    }

    if (raw.length != RAW_SKYLINK_SIZE) {
      throw new MalformedSkylinkException(
          String.format(
              "Skylink decoded to %d bytes, expected %d", raw.length, RAW_SKYLINK_SIZE));
    }
    return new RawSkylink(raw);
  }

  /** Encode raw bytes into the bare 46-character form. */
  public static String encode(RawSkylink skylink) {
    return ENCODER.encodeToString(skylink.bytes());
  }

  /**
   * Strip any recognized scheme prefix, leaving the bare form.
   *
   * <p>Repeated or mixed prefixes are all stripped, so formatting is idempotent.
   */
  public static String format(String input) {
    if (input == null) {
      throw new MalformedSkylinkException("Skylink must not be null");
    }
    String bare = input.trim();
    while (true) {
      if (bare.startsWith(URI_SKYNET_PREFIX)) {
        bare = bare.substring(URI_SKYNET_PREFIX.length());
      } else if (bare.startsWith(URI_SKYNET_SHORT_PREFIX)) {
        bare = bare.substring(URI_SKYNET_SHORT_PREFIX.length());
      } else {
        return bare;
      }
    }
  }

  /** Prefix a bare skylink with the canonical scheme. Prefixed input is normalized first. */
  public static String toUri(String encoded) {
    return URI_SKYNET_PREFIX + format(encoded);
  }
}
