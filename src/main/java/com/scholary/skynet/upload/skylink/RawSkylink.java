package com.scholary.skynet.upload.skylink;

import java.util.Arrays;

/**
 * The 34 raw bytes of a skylink.
 *
 * <p>Layout: a 2-byte little-endian bitfield (version, fetch offset and size) followed by the
 * 32-byte merkle root of the content. Instances are immutable; accessors hand out copies.
 */
public final class RawSkylink {

  private final byte[] bytes;

  public RawSkylink(byte[] bytes) {
    if (bytes == null || bytes.length != SkylinkCodec.RAW_SKYLINK_SIZE) {
      throw new MalformedSkylinkException(
          String.format(
              "Raw skylink must be %d bytes, was %s",
              SkylinkCodec.RAW_SKYLINK_SIZE, bytes == null ? "null" : bytes.length));
    }
    this.bytes = bytes.clone();
  }

  public byte[] bytes() {
    return bytes.clone();
  }

  /** The leading 16-bit bitfield, read little-endian. */
  public int bitfield() {
    return (bytes[0] & 0xff) | ((bytes[1] & 0xff) << 8);
  }

  public byte[] merkleRoot() {
    return Arrays.copyOfRange(bytes, 2, bytes.length);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawSkylink)) {
      return false;
    }
    return Arrays.equals(bytes, ((RawSkylink) o).bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return SkylinkCodec.encode(this);
  }
}
