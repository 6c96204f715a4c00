package com.scholary.skynet.upload.transport;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

/** File type guessing and upload metadata. */
public final class ContentTypes {

  private ContentTypes() {}

  /** Guess the MIME type from the file extension, falling back to octet-stream. */
  public static String forFilename(String filename) {
    return MediaTypeFactory.getMediaType(filename)
        .orElse(MediaType.APPLICATION_OCTET_STREAM)
        .toString();
  }

  /** Metadata sent with every resumable upload. */
  public static Map<String, String> uploadMetadata(String filename) {
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("filename", filename);
    metadata.put("filetype", forFilename(filename));
    return metadata;
  }
}
