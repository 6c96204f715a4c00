package com.scholary.skynet.upload.transport;

import com.scholary.skynet.upload.config.SkynetProperties;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Headers every portal request carries.
 *
 * <p>The API key goes in as the basic-auth password with an empty user name, which is what portals
 * expect.
 */
final class RequestHeaders {

  private RequestHeaders() {}

  static HttpRequest.Builder apply(HttpRequest.Builder builder, SkynetProperties properties) {
    if (hasText(properties.customUserAgent())) {
      builder.header("User-Agent", properties.customUserAgent());
    }
    if (hasText(properties.customCookie())) {
      builder.header("Cookie", properties.customCookie());
    }
    if (hasText(properties.apiKey())) {
      String credentials = ":" + properties.apiKey();
      builder.header(
          "Authorization",
          "Basic "
              + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
    }
    if (hasText(properties.skynetApiKey())) {
      builder.header("Skynet-Api-Key", properties.skynetApiKey());
    }
    return builder;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
