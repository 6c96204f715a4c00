package com.scholary.skynet.upload.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.skynet.upload.config.SkynetProperties;
import com.scholary.skynet.upload.upload.UploadCancelledException;
import com.scholary.skynet.upload.upload.UploadIncompleteException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the portal's single-request skyfile endpoint.
 *
 * <p>Small payloads go up as one multipart/form-data POST and the portal answers with JSON
 * carrying the skylink. No retry here; the caller decides whether to repeat a failed upload.
 */
public class PortalHttpClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(PortalHttpClient.class);

  private final HttpClient httpClient;
  private final SkynetProperties properties;
  private final ObjectMapper objectMapper;

  public PortalHttpClient(SkynetProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeoutSeconds()))
            .build());
  }

  PortalHttpClient(SkynetProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = httpClient;

    LOGGER.info("Initialized portal client: portalUrl={}", properties.portalUrl());
  }

  /**
   * Upload a payload in one request.
   *
   * @param data the bytes to upload
   * @param filename the name to store them under
   * @param dryRun ask the portal to compute the skylink without pinning the data
   * @return the skylink exactly as the portal returned it
   * @throws TransportException if the request fails or the portal rejects it
   * @throws UploadIncompleteException if the response carries no skylink
   */
  public String uploadSmallFile(byte[] data, String filename, boolean dryRun) {
    String url = properties.portalUrl() + properties.endpointUpload();
    if (dryRun) {
      url += "?dryrun=true";
    }

    String boundary = UUID.randomUUID().toString();
    HttpRequest request =
        RequestHeaders.apply(HttpRequest.newBuilder(), properties)
            .uri(URI.create(url))
            .timeout(Duration.ofSeconds(properties.readTimeoutSeconds()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(buildMultipartBody(data, filename, boundary))
            .build();

    LOGGER.debug("Uploading {} bytes as {} to {}", data.length, filename, request.uri());

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new TransportException(
          String.format("POST %s failed: %s", request.uri(), e.getMessage()), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UploadCancelledException("Interrupted during upload", e);
    }

    if (response.statusCode() / 100 != 2) {
      throw errorFor(request, response);
    }

    String skylink = parseSkylink(response.body());
    LOGGER.info("Uploaded {} ({} bytes): skylink={}", filename, data.length, skylink);
    return skylink;
  }

  private String parseSkylink(String body) {
    JsonNode node;
    try {
      node = objectMapper.readTree(body);
    } catch (IOException e) {
      throw new UploadIncompleteException("Portal response is not JSON: " + body);
    }
    JsonNode skylink = node == null ? null : node.get("skylink");
    if (skylink == null || skylink.asText().isBlank()) {
      throw new UploadIncompleteException("Portal response did not contain a skylink");
    }
    return skylink.asText();
  }

  /**
   * Build the multipart body by hand; the JDK HttpClient has no multipart support. The layout is:
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="hello.txt"
   * Content-Type: text/plain
   *
   * [binary data]
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(byte[] data, String filename, String boundary) {
    String prefix =
        "--"
            + boundary
            + "\r\n"
            + "Content-Disposition: form-data; name=\""
            + properties.portalFileFieldname()
            + "\"; filename=\""
            + filename.replace("\"", "\\\"")
            + "\"\r\n"
            + "Content-Type: "
            + ContentTypes.forFilename(filename)
            + "\r\n\r\n";
    String suffix = "\r\n--" + boundary + "--\r\n";

    byte[] head = prefix.getBytes(StandardCharsets.UTF_8);
    byte[] tail = suffix.getBytes(StandardCharsets.UTF_8);

    byte[] body = new byte[head.length + data.length + tail.length];
    System.arraycopy(head, 0, body, 0, head.length);
    System.arraycopy(data, 0, body, head.length, data.length);
    System.arraycopy(tail, 0, body, head.length + data.length, tail.length);

    return BodyPublishers.ofByteArray(body);
  }

  /** Prefer the portal's own error text over a generic status message. */
  static TransportException errorFor(HttpRequest request, HttpResponse<String> response) {
    String body = response.body() == null ? "" : response.body().trim();
    String message =
        body.isEmpty()
            ? String.format(
                "Portal returned status %d for %s %s",
                response.statusCode(), request.method(), request.uri())
            : body;
    LOGGER.warn(
        "Portal request failed: method={}, uri={}, status={}",
        request.method(),
        request.uri(),
        response.statusCode());
    return new TransportException(response.statusCode(), message);
  }
}
