package com.scholary.skynet.upload.transport;

import com.scholary.skynet.upload.config.SkynetProperties;
import com.scholary.skynet.upload.upload.UploadCancelledException;
import com.scholary.skynet.upload.upload.UploadIncompleteException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongConsumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * tus 1.0.0 client for the portal's resumable endpoint.
 *
 * <p>Each method is one HTTP round trip; retries and resumption are the session's business. Uses
 * the JDK HttpClient like our other portal traffic.
 *
 * <p>Parallel uploads rely on the concatenation extension: parts are created with {@code
 * Upload-Concat: partial} and joined by a final POST listing their URLs in order.
 */
public class TusHttpProtocol implements ResumableTransferProtocol {

  private static final Logger LOGGER = LoggerFactory.getLogger(TusHttpProtocol.class);

  static final String TUS_VERSION = "1.0.0";
  static final String SKYLINK_HEADER = "Skynet-Skylink";

  private final HttpClient httpClient;
  private final SkynetProperties properties;
  private final URI endpoint;

  public TusHttpProtocol(SkynetProperties properties) {
    this(
        properties,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeoutSeconds()))
            .build());
  }

  TusHttpProtocol(SkynetProperties properties, HttpClient httpClient) {
    this.properties = properties;
    this.httpClient = httpClient;
    this.endpoint = URI.create(properties.portalUrl() + properties.endpointLargeUpload());

    LOGGER.info("Initialized resumable upload client: endpoint={}", endpoint);
  }

  @Override
  public URI createUpload(long uploadLength, Map<String, String> metadata, boolean partial) {
    HttpRequest.Builder builder =
        request(endpoint)
            .header("Upload-Length", Long.toString(uploadLength))
            .header("Upload-Metadata", encodeMetadata(metadata))
            .POST(BodyPublishers.noBody());
    if (partial) {
      builder.header("Upload-Concat", "partial");
    }

    HttpResponse<String> response = send(builder.build(), 201);
    URI location = resolveLocation(response);

    LOGGER.debug(
        "Created upload: location={}, length={}, partial={}", location, uploadLength, partial);
    return location;
  }

  @Override
  public long getOffset(URI location) {
    HttpResponse<String> response =
        send(request(location).method("HEAD", BodyPublishers.noBody()).build(), 200, 204);

    return uploadOffset(response)
        .orElseThrow(
            () ->
                new TransportException(
                    response.statusCode(), "Portal did not report an offset for " + location));
  }

  @Override
  public long writeChunk(
      URI location, long offset, byte[] data, int from, int length, LongConsumer progress) {
    BodyPublisher body =
        BodyPublishers.fromPublisher(
            BodyPublishers.ofInputStream(
                () ->
                    new CountingInputStream(
                        new ByteArrayInputStream(data, from, length), progress)),
            length);

    HttpRequest request =
        request(location)
            .timeout(Duration.ofSeconds(properties.readTimeoutSeconds()))
            .header("Upload-Offset", Long.toString(offset))
            .header("Content-Type", "application/offset+octet-stream")
            .method("PATCH", body)
            .build();

    HttpResponse<String> response = send(request, 204);

    long newOffset = uploadOffset(response).orElse(offset + length);

    LOGGER.debug("Wrote chunk: location={}, offset={}, newOffset={}", location, offset, newOffset);
    return newOffset;
  }

  @Override
  public URI concatenate(List<URI> partials, Map<String, String> metadata) {
    String concat =
        "final;" + partials.stream().map(URI::toString).collect(Collectors.joining(" "));

    HttpRequest request =
        request(endpoint)
            .header("Upload-Concat", concat)
            .header("Upload-Metadata", encodeMetadata(metadata))
            .POST(BodyPublishers.noBody())
            .build();

    URI location = resolveLocation(send(request, 201));
    LOGGER.info("Concatenated {} partial uploads into {}", partials.size(), location);
    return location;
  }

  @Override
  public Optional<String> probeSkylink(URI location) {
    HttpResponse<String> response =
        send(request(location).method("HEAD", BodyPublishers.noBody()).build(), 200, 204);
    return response.headers().firstValue(SKYLINK_HEADER).filter(s -> !s.isBlank());
  }

  private HttpRequest.Builder request(URI uri) {
    return RequestHeaders.apply(
        HttpRequest.newBuilder().uri(uri).header("Tus-Resumable", TUS_VERSION), properties);
  }

  private HttpResponse<String> send(HttpRequest request, int... expectedStatus) {
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new TransportException(
          String.format("%s %s failed: %s", request.method(), request.uri(), e.getMessage()), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UploadCancelledException("Interrupted during " + request.method(), e);
    }

    for (int status : expectedStatus) {
      if (response.statusCode() == status) {
        return response;
      }
    }
    throw PortalHttpClient.errorFor(request, response);
  }

  private static Optional<Long> uploadOffset(HttpResponse<String> response) {
    Optional<String> header = response.headers().firstValue("Upload-Offset");
    if (header.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Long.parseLong(header.get().trim()));
    } catch (NumberFormatException e) {
      throw new TransportException(
          response.statusCode(), "Portal sent invalid Upload-Offset '" + header.get() + "'");
    }
  }

  private URI resolveLocation(HttpResponse<String> response) {
    return response
        .headers()
        .firstValue("Location")
        .map(endpoint::resolve)
        .orElseThrow(
            () -> new UploadIncompleteException("Portal did not return an upload location"));
  }

  static String encodeMetadata(Map<String, String> metadata) {
    return metadata.entrySet().stream()
        .map(
            e ->
                e.getKey()
                    + " "
                    + Base64.getEncoder()
                        .encodeToString(e.getValue().getBytes(StandardCharsets.UTF_8)))
        .collect(Collectors.joining(","));
  }

  /** Reports bytes as the HttpClient pulls them off the request body. */
  private static final class CountingInputStream extends InputStream {

    private final InputStream in;
    private final LongConsumer progress;
    private long count;

    CountingInputStream(InputStream in, LongConsumer progress) {
      this.in = in;
      this.progress = progress;
    }

    @Override
    public int read() throws IOException {
      int b = in.read();
      if (b >= 0) {
        progress.accept(++count);
      }
      return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
      int n = in.read(b, off, len);
      if (n > 0) {
        count += n;
        progress.accept(count);
      }
      return n;
    }
  }
}
