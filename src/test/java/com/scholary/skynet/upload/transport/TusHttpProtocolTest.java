package com.scholary.skynet.upload.transport;

import static com.scholary.skynet.upload.transport.PortalTestServer.send;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.skynet.upload.upload.UploadIncompleteException;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TusHttpProtocolTest {

  private static final String SKYLINK = "XABvi7JtJbQSMAcDwnUnmp2FKDPjg8_tTTFP4BwMSxVdEg";

  private PortalTestServer server;
  private TusHttpProtocol protocol;

  @BeforeEach
  void setUp() throws IOException {
    server = new PortalTestServer();
    protocol =
        new TusHttpProtocol(server.properties("secret", null), PortalTestServer.httpClient());
  }

  @AfterEach
  void tearDown() {
    server.close();
  }

  @Test
  void createUpload_shouldPostLengthMetadataAndConcatHeader() {
    server.respondWith(
        (request, exchange) -> send(exchange, 201, "", "Location", "/skynet/tus/abc"));

    URI location = protocol.createUpload(1234, ContentTypes.uploadMetadata("a.txt"), true);

    assertThat(location.toString()).isEqualTo(server.baseUrl() + "/skynet/tus/abc");
    PortalTestServer.Recorded request = server.lastRequest();
    assertThat(request.method()).isEqualTo("POST");
    assertThat(request.path()).isEqualTo("/skynet/tus");
    assertThat(request.header("Tus-Resumable")).isEqualTo("1.0.0");
    assertThat(request.header("Upload-Length")).isEqualTo("1234");
    assertThat(request.header("Upload-Concat")).isEqualTo("partial");
    assertThat(request.header("Upload-Metadata"))
        .isEqualTo("filename " + b64("a.txt") + ",filetype " + b64("text/plain"));
  }

  @Test
  void createUpload_shouldOmitConcatHeaderForPlainUpload() {
    server.respondWith(
        (request, exchange) -> send(exchange, 201, "", "Location", "/skynet/tus/abc"));

    protocol.createUpload(10, Map.of(), false);

    assertThat(server.lastRequest().header("Upload-Concat")).isNull();
  }

  @Test
  void createUpload_shouldSendPortalHeaders() {
    server.respondWith(
        (request, exchange) -> send(exchange, 201, "", "Location", "/skynet/tus/abc"));

    protocol.createUpload(10, Map.of(), false);

    PortalTestServer.Recorded request = server.lastRequest();
    assertThat(request.header("Authorization")).isEqualTo("Basic " + b64(":secret"));
    assertThat(request.header("User-Agent")).isEqualTo("skynet-uploader-test");
    assertThat(request.header("Cookie")).isEqualTo("session=abc");
  }

  @Test
  void createUpload_shouldFailWithoutLocation() {
    server.respondWith((request, exchange) -> send(exchange, 201, ""));

    assertThatThrownBy(() -> protocol.createUpload(10, Map.of(), false))
        .isInstanceOf(UploadIncompleteException.class);
  }

  @Test
  void writeChunk_shouldPatchBytesAtOffset() {
    server.respondWith(
        (request, exchange) -> send(exchange, 204, "", "Upload-Offset", "105"));
    byte[] data = "xxhello world".getBytes(StandardCharsets.US_ASCII);
    AtomicLong progress = new AtomicLong();
    URI location = URI.create(server.baseUrl() + "/skynet/tus/abc");

    long newOffset = protocol.writeChunk(location, 100, data, 2, 5, progress::set);

    assertThat(newOffset).isEqualTo(105);
    assertThat(progress.get()).isEqualTo(5);
    PortalTestServer.Recorded request = server.lastRequest();
    assertThat(request.method()).isEqualTo("PATCH");
    assertThat(request.path()).isEqualTo("/skynet/tus/abc");
    assertThat(request.header("Upload-Offset")).isEqualTo("100");
    assertThat(request.header("Content-Type")).isEqualTo("application/offset+octet-stream");
    assertThat(request.bodyText()).isEqualTo("hello");
  }

  @Test
  void writeChunk_shouldUsePortalBodyAsErrorMessage() {
    server.respondWith((request, exchange) -> send(exchange, 500, "  disk full \n"));
    URI location = URI.create(server.baseUrl() + "/skynet/tus/abc");

    assertThatThrownBy(() -> protocol.writeChunk(location, 0, new byte[4], 0, 4, n -> {}))
        .isInstanceOfSatisfying(
            TransportException.class,
            e -> {
              assertThat(e.getStatusCode()).isEqualTo(500);
              assertThat(e.getMessage()).isEqualTo("disk full");
              assertThat(e.isRetryable()).isTrue();
            });
  }

  @Test
  void writeChunk_shouldFallBackToGenericMessageWithoutBody() {
    server.respondWith((request, exchange) -> send(exchange, 400, ""));
    URI location = URI.create(server.baseUrl() + "/skynet/tus/abc");

    assertThatThrownBy(() -> protocol.writeChunk(location, 0, new byte[4], 0, 4, n -> {}))
        .isInstanceOfSatisfying(
            TransportException.class,
            e -> {
              assertThat(e.getMessage()).contains("Portal returned status 400");
              assertThat(e.isRetryable()).isFalse();
            });
  }

  @Test
  void writeChunk_shouldReportMalformedOffsetAsTransportFailure() {
    server.respondWith(
        (request, exchange) -> send(exchange, 204, "", "Upload-Offset", "abc"));
    URI location = URI.create(server.baseUrl() + "/skynet/tus/abc");

    assertThatThrownBy(() -> protocol.writeChunk(location, 0, new byte[4], 0, 4, n -> {}))
        .isInstanceOfSatisfying(
            TransportException.class,
            e -> {
              assertThat(e.getStatusCode()).isEqualTo(204);
              assertThat(e.getMessage()).contains("invalid Upload-Offset 'abc'");
            });
  }

  @Test
  void getOffset_shouldReportMalformedOffsetAsTransportFailure() {
    server.respondWith(
        (request, exchange) -> send(exchange, 200, "", "Upload-Offset", "12x"));

    assertThatThrownBy(
            () -> protocol.getOffset(URI.create(server.baseUrl() + "/skynet/tus/abc")))
        .isInstanceOf(TransportException.class)
        .hasMessageContaining("invalid Upload-Offset");
  }

  @Test
  void getOffset_shouldReadUploadOffsetHeader() {
    server.respondWith(
        (request, exchange) -> send(exchange, 200, "", "Upload-Offset", "4096"));

    long offset = protocol.getOffset(URI.create(server.baseUrl() + "/skynet/tus/abc"));

    assertThat(offset).isEqualTo(4096);
    assertThat(server.lastRequest().method()).isEqualTo("HEAD");
  }

  @Test
  void concatenate_shouldListPartialsInOrder() {
    server.respondWith(
        (request, exchange) -> send(exchange, 201, "", "Location", "/skynet/tus/final"));
    URI first = URI.create(server.baseUrl() + "/skynet/tus/1");
    URI second = URI.create(server.baseUrl() + "/skynet/tus/2");
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("filename", "big.bin");

    URI location = protocol.concatenate(List.of(first, second), metadata);

    assertThat(location.getPath()).isEqualTo("/skynet/tus/final");
    PortalTestServer.Recorded request = server.lastRequest();
    assertThat(request.header("Upload-Concat")).isEqualTo("final;" + first + " " + second);
    assertThat(request.header("Upload-Metadata")).isEqualTo("filename " + b64("big.bin"));
  }

  @Test
  void probeSkylink_shouldReadSkylinkHeader() {
    server.respondWith(
        (request, exchange) -> send(exchange, 200, "", "Skynet-Skylink", SKYLINK));

    assertThat(protocol.probeSkylink(URI.create(server.baseUrl() + "/skynet/tus/final")))
        .contains(SKYLINK);
  }

  @Test
  void probeSkylink_shouldBeEmptyWithoutHeader() {
    server.respondWith((request, exchange) -> send(exchange, 200, ""));

    assertThat(protocol.probeSkylink(URI.create(server.baseUrl() + "/skynet/tus/final")))
        .isEmpty();
  }

  @Test
  void request_shouldFailWithoutStatusWhenPortalIsDown() {
    String url = server.baseUrl();
    server.close();

    assertThatThrownBy(() -> protocol.getOffset(URI.create(url + "/skynet/tus/abc")))
        .isInstanceOfSatisfying(
            TransportException.class,
            e -> {
              assertThat(e.getStatusCode()).isEqualTo(TransportException.NO_STATUS);
              assertThat(e.isRetryable()).isTrue();
            });
  }

  private static String b64(String value) {
    return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
  }
}
