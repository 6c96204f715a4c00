package com.scholary.skynet.upload.upload;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.scholary.skynet.upload.chunking.ChunkPartitioner;
import com.scholary.skynet.upload.transport.TransportException;
import java.io.ByteArrayInputStream;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ConcurrentTaskExecutor;

class ParallelUploadCoordinatorTest {

  private static final int CHUNK = 100;

  private ExecutorService executorService;
  private InMemoryTusProtocol portal;
  private ParallelUploadCoordinator coordinator;

  @BeforeEach
  void setUp() {
    executorService = Executors.newFixedThreadPool(4);
    portal = new InMemoryTusProtocol();
    coordinator =
        new ParallelUploadCoordinator(
            portal, new ChunkPartitioner(), new ConcurrentTaskExecutor(executorService));
  }

  @AfterEach
  void tearDown() {
    executorService.shutdownNow();
  }

  @Test
  void upload_shouldUseSingleSessionWhenOneChunk() {
    byte[] data = randomBytes(80);

    UploadOutcome outcome = upload(data, options(4, null, List.of()));

    assertThat(outcome.skylink()).isEqualTo(InMemoryTusProtocol.skylinkFor(data));
    assertThat(outcome.skylinkUri()).isEqualTo("sia://" + outcome.skylink());
    assertThat(portal.partialsCreated()).isZero();
    assertThat(portal.concatenations()).isZero();
  }

  @Test
  void upload_shouldUseSingleSessionWhenParallelismIsOne() {
    byte[] data = randomBytes(1050);

    UploadOutcome outcome = upload(data, options(1, 50, List.of()));

    assertThat(outcome.skylink()).isEqualTo(InMemoryTusProtocol.skylinkFor(data));
    assertThat(portal.partialsCreated()).isZero();
    assertThat(portal.writes()).isEqualTo(11);
  }

  @Test
  void upload_shouldSplitAndConcatenateInPartOrder() {
    byte[] data = randomBytes(1050);

    UploadOutcome outcome = upload(data, options(3, null, List.of()));

    assertThat(outcome.skylink()).isEqualTo(InMemoryTusProtocol.skylinkFor(data));
    assertThat(portal.partialsCreated()).isEqualTo(3);
    assertThat(portal.concatenations()).isEqualTo(1);
  }

  @Test
  void upload_shouldClampParallelismToChunkCount() {
    byte[] data = randomBytes(150);

    upload(data, options(5, null, List.of()));

    assertThat(portal.partialsCreated()).isEqualTo(2);
  }

  @Test
  void upload_shouldStartNextPartOnlyAfterPreviousPartIsUnderway() {
    byte[] data = randomBytes(400);

    upload(data, options(2, 50, List.of()));

    List<String> events = portal.events();
    assertThat(events.indexOf("create:/2")).isGreaterThan(events.indexOf("write:/1"));
  }

  @Test
  void upload_shouldReportProgressUpToTotal() {
    byte[] data = randomBytes(730);
    AtomicLong last = new AtomicLong();
    AtomicLong total = new AtomicLong();

    coordinator.upload(
        UploadSource.ofBytes(data),
        "data.bin",
        options(3, null, List.of()),
        CancellationToken.create(),
        (uploaded, all) -> {
          last.accumulateAndGet(uploaded, Math::max);
          total.set(all);
        });

    assertThat(last.get()).isEqualTo(730);
    assertThat(total.get()).isEqualTo(730);
  }

  @Test
  void upload_shouldRecoverFromTransientFailuresWithSameSkylink() {
    byte[] data = randomBytes(1000);
    String clean = InMemoryTusProtocol.skylinkFor(data);
    portal.failWritesWhere(n -> n == 2 || n == 3, 503, true);

    UploadOutcome outcome = upload(data, options(2, null, zeroDelays(3)));

    assertThat(outcome.skylink()).isEqualTo(clean);
  }

  @Test
  void upload_shouldWaitRetryDelaysInOrder() {
    byte[] data = randomBytes(400);
    portal.failWritesWhere(n -> n <= 3, 503, false);
    Logger sessionLogger = (Logger) LoggerFactory.getLogger(ResumableSession.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    sessionLogger.addAppender(appender);

    UploadOutcome outcome;
    long elapsedNanos;
    try {
      long started = System.nanoTime();
      outcome =
          upload(
              data,
              options(
                  1,
                  null,
                  List.of(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(40))));
      elapsedNanos = System.nanoTime() - started;
    } finally {
      sessionLogger.detachAppender(appender);
    }

    Pattern delay = Pattern.compile("delay=(\\d+)ms");
    List<Long> waited =
        appender.list.stream()
            .map(ILoggingEvent::getFormattedMessage)
            .filter(message -> message.startsWith("Session retry"))
            .map(delay::matcher)
            .filter(Matcher::find)
            .map(matcher -> Long.parseLong(matcher.group(1)))
            .toList();
    assertThat(waited).containsExactly(10L, 20L, 40L);
    assertThat(Duration.ofNanos(elapsedNanos)).isGreaterThanOrEqualTo(Duration.ofMillis(70));
    assertThat(outcome.skylink()).isEqualTo(InMemoryTusProtocol.skylinkFor(data));
  }

  @Test
  void upload_shouldResetRetryBudgetAfterProgress() {
    byte[] data = randomBytes(400);
    // Every odd write fails after storing half the chunk; one retry is enough each time.
    portal.failWritesWhere(n -> n % 2 == 1, 503, true);

    UploadOutcome outcome = upload(data, options(1, null, zeroDelays(1)));

    assertThat(outcome.skylink()).isEqualTo(InMemoryTusProtocol.skylinkFor(data));
  }

  @Test
  void upload_shouldFailWhenRetriesAreExhausted() {
    byte[] data = randomBytes(400);
    portal.failWritesWhere(n -> true, 503, false);

    assertThatThrownBy(() -> upload(data, options(2, null, zeroDelays(2))))
        .isInstanceOf(UploadFailedException.class)
        .hasCauseInstanceOf(TransportException.class)
        .hasMessageContaining("Injected failure");
    assertThat(portal.concatenations()).isZero();
  }

  @Test
  void upload_shouldNotRetryClientErrors() {
    byte[] data = randomBytes(400);
    portal.failWritesWhere(n -> true, 400, false);

    assertThatThrownBy(() -> upload(data, options(1, null, zeroDelays(5))))
        .isInstanceOfSatisfying(
            UploadFailedException.class,
            e -> {
              assertThat(e.getPartIndex()).isZero();
              assertThat(((TransportException) e.getCause()).getStatusCode()).isEqualTo(400);
            });
    assertThat(portal.writes()).isEqualTo(1);
  }

  @Test
  void upload_shouldRejectZeroMultiplierBeforeAnyRequest() {
    UploadOptions options = new UploadOptions(1, CHUNK, 0, 2, null, List.of(), false, null);

    assertThatThrownBy(() -> upload(randomBytes(400), options))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("chunkSizeMultiplier");
    assertThat(portal.interactions()).isZero();
  }

  @Test
  void upload_shouldRejectZeroParallelismBeforeAnyRequest() {
    UploadOptions options = new UploadOptions(1, CHUNK, 1, 0, null, List.of(), false, null);

    assertThatThrownBy(() -> upload(randomBytes(400), options))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("numParallelUploads");
    assertThat(portal.interactions()).isZero();
  }

  @Test
  void upload_shouldRejectPartitionThatCannotSplitBeforeAnyRequest() {
    // Two base chunks but only one effective chunk once multiplied.
    UploadOptions options = new UploadOptions(1, CHUNK, 2, 2, null, List.of(), false, null);

    assertThatThrownBy(() -> upload(randomBytes(150), options))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(portal.interactions()).isZero();
  }

  @Test
  void upload_shouldRejectStreamSourceForParallelSessions() {
    byte[] data = randomBytes(400);

    assertThatThrownBy(
            () ->
                coordinator.upload(
                    UploadSource.ofStream(new ByteArrayInputStream(data), data.length),
                    "data.bin",
                    options(2, null, List.of()),
                    CancellationToken.create(),
                    UploadProgressListener.NONE))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(portal.interactions()).isZero();
  }

  @Test
  void upload_shouldAcceptStreamSourceForSingleSession() {
    byte[] data = randomBytes(400);

    UploadOutcome outcome =
        coordinator.upload(
            UploadSource.ofStream(new ByteArrayInputStream(data), data.length),
            "data.bin",
            options(1, null, zeroDelays(1)),
            CancellationToken.create(),
            UploadProgressListener.NONE);

    assertThat(outcome.skylink()).isEqualTo(InMemoryTusProtocol.skylinkFor(data));
  }

  @Test
  void upload_shouldFailWhenPortalReturnsNoSkylink() {
    portal.omitSkylink();

    assertThatThrownBy(() -> upload(randomBytes(400), options(2, null, List.of())))
        .isInstanceOf(UploadIncompleteException.class);
  }

  @Test
  void upload_shouldStopWhenCancelled() {
    byte[] data = randomBytes(2000);
    CancellationToken token = CancellationToken.create();

    assertThatThrownBy(
            () ->
                coordinator.upload(
                    UploadSource.ofBytes(data),
                    "data.bin",
                    options(2, null, List.of()),
                    token,
                    (uploaded, total) -> token.cancel()))
        .isInstanceOf(UploadCancelledException.class);
    assertThat(portal.concatenations()).isZero();
  }

  @Test
  void upload_shouldUnlinkSessionTokenFromCallerToken() {
    CancellationToken token = CancellationToken.create();

    coordinator.upload(
        UploadSource.ofBytes(randomBytes(400)),
        "data.bin",
        options(2, null, List.of()),
        token,
        UploadProgressListener.NONE);
    portal.failWritesWhere(n -> true, 400, false);
    assertThatThrownBy(
            () ->
                coordinator.upload(
                    UploadSource.ofBytes(randomBytes(400)),
                    "data.bin",
                    options(2, null, List.of()),
                    token,
                    UploadProgressListener.NONE))
        .isInstanceOf(UploadFailedException.class);

    assertThat(token.callbackCount()).isZero();
    assertThat(token.isCancelled()).isFalse();
  }

  @Test
  void effectiveParallelism_shouldUseBaseChunkCount() {
    UploadOptions options = options(4, null, List.of());

    assertThat(ParallelUploadCoordinator.effectiveParallelism(0, options)).isEqualTo(1);
    assertThat(ParallelUploadCoordinator.effectiveParallelism(100, options)).isEqualTo(1);
    assertThat(ParallelUploadCoordinator.effectiveParallelism(101, options)).isEqualTo(2);
    assertThat(ParallelUploadCoordinator.effectiveParallelism(10_000, options)).isEqualTo(4);
  }

  private UploadOutcome upload(byte[] data, UploadOptions options) {
    return coordinator.upload(
        UploadSource.ofBytes(data),
        "data.bin",
        options,
        CancellationToken.create(),
        UploadProgressListener.NONE);
  }

  private static UploadOptions options(
      int parallelUploads, Integer staggerPercent, List<Duration> retryDelays) {
    return new UploadOptions(
        1, CHUNK, 1, parallelUploads, staggerPercent, retryDelays, false, null);
  }

  private static List<Duration> zeroDelays(int count) {
    return Collections.nCopies(count, Duration.ZERO);
  }

  private static byte[] randomBytes(int size) {
    byte[] data = new byte[size];
    new Random(size).nextBytes(data);
    return data;
  }
}
