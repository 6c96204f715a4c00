package com.scholary.skynet.upload.upload;

import com.scholary.skynet.upload.chunking.ByteRange;
import com.scholary.skynet.upload.logging.StructuredLogger;
import com.scholary.skynet.upload.transport.ResumableTransferProtocol;
import com.scholary.skynet.upload.transport.TransportException;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uploads one part of a large upload as a resumable session.
 *
 * <p>The session reads its range one chunk at a time into a buffer and pushes the chunk at the
 * session's current offset. When a request fails with a retryable {@link TransportException} it
 * waits for the next entry of the retry delays, re-reads the offset from the portal and resends
 * from there out of the buffer, so even a one-pass stream can resume. The retry budget starts over
 * once the session gets further than it was at its last retry.
 *
 * <p>The stagger gate opens once the first chunk is {@code staggerPercent} percent sent, or when
 * the session ends either way, so the coordinator never waits on a dead session.
 */
final class ResumableSession {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResumableSession.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final int partIndex;
  private final ByteRange range;
  private final boolean partial;
  private final Integer staggerPercent;
  private final UploadSource source;
  private final ResumableTransferProtocol protocol;
  private final Map<String, String> metadata;
  private final long chunkSize;
  private final List<Duration> retryDelays;
  private final CancellationToken cancellation;
  private final ProgressTracker progress;

  private final CompletableFuture<Void> staggerGate = new CompletableFuture<>();

  ResumableSession(
      int partIndex,
      ByteRange range,
      boolean partial,
      Integer staggerPercent,
      UploadSource source,
      ResumableTransferProtocol protocol,
      Map<String, String> metadata,
      long chunkSize,
      List<Duration> retryDelays,
      CancellationToken cancellation,
      ProgressTracker progress) {
    this.partIndex = partIndex;
    this.range = range;
    this.partial = partial;
    this.staggerPercent = staggerPercent;
    this.source = source;
    this.protocol = protocol;
    this.metadata = metadata;
    this.chunkSize = chunkSize;
    this.retryDelays = retryDelays;
    this.cancellation = cancellation;
    this.progress = progress;
  }

  int partIndex() {
    return partIndex;
  }

  CompletableFuture<Void> staggerGate() {
    return staggerGate;
  }

  /**
   * Run the session to completion.
   *
   * @return the session's location
   * @throws TransportException once a failure is not retryable or the delays are used up
   * @throws UploadCancelledException if cancelled
   * @throws IOException if the source cannot be read
   */
  URI run() throws IOException {
    long length = range.length();
    long startMs = System.currentTimeMillis();
    structuredLogger.logSessionStarted(partIndex, range.start(), range.end(), partial);

    if (staggerPercent != null && staggerPercent == 0) {
      staggerGate.complete(null);
    }

    try (InputStream in = source.openRange(range.start(), range.end())) {
      byte[] buffer = new byte[(int) Math.min(chunkSize, length)];
      long bufferStart = 0;
      int buffered = 0;

      URI location = null;
      long offset = 0;
      long offsetBeforeRetry = 0;
      int attempt = 0;
      boolean resuming = false;

      while (true) {
        cancellation.throwIfCancelled();
        try {
          if (location == null) {
            location = protocol.createUpload(length, metadata, partial);
          } else if (resuming) {
            offset = protocol.getOffset(location);
            if (offset < bufferStart || offset > bufferStart + buffered) {
              throw new SkynetException(
                  String.format(
                      "Portal reported offset %d for part %d, outside the buffered chunk [%d, %d)",
                      offset, partIndex, bufferStart, bufferStart + buffered));
            }
            LOGGER.info("Resuming part {} at offset {}", partIndex, offset);
          }
          resuming = false;

          while (offset < length) {
            cancellation.throwIfCancelled();

            if (offset == bufferStart + buffered) {
              bufferStart = offset;
              int wanted = (int) Math.min(chunkSize, length - offset);
              buffered = in.readNBytes(buffer, 0, wanted);
              if (buffered < wanted) {
                throw new EOFException(
                    String.format(
                        "Source ended %d bytes early in part %d", wanted - buffered, partIndex));
              }
            }

            long chunkOffset = offset;
            int skip = (int) (offset - bufferStart);
            boolean firstChunk = bufferStart == 0;
            int firstChunkLength = buffered;
            long sendStart = System.currentTimeMillis();

            long newOffset =
                protocol.writeChunk(
                    location,
                    offset,
                    buffer,
                    skip,
                    buffered - skip,
                    sent -> {
                      progress.update(partIndex, chunkOffset + sent);
                      if (firstChunk) {
                        openGateIfDue(chunkOffset + sent, firstChunkLength);
                      }
                    });

            if (newOffset <= offset || newOffset > bufferStart + buffered) {
              throw new SkynetException(
                  String.format(
                      "Portal moved part %d from offset %d to %d, expected at most %d",
                      partIndex, offset, newOffset, bufferStart + buffered));
            }
            offset = newOffset;
            progress.update(partIndex, offset);
            structuredLogger.logChunkSent(
                partIndex, chunkOffset, offset, System.currentTimeMillis() - sendStart);
          }

          structuredLogger.logSessionFinished(
              partIndex, length, System.currentTimeMillis() - startMs);
          return location;

        } catch (TransportException e) {
          if (offset > offsetBeforeRetry) {
            attempt = 0;
          }
          if (!e.isRetryable() || attempt >= retryDelays.size()) {
            structuredLogger.logSessionFailed(partIndex, e.getStatusCode(), e.getMessage());
            throw e;
          }

          Duration delay = retryDelays.get(attempt++);
          offsetBeforeRetry = offset;
          structuredLogger.logSessionRetry(
              partIndex,
              attempt,
              retryDelays.size(),
              delay.toMillis(),
              e.getStatusCode(),
              e.getMessage());

          cancellation.sleep(delay);
          resuming = location != null;
        }
      }
    } finally {
      staggerGate.complete(null);
    }
  }

  private void openGateIfDue(long sent, int firstChunkLength) {
    if (staggerPercent != null
        && !staggerGate.isDone()
        && sent * 100 >= (long) staggerPercent * firstChunkLength) {
      staggerGate.complete(null);
    }
  }
}
