package com.scholary.skynet.upload.upload;

import com.scholary.skynet.upload.chunking.ByteRange;
import com.scholary.skynet.upload.chunking.ChunkPartitioner;
import com.scholary.skynet.upload.chunking.PartitionPlan;
import com.scholary.skynet.upload.transport.ContentTypes;
import com.scholary.skynet.upload.transport.ResumableTransferProtocol;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs one large upload as one or more concurrent resumable sessions and resolves its skylink.
 *
 * <p>Flow:
 *
 * <ol>
 *   <li>Validate options, before any I/O
 *   <li>Clamp parallelism to the number of base chunks so no part comes out empty
 *   <li>One part: a single plain session over the whole source
 *   <li>Several parts: partition into chunk-aligned ranges, start one partial session per part in
 *       order, staggered, then concatenate the partials
 *   <li>Probe the finished upload for the skylink the portal assigned
 * </ol>
 *
 * <p>Sessions share nothing mutable but the progress tracker. The first session to fail for good
 * cancels the rest and fails the whole upload; no skylink is ever returned unless every session
 * finished.
 */
@Service
public class ParallelUploadCoordinator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ParallelUploadCoordinator.class);

  private final ResumableTransferProtocol protocol;
  private final ChunkPartitioner partitioner;
  private final AsyncTaskExecutor uploadExecutor;

  public ParallelUploadCoordinator(
      ResumableTransferProtocol protocol,
      ChunkPartitioner partitioner,
      @Qualifier("uploadExecutor") AsyncTaskExecutor uploadExecutor) {
    this.protocol = protocol;
    this.partitioner = partitioner;
    this.uploadExecutor = uploadExecutor;
  }

  /**
   * Upload {@code source} through the resumable endpoint.
   *
   * @param source the bytes to upload; must support range reads when more than one session runs
   * @param filename the name stored in the upload metadata
   * @param options resolved options for this call
   * @param cancellation cancels every running session when cancelled
   * @param listener receives aggregated progress
   * @return the skylink of the finished upload
   * @throws IllegalArgumentException if the options are invalid, before any network call
   * @throws UploadFailedException if a session fails for good
   * @throws UploadIncompleteException if the portal returned no skylink
   * @throws UploadCancelledException if cancelled
   */
  public UploadOutcome upload(
      UploadSource source,
      String filename,
      UploadOptions options,
      CancellationToken cancellation,
      UploadProgressListener listener) {
    options.validate();

    long totalSize = source.size();
    int parallelism = effectiveParallelism(totalSize, options);
    if (parallelism > 1 && !source.supportsRangeReads()) {
      throw new IllegalArgumentException(
          "A source read by "
              + parallelism
              + " parallel sessions must support independent range reads");
    }

    LOGGER.info(
        "Starting large upload: filename={}, size={} bytes, parallelism={}, chunkSize={}, stagger={}",
        filename,
        totalSize,
        parallelism,
        options.effectiveChunkSize(),
        options.staggerPercent());

    Map<String, String> metadata = ContentTypes.uploadMetadata(filename);
    CancellationToken sessionToken = cancellation.child();

    URI location;
    try {
      if (parallelism == 1) {
        ProgressTracker tracker = new ProgressTracker(1, totalSize, listener);
        List<URI> single =
            runSessions(
                List.of(new ByteRange(0, totalSize)),
                false,
                null,
                source,
                metadata,
                options,
                sessionToken,
                tracker);
        location = single.get(0);
      } else {
        PartitionPlan plan =
            partitioner.partition(totalSize, parallelism, options.effectiveChunkSize());
        ProgressTracker tracker = new ProgressTracker(plan.partCount(), totalSize, listener);
        List<URI> partials =
            runSessions(
                plan.parts(),
                true,
                options.staggerPercent(),
                source,
                metadata,
                options,
                sessionToken,
                tracker);
        cancellation.throwIfCancelled();
        location = protocol.concatenate(partials, metadata);
      }
    } finally {
      sessionToken.detach();
    }

    if (location == null) {
      throw new UploadIncompleteException("Upload finished without a location");
    }

    String skylink =
        protocol
            .probeSkylink(location)
            .orElseThrow(
                () -> new UploadIncompleteException("Portal returned no skylink for " + location));

    UploadOutcome outcome = UploadOutcome.fromPortalSkylink(skylink);
    LOGGER.info("Large upload complete: filename={}, skylink={}", filename, outcome.skylink());
    return outcome;
  }

  /** {@code min(numParallelUploads, ceil(totalSize / baseChunkSize))}, and at least one. */
  static int effectiveParallelism(long totalSize, UploadOptions options) {
    long baseChunks = (totalSize + options.baseChunkSize() - 1) / options.baseChunkSize();
    return (int) Math.max(1, Math.min(options.numParallelUploads(), baseChunks));
  }

  private List<URI> runSessions(
      List<ByteRange> parts,
      boolean partial,
      Integer staggerPercent,
      UploadSource source,
      Map<String, String> metadata,
      UploadOptions options,
      CancellationToken sessionToken,
      ProgressTracker tracker) {

    List<CompletableFuture<URI>> results = new ArrayList<>(parts.size());
    List<Future<?>> tasks = new ArrayList<>(parts.size());
    CompletableFuture<Void> settled = new CompletableFuture<>();
    sessionToken.onCancel(
        () -> settled.completeExceptionally(new UploadCancelledException("Upload was cancelled")));

    Map<String, String> mdc = MDC.getCopyOfContextMap();

    try {
      for (int i = 0; i < parts.size() && !settled.isDone(); i++) {
        ResumableSession session =
            new ResumableSession(
                i,
                parts.get(i),
                partial,
                staggerPercent,
                source,
                protocol,
                metadata,
                options.effectiveChunkSize(),
                options.retryDelays(),
                sessionToken,
                tracker);

        CompletableFuture<URI> result = new CompletableFuture<>();
        result.whenComplete(
            (uri, failure) -> {
              if (failure != null) {
                settled.completeExceptionally(failure);
              }
            });
        results.add(result);
        tasks.add(uploadExecutor.submit(() -> runSession(session, result, mdc)));

        // Hold the next part back until this one is far enough into its first chunk.
        if (staggerPercent != null && i < parts.size() - 1) {
          await(CompletableFuture.anyOf(session.staggerGate(), settled));
        }
      }

      CompletableFuture.allOf(results.toArray(new CompletableFuture<?>[0]))
          .thenRun(() -> settled.complete(null));
      await(settled);

      return results.stream().map(CompletableFuture::join).collect(Collectors.toList());

    } catch (RuntimeException e) {
      sessionToken.cancel();
      tasks.forEach(task -> task.cancel(true));
      throw e;
    }
  }

  private void runSession(
      ResumableSession session, CompletableFuture<URI> result, Map<String, String> mdc) {
    if (mdc != null) {
      MDC.setContextMap(mdc);
    }
    int part = session.partIndex();
    try {
      result.complete(session.run());
    } catch (UploadCancelledException e) {
      result.completeExceptionally(e);
    } catch (IOException | SkynetException e) {
      result.completeExceptionally(
          new UploadFailedException(
              part, String.format("Upload part %d failed: %s", part, e.getMessage()), e));
    } catch (RuntimeException e) {
      result.completeExceptionally(e);
    } finally {
      MDC.clear();
    }
  }

  private static void await(CompletableFuture<?> future) {
    try {
      future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UploadCancelledException("Interrupted while waiting for upload sessions", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new SkynetException("Upload session failed", cause);
    }
  }
}
