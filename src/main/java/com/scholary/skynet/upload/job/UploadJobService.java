package com.scholary.skynet.upload.job;

import com.scholary.skynet.upload.api.JobStatusResponse.Status;
import com.scholary.skynet.upload.api.UploadResponse;
import com.scholary.skynet.upload.logging.StructuredLogger;
import com.scholary.skynet.upload.upload.SkynetClient;
import com.scholary.skynet.upload.upload.UploadCancelledException;
import com.scholary.skynet.upload.upload.UploadOptionsOverride;
import com.scholary.skynet.upload.upload.UploadOutcome;
import com.scholary.skynet.upload.upload.UploadProgressListener;
import com.scholary.skynet.upload.upload.UploadSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs upload jobs in the background.
 *
 * <p>The job status is updated as processing progresses. The spooled temp file belongs to the job
 * and is deleted when it ends, whatever the outcome.
 */
@Service
public class UploadJobService {

  private static final Logger LOGGER = LoggerFactory.getLogger(UploadJobService.class);

  private final SkynetClient skynetClient;
  private final UploadJobRepository jobRepository;
  private final StructuredLogger structuredLogger;

  public UploadJobService(SkynetClient skynetClient, UploadJobRepository jobRepository) {
    this.skynetClient = skynetClient;
    this.jobRepository = jobRepository;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  @Async("taskExecutor")
  public void process(UploadJob job, Path tempFile, UploadOptionsOverride overrides) {
    StructuredLogger.setJobContext(job.getJobId());
    LOGGER.info("Starting async upload for job: {}", job.getJobId());

    try {
      if (job.getCancellation().isCancelled()) {
        throw new UploadCancelledException("Upload was cancelled before it started");
      }
      job.setStatus(Status.PROCESSING);
      jobRepository.save(job);

      UploadOutcome outcome =
          skynetClient.upload(
              UploadSource.ofPath(tempFile),
              job.getFilename(),
              overrides,
              job.getCancellation(),
              progressListener(job));

      job.setResult(UploadResponse.from(outcome));
      job.setProgress(100);
      job.setStatus(Status.COMPLETED);
      jobRepository.save(job);

      LOGGER.info("Completed async upload for job: {} -> {}", job.getJobId(), outcome.skylink());

    } catch (UploadCancelledException e) {
      LOGGER.info("Async upload cancelled for job: {}", job.getJobId());
      job.setStatus(Status.CANCELLED);
      job.setError(e.getMessage());
      jobRepository.save(job);
    } catch (IOException | RuntimeException e) {
      LOGGER.error("Async upload failed for job: {}", job.getJobId(), e);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
      jobRepository.save(job);
    } finally {
      deleteQuietly(tempFile);
      StructuredLogger.clearJobContext();
    }
  }

  private UploadProgressListener progressListener(UploadJob job) {
    AtomicInteger lastPercent = new AtomicInteger(-1);
    return (uploaded, total) -> {
      int percent = total == 0 ? 100 : (int) (uploaded * 100 / total);
      // Sessions report concurrently; only log each percentage once.
      int previous = lastPercent.getAndAccumulate(percent, Math::max);
      if (percent > previous) {
        job.setProgress(percent);
        structuredLogger.logUploadProgress(job.getJobId(), uploaded, total, percent);
      }
    };
  }

  private static void deleteQuietly(Path tempFile) {
    try {
      Files.deleteIfExists(tempFile);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temp file {}: {}", tempFile, e.getMessage());
    }
  }
}
