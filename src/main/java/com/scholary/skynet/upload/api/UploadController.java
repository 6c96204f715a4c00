package com.scholary.skynet.upload.api;

import com.scholary.skynet.upload.api.JobStatusResponse.Status;
import com.scholary.skynet.upload.job.UploadJob;
import com.scholary.skynet.upload.job.UploadJobRepository;
import com.scholary.skynet.upload.job.UploadJobService;
import com.scholary.skynet.upload.skylink.RawSkylink;
import com.scholary.skynet.upload.skylink.SkylinkCodec;
import com.scholary.skynet.upload.upload.CancellationToken;
import com.scholary.skynet.upload.upload.SkynetClient;
import com.scholary.skynet.upload.upload.UploadOptionsOverride;
import com.scholary.skynet.upload.upload.UploadOutcome;
import com.scholary.skynet.upload.upload.UploadProgressListener;
import com.scholary.skynet.upload.upload.UploadSource;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for uploading to the portal.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Synchronous upload (blocks until the skylink is known)
 *   <li>Asynchronous upload (returns job ID immediately)
 *   <li>Job status polling and cancellation
 *   <li>Skylink validation and normalization
 * </ul>
 *
 * <p>Uploaded parts are spooled to a temp file first so large uploads can be read by range.
 */
@RestController
@Tag(name = "Upload", description = "Chunked, parallel uploads to a Skynet portal")
public class UploadController {

  private static final Logger LOGGER = LoggerFactory.getLogger(UploadController.class);

  private final SkynetClient skynetClient;
  private final UploadJobRepository jobRepository;
  private final UploadJobService jobService;

  public UploadController(
      SkynetClient skynetClient, UploadJobRepository jobRepository, UploadJobService jobService) {
    this.skynetClient = skynetClient;
    this.jobRepository = jobRepository;
    this.jobService = jobService;
  }

  @PostMapping(value = "/v1/skyfile", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Upload a file",
      description = "Upload a file and wait for its skylink")
  public ResponseEntity<UploadResponse> uploadSkyfile(
      @RequestParam("file") MultipartFile file,
      @RequestParam(required = false) String filename,
      @RequestParam(required = false) Boolean dryRun,
      @RequestParam(required = false) Integer numParallelUploads,
      @RequestParam(required = false) Integer chunkSizeMultiplier,
      @RequestParam(required = false) Integer staggerPercent)
      throws IOException {

    UploadOptionsOverride overrides =
        overrides(filename, dryRun, numParallelUploads, chunkSizeMultiplier, staggerPercent);
    LOGGER.info(
        "Upload request: file={}, size={} bytes", file.getOriginalFilename(), file.getSize());

    Path tempFile = spool(file);
    try {
      UploadOutcome outcome =
          skynetClient.upload(
              UploadSource.ofPath(tempFile),
              originalName(file),
              overrides,
              CancellationToken.create(),
              UploadProgressListener.NONE);
      return ResponseEntity.ok(UploadResponse.from(outcome));
    } finally {
      Files.deleteIfExists(tempFile);
    }
  }

  @PostMapping(value = "/v1/uploads", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Start upload",
      description = "Start an asynchronous upload and return job ID for status polling")
  public ResponseEntity<AsyncJobResponse> startUpload(
      @RequestParam("file") MultipartFile file,
      @RequestParam(required = false) String filename,
      @RequestParam(required = false) Boolean dryRun,
      @RequestParam(required = false) Integer numParallelUploads,
      @RequestParam(required = false) Integer chunkSizeMultiplier,
      @RequestParam(required = false) Integer staggerPercent)
      throws IOException {

    UploadOptionsOverride overrides =
        overrides(filename, dryRun, numParallelUploads, chunkSizeMultiplier, staggerPercent);

    String jobId = UUID.randomUUID().toString();
    Path tempFile = spool(file);
    UploadJob job = new UploadJob(jobId, originalName(file), file.getSize());
    jobRepository.save(job);
    LOGGER.info("Created async upload job: {}", jobId);

    try {
      jobService.process(job, tempFile, overrides);
    } catch (RuntimeException e) {
      Files.deleteIfExists(tempFile);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
      jobRepository.save(job);
      LOGGER.error("Could not hand off async upload job {}: {}", jobId, e.getMessage());
      throw e;
    }

    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId));
  }

  /**
   * Get job status.
   *
   * <p>Returns the current state of an async job. If the job is completed, includes the skylink.
   */
  @GetMapping("/v1/uploads/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an async upload")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(job -> ResponseEntity.ok(toStatusResponse(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  /**
   * Cancel a job.
   *
   * <p>Cancellation is cooperative: the job moves to CANCELLED once its sessions have stopped.
   * Jobs that already finished are returned unchanged.
   */
  @DeleteMapping("/v1/uploads/{id}")
  @Operation(summary = "Cancel job", description = "Cancel a running async upload")
  public ResponseEntity<JobStatusResponse> cancelJob(@PathVariable String id) {
    jobRepository
        .findActive(id)
        .ifPresent(
            job -> {
              LOGGER.info("Cancelling async upload job: {}", id);
              job.getCancellation().cancel();
            });
    return jobRepository
        .findById(id)
        .map(job -> ResponseEntity.accepted().body(toStatusResponse(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  @GetMapping("/v1/skylinks/{skylink}")
  @Operation(
      summary = "Normalize skylink",
      description = "Validate a skylink and return its bare and sia:// forms")
  public ResponseEntity<SkylinkResponse> normalizeSkylink(@PathVariable String skylink) {
    String bare = SkylinkCodec.format(skylink);
    RawSkylink raw = SkylinkCodec.decode(bare);
    return ResponseEntity.ok(new SkylinkResponse(bare, SkylinkCodec.toUri(bare), raw.bitfield()));
  }

  private static JobStatusResponse toStatusResponse(UploadJob job) {
    return new JobStatusResponse(
        job.getJobId(), job.getStatus(), job.getProgress(), job.getResult(), job.getError());
  }

  private static UploadOptionsOverride overrides(
      String filename,
      Boolean dryRun,
      Integer numParallelUploads,
      Integer chunkSizeMultiplier,
      Integer staggerPercent) {
    return UploadOptionsOverride.builder()
        .customFilename(filename)
        .dryRun(dryRun)
        .numParallelUploads(numParallelUploads)
        .chunkSizeMultiplier(chunkSizeMultiplier)
        .staggerPercent(staggerPercent)
        .build();
  }

  private static String originalName(MultipartFile file) {
    String name = file.getOriginalFilename();
    return name == null || name.isBlank() ? "file" : name;
  }

  private static Path spool(MultipartFile file) throws IOException {
    Path tempFile = Files.createTempFile("skynet-upload-", ".part");
    try {
      file.transferTo(tempFile);
    } catch (IOException | RuntimeException e) {
      Files.deleteIfExists(tempFile);
      throw e;
    }
    return tempFile;
  }
}
