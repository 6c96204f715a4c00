package com.scholary.skynet.upload.upload;

import com.scholary.skynet.upload.logging.StructuredLogger;
import com.scholary.skynet.upload.strategy.UploadStrategy;
import com.scholary.skynet.upload.strategy.UploadStrategySelector;
import com.scholary.skynet.upload.transport.PortalHttpClient;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SkynetClient} backed by a portal.
 *
 * <p>Small payloads go through {@link PortalHttpClient} in one request; anything at or above the
 * large-file threshold goes to the {@link ParallelUploadCoordinator}.
 */
public class PortalSkynetClient implements SkynetClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(PortalSkynetClient.class);

  private final PortalHttpClient portalHttpClient;
  private final ParallelUploadCoordinator coordinator;
  private final UploadStrategySelector strategySelector;
  private final UploadOptions builtInDefaults;
  private final UploadOptionsOverride clientOptions;

  public PortalSkynetClient(
      PortalHttpClient portalHttpClient,
      ParallelUploadCoordinator coordinator,
      UploadStrategySelector strategySelector,
      UploadOptions builtInDefaults,
      UploadOptionsOverride clientOptions) {
    this.portalHttpClient = portalHttpClient;
    this.coordinator = coordinator;
    this.strategySelector = strategySelector;
    this.builtInDefaults = builtInDefaults;
    this.clientOptions = clientOptions;

    // Fail at construction, not on the first upload.
    UploadOptions.merge(builtInDefaults, clientOptions, UploadOptionsOverride.NONE).validate();
  }

  @Override
  public UploadOutcome uploadData(byte[] data, String filename, UploadOptionsOverride overrides) {
    return upload(
        UploadSource.ofBytes(data),
        filename,
        overrides,
        CancellationToken.create(),
        UploadProgressListener.NONE);
  }

  @Override
  public UploadOutcome uploadFile(Path path, UploadOptionsOverride overrides) throws IOException {
    return upload(
        UploadSource.ofPath(path),
        path.getFileName().toString(),
        overrides,
        CancellationToken.create(),
        UploadProgressListener.NONE);
  }

  @Override
  public UploadOutcome upload(
      UploadSource source,
      String filename,
      UploadOptionsOverride overrides,
      CancellationToken cancellation,
      UploadProgressListener listener) {
    UploadOptions options = UploadOptions.merge(builtInDefaults, clientOptions, overrides);
    options.validate();

    String name =
        options.customFilename() != null && !options.customFilename().isBlank()
            ? options.customFilename()
            : filename;

    StructuredLogger.setUploadContext(UUID.randomUUID().toString(), name);
    try {
      UploadStrategy strategy = strategySelector.select(source.size(), options.largeFileSize());
      LOGGER.info(
          "Uploading {}: size={} bytes, strategy={}, dryRun={}",
          name,
          source.size(),
          strategy,
          options.dryRun());

      if (strategy == UploadStrategy.SMALL_FILE) {
        return uploadSmall(source, name, options, cancellation, listener);
      }
      return coordinator.upload(source, name, options, cancellation, listener);
    } finally {
      StructuredLogger.clearUploadContext();
    }
  }

  private UploadOutcome uploadSmall(
      UploadSource source,
      String filename,
      UploadOptions options,
      CancellationToken cancellation,
      UploadProgressListener listener) {
    cancellation.throwIfCancelled();

    byte[] data;
    try (InputStream in = source.openRange(0, source.size())) {
      data = in.readAllBytes();
    } catch (IOException e) {
      throw new UploadFailedException(0, "Failed to read upload source: " + e.getMessage(), e);
    }

    listener.onProgress(0, data.length);
    String returned = portalHttpClient.uploadSmallFile(data, filename, options.dryRun());
    listener.onProgress(data.length, data.length);

    return UploadOutcome.fromPortalSkylink(returned);
  }
}
