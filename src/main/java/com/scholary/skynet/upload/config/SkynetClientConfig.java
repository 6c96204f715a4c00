package com.scholary.skynet.upload.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.skynet.upload.strategy.UploadStrategySelector;
import com.scholary.skynet.upload.transport.PortalHttpClient;
import com.scholary.skynet.upload.transport.ResumableTransferProtocol;
import com.scholary.skynet.upload.transport.TusHttpProtocol;
import com.scholary.skynet.upload.upload.ParallelUploadCoordinator;
import com.scholary.skynet.upload.upload.PortalSkynetClient;
import com.scholary.skynet.upload.upload.SkynetClient;
import com.scholary.skynet.upload.upload.UploadOptions;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the portal client.
 *
 * <p>Wires the HTTP adapters from {@link SkynetProperties} and builds the one {@link SkynetClient}
 * the application uses, with the {@code skynet.upload} block as its client-level options.
 */
@Configuration
@EnableConfigurationProperties(SkynetProperties.class)
public class SkynetClientConfig {

  @Bean
  public PortalHttpClient portalHttpClient(
      SkynetProperties properties, ObjectMapper objectMapper) {
    return new PortalHttpClient(properties, objectMapper);
  }

  @Bean
  public ResumableTransferProtocol resumableTransferProtocol(SkynetProperties properties) {
    return new TusHttpProtocol(properties);
  }

  @Bean
  public SkynetClient skynetClient(
      PortalHttpClient portalHttpClient,
      ParallelUploadCoordinator coordinator,
      UploadStrategySelector strategySelector,
      SkynetProperties properties) {
    return new PortalSkynetClient(
        portalHttpClient,
        coordinator,
        strategySelector,
        UploadOptions.DEFAULTS,
        properties.uploadOverride());
  }
}
