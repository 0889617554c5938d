package com.scholary.dialect.transcriber.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for pipeline defaults.
 *
 * <p>Loads {@link PipelineProperties} and {@link TranscriptionProperties} from application.yml and
 * exposes the validated default {@link PipelineConfig}. Invalid defaults fail startup with a
 * {@link ConfigurationException}.
 */
@Configuration
@EnableConfigurationProperties({PipelineProperties.class, TranscriptionProperties.class})
public class TranscriptionConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionConfig.class);

  @Bean
  public PipelineConfig defaultPipelineConfig(PipelineProperties properties) {
    PipelineConfig config = properties.toPipelineConfig();
    LOGGER.info(
        "Pipeline defaults: chunk={}s, overlap={}s, admission={}, tiers=({}, {}), language={}, rate={}",
        config.chunkDurationSeconds(),
        config.overlapSeconds(),
        config.admissionConfidenceThreshold(),
        config.autoTierThreshold(),
        config.suggestTierThreshold(),
        config.targetLanguage(),
        config.sampleRate());
    return config;
  }
}
