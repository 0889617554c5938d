package com.scholary.dialect.transcriber.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dialect.transcriber.correction.CorrectionResponseParser;
import com.scholary.dialect.transcriber.correction.CorrectionService;
import com.scholary.dialect.transcriber.correction.Corrector;
import com.scholary.dialect.transcriber.correction.CorrectorProperties;
import com.scholary.dialect.transcriber.correction.OllamaCorrector;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for text correction.
 *
 * <p>Corrector calls run on their own small pool so that {@link CorrectionService} can give up on
 * a call once its timeout expires.
 */
@Configuration
@EnableConfigurationProperties(CorrectorProperties.class)
public class CorrectorConfig {

  @Bean
  public Corrector corrector(CorrectorProperties properties, ObjectMapper objectMapper) {
    return new OllamaCorrector(properties, objectMapper);
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService correctionExecutor(TranscriptionProperties properties) {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newFixedThreadPool(
        properties.correctionThreads(),
        runnable -> {
          Thread thread = new Thread(runnable, "correction-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
  }

  @Bean
  public CorrectionService correctionService(
      Corrector corrector,
      ObjectMapper objectMapper,
      ExecutorService correctionExecutor,
      PipelineProperties pipelineProperties) {
    return new CorrectionService(
        corrector,
        new CorrectionResponseParser(objectMapper),
        correctionExecutor,
        Duration.ofSeconds(pipelineProperties.correctionTimeoutSeconds()),
        pipelineProperties.confirmationOverrideThreshold());
  }
}
