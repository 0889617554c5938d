package com.scholary.dialect.transcriber.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dialect.transcriber.speech.SerializedSpeechModel;
import com.scholary.dialect.transcriber.speech.SpeechModel;
import com.scholary.dialect.transcriber.speech.SpeechModelClient;
import com.scholary.dialect.transcriber.speech.SpeechModelProperties;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the speech model.
 *
 * <p>One HTTP client is shared by every pipeline run, wrapped so decodes never overlap.
 */
@Configuration
@EnableConfigurationProperties(SpeechModelProperties.class)
public class SpeechModelConfig {

  @Bean
  public SpeechModel speechModel(SpeechModelProperties properties, ObjectMapper objectMapper) {
    return new SerializedSpeechModel(
        new SpeechModelClient(properties, objectMapper),
        Duration.ofSeconds(properties.queueTimeout()));
  }
}
