package com.scholary.dialect.transcriber.speech;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the speech inference service ("speech-model.*").
 *
 * <p>Timeouts are in seconds. {@code queueTimeout} bounds how long a run waits for its turn on
 * the shared model.
 */
@ConfigurationProperties(prefix = "speech-model")
@Validated
public record SpeechModelProperties(
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @Positive int queueTimeout) {}
