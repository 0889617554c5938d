package com.scholary.dialect.transcriber.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Resource limits for asynchronous transcription jobs ("transcription.*").
 *
 * <p>{@code correctionThreads} sizes the pool that runs bounded corrector calls.
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public record TranscriptionProperties(
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize,
    @Positive int correctionThreads) {}
