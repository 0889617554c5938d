package com.scholary.dialect.transcriber.audio;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg decoding ("ffmpeg.*").
 *
 * <p>When disabled, only the containers the JDK reads natively (WAV, AIFF, AU) are accepted.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    boolean enabled, @NotBlank String binary, @Positive int timeoutSeconds) {}
