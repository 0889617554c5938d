package com.scholary.dialect.transcriber.correction;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the text-correction model ("corrector.*").
 *
 * <p>{@code apiKey} is optional; when present it is sent as a bearer token. Timeouts are in
 * seconds.
 */
@ConfigurationProperties(prefix = "corrector")
@Validated
public record CorrectorProperties(
    @NotBlank String host,
    @NotBlank String model,
    String apiKey,
    @Positive int connectTimeout,
    @Positive int requestTimeout,
    @NotBlank String dialect,
    @NotEmpty List<String> colloquialExamples) {}
