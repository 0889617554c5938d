package com.scholary.dialect.transcriber.objectstore;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the recordings object store ("objectstore.*" in application.yml).
 *
 * <p>{@code pathStyleAccess} must be on for MinIO and other S3-compatible stores.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    String region,
    boolean pathStyleAccess) {}
