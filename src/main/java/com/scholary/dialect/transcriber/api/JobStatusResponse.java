package com.scholary.dialect.transcriber.api;

import com.scholary.dialect.transcriber.transcript.PipelineOutput;
import java.time.Instant;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async job and includes the result once it has one. A
 * cancelled job carries the partial transcript assembled before it stopped.
 *
 * @param source where the audio came from, as a path or {@code s3://bucket/key}
 */
public record JobStatusResponse(
    String jobId,
    String source,
    Instant createdAt,
    Status status,
    Integer progress,
    int chunksProcessed,
    int totalChunks,
    PipelineOutput result,
    String error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    CANCELLED,
    FAILED
  }
}
