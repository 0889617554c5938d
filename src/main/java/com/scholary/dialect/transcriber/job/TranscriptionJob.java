package com.scholary.dialect.transcriber.job;

import com.scholary.dialect.transcriber.api.JobStatusResponse;
import com.scholary.dialect.transcriber.api.JobStatusResponse.Status;
import com.scholary.dialect.transcriber.service.CancellationToken;
import com.scholary.dialect.transcriber.transcript.PipelineOutput;
import java.time.Instant;

/**
 * Represents an async transcription job.
 *
 * <p>Tracks the job's state, progress, and result. Written by the worker thread and read by status
 * requests, so mutable fields are volatile.
 */
public class TranscriptionJob {

  private final String jobId;
  private final String source;
  private final Instant createdAt;
  private final CancellationToken cancellationToken = new CancellationToken();

  private volatile Status status;
  private volatile int chunksProcessed;
  private volatile int totalChunks;
  private volatile PipelineOutput result;
  private volatile String error;

  public TranscriptionJob(String jobId, String source) {
    this.jobId = jobId;
    this.source = source;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
  }

  public String getJobId() {
    return jobId;
  }

  public CancellationToken getCancellationToken() {
    return cancellationToken;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public void updateProgress(int chunksProcessed, int totalChunks) {
    this.chunksProcessed = chunksProcessed;
    this.totalChunks = totalChunks;
  }

  /** Percentage of chunks handled, 0-100. */
  public int getProgress() {
    if (status == Status.COMPLETED) {
      return 100;
    }
    return totalChunks == 0 ? 0 : (chunksProcessed * 100) / totalChunks;
  }

  public PipelineOutput getResult() {
    return result;
  }

  public void setResult(PipelineOutput result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }

  public boolean isFinished() {
    return status == Status.COMPLETED || status == Status.CANCELLED || status == Status.FAILED;
  }

  public JobStatusResponse toStatusResponse() {
    return new JobStatusResponse(
        jobId,
        source,
        createdAt,
        status,
        getProgress(),
        chunksProcessed,
        totalChunks,
        result,
        error);
  }
}
