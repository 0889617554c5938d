package com.scholary.dialect.transcriber.job;

import com.scholary.dialect.transcriber.api.JobStatusResponse.Status;
import com.scholary.dialect.transcriber.api.TranscriptionRequest;
import com.scholary.dialect.transcriber.audio.AudioSource;
import com.scholary.dialect.transcriber.config.PipelineConfig;
import com.scholary.dialect.transcriber.logging.StructuredLogger;
import com.scholary.dialect.transcriber.service.PipelineOrchestrator;
import com.scholary.dialect.transcriber.transcript.PipelineOutput;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs transcription requests as background jobs.
 *
 * <p>Jobs run on the bounded "transcription-" pool. Settings and the audio source are validated
 * before the job is queued, so a bad request fails fast instead of producing a failed job.
 */
@Service
public class TranscriptionJobService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionJobService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final PipelineOrchestrator orchestrator;
  private final JobRepository jobRepository;
  private final PipelineConfig defaultPipelineConfig;
  private final Executor taskExecutor;

  public TranscriptionJobService(
      PipelineOrchestrator orchestrator,
      JobRepository jobRepository,
      PipelineConfig defaultPipelineConfig,
      @Qualifier("taskExecutor") Executor taskExecutor) {
    this.orchestrator = orchestrator;
    this.jobRepository = jobRepository;
    this.defaultPipelineConfig = defaultPipelineConfig;
    this.taskExecutor = taskExecutor;
  }

  /**
   * Queue a job.
   *
   * @throws com.scholary.dialect.transcriber.config.ConfigurationException if the overrides are
   *     invalid
   * @throws IllegalArgumentException if the request has no usable audio source
   */
  public TranscriptionJob submit(TranscriptionRequest request) {
    AudioSource source = request.toAudioSource();
    PipelineConfig config = request.applyTo(defaultPipelineConfig);

    TranscriptionJob job = new TranscriptionJob(UUID.randomUUID().toString(), source.describe());
    jobRepository.save(job);
    LOGGER.info("Created async transcription job: {} for {}", job.getJobId(), source.describe());

    try {
      taskExecutor.execute(() -> run(job, source, config));
    } catch (RuntimeException e) {
      jobRepository.delete(job.getJobId());
      throw e;
    }
    return job;
  }

  public Optional<TranscriptionJob> find(String jobId) {
    return jobRepository.findById(jobId);
  }

  /**
   * Request cancellation. The job stops after the chunk in flight and keeps its partial result.
   *
   * @return the job, empty if unknown
   */
  public Optional<TranscriptionJob> cancel(String jobId) {
    Optional<TranscriptionJob> job = jobRepository.findById(jobId);
    job.ifPresent(
        j -> {
          if (!j.isFinished()) {
            LOGGER.info("Cancelling job: {}", jobId);
            j.getCancellationToken().cancel();
          }
        });
    return job;
  }

  void run(TranscriptionJob job, AudioSource source, PipelineConfig config) {
    StructuredLogger.setJobContext(job.getJobId(), source.describe());
    try {
      if (job.getCancellationToken().isCancelled()) {
        job.setStatus(Status.CANCELLED);
        return;
      }
      job.setStatus(Status.PROCESSING);
      jobRepository.save(job);
      structuredLogger.logJobProgress(job.getJobId(), 0, "started");

      PipelineOutput output =
          orchestrator.processAudio(
              source,
              config,
              job.getCancellationToken(),
              (processed, total) -> {
                job.updateProgress(processed, total);
                structuredLogger.logJobProgress(job.getJobId(), processed, "transcribing");
              });

      job.setResult(output);
      job.setStatus(output.metadata().cancelled() ? Status.CANCELLED : Status.COMPLETED);
      structuredLogger.logJobProgress(
          job.getJobId(), output.metadata().chunkCount(), job.getStatus().name().toLowerCase());

    } catch (RuntimeException e) {
      LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
    } finally {
      jobRepository.save(job);
      StructuredLogger.clearJobContext();
    }
  }
}
