package com.scholary.dialect.transcriber.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dialect.transcriber.audio.AudioSource;
import com.scholary.dialect.transcriber.chunking.ChunkBoundary;
import com.scholary.dialect.transcriber.config.PipelineConfig;
import com.scholary.dialect.transcriber.job.TranscriptionJob;
import com.scholary.dialect.transcriber.job.TranscriptionJobService;
import com.scholary.dialect.transcriber.service.CancellationToken;
import com.scholary.dialect.transcriber.service.PipelineOrchestrator;
import com.scholary.dialect.transcriber.transcript.PipelineOutput;
import com.scholary.dialect.transcriber.transcript.TranscriptionSegment;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * REST API for dialect transcription.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Synchronous transcription of a file or object
 *   <li>Streaming segments as NDJSON while chunks are processed
 *   <li>Asynchronous jobs with status polling and cancellation
 *   <li>Previewing chunk boundaries
 * </ul>
 */
@RestController
@Tag(name = "Transcription", description = "Chunked transcription and dialect correction API")
public class TranscriptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionController.class);

  static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

  private final PipelineOrchestrator orchestrator;
  private final TranscriptionJobService jobService;
  private final PipelineConfig defaultPipelineConfig;
  private final ObjectMapper objectMapper;

  public TranscriptionController(
      PipelineOrchestrator orchestrator,
      TranscriptionJobService jobService,
      PipelineConfig defaultPipelineConfig,
      ObjectMapper objectMapper) {
    this.orchestrator = orchestrator;
    this.jobService = jobService;
    this.defaultPipelineConfig = defaultPipelineConfig;
    this.objectMapper = objectMapper;
  }

  @PostMapping("/v1/transcribe")
  @Operation(
      summary = "Transcribe audio",
      description = "Transcribe and correct an audio file, returning the full transcript")
  public PipelineOutput transcribe(@Valid @RequestBody TranscriptionRequest request) {
    AudioSource source = request.toAudioSource();
    LOGGER.info("Transcription request: source={}", source.describe());
    return orchestrator.processAudio(source, request.applyTo(defaultPipelineConfig));
  }

  /**
   * Stream segments as newline-delimited JSON.
   *
   * <p>Audio is loaded and normalized before the response starts, so unreadable audio still gets
   * a proper error status. Once streaming has begun, failures can only cut the stream short.
   */
  @PostMapping(value = "/v1/transcribe/stream", produces = "application/x-ndjson")
  @Operation(
      summary = "Stream transcription",
      description = "Transcribe audio and emit one JSON segment per line as chunks complete")
  public ResponseEntity<StreamingResponseBody> transcribeStream(
      @Valid @RequestBody TranscriptionRequest request) {
    AudioSource source = request.toAudioSource();
    LOGGER.info("Streaming transcription request: source={}", source.describe());

    CancellationToken token = new CancellationToken();
    Stream<TranscriptionSegment> segments =
        orchestrator.streamAudio(source, request.applyTo(defaultPipelineConfig), token);

    StreamingResponseBody body =
        out -> {
          try (segments) {
            Iterator<TranscriptionSegment> iterator = segments.iterator();
            while (iterator.hasNext()) {
              out.write(objectMapper.writeValueAsBytes(iterator.next()));
              out.write("\n".getBytes(StandardCharsets.UTF_8));
              out.flush();
            }
          } catch (RuntimeException | IOException e) {
            token.cancel();
            LOGGER.warn("Segment stream for {} ended early: {}", source.describe(), e.getMessage());
            throw e;
          }
        };
    return ResponseEntity.ok().contentType(NDJSON).body(body);
  }

  @PostMapping("/v1/jobs")
  @Operation(
      summary = "Start transcription job",
      description = "Start asynchronous transcription and return a job ID for status polling")
  public ResponseEntity<AsyncJobResponse> submitJob(
      @Valid @RequestBody TranscriptionRequest request) {
    TranscriptionJob job = jobService.submit(request);
    return ResponseEntity.accepted()
        .body(new AsyncJobResponse(job.getJobId(), "/v1/jobs/" + job.getJobId()));
  }

  /**
   * Get job status.
   *
   * <p>Returns the current state of an async job. Completed and cancelled jobs include their
   * transcript.
   */
  @GetMapping("/v1/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an async job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobService
        .find(id)
        .map(job -> ResponseEntity.ok(job.toStatusResponse()))
        .orElse(ResponseEntity.notFound().build());
  }

  @DeleteMapping("/v1/jobs/{id}")
  @Operation(
      summary = "Cancel job",
      description = "Stop an async job after the chunk in flight, keeping its partial transcript")
  public ResponseEntity<JobStatusResponse> cancelJob(@PathVariable String id) {
    return jobService
        .cancel(id)
        .map(job -> ResponseEntity.accepted().body(job.toStatusResponse()))
        .orElse(ResponseEntity.notFound().build());
  }

  @PostMapping("/v1/chunks/preview")
  @Operation(
      summary = "Preview chunks",
      description = "Show how audio will be split into chunks without transcribing it")
  public ChunkPreviewResponse previewChunks(@Valid @RequestBody TranscriptionRequest request) {
    PipelineConfig config = request.applyTo(defaultPipelineConfig);
    List<ChunkBoundary> chunks = orchestrator.previewChunks(request.toAudioSource(), config);
    double total = chunks.isEmpty() ? 0.0 : chunks.get(chunks.size() - 1).endSeconds();
    return new ChunkPreviewResponse(
        total, config.chunkDurationSeconds(), config.overlapSeconds(), chunks.size(), chunks);
  }
}
