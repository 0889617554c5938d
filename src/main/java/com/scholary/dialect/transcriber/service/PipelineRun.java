package com.scholary.dialect.transcriber.service;

import com.scholary.dialect.transcriber.audio.Waveform;
import com.scholary.dialect.transcriber.chunking.AudioChunk;
import com.scholary.dialect.transcriber.config.PipelineConfig;
import com.scholary.dialect.transcriber.correction.CorrectionOutcome;
import com.scholary.dialect.transcriber.correction.CorrectionPolicy;
import com.scholary.dialect.transcriber.correction.CorrectionPolicyRouter;
import com.scholary.dialect.transcriber.correction.CorrectionService;
import com.scholary.dialect.transcriber.logging.StructuredLogger;
import com.scholary.dialect.transcriber.speech.TranscriptionEngine;
import com.scholary.dialect.transcriber.transcript.ChunkLifecycle;
import com.scholary.dialect.transcriber.transcript.ChunkState;
import com.scholary.dialect.transcriber.transcript.ChunkTranscript;
import com.scholary.dialect.transcriber.transcript.PipelineMetadata;
import com.scholary.dialect.transcriber.transcript.PipelineOutput;
import com.scholary.dialect.transcriber.transcript.SegmentAssembler;
import com.scholary.dialect.transcriber.transcript.TranscriptionSegment;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * One pass over the chunks of a normalized waveform, yielding assembled segments in chunk order.
 *
 * <p>Each call to {@link #next()} drives as many chunks as needed to produce the next segment:
 * decode, admission, correction, assembly. Dropped chunks produce nothing. Chunk-scoped failures
 * are logged and the chunk is dropped; the run continues with the next one. The run is not
 * restartable and must be consumed on a single thread.
 */
class PipelineRun implements Iterator<TranscriptionSegment> {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineRun.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final String correlationId;
  private final Waveform waveform;
  private final Iterator<AudioChunk> chunks;
  private final int totalChunks;
  private final PipelineConfig config;
  private final TranscriptionEngine transcriptionEngine;
  private final CorrectionService correctionService;
  private final CorrectionPolicyRouter policyRouter;
  private final CancellationToken cancellationToken;
  private final ProgressListener progressListener;
  private final SegmentAssembler assembler = new SegmentAssembler();
  private final long startedAt = System.currentTimeMillis();

  private TranscriptionSegment pending;
  private int chunkCount;
  private int droppedCount;
  private boolean cancelled;
  private boolean finished;
  private long elapsedMs;

  PipelineRun(
      String correlationId,
      Waveform waveform,
      Iterable<AudioChunk> chunks,
      int totalChunks,
      PipelineConfig config,
      TranscriptionEngine transcriptionEngine,
      CorrectionService correctionService,
      CancellationToken cancellationToken,
      ProgressListener progressListener) {
    this.correlationId = correlationId;
    this.waveform = waveform;
    this.chunks = chunks.iterator();
    this.totalChunks = totalChunks;
    this.config = config;
    this.transcriptionEngine = transcriptionEngine;
    this.correctionService = correctionService;
    this.policyRouter =
        new CorrectionPolicyRouter(config.autoTierThreshold(), config.suggestTierThreshold());
    this.cancellationToken = cancellationToken;
    this.progressListener = progressListener;
  }

  @Override
  public boolean hasNext() {
    if (pending == null && !finished) {
      advance();
    }
    return pending != null;
  }

  @Override
  public TranscriptionSegment next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    TranscriptionSegment segment = pending;
    pending = null;
    return segment;
  }

  /**
   * Drain the remaining chunks and build the batch result.
   *
   * <p>Segments already handed out through {@link #next()} are included.
   */
  PipelineOutput drain() {
    while (hasNext()) {
      next();
    }
    return new PipelineOutput(
        assembler.fullRawText(),
        assembler.fullCorrectedText(),
        assembler.segments(),
        new PipelineMetadata(
            chunkCount,
            waveform.durationSeconds(),
            elapsedMs,
            assembler.segments().size(),
            droppedCount,
            assembler.fallbackCount(),
            cancelled,
            config.targetLanguage()));
  }

  private void advance() {
    boolean ownsCorrelationId = MDC.get("correlationId") == null;
    if (ownsCorrelationId) {
      MDC.put("correlationId", correlationId);
    }
    try {
      while (pending == null) {
        if (!chunks.hasNext()) {
          finish();
          return;
        }
        if (cancellationToken.isCancelled()) {
          LOGGER.info("Run cancelled after {} of {} chunks", chunkCount, totalChunks);
          cancelled = true;
          finish();
          return;
        }
        AudioChunk chunk = chunks.next();
        chunkCount++;
        pending = processChunk(chunk);
        progressListener.onChunkProcessed(chunkCount, totalChunks);
      }
    } finally {
      if (ownsCorrelationId) {
        MDC.remove("correlationId");
      }
    }
  }

  private TranscriptionSegment processChunk(AudioChunk chunk) {
    structuredLogger.logChunkStarted(chunk.index(), chunk.startSeconds(), chunk.endSeconds());
    long decodeStart = System.currentTimeMillis();

    ChunkTranscript transcript;
    try {
      transcript = transcriptionEngine.transcribe(chunk, config.targetLanguage());
    } catch (RuntimeException e) {
      droppedCount++;
      structuredLogger.logDecodeFailed(chunk.index(), e.getClass().getSimpleName(), e.getMessage());
      return null;
    }

    structuredLogger.logChunkDecoded(
        chunk.index(),
        transcript.confidence(),
        transcript.tokenCount(),
        System.currentTimeMillis() - decodeStart);

    ChunkLifecycle lifecycle = new ChunkLifecycle(chunk.index());
    if (transcript.isEmpty()) {
      return drop(lifecycle, transcript, "empty_text");
    }
    if (transcript.confidence() <= config.admissionConfidenceThreshold()) {
      return drop(lifecycle, transcript, "below_admission_threshold");
    }
    lifecycle.transitionTo(ChunkState.ADMITTED);

    CorrectionPolicy policy = policyRouter.route(transcript.confidence());
    CorrectionOutcome outcome;
    try {
      outcome = correctionService.correct(transcript.rawText(), transcript.confidence(), policy);
    } catch (RuntimeException e) {
      LOGGER.error("Correction of chunk {} failed unexpectedly", chunk.index(), e);
      return drop(lifecycle, transcript, "correction_error");
    }
    if (outcome.isFallback()) {
      Throwable cause = outcome.cause();
      structuredLogger.logCorrectionFallback(
          chunk.index(),
          policy.tier().name(),
          cause == null ? "unknown" : cause.getClass().getSimpleName(),
          cause == null ? null : cause.getMessage());
    }
    lifecycle.transitionTo(ChunkState.CORRECTED);

    TranscriptionSegment segment =
        assembler.append(
            SegmentAssembler.toSegment(transcript, policy, outcome), outcome.isFallback());
    lifecycle.transitionTo(ChunkState.ASSEMBLED);

    structuredLogger.logSegmentAssembled(
        segment.index(),
        segment.confidence(),
        segment.tier().name(),
        segment.needsReview(),
        outcome.result().changesMade());
    return segment;
  }

  private TranscriptionSegment drop(
      ChunkLifecycle lifecycle, ChunkTranscript transcript, String reason) {
    lifecycle.transitionTo(ChunkState.DROPPED);
    droppedCount++;
    structuredLogger.logChunkDropped(transcript.chunkIndex(), transcript.confidence(), reason);
    return null;
  }

  private void finish() {
    if (finished) {
      return;
    }
    finished = true;
    elapsedMs = System.currentTimeMillis() - startedAt;
    structuredLogger.logRunFinished(
        chunkCount,
        assembler.segments().size(),
        droppedCount,
        assembler.fallbackCount(),
        cancelled,
        elapsedMs);
  }
}
