package com.scholary.dialect.transcriber.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into the MDC around a single log call, so they show up as
 * queryable fields in JSON log output and in the console pattern.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log pipeline start event. */
  public void logRunStarted(String source, double durationSeconds, int sampleRate) {
    try {
      MDC.put("event_type", "run_started");
      MDC.put("durationSeconds", String.valueOf(durationSeconds));

      logger.info(
          "Pipeline started: source={}, duration={}s, rate={}",
          source,
          String.format("%.2f", durationSeconds),
          sampleRate);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk started event. */
  public void logChunkStarted(int chunkIndex, double start, double end) {
    try {
      MDC.put("event_type", "chunk_started");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));

      logger.debug("Chunk started: index={}, range=[{}-{}]", chunkIndex, start, end);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk decoded event. */
  public void logChunkDecoded(int chunkIndex, double confidence, int tokenCount, long decodeMs) {
    try {
      MDC.put("event_type", "chunk_decoded");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("confidence", String.valueOf(confidence));
      MDC.put("tokenCount", String.valueOf(tokenCount));
      MDC.put("decodeMs", String.valueOf(decodeMs));

      logger.debug(
          "Chunk decoded: index={}, confidence={}, tokens={}, decode={}ms",
          chunkIndex,
          String.format("%.3f", confidence),
          tokenCount,
          decodeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk dropped event. */
  public void logChunkDropped(int chunkIndex, double confidence, String reason) {
    try {
      MDC.put("event_type", "chunk_dropped");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("confidence", String.valueOf(confidence));
      MDC.put("reason", reason);

      logger.info(
          "Chunk dropped: index={}, confidence={}, reason={}",
          chunkIndex,
          String.format("%.3f", confidence),
          reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log decode failure event. */
  public void logDecodeFailed(int chunkIndex, String errorType, String message) {
    try {
      MDC.put("event_type", "decode_failed");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("errorType", errorType);

      logger.error(
          "Decode failed: chunk={}, error={}, message={}", chunkIndex, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log correction fallback event. */
  public void logCorrectionFallback(int chunkIndex, String tier, String errorType, String message) {
    try {
      MDC.put("event_type", "correction_fallback");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("tier", tier);
      MDC.put("errorType", errorType);

      logger.warn(
          "Correction fallback: chunk={}, tier={}, error={}, message={}",
          chunkIndex,
          tier,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log segment assembled event. */
  public void logSegmentAssembled(
      int chunkIndex, double confidence, String tier, boolean needsReview, boolean changesMade) {
    try {
      MDC.put("event_type", "segment_assembled");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("confidence", String.valueOf(confidence));
      MDC.put("tier", tier);
      MDC.put("needsReview", String.valueOf(needsReview));

      logger.debug(
          "Segment assembled: index={}, confidence={}, tier={}, needsReview={}, changed={}",
          chunkIndex,
          String.format("%.3f", confidence),
          tier,
          needsReview,
          changesMade);
    } finally {
      clearEventFields();
    }
  }

  /** Log pipeline finished event. */
  public void logRunFinished(
      int chunkCount, int assembled, int dropped, int fallbacks, boolean cancelled, long elapsedMs) {
    try {
      MDC.put("event_type", "run_finished");
      MDC.put("chunkCount", String.valueOf(chunkCount));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Pipeline finished: chunks={}, assembled={}, dropped={}, fallbacks={}, cancelled={}, elapsed={}ms",
          chunkCount,
          assembled,
          dropped,
          fallbacks,
          cancelled,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String jobId, int chunksProcessed, String phase) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("jobId", jobId);
      MDC.put("chunksProcessed", String.valueOf(chunksProcessed));
      MDC.put("phase", phase);

      logger.info("Job progress: jobId={}, phase={}, chunks={}", jobId, phase, chunksProcessed);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String source) {
    MDC.put("jobId", jobId);
    MDC.put("source", source);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("source");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("chunk_index");
    MDC.remove("start");
    MDC.remove("end");
    MDC.remove("durationSeconds");
    MDC.remove("confidence");
    MDC.remove("tokenCount");
    MDC.remove("decodeMs");
    MDC.remove("reason");
    MDC.remove("tier");
    MDC.remove("needsReview");
    MDC.remove("errorType");
    MDC.remove("chunkCount");
    MDC.remove("elapsedMs");
    MDC.remove("chunksProcessed");
    MDC.remove("phase");
  }
}
