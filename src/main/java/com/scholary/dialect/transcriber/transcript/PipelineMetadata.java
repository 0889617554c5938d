package com.scholary.dialect.transcriber.transcript;

/**
 * Run statistics reported with a {@link PipelineOutput}.
 *
 * @param chunkCount chunks produced by the splitter and reached before cancellation
 * @param durationSeconds length of the normalized audio
 * @param processingTimeMs wall time of the run
 * @param assembledCount chunks that became segments
 * @param droppedCount chunks rejected by admission or lost to a decode failure
 * @param fallbackCount assembled chunks whose correction fell back to the raw text
 * @param cancelled whether the run stopped early on request
 * @param targetLanguage language hint the chunks were decoded with
 */
public record PipelineMetadata(
    int chunkCount,
    double durationSeconds,
    long processingTimeMs,
    int assembledCount,
    int droppedCount,
    int fallbackCount,
    boolean cancelled,
    String targetLanguage) {}
