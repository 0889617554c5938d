package com.scholary.dialect.transcriber.transcript;

import java.util.List;

/**
 * Result of a batch pipeline run.
 *
 * <p>Full texts are the segments' texts joined with single spaces, in chunk order.
 */
public record PipelineOutput(
    String fullRawText,
    String fullCorrectedText,
    List<TranscriptionSegment> segments,
    PipelineMetadata metadata) {

  public PipelineOutput {
    segments = List.copyOf(segments);
  }
}
