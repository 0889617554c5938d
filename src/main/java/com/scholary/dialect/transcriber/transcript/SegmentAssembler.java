package com.scholary.dialect.transcriber.transcript;

import com.scholary.dialect.transcriber.correction.CorrectionOutcome;
import com.scholary.dialect.transcriber.correction.CorrectionPolicy;
import com.scholary.dialect.transcriber.correction.CorrectionResult;
import java.util.ArrayList;
import java.util.List;

/**
 * Folds corrected chunks into segments and joins them into the final transcript.
 *
 * <p>Segments must arrive in strictly increasing chunk order. One assembler serves one run.
 */
public class SegmentAssembler {

  private final List<TranscriptionSegment> segments = new ArrayList<>();
  private int fallbackCount;

  /** Build the segment for a corrected chunk without keeping it. */
  public static TranscriptionSegment toSegment(
      ChunkTranscript transcript, CorrectionPolicy policy, CorrectionOutcome outcome) {
    CorrectionResult result = outcome.result();
    boolean needsReview =
        policy.requiresReview() || result.requiresConfirmation() || outcome.isFallback();
    return new TranscriptionSegment(
        transcript.chunkIndex(),
        transcript.rawText(),
        result.correctedText(),
        transcript.confidence(),
        policy.tier(),
        needsReview,
        transcript.startSeconds(),
        transcript.endSeconds());
  }

  /**
   * Append a segment.
   *
   * @throws IllegalStateException if the segment does not follow the last one in chunk order
   */
  public TranscriptionSegment append(TranscriptionSegment segment, boolean fallback) {
    if (!segments.isEmpty() && segment.index() <= segments.get(segments.size() - 1).index()) {
      throw new IllegalStateException(
          String.format(
              "Segment %d appended after segment %d",
              segment.index(), segments.get(segments.size() - 1).index()));
    }
    segments.add(segment);
    if (fallback) {
      fallbackCount++;
    }
    return segment;
  }

  public List<TranscriptionSegment> segments() {
    return List.copyOf(segments);
  }

  public int fallbackCount() {
    return fallbackCount;
  }

  public String fullRawText() {
    return join(segments, true);
  }

  public String fullCorrectedText() {
    return join(segments, false);
  }

  private static String join(List<TranscriptionSegment> segments, boolean raw) {
    StringBuilder text = new StringBuilder();
    for (TranscriptionSegment segment : segments) {
      if (text.length() > 0) {
        text.append(" ");
      }
      text.append(raw ? segment.rawText() : segment.correctedText());
    }
    return text.toString();
  }
}
