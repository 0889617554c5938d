package com.scholary.dialect.transcriber.transcript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.dialect.transcriber.correction.CorrectionOutcome;
import com.scholary.dialect.transcriber.correction.CorrectionPolicy;
import com.scholary.dialect.transcriber.correction.CorrectionResult;
import com.scholary.dialect.transcriber.correction.CorrectionServiceException;
import com.scholary.dialect.transcriber.correction.CorrectionTier;
import org.junit.jupiter.api.Test;

class SegmentAssemblerTest {

  @Test
  void toSegment_autoTierWithoutConfirmationNeedsNoReview() {
    TranscriptionSegment segment =
        SegmentAssembler.toSegment(
            transcript(0, "raw", 0.85),
            CorrectionPolicy.of(CorrectionTier.SUGGEST),
            CorrectionOutcome.corrected(new CorrectionResult("fixed", true, false, "raw")));

    assertThat(segment.needsReview()).isFalse();
    assertThat(segment.correctedText()).isEqualTo("fixed");
    assertThat(segment.tier()).isEqualTo(CorrectionTier.SUGGEST);
    assertThat(segment.startSeconds()).isEqualTo(0.0);
    assertThat(segment.endSeconds()).isEqualTo(1.0);
  }

  @Test
  void toSegment_reviewTierNeedsReview() {
    TranscriptionSegment segment =
        SegmentAssembler.toSegment(
            transcript(0, "raw", 0.5),
            CorrectionPolicy.of(CorrectionTier.REVIEW),
            CorrectionOutcome.corrected(new CorrectionResult("raw.", true, false, "raw")));

    assertThat(segment.needsReview()).isTrue();
  }

  @Test
  void toSegment_confirmationRequestNeedsReview() {
    TranscriptionSegment segment =
        SegmentAssembler.toSegment(
            transcript(0, "raw", 0.95),
            CorrectionPolicy.of(CorrectionTier.AUTO),
            CorrectionOutcome.corrected(new CorrectionResult("raw.", true, true, "raw")));

    assertThat(segment.needsReview()).isTrue();
  }

  @Test
  void toSegment_fallbackKeepsRawTextAndNeedsReview() {
    TranscriptionSegment segment =
        SegmentAssembler.toSegment(
            transcript(0, "raw words", 0.95),
            CorrectionPolicy.of(CorrectionTier.AUTO),
            CorrectionOutcome.fallback("raw words", new CorrectionServiceException("down")));

    assertThat(segment.correctedText()).isEqualTo("raw words");
    assertThat(segment.needsReview()).isTrue();
  }

  @Test
  void assembler_joinsTextsWithSingleSpaces() {
    SegmentAssembler assembler = new SegmentAssembler();
    assembler.append(segment(0, "a", "A."), false);
    assembler.append(segment(2, "b", "B."), true);

    assertThat(assembler.fullRawText()).isEqualTo("a b");
    assertThat(assembler.fullCorrectedText()).isEqualTo("A. B.");
    assertThat(assembler.segments()).hasSize(2);
    assertThat(assembler.fallbackCount()).isEqualTo(1);
  }

  @Test
  void assembler_emptyRunHasEmptyTexts() {
    SegmentAssembler assembler = new SegmentAssembler();

    assertThat(assembler.fullRawText()).isEmpty();
    assertThat(assembler.fullCorrectedText()).isEmpty();
  }

  @Test
  void assembler_rejectsOutOfOrderSegments() {
    SegmentAssembler assembler = new SegmentAssembler();
    assembler.append(segment(3, "c", "C"), false);

    assertThatThrownBy(() -> assembler.append(segment(1, "a", "A"), false))
        .isInstanceOf(IllegalStateException.class);
  }

  private static ChunkTranscript transcript(int index, String text, double confidence) {
    return new ChunkTranscript(index, text, confidence, 3, 0, 16000, 16000);
  }

  private static TranscriptionSegment segment(int index, String raw, String corrected) {
    return new TranscriptionSegment(
        index, raw, corrected, 0.9, CorrectionTier.SUGGEST, false, index, index + 1);
  }
}
