package com.scholary.dialect.transcriber.transcript;

import com.scholary.dialect.transcriber.correction.CorrectionTier;

/**
 * One assembled chunk of the final transcript.
 *
 * <p>Only chunks that passed admission with non-empty text become segments. {@code needsReview}
 * is set when the tier is REVIEW, when the corrector asked for confirmation, or when correction
 * fell back to the raw text.
 */
public record TranscriptionSegment(
    int index,
    String rawText,
    String correctedText,
    double confidence,
    CorrectionTier tier,
    boolean needsReview,
    double startSeconds,
    double endSeconds) {}
