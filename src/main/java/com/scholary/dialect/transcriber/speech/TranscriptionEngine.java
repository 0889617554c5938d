package com.scholary.dialect.transcriber.speech;

import com.scholary.dialect.transcriber.chunking.AudioChunk;
import com.scholary.dialect.transcriber.confidence.ConfidenceEstimator;
import com.scholary.dialect.transcriber.confidence.ConfidenceScore;
import com.scholary.dialect.transcriber.transcript.ChunkTranscript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Transcribes one chunk with the shared speech model and scores the result.
 *
 * <p>Errors from the model propagate unchanged; the orchestrator decides what to do with them.
 */
@Component
public class TranscriptionEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionEngine.class);

  private final SpeechModel speechModel;
  private final ConfidenceEstimator confidenceEstimator;

  public TranscriptionEngine(SpeechModel speechModel, ConfidenceEstimator confidenceEstimator) {
    this.speechModel = speechModel;
    this.confidenceEstimator = confidenceEstimator;
  }

  public ChunkTranscript transcribe(AudioChunk chunk, String targetLanguage) {
    DecodeResult result =
        speechModel.decode(chunk.samples(), chunk.sampleRate(), targetLanguage);

    String text = result.text().trim();
    ConfidenceScore score =
        text.isEmpty() ? ConfidenceScore.ZERO : confidenceEstimator.estimate(result.distribution());

    LOGGER.debug(
        "Transcribed chunk {}: textLength={}, steps={}, confidence={}",
        chunk.index(),
        text.length(),
        result.distribution().stepCount(),
        String.format("%.3f", score.value()));

    return new ChunkTranscript(
        chunk.index(),
        text,
        score.value(),
        result.distribution().stepCount(),
        chunk.startOffset(),
        chunk.endOffset(),
        chunk.sampleRate());
  }
}
