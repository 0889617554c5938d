package com.scholary.dialect.transcriber.speech;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.dialect.transcriber.chunking.AudioChunk;
import com.scholary.dialect.transcriber.confidence.ConfidenceEstimator;
import com.scholary.dialect.transcriber.confidence.TokenDistribution;
import com.scholary.dialect.transcriber.transcript.ChunkTranscript;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TranscriptionEngineTest {

  @Mock private SpeechModel speechModel;

  private TranscriptionEngine engine;
  private AudioChunk chunk;

  @BeforeEach
  void setUp() {
    engine = new TranscriptionEngine(speechModel, new ConfidenceEstimator());
    chunk = new AudioChunk(2, new float[16000], 32000, 16000, 16000);
  }

  @Test
  void transcribe_scoresDecodedText() {
    double[] oneHot = {0.0, 1.0, 0.0};
    when(speechModel.decode(any(float[].class), eq(16000), eq("arb")))
        .thenReturn(new DecodeResult("  مرحبا  ", new TokenDistribution(List.of(oneHot, oneHot))));

    ChunkTranscript transcript = engine.transcribe(chunk, "arb");

    assertThat(transcript.chunkIndex()).isEqualTo(2);
    assertThat(transcript.rawText()).isEqualTo("مرحبا");
    assertThat(transcript.confidence()).isEqualTo(1.0);
    assertThat(transcript.tokenCount()).isEqualTo(2);
    assertThat(transcript.startSeconds()).isEqualTo(2.0);
    assertThat(transcript.endSeconds()).isEqualTo(3.0);
  }

  @Test
  void transcribe_emptyTextHasZeroConfidence() {
    double[] oneHot = {1.0, 0.0};
    when(speechModel.decode(any(float[].class), eq(16000), eq("arb")))
        .thenReturn(new DecodeResult("   ", new TokenDistribution(List.of(oneHot))));

    ChunkTranscript transcript = engine.transcribe(chunk, "arb");

    assertThat(transcript.isEmpty()).isTrue();
    assertThat(transcript.confidence()).isZero();
  }

  @Test
  void transcribe_passesTargetLanguage() {
    when(speechModel.decode(any(float[].class), eq(16000), eq("eng")))
        .thenReturn(new DecodeResult("hi", TokenDistribution.EMPTY));

    engine.transcribe(chunk, "eng");

    verify(speechModel).decode(chunk.samples(), 16000, "eng");
  }

  @Test
  void transcribe_propagatesModelErrors() {
    when(speechModel.decode(any(float[].class), eq(16000), eq("arb")))
        .thenThrow(new DecodeException("model crashed"));

    assertThatThrownBy(() -> engine.transcribe(chunk, "arb"))
        .isInstanceOf(DecodeException.class)
        .hasMessage("model crashed");
  }
}
