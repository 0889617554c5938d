package com.scholary.dialect.transcriber.service;

import com.scholary.dialect.transcriber.audio.AudioNormalizer;
import com.scholary.dialect.transcriber.audio.AudioSource;
import com.scholary.dialect.transcriber.audio.AudioSourceLoader;
import com.scholary.dialect.transcriber.audio.PcmAudio;
import com.scholary.dialect.transcriber.audio.Waveform;
import com.scholary.dialect.transcriber.chunking.ChunkBoundary;
import com.scholary.dialect.transcriber.chunking.ChunkSplitter;
import com.scholary.dialect.transcriber.config.PipelineConfig;
import com.scholary.dialect.transcriber.correction.CorrectionService;
import com.scholary.dialect.transcriber.logging.StructuredLogger;
import com.scholary.dialect.transcriber.speech.TranscriptionEngine;
import com.scholary.dialect.transcriber.transcript.PipelineOutput;
import com.scholary.dialect.transcriber.transcript.TranscriptionSegment;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.UUID;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Runs the transcription pipeline.
 *
 * <pre>
 * load -&gt; normalize -&gt; split -&gt; per chunk: decode, admit, correct, assemble
 * </pre>
 *
 * <p>Loading, normalization and splitting happen before any chunk is touched, so their errors
 * ({@code AudioFormatException}, {@code EmptyAudioException}, {@code ObjectStoreException}, {@code
 * ConfigurationException}) reach the caller unchanged, also for {@code streamAudio}. Failures
 * inside a chunk only drop that chunk.
 *
 * <p>Chunks are processed sequentially. Several runs may execute concurrently; they share the
 * serialized speech model and the correction service.
 */
@Service
public class PipelineOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final AudioSourceLoader audioSourceLoader;
  private final AudioNormalizer audioNormalizer;
  private final TranscriptionEngine transcriptionEngine;
  private final CorrectionService correctionService;

  public PipelineOrchestrator(
      AudioSourceLoader audioSourceLoader,
      AudioNormalizer audioNormalizer,
      TranscriptionEngine transcriptionEngine,
      CorrectionService correctionService) {
    this.audioSourceLoader = audioSourceLoader;
    this.audioNormalizer = audioNormalizer;
    this.transcriptionEngine = transcriptionEngine;
    this.correctionService = correctionService;
  }

  public PipelineOutput processAudio(AudioSource source, PipelineConfig config) {
    return processAudio(source, config, CancellationToken.none(), ProgressListener.NONE);
  }

  /**
   * Transcribe and correct an audio source in one batch.
   *
   * @return the assembled transcript; partial with {@code metadata.cancelled} set if the token
   *     was cancelled mid-run
   */
  public PipelineOutput processAudio(
      AudioSource source,
      PipelineConfig config,
      CancellationToken cancellationToken,
      ProgressListener progressListener) {
    PcmAudio audio = audioSourceLoader.load(source);
    return startRun(source.describe(), audio, config, cancellationToken, progressListener).drain();
  }

  public PipelineOutput processAudio(PcmAudio audio, PipelineConfig config) {
    return processAudio(audio, config, CancellationToken.none());
  }

  public PipelineOutput processAudio(
      PcmAudio audio, PipelineConfig config, CancellationToken cancellationToken) {
    return startRun("pcm", audio, config, cancellationToken, ProgressListener.NONE).drain();
  }

  public Stream<TranscriptionSegment> streamAudio(AudioSource source, PipelineConfig config) {
    return streamAudio(source, config, CancellationToken.none());
  }

  /**
   * Transcribe an audio source lazily, one segment at a time.
   *
   * <p>The stream is ordered, finite and single-use. Each chunk is processed when the consumer
   * pulls the next element, on the consumer's thread. Cancelling the token ends the stream after
   * the chunk in flight.
   */
  public Stream<TranscriptionSegment> streamAudio(
      AudioSource source, PipelineConfig config, CancellationToken cancellationToken) {
    return toStream(
        startRun(
            source.describe(),
            audioSourceLoader.load(source),
            config,
            cancellationToken,
            ProgressListener.NONE));
  }

  public Stream<TranscriptionSegment> streamAudio(
      PcmAudio audio, PipelineConfig config, CancellationToken cancellationToken) {
    return toStream(startRun("pcm", audio, config, cancellationToken, ProgressListener.NONE));
  }

  /** Chunk boundaries a run over {@code source} would use, without decoding anything. */
  public List<ChunkBoundary> previewChunks(AudioSource source, PipelineConfig config) {
    Waveform waveform =
        audioNormalizer.normalize(audioSourceLoader.load(source), config.sampleRate());
    ChunkSplitter splitter =
        new ChunkSplitter(config.chunkDurationSeconds(), config.overlapSeconds());
    return splitter.preview(waveform.length(), waveform.sampleRate());
  }

  private PipelineRun startRun(
      String sourceName,
      PcmAudio audio,
      PipelineConfig config,
      CancellationToken cancellationToken,
      ProgressListener progressListener) {
    String correlationId = UUID.randomUUID().toString();
    MDC.put("correlationId", correlationId);
    try {
      Waveform waveform = audioNormalizer.normalize(audio, config.sampleRate());
      ChunkSplitter splitter =
          new ChunkSplitter(config.chunkDurationSeconds(), config.overlapSeconds());
      int totalChunks = splitter.preview(waveform.length(), waveform.sampleRate()).size();

      structuredLogger.logRunStarted(sourceName, waveform.durationSeconds(), waveform.sampleRate());
      LOGGER.info(
          "Planned {} chunks: chunk={}s, overlap={}s, admission={}",
          totalChunks,
          config.chunkDurationSeconds(),
          config.overlapSeconds(),
          config.admissionConfidenceThreshold());

      return new PipelineRun(
          correlationId,
          waveform,
          splitter.split(waveform),
          totalChunks,
          config,
          transcriptionEngine,
          correctionService,
          cancellationToken,
          progressListener);
    } finally {
      MDC.remove("correlationId");
    }
  }

  private static Stream<TranscriptionSegment> toStream(PipelineRun run) {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(
            run, Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE),
        false);
  }
}
