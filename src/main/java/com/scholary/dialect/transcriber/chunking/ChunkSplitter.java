package com.scholary.dialect.transcriber.chunking;

import com.scholary.dialect.transcriber.audio.Waveform;
import com.scholary.dialect.transcriber.config.ConfigurationException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-duration chunking with overlaps.
 *
 * <p>Chunks of {@code D} samples start every {@code D - V} samples, so neighbours share {@code V}
 * samples of audio. The final chunk may be shorter and always ends at the end of the waveform.
 *
 * <p>Example with 20s chunks and 2s overlap on 45s of audio:
 *
 * <pre>
 * Chunk 0:  0s - 20s
 * Chunk 1: 18s - 38s
 * Chunk 2: 36s - 45s
 * </pre>
 *
 * <p>Overlapping decoded text is not de-duplicated.
 */
public class ChunkSplitter {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkSplitter.class);

  private final double chunkDurationSeconds;
  private final double overlapSeconds;

  /**
   * @throws ConfigurationException if the overlap is not strictly shorter than the chunk
   */
  public ChunkSplitter(double chunkDurationSeconds, double overlapSeconds) {
    if (chunkDurationSeconds <= 0) {
      throw new ConfigurationException(
          "Chunk duration must be positive: " + chunkDurationSeconds + "s");
    }
    if (overlapSeconds < 0) {
      throw new ConfigurationException("Overlap must not be negative: " + overlapSeconds + "s");
    }
    if (chunkDurationSeconds <= overlapSeconds) {
      throw new ConfigurationException(
          String.format(
              "Chunk duration (%.3fs) must be greater than overlap (%.3fs)",
              chunkDurationSeconds, overlapSeconds));
    }
    this.chunkDurationSeconds = chunkDurationSeconds;
    this.overlapSeconds = overlapSeconds;
  }

  /**
   * Split a waveform into overlapping chunks.
   *
   * <p>The returned sequence is lazy and restartable: each call to {@code iterator()} starts again
   * from chunk 0 and yields identical boundaries.
   */
  public Iterable<AudioChunk> split(Waveform waveform) {
    int chunkSamples = chunkSamples(waveform.sampleRate());
    int step = stepSamples(waveform.sampleRate());

    LOGGER.info(
        "Splitting waveform: totalSamples={}, chunkSamples={}, overlapSamples={}, step={}",
        waveform.length(),
        chunkSamples,
        chunkSamples - step,
        step);

    return () -> new ChunkIterator(waveform, chunkSamples, step);
  }

  /** Plan chunk boundaries for {@code totalSamples} without touching any audio. */
  public List<ChunkBoundary> preview(int totalSamples, int sampleRate) {
    int chunkSamples = chunkSamples(sampleRate);
    int step = stepSamples(sampleRate);

    List<ChunkBoundary> boundaries = new ArrayList<>();
    int start = 0;
    int index = 0;
    while (start < totalSamples) {
      int end = Math.min(start + chunkSamples, totalSamples);
      boundaries.add(
          new ChunkBoundary(
              index, start, end, (double) start / sampleRate, (double) end / sampleRate));
      if (end == totalSamples) {
        break;
      }
      start += step;
      index++;
    }
    return boundaries;
  }

  int chunkSamples(int sampleRate) {
    return toSamples("Chunk duration", chunkDurationSeconds, sampleRate);
  }

  int stepSamples(int sampleRate) {
    int chunkSamples = chunkSamples(sampleRate);
    int overlapSamples = toSamples("Overlap", overlapSeconds, sampleRate);
    int step = chunkSamples - overlapSamples;
    if (step <= 0) {
      throw new ConfigurationException(
          String.format(
              "Chunk of %d samples leaves no step after %d overlap samples at %dHz",
              chunkSamples, overlapSamples, sampleRate));
    }
    return step;
  }

  private static int toSamples(String name, double seconds, int sampleRate) {
    long samples = Math.round(seconds * sampleRate);
    if (samples > Integer.MAX_VALUE) {
      throw new ConfigurationException(
          String.format("%s (%.3fs) is too long for %dHz audio", name, seconds, sampleRate));
    }
    return (int) samples;
  }

  private static final class ChunkIterator implements Iterator<AudioChunk> {

    private final Waveform waveform;
    private final int chunkSamples;
    private final int step;
    private int nextStart;
    private int nextIndex;
    private boolean finished;

    ChunkIterator(Waveform waveform, int chunkSamples, int step) {
      this.waveform = waveform;
      this.chunkSamples = chunkSamples;
      this.step = step;
      this.finished = waveform.length() == 0;
    }

    @Override
    public boolean hasNext() {
      return !finished;
    }

    @Override
    public AudioChunk next() {
      if (finished) {
        throw new NoSuchElementException();
      }
      int total = waveform.length();
      int start = nextStart;
      int end = Math.min(start + chunkSamples, total);

      AudioChunk chunk =
          new AudioChunk(
              nextIndex, waveform.slice(start, end), start, end - start, waveform.sampleRate());

      LOGGER.debug(
          "Chunk {}: samples [{}, {}) ({}s - {}s)",
          nextIndex,
          start,
          end,
          chunk.startSeconds(),
          chunk.endSeconds());

      if (end == total) {
        finished = true;
      } else {
        nextStart = start + step;
        nextIndex++;
      }
      return chunk;
    }
  }
}
