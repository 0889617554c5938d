package com.scholary.dialect.transcriber.speech;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes access to a shared {@link SpeechModel}.
 *
 * <p>The model is a single stateful instance, so decodes from concurrent pipeline runs are queued
 * on a fair lock and executed one at a time. Waiting is bounded: a run that cannot get the model
 * within {@code queueTimeout} fails that chunk with a {@link DecodeException}.
 */
public class SerializedSpeechModel implements SpeechModel {

  private static final Logger LOGGER = LoggerFactory.getLogger(SerializedSpeechModel.class);

  private final SpeechModel delegate;
  private final Duration queueTimeout;
  private final ReentrantLock lock = new ReentrantLock(true);

  public SerializedSpeechModel(SpeechModel delegate, Duration queueTimeout) {
    this.delegate = delegate;
    this.queueTimeout = queueTimeout;
  }

  @Override
  public DecodeResult decode(float[] samples, int sampleRate, String targetLanguage) {
    acquire();
    try {
      return delegate.decode(samples, sampleRate, targetLanguage);
    } finally {
      lock.unlock();
    }
  }

  private void acquire() {
    try {
      if (!lock.tryLock(queueTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        LOGGER.warn(
            "Speech model busy: waited {}ms, queued={}", queueTimeout.toMillis(), lock.getQueueLength());
        throw new DecodeException(
            "Speech model busy after waiting " + queueTimeout.toMillis() + "ms");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DecodeException("Interrupted while waiting for the speech model", e);
    }
  }
}
