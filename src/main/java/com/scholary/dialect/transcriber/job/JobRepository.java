package com.scholary.dialect.transcriber.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for transcription jobs.
 *
 * <p>Uses a Caffeine cache so the number of retained jobs stays bounded. Queued and running jobs
 * never expire; once a finished job is saved it expires {@code expireAfterMinutes} later. Jobs are
 * mutable and updated in place; {@link #save} re-evaluates the entry's expiry.
 */
@Repository
public class JobRepository {

  private final Cache<String, TranscriptionJob> cache;

  @Autowired
  public JobRepository(
      @Value("${jobstore.max-size}") int maxSize,
      @Value("${jobstore.expire-after-minutes}") int expireAfterMinutes) {
    this(maxSize, Duration.ofMinutes(expireAfterMinutes), Ticker.systemTicker());
  }

  JobRepository(int maxSize, Duration finishedJobTtl, Ticker ticker) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfter(new FinishedJobExpiry(finishedJobTtl.toNanos()))
            .ticker(ticker)
            .build();
  }

  public void save(TranscriptionJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<TranscriptionJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }

  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  private static final class FinishedJobExpiry implements Expiry<String, TranscriptionJob> {

    private final long ttlNanos;

    FinishedJobExpiry(long ttlNanos) {
      this.ttlNanos = ttlNanos;
    }

    @Override
    public long expireAfterCreate(String jobId, TranscriptionJob job, long currentTime) {
      return job.isFinished() ? ttlNanos : Long.MAX_VALUE;
    }

    @Override
    public long expireAfterUpdate(
        String jobId, TranscriptionJob job, long currentTime, long currentDuration) {
      return job.isFinished() ? ttlNanos : Long.MAX_VALUE;
    }

    @Override
    public long expireAfterRead(
        String jobId, TranscriptionJob job, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
