package com.scholary.dialect.transcriber.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.dialect.transcriber.api.JobStatusResponse.Status;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JobRepositoryTest {

  private final AtomicLong nanos = new AtomicLong();
  private JobRepository repository;

  @BeforeEach
  void setUp() {
    repository = new JobRepository(10, Duration.ofMinutes(60), nanos::get);
  }

  @Test
  void findById_keepsUnfinishedJobsPastTheRetentionWindow() {
    TranscriptionJob job = new TranscriptionJob("job-1", "/data/call.wav");
    repository.save(job);

    advance(Duration.ofHours(5));

    assertThat(repository.findById("job-1")).containsSame(job);
  }

  @Test
  void findById_expiresFinishedJobsAfterTheRetentionWindow() {
    TranscriptionJob job = new TranscriptionJob("job-1", "/data/call.wav");
    repository.save(job);
    advance(Duration.ofHours(2));
    job.setStatus(Status.COMPLETED);
    repository.save(job);

    advance(Duration.ofMinutes(59));
    assertThat(repository.findById("job-1")).isPresent();

    advance(Duration.ofMinutes(2));
    assertThat(repository.findById("job-1")).isEmpty();
  }

  @Test
  void delete_removesJob() {
    repository.save(new TranscriptionJob("job-1", "/data/call.wav"));

    repository.delete("job-1");

    assertThat(repository.findById("job-1")).isEmpty();
    assertThat(repository.size()).isZero();
  }

  private void advance(Duration duration) {
    nanos.addAndGet(duration.toNanos());
  }
}
