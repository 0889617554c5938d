package com.scholary.dialect.transcriber.correction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CorrectionServiceTest {

  private static final CorrectionPolicy AUTO = CorrectionPolicy.of(CorrectionTier.AUTO);
  private static final CorrectionPolicy SUGGEST = CorrectionPolicy.of(CorrectionTier.SUGGEST);

  @Mock private Corrector corrector;

  private ExecutorService executor;
  private CorrectionService service;

  @BeforeEach
  void setUp() {
    executor = Executors.newCachedThreadPool();
    service =
        new CorrectionService(
            corrector,
            new CorrectionResponseParser(new ObjectMapper()),
            executor,
            Duration.ofMillis(500),
            0.8);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void correct_returnsParsedCorrection() {
    when(corrector.correct(any()))
        .thenReturn("{\"corrected_text\": \"fixed.\", \"changes_made\": true}");

    CorrectionOutcome outcome = service.correct("fixed", 0.75, SUGGEST);

    assertThat(outcome.kind()).isEqualTo(CorrectionOutcome.Kind.CORRECTED);
    assertThat(outcome.result().correctedText()).isEqualTo("fixed.");
    assertThat(outcome.result().requiresConfirmation()).isFalse();
  }

  @Test
  void correct_passesTextConfidenceAndPolicy() {
    when(corrector.correct(any())).thenReturn("{\"corrected_text\": \"x\"}");

    service.correct("x", 0.75, SUGGEST);

    ArgumentCaptor<CorrectionRequest> captor = ArgumentCaptor.forClass(CorrectionRequest.class);
    verify(corrector).correct(captor.capture());
    assertThat(captor.getValue().text()).isEqualTo("x");
    assertThat(captor.getValue().confidence()).isEqualTo(0.75);
    assertThat(captor.getValue().policy()).isEqualTo(SUGGEST);
  }

  @Test
  void correct_highConfidenceForcesConfirmation() {
    when(corrector.correct(any()))
        .thenReturn("{\"corrected_text\": \"ok.\", \"requires_confirmation\": false}");

    CorrectionOutcome outcome = service.correct("ok", 0.95, AUTO);

    assertThat(outcome.isFallback()).isFalse();
    assertThat(outcome.result().requiresConfirmation()).isTrue();
  }

  @Test
  void correct_confidenceAtOverrideThresholdIsNotForced() {
    when(corrector.correct(any())).thenReturn("{\"corrected_text\": \"ok.\"}");

    CorrectionOutcome outcome = service.correct("ok", 0.8, SUGGEST);

    assertThat(outcome.result().requiresConfirmation()).isFalse();
  }

  @Test
  void correct_serviceFailureFallsBackToRawText() {
    when(corrector.correct(any())).thenThrow(new CorrectionServiceException("connection refused"));

    CorrectionOutcome outcome = service.correct("raw words", 0.95, AUTO);

    assertThat(outcome.isFallback()).isTrue();
    assertThat(outcome.cause()).isInstanceOf(CorrectionServiceException.class);
    assertThat(outcome.result().correctedText()).isEqualTo("raw words");
    assertThat(outcome.result().originalText()).isEqualTo("raw words");
    assertThat(outcome.result().changesMade()).isFalse();
    assertThat(outcome.result().requiresConfirmation()).isTrue();
  }

  @Test
  void correct_unparseableReplyFallsBack() {
    when(corrector.correct(any())).thenReturn("Sorry, I can't do that.");

    CorrectionOutcome outcome = service.correct("raw", 0.75, SUGGEST);

    assertThat(outcome.isFallback()).isTrue();
    assertThat(outcome.cause()).isInstanceOf(CorrectionParseException.class);
    assertThat(outcome.result().correctedText()).isEqualTo("raw");
  }

  @Test
  void correct_timeoutFallsBack() {
    CountDownLatch release = new CountDownLatch(1);
    when(corrector.correct(any()))
        .thenAnswer(
            invocation -> {
              release.await();
              return "{\"corrected_text\": \"too late\"}";
            });

    long start = System.currentTimeMillis();
    CorrectionOutcome outcome = service.correct("slow", 0.75, SUGGEST);
    long elapsed = System.currentTimeMillis() - start;
    release.countDown();

    assertThat(outcome.isFallback()).isTrue();
    assertThat(outcome.cause()).isInstanceOf(TimeoutException.class);
    assertThat(outcome.result().correctedText()).isEqualTo("slow");
    assertThat(elapsed).isLessThan(5000);
  }

  @Test
  void correct_rejectedByShutDownPoolFallsBack() {
    executor.shutdown();

    CorrectionOutcome outcome = service.correct("raw words", 0.75, SUGGEST);

    assertThat(outcome.isFallback()).isTrue();
    assertThat(outcome.cause()).isInstanceOf(RejectedExecutionException.class);
    assertThat(outcome.result().correctedText()).isEqualTo("raw words");
    assertThat(outcome.result().requiresConfirmation()).isTrue();
    verify(corrector, never()).correct(any());
  }

  @Test
  void correct_emptyInputSkipsCorrector() {
    CorrectionOutcome outcome = service.correct("", 0.95, AUTO);

    assertThat(outcome.kind()).isEqualTo(CorrectionOutcome.Kind.SKIPPED);
    assertThat(outcome.result().correctedText()).isEmpty();
    assertThat(outcome.result().requiresConfirmation()).isFalse();
    verify(corrector, never()).correct(any());
  }
}
