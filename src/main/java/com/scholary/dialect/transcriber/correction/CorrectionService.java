package com.scholary.dialect.transcriber.correction;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Corrects one chunk of text through the {@link Corrector}, never failing the caller.
 *
 * <p>Each call is bounded by a timeout. A timeout, a service error or an unparseable reply yields
 * a fallback outcome: the raw text passed through with confirmation required. So does a
 * correction pool that refuses the task because it is shut down or saturated. Confidence above the
 * override threshold also forces confirmation, even when the corrector did not ask for it.
 */
public class CorrectionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(CorrectionService.class);

  private final Corrector corrector;
  private final CorrectionResponseParser parser;
  private final ExecutorService executor;
  private final Duration timeout;
  private final double confirmationOverrideThreshold;

  public CorrectionService(
      Corrector corrector,
      CorrectionResponseParser parser,
      ExecutorService executor,
      Duration timeout,
      double confirmationOverrideThreshold) {
    this.corrector = corrector;
    this.parser = parser;
    this.executor = executor;
    this.timeout = timeout;
    this.confirmationOverrideThreshold = confirmationOverrideThreshold;
  }

  public CorrectionOutcome correct(String text, double confidence, CorrectionPolicy policy) {
    if (text == null || text.isBlank()) {
      return CorrectionOutcome.skipped();
    }

    CorrectionRequest request = new CorrectionRequest(text, confidence, policy);
    Future<String> future;
    try {
      future = executor.submit(() -> corrector.correct(request));
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Correction pool rejected the request, keeping raw text: {}", e.getMessage());
      return CorrectionOutcome.fallback(text, e);
    }

    CorrectionResult result;
    try {
      String reply = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      result = parser.parse(reply, text);
    } catch (TimeoutException e) {
      future.cancel(true);
      LOGGER.warn("Correction timed out after {}ms, keeping raw text", timeout.toMillis());
      return CorrectionOutcome.fallback(text, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      LOGGER.warn("Correction failed, keeping raw text: {}", cause.getMessage());
      return CorrectionOutcome.fallback(text, cause);
    } catch (CorrectionParseException e) {
      LOGGER.warn("Unparseable correction reply, keeping raw text: {}", e.getMessage());
      return CorrectionOutcome.fallback(text, e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      LOGGER.warn("Correction interrupted, keeping raw text");
      return CorrectionOutcome.fallback(text, e);
    }

    if (confidence > confirmationOverrideThreshold) {
      result = result.withConfirmationRequired();
    }
    return CorrectionOutcome.corrected(result);
  }
}
