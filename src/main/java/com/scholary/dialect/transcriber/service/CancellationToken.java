package com.scholary.dialect.transcriber.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for a pipeline run.
 *
 * <p>The run checks the token between chunks; work already in flight for a chunk finishes.
 */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  /** A fresh token that nobody else holds, for runs that cannot be cancelled. */
  public static CancellationToken none() {
    return new CancellationToken();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
