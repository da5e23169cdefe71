package com.trendlens.engine.analytics;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

public final class CancellationToken {

  private static final CancellationToken NONE = new CancellationToken();

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public static CancellationToken none() {
    return NONE;
  }

  public static CancellationToken create() {
    return new CancellationToken();
  }

  public void cancel() {
    if (this == NONE) {
      throw new UnsupportedOperationException("The shared no-op token cannot be cancelled");
    }
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public void throwIfCancelled() {
    if (cancelled.get()) {
      throw new CancellationException("Analysis cancelled");
    }
  }
}
