package com.onthegomap.overlapresolver.progress;

import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.concurrent.ThreadSafe;

/** A {@link ProgressController} that any thread can cancel, forwarding progress to another controller. */
@ThreadSafe
public class CancellableProgress implements ProgressController {

  private final ProgressController delegate;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  public CancellableProgress(ProgressController delegate) {
    this.delegate = delegate;
  }

  public CancellableProgress() {
    this(NONE);
  }

  /** Requests that processing stop once the current overlap group finishes. */
  public void cancel() {
    cancelled.set(true);
  }

  @Override
  public void report(long completed, long total) {
    delegate.report(completed, total);
  }

  @Override
  public boolean isCancelled() {
    return cancelled.get() || delegate.isCancelled();
  }
}
