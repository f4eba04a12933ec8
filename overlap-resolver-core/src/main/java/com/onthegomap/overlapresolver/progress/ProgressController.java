package com.onthegomap.overlapresolver.progress;

/**
 * Channel between a long-running resolution and its caller, used to report progress and to ask the resolution to stop
 * early.
 * <p>
 * Cancellation is cooperative: the resolver checks {@link #isCancelled()} before each overlap group and never stops in
 * the middle of one.
 */
public interface ProgressController {

  /** A controller that ignores progress and never cancels. */
  ProgressController NONE = new ProgressController() {
    @Override
    public void report(long completed, long total) {}

    @Override
    public boolean isCancelled() {
      return false;
    }
  };

  /** Called periodically with the number of features processed so far out of {@code total}. */
  void report(long completed, long total);

  /** Returns true if the caller wants processing to stop. */
  boolean isCancelled();
}
