package com.onthegomap.overlapresolver.stats;

import java.time.Duration;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Measures the amount of wall time that a task takes.
 */
@ThreadSafe
public class Timer {

  private final long start;
  private volatile long end = -1;

  private Timer() {
    start = System.nanoTime();
  }

  public static Timer start() {
    return new Timer();
  }

  /**
   * Sets the end time to now, and makes {@link #running()} return false. Calling multiple times will extend the end
   * time.
   */
  public Timer stop() {
    synchronized (this) {
      end = System.nanoTime();
    }
    return this;
  }

  /** Returns {@code false} if {@link #stop()} has been called. */
  public boolean running() {
    synchronized (this) {
      return end < 0;
    }
  }

  /** Returns the time from start to now if the task is still running, or start to end if it has finished. */
  public Duration elapsed() {
    synchronized (this) {
      return Duration.ofNanos((end < 0 ? System.nanoTime() : end) - start);
    }
  }

  @Override
  public String toString() {
    return elapsed().toString();
  }
}
