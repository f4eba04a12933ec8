package com.onthegomap.overlapresolver.stats;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * A {@code long} value that only goes up, like the number of features visited or groups resolved so far.
 */
public interface Counter {

  default void inc() {
    incBy(1);
  }

  void incBy(long value);

  /** A counter that lets clients get the current value. */
  interface Readable extends Counter, LongSupplier {

    long get();

    @Override
    default long getAsLong() {
      return get();
    }
  }

  /**
   * Returns a counter that is optimized for updates from a single thread, but still thread safe for reads from a
   * different thread, like a progress logger.
   */
  static Readable newSingleThreadCounter() {
    return new SingleThreadCounter();
  }

  /** Counter optimized for updates from a single thread, but still safe for reads from multiple threads. */
  class SingleThreadCounter implements Readable {

    private SingleThreadCounter() {}

    private final AtomicLong counter = new AtomicLong(0);

    @Override
    public void incBy(long value) {
      counter.addAndGet(value);
    }

    @Override
    public long get() {
      return counter.get();
    }
  }
}
