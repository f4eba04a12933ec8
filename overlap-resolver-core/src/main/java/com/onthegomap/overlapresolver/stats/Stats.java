package com.onthegomap.overlapresolver.stats;

import com.onthegomap.overlapresolver.util.LogUtil;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A utility that collects and reports statistics about a resolution run that logs alone can't convey: how long each
 * stage took, how many features and groups were processed and how often each kind of bad input was encountered.
 */
public interface Stats {

  /** Returns a new stat collector that stores stats in-memory to report through {@link #printSummary()}. */
  static Stats inMemory() {
    return new InMemory();
  }

  /** Logs the time each stage has taken, the counters, and the number of each kind of data error. */
  default void printSummary() {
    Logger logger = LoggerFactory.getLogger(getClass());
    logger.info("");
    logger.info("-".repeat(40));
    timers().printSummary();
    logger.info("-".repeat(40));
    for (var entry : counters().entrySet()) {
      logger.info("\t{}\t{}", entry.getKey(), entry.getValue());
    }
    for (var entry : dataErrors().entrySet()) {
      logger.info("\terror {}\t{}", entry.getKey(), entry.getValue());
    }
  }

  /**
   * Records that a long-running stage with {@code name} has started and returns a handle to call when finished.
   * <p>
   * Also sets the "stage" prefix that shows up in the logs to {@code name}.
   */
  default Timers.Finishable startStage(String name) {
    LogUtil.setStage(name);
    var timer = timers().startTimer(name, true);
    return () -> {
      timer.stop();
      LogUtil.clearStage();
    };
  }

  /** Returns the timers for all stages started with {@link #startStage(String)}. */
  Timers timers();

  /** Returns and starts tracking a new counter with {@code name}. */
  Counter.Readable longCounter(String name);

  /** Returns the current value of every counter created through {@link #longCounter(String)}. */
  Map<String, Long> counters();

  /**
   * Records that an invalid input feature or intermediate geometry was encountered where {@code errorCode} can be
   * used to identify the kind of failure.
   */
  void dataError(String errorCode);

  /** Returns the number of times each {@code errorCode} passed to {@link #dataError(String)} was seen. */
  Map<String, Long> dataErrors();

  /**
   * A stat collector that stores top-level metrics in-memory to report through {@link #printSummary()}.
   */
  class InMemory implements Stats {

    /** use {@link #inMemory()} */
    private InMemory() {}

    private final Timers timers = new Timers();
    private final Map<String, Counter.Readable> counters = new ConcurrentSkipListMap<>();
    private final Map<String, AtomicLong> dataErrors = new ConcurrentHashMap<>();

    @Override
    public Timers timers() {
      return timers;
    }

    @Override
    public Counter.Readable longCounter(String name) {
      return counters.computeIfAbsent(name, n -> Counter.newSingleThreadCounter());
    }

    @Override
    public Map<String, Long> counters() {
      Map<String, Long> result = new TreeMap<>();
      counters.forEach((key, value) -> result.put(key, value.get()));
      return result;
    }

    @Override
    public void dataError(String errorCode) {
      dataErrors.computeIfAbsent(errorCode, code -> new AtomicLong()).incrementAndGet();
    }

    @Override
    public Map<String, Long> dataErrors() {
      Map<String, Long> result = new TreeMap<>();
      dataErrors.forEach((key, value) -> result.put(key, value.get()));
      return result;
    }
  }
}
