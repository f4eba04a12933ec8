package com.onthegomap.overlapresolver.progress;

import com.onthegomap.overlapresolver.util.Format;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs "name: [ numCompleted pctComplete% rate/s ]" at most once per interval, and always when the task finishes,
 * then forwards to another controller.
 */
public class LoggingProgress implements ProgressController {

  private static final Logger LOGGER = LoggerFactory.getLogger(LoggingProgress.class);

  private final String name;
  private final long intervalNanos;
  private final ProgressController delegate;
  private final Format format;
  private long lastTime;
  private long lastValue = 0;

  public LoggingProgress(String name, Duration interval, ProgressController delegate) {
    this(name, interval, delegate, Format.DEFAULT_LOCALE);
  }

  LoggingProgress(String name, Duration interval, ProgressController delegate, Locale locale) {
    this.format = Format.forLocale(locale);
    this.name = name;
    this.intervalNanos = interval.toNanos();
    this.delegate = delegate;
    this.lastTime = System.nanoTime();
  }

  @Override
  public void report(long completed, long total) {
    long now = System.nanoTime();
    if (now - lastTime >= intervalNanos || (completed >= total && completed != lastValue)) {
      LOGGER.info("{}: {}", name, format(completed, total, now));
    }
    delegate.report(completed, total);
  }

  String format(long completed, long total, long now) {
    double timeDiff = Math.max(1, now - lastTime) * 1d / TimeUnit.SECONDS.toNanos(1);
    double valueDiff = Math.max(0, completed - lastValue);
    lastTime = now;
    lastValue = completed;
    return "[ " + format.count(completed, true) + " " + format.progress(completed, total) + " " +
      format.count(valueDiff / timeDiff, true) + "/s ]";
  }

  @Override
  public boolean isCancelled() {
    return delegate.isCancelled();
  }
}
