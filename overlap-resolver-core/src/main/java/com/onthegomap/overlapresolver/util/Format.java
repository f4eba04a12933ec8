package com.onthegomap.overlapresolver.util;

import java.text.NumberFormat;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.StringUtils;

/**
 * Locale-aware formatting for the feature counts, rates, percentages, areas and stage durations that show up in
 * progress logs and run summaries.
 */
public class Format {

  public static final Locale DEFAULT_LOCALE = Locale.getDefault(Locale.Category.FORMAT);

  /** Width of a padded count or percentage, wide enough for "999k" or "100%". */
  private static final int COLUMN_WIDTH = 4;
  private static final String[] COUNT_SUFFIXES = {"", "k", "M", "B", "T"};
  private static final ConcurrentMap<Locale, Format> instances = new ConcurrentHashMap<>();

  // NumberFormat instances are not thread safe
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> percentFormat;
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> decimalFormat;

  private Format(Locale locale) {
    percentFormat = ThreadLocal.withInitial(() -> {
      var f = NumberFormat.getPercentInstance(locale);
      f.setMaximumFractionDigits(0);
      return f;
    });
    decimalFormat = ThreadLocal.withInitial(() -> {
      var f = NumberFormat.getNumberInstance(locale);
      f.setMaximumFractionDigits(1);
      return f;
    });
  }

  public static Format forLocale(Locale locale) {
    return instances.computeIfAbsent(locale, Format::new);
  }

  public static Format defaultInstance() {
    return forLocale(DEFAULT_LOCALE);
  }

  public static String padLeft(String str, int size) {
    return StringUtils.leftPad(str, size);
  }

  public static String padRight(String str, int size) {
    return StringUtils.rightPad(str, size);
  }

  /** Returns a count abbreviated to at most 3 significant digits, like "999", "1.2k" or "25M". */
  public String count(double value) {
    return count(value, false);
  }

  /**
   * Returns a count abbreviated like {@link #count(double)}, left-padded to a fixed width when {@code pad} is true so
   * that successive progress lines stay aligned.
   */
  public String count(double value, boolean pad) {
    String result;
    if (value < 0) {
      result = "-";
    } else if (value > 0 && value < 1) {
      result = "<1";
    } else {
      long whole = (long) value;
      int tier = 0;
      long unit = 1;
      while (tier < COUNT_SUFFIXES.length - 1 && whole >= unit * 1000) {
        unit *= 1000;
        tier++;
      }
      if (tier == 0) {
        result = Long.toString(whole);
      } else {
        long tenths = whole / (unit / 10);
        boolean showTenths = tenths < 100 && tenths % 10 != 0;
        result = (showTenths ? decimal(tenths / 10d) : Long.toString(tenths / 10)) + COUNT_SUFFIXES[tier];
      }
    }
    return pad ? padLeft(result, COLUMN_WIDTH) : result;
  }

  /** Returns {@code completed} out of {@code total} as a padded whole percentage, "100%" when total is 0. */
  public String progress(long completed, long total) {
    return padLeft(percent(total == 0 ? 1 : 1d * completed / total), COLUMN_WIDTH);
  }

  /** Returns 0.0-1.0 as "0%" - "100%" with no decimal points. */
  public String percent(double ratio) {
    return percentFormat.get().format(ratio);
  }

  /** Returns a number with at most 1 decimal point, used for areas. */
  public String decimal(double value) {
    return decimalFormat.get().format(value);
  }

  /** Returns a stage duration like "0.2s", "59s", "1m1s" or "2h3m". */
  public String duration(Duration duration) {
    long nanos = duration.toNanos();
    if (nanos < TimeUnit.SECONDS.toNanos(1)) {
      return decimal(nanos / 1e9) + "s";
    }
    long seconds = Math.round(nanos / 1e9);
    long hours = seconds / 3600;
    long minutes = (seconds % 3600) / 60;
    long secs = seconds % 60;
    StringBuilder result = new StringBuilder();
    if (hours > 0) {
      result.append(hours).append('h');
    }
    if (minutes > 0) {
      result.append(minutes).append('m');
    }
    if (secs > 0) {
      result.append(secs).append('s');
    }
    return result.toString();
  }
}
