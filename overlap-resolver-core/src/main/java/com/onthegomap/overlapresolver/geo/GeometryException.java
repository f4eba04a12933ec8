package com.onthegomap.overlapresolver.geo;

import com.onthegomap.overlapresolver.stats.Stats;
import java.util.ArrayList;
import java.util.Base64;
import java.util.function.Supplier;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKBWriter;
import org.locationtech.jts.io.WKTWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An error caused by a geometry that can't be repaired or can't take part in an overlay operation, which should only
 * stop processing of the features it belongs to instead of the entire run.
 */
public class GeometryException extends Exception {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeometryException.class);

  private final String stat;
  private final ArrayList<Supplier<String>> detailsSuppliers = new ArrayList<>();

  /**
   * Constructs a new exception with a detailed error message caused by {@code cause}.
   *
   * @param stat    string that uniquely defines this error that will be used to count number of occurrences in stats
   * @param message description of the error to log that should be detailed enough that you can find the offending
   *                geometry from it
   * @param cause   the original exception that was thrown
   */
  public GeometryException(String stat, String message, Throwable cause) {
    super(message, cause);
    this.stat = stat;
  }

  /** Constructs a new exception with a detailed error message. */
  public GeometryException(String stat, String message) {
    super(message);
    this.stat = stat;
  }

  public GeometryException addDetails(Supplier<String> detailsSupplier) {
    this.detailsSuppliers.add(detailsSupplier);
    return this;
  }

  /** Returns the unique code for this error condition to use for counting the number of occurrences in stats. */
  public String stat() {
    return stat;
  }

  /** Returns the message followed by each line of details that were attached to this error. */
  public String detailedMessage() {
    StringBuilder result = new StringBuilder(getMessage());
    for (var details : detailsSuppliers) {
      result.append("\n").append(details.get());
    }
    return result.toString();
  }

  /** Logs the error and increments a stat counter for this error. */
  public void log(Stats stats, String statPrefix, String logPrefix) {
    stats.dataError(statPrefix + "_" + stat());
    log(logPrefix);
  }

  /** Logs the error but does not increment any stats. */
  public void log(String logContext) {
    LOGGER.warn("{}: {}", logContext, getMessage());
    if (!detailsSuppliers.isEmpty() && LOGGER.isDebugEnabled()) {
      LOGGER.debug("{}: {}", logContext, detailedMessage(), getCause() == null ? this : getCause());
    }
  }

  public GeometryException addGeometryDetails(String original, Geometry geometry) {
    return addDetails(() -> {
      var wktWriter = new WKTWriter();
      var wkbWriter = new WKBWriter();
      var base64 = Base64.getEncoder();
      return """
        %s (wkt): %s
        %s (wkb): %s
        """.formatted(
        original, wktWriter.write(geometry),
        original, base64.encodeToString(wkbWriter.write(geometry))
      ).strip();
    });
  }
}
