package com.onthegomap.overlapresolver.resolve;

import com.onthegomap.overlapresolver.feature.FeatureKey;
import com.onthegomap.overlapresolver.geo.GeometryException;

/**
 * A problem encountered while loading or resolving features, with enough context to find the offending input.
 *
 * @param kind    category of the problem
 * @param groupId id of the overlap group being resolved, or {@link #NO_GROUP} if it happened outside of one
 * @param feature the feature involved, or null if the problem is not specific to one feature
 * @param message description of the problem
 */
public record ResolutionError(Kind kind, long groupId, FeatureKey feature, String message) {

  public static final long NO_GROUP = -1;

  public enum Kind {
    /** A geometry could not be repaired or failed an overlay operation, only its group is affected. */
    INVALID_GEOMETRY,
    /** A datetime value was missing or unparseable so the feature cannot win, processing continues. */
    UNPARSEABLE_DATETIME,
    /** The configuration does not fit the input, nothing was resolved. */
    CONFIGURATION
  }

  public static ResolutionError invalidGeometry(long groupId, FeatureKey feature, GeometryException e) {
    return new ResolutionError(Kind.INVALID_GEOMETRY, groupId, feature, e.getMessage());
  }

  public static ResolutionError unparseableDatetime(FeatureKey feature, String field, Object value) {
    String message = value == null ?
      ("Missing datetime value in field '" + field + "'") :
      ("Unable to parse datetime value '" + value + "' in field '" + field + "'");
    return new ResolutionError(Kind.UNPARSEABLE_DATETIME, NO_GROUP, feature, message);
  }

  public static ResolutionError configuration(String message) {
    return new ResolutionError(Kind.CONFIGURATION, NO_GROUP, null, message);
  }

  public boolean hasGroup() {
    return groupId != NO_GROUP;
  }

  @Override
  public String toString() {
    return kind + (hasGroup() ? " group=" + groupId : "") + (feature == null ? "" : " feature=" + feature) + ": " +
      message;
  }
}
