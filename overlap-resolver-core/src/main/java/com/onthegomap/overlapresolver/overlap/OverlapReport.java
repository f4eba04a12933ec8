package com.onthegomap.overlapresolver.overlap;

import com.onthegomap.overlapresolver.util.Format;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * A preview of the overlaps in the input before anything is resolved.
 *
 * @param overlaps       every overlapping pair in group order
 * @param groupCount     number of overlap groups
 * @param failedGroups   number of groups where an overlap region could not be computed
 * @param totalArea      sum of the area of every overlap region
 * @param subdivisions   number of overlaps that cover nearly all of one of their features
 */
public record OverlapReport(List<Overlap> overlaps, int groupCount, int failedGroups, double totalArea,
  int subdivisions) {

  public OverlapReport {
    overlaps = List.copyOf(overlaps);
  }

  /** Consumes every group from {@code groups} into a report. */
  public static OverlapReport of(Iterator<OverlapGroup> groups) {
    List<Overlap> overlaps = new ArrayList<>();
    int groupCount = 0;
    int failed = 0;
    double area = 0;
    int subdivisions = 0;
    while (groups.hasNext()) {
      OverlapGroup group = groups.next();
      groupCount++;
      if (group.failed()) {
        failed++;
      }
      for (Overlap overlap : group.overlaps()) {
        overlaps.add(overlap);
        area += overlap.area();
        if (overlap.isSubdivision()) {
          subdivisions++;
        }
      }
    }
    return new OverlapReport(overlaps, groupCount, failed, area, subdivisions);
  }

  /** Returns true if no two features overlap. */
  public boolean isEmpty() {
    return groupCount == 0;
  }

  /** Returns a one-line description of the overlaps for logging. */
  public String summary() {
    if (isEmpty()) {
      return "No overlaps found";
    }
    Format format = Format.defaultInstance();
    return "Found " + format.count(overlaps.size()) + " overlaps in " + format.count(groupCount) +
      " groups covering " + format.decimal(totalArea) + " square units, " + format.count(subdivisions) +
      " subdivisions" + (failedGroups > 0 ? ", " + failedGroups + " failed" : "");
  }
}
