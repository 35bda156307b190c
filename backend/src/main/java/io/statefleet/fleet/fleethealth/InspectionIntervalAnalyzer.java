package io.statefleet.fleet.fleethealth;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/** Derives a vehicle's typical inspection cadence from its own history. */
public final class InspectionIntervalAnalyzer {

  private static final long MILLIS_PER_DAY = 86_400_000L;

  private InspectionIntervalAnalyzer() {}

  /**
   * Computes the mean gap in whole days between consecutive inspections, rounded to the nearest
   * day. Input order does not matter.
   *
   * @param inspections a vehicle's inspections
   * @return the average interval, or null when fewer than two inspections exist
   */
  public static Integer averageIntervalDays(List<InspectionRecord> inspections) {
    if (inspections == null || inspections.size() < 2) {
      return null;
    }
    List<Instant> ascending =
        inspections.stream()
            .map(InspectionRecord::occurredAt)
            .sorted(Comparator.naturalOrder())
            .toList();
    long total = 0;
    for (int i = 1; i < ascending.size(); i++) {
      total += daysBetween(ascending.get(i - 1), ascending.get(i));
    }
    return (int) Math.round((double) total / (ascending.size() - 1));
  }

  /** Whole days from {@code from} to {@code to}, floored; negative when {@code to} is earlier. */
  public static long daysBetween(Instant from, Instant to) {
    return Math.floorDiv(to.toEpochMilli() - from.toEpochMilli(), MILLIS_PER_DAY);
  }
}
