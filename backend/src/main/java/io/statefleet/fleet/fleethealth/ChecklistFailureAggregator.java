package io.statefleet.fleet.fleethealth;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds failed checklist items: those failed on the latest inspection, and those failing
 * repeatedly across a sliding window of recent inspections. A failure of any safety-critical item
 * makes the resulting issue critical. The two checks are independent and may both fire for the
 * same item.
 */
public final class ChecklistFailureAggregator {

  private final FleetHealthProperties properties;
  private final ChecklistLabelResolver labelResolver;

  public ChecklistFailureAggregator(
      FleetHealthProperties properties, ChecklistLabelResolver labelResolver) {
    this.properties = properties;
    this.labelResolver = labelResolver;
  }

  /**
   * Reports every failed item of the latest inspection, provided that inspection is at most
   * {@code recentFailureWindowDays} old.
   *
   * @param latest the most recent inspection
   * @param daysSinceLatest whole days elapsed since it
   */
  public Optional<HealthIssue> recentFailures(InspectionRecord latest, long daysSinceLatest) {
    if (daysSinceLatest > properties.recentFailureWindowDays()) {
      return Optional.empty();
    }
    List<String> failed = failedKeys(latest);
    if (failed.isEmpty()) {
      return Optional.empty();
    }
    String message =
        "Last inspection (%s): %s: %s"
            .formatted(
                IssueFormat.shortDate(latest.occurredAt(), properties.zoneId()),
                IssueFormat.plural(failed.size(), "issue"),
                labels(failed));
    return Optional.of(new HealthIssue(severityFor(failed), message));
  }

  /**
   * Reports items that failed at least {@code recurringMinCount} times within the {@code
   * recurringWindowSize} most recent inspections. Skipped entirely when the vehicle has fewer
   * inspections than the window.
   *
   * @param newestFirst a vehicle's inspections, sorted by occurrence descending
   */
  public Optional<HealthIssue> recurringFailures(List<InspectionRecord> newestFirst) {
    int window = properties.recurringWindowSize();
    if (newestFirst.size() < window) {
      return Optional.empty();
    }
    List<String> recurring = new ArrayList<>();
    failureCounts(newestFirst.subList(0, window))
        .forEach(
            (key, count) -> {
              if (count >= properties.recurringMinCount()) {
                recurring.add(key);
              }
            });
    if (recurring.isEmpty()) {
      return Optional.empty();
    }
    String message = "Recurring in last %d inspections: %s".formatted(window, labels(recurring));
    return Optional.of(new HealthIssue(severityFor(recurring), message));
  }

  static List<String> failedKeys(InspectionRecord inspection) {
    List<String> failed = new ArrayList<>();
    inspection
        .checklist()
        .forEach(
            (key, result) -> {
              if (result != null && !result.ok()) {
                failed.add(key);
              }
            });
    return failed;
  }

  /** Failure tally per key, in first-seen order. */
  static Map<String, Integer> failureCounts(List<InspectionRecord> window) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (InspectionRecord inspection : window) {
      for (String key : failedKeys(inspection)) {
        counts.merge(key, 1, Integer::sum);
      }
    }
    return counts;
  }

  private IssueSeverity severityFor(List<String> keys) {
    return IssueSeverity.escalatedIf(keys.stream().anyMatch(properties::isSafetyCritical));
  }

  private String labels(List<String> keys) {
    return String.join(", ", keys.stream().map(labelResolver::resolveLabel).toList());
  }
}
