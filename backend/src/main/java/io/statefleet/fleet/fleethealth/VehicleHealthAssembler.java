package io.statefleet.fleet.fleethealth;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Deterministic rule-based vehicle health assessment.
 *
 * <p>Evaluates the rules below against a vehicle's inspection and maintenance history and returns
 * {@link VehicleHealthResult.NoData}, {@link VehicleHealthResult.Clear} or a {@link
 * VehicleHealthResult.Flagged} result whose status is the worst issue severity. Pure class with no
 * Spring dependencies; histories may be passed in any order.
 *
 * <p>Rules:
 *
 * <ol>
 *   <li>No inspections and no maintenance -> NO_DATA (terminal)
 *   <li>Maintenance but no inspection -> WARNING
 *   <li>Inspection overdue against the vehicle's own cadence, or fixed days without history ->
 *       WARNING / CRITICAL
 *   <li>Failed items on an inspection from the last few days -> WARNING, CRITICAL if safety item
 *   <li>Items failing repeatedly in the recent window -> WARNING, CRITICAL if safety item
 *   <li>Inspections but no service record -> WARNING
 *   <li>Service overdue -> WARNING / CRITICAL
 *   <li>Odometer gap since last service -> WARNING
 * </ol>
 */
public final class VehicleHealthAssembler {

  static final Comparator<InspectionRecord> INSPECTIONS_NEWEST_FIRST =
      Comparator.comparing(InspectionRecord::occurredAt)
          .thenComparing(InspectionRecord::id)
          .reversed();

  static final Comparator<MaintenanceRecord> MAINTENANCE_NEWEST_FIRST =
      Comparator.comparing(MaintenanceRecord::occurredAt)
          .thenComparing(MaintenanceRecord::id)
          .reversed();

  private final FleetHealthProperties properties;
  private final ChecklistFailureAggregator failureAggregator;
  private final OdometerGapDetector odometerGapDetector;

  public VehicleHealthAssembler(
      FleetHealthProperties properties, ChecklistLabelResolver labelResolver) {
    this.properties = properties;
    this.failureAggregator = new ChecklistFailureAggregator(properties, labelResolver);
    this.odometerGapDetector = new OdometerGapDetector(properties.odometerGapKm());
  }

  /**
   * Assesses one vehicle.
   *
   * @param vehicle the vehicle identity
   * @param inspections the vehicle's inspections, any order, may be empty
   * @param maintenance the vehicle's maintenance events, any order, may be empty
   * @param now the evaluation instant
   * @return the vehicle's health
   */
  public VehicleHealthResult assess(
      VehicleSummary vehicle,
      List<InspectionRecord> inspections,
      List<MaintenanceRecord> maintenance,
      Instant now) {
    List<InspectionRecord> inspectionHistory = newestFirst(inspections, INSPECTIONS_NEWEST_FIRST);
    List<MaintenanceRecord> maintenanceHistory =
        newestFirst(maintenance, MAINTENANCE_NEWEST_FIRST);

    // Rule 1: No data at all -- terminal
    if (inspectionHistory.isEmpty() && maintenanceHistory.isEmpty()) {
      return new VehicleHealthResult.NoData(vehicle.id());
    }

    InspectionRecord latestInspection = inspectionHistory.isEmpty() ? null : inspectionHistory.get(0);
    MaintenanceRecord latestMaintenance =
        maintenanceHistory.isEmpty() ? null : maintenanceHistory.get(0);
    Long daysSinceInspection =
        latestInspection == null
            ? null
            : InspectionIntervalAnalyzer.daysBetween(latestInspection.occurredAt(), now);
    Long daysSinceMaintenance =
        latestMaintenance == null
            ? null
            : InspectionIntervalAnalyzer.daysBetween(latestMaintenance.occurredAt(), now);

    List<HealthIssue> issues = new ArrayList<>();

    if (latestInspection == null) {
      // Rule 2: Maintenance exists but nothing was ever inspected
      issues.add(HealthIssue.warning("No inspection on record yet"));
    } else {
      // Rule 3: Inspection timing
      inspectionOverdue(inspectionHistory, daysSinceInspection).ifPresent(issues::add);
      // Rule 4: Recent failures
      failureAggregator
          .recentFailures(latestInspection, daysSinceInspection)
          .ifPresent(issues::add);
      // Rule 5: Recurring failures
      failureAggregator.recurringFailures(inspectionHistory).ifPresent(issues::add);

      // Rules 6-7: Maintenance is only judged once inspections prove the vehicle is in use
      if (latestMaintenance == null) {
        issues.add(HealthIssue.warning("No service record on record yet"));
      } else {
        maintenanceOverdue(latestMaintenance, daysSinceMaintenance).ifPresent(issues::add);
      }
    }

    // Rule 8: Odometer gap
    odometerGapDetector.detect(latestInspection, latestMaintenance).ifPresent(issues::add);

    if (issues.isEmpty()) {
      return new VehicleHealthResult.Clear(vehicle.id());
    }

    HealthStatus status = HealthStatus.WARNING;
    for (HealthIssue issue : issues) {
      status = escalate(status, issue.severity().toStatus());
    }

    return new VehicleHealthResult.Flagged(
        vehicle.id(),
        vehicle.code(),
        vehicle.brand(),
        vehicle.model(),
        status,
        issues,
        latestInspection == null ? null : latestInspection.occurredAt(),
        latestMaintenance == null ? null : latestMaintenance.occurredAt(),
        toInteger(daysSinceInspection),
        toInteger(daysSinceMaintenance));
  }

  private Optional<HealthIssue> inspectionOverdue(
      List<InspectionRecord> newestFirst, long daysSince) {
    Integer averageInterval = InspectionIntervalAnalyzer.averageIntervalDays(newestFirst);
    var policy = OverdueThresholdPolicy.forInspections(averageInterval, properties);
    return policy
        .evaluate(daysSince)
        .map(
            severity -> {
              if (!policy.isAdaptive()) {
                return new HealthIssue(severity, "No inspection in %d days".formatted(daysSince));
              }
              if (severity == IssueSeverity.CRITICAL) {
                return HealthIssue.critical(
                    "No inspection in %d days (typically every ~%d days)"
                        .formatted(daysSince, averageInterval));
              }
              return HealthIssue.warning(
                  "Due for inspection (%d days since last, typical interval ~%d days)"
                      .formatted(daysSince, averageInterval));
            });
  }

  private Optional<HealthIssue> maintenanceOverdue(MaintenanceRecord latest, long daysSince) {
    return OverdueThresholdPolicy.forMaintenance(properties)
        .evaluate(daysSince)
        .map(
            severity ->
                severity == IssueSeverity.CRITICAL
                    ? HealthIssue.critical("No service in %d days".formatted(daysSince))
                    : HealthIssue.warning(
                        "Last service %d days ago (%s)"
                            .formatted(
                                daysSince,
                                IssueFormat.shortDate(latest.occurredAt(), properties.zoneId()))));
  }

  private static <T> List<T> newestFirst(List<T> records, Comparator<T> order) {
    if (records == null || records.isEmpty()) {
      return List.of();
    }
    return records.stream().sorted(order).toList();
  }

  private static HealthStatus escalate(HealthStatus current, HealthStatus candidate) {
    return current.severity() >= candidate.severity() ? current : candidate;
  }

  private static Integer toInteger(Long days) {
    return days == null ? null : Math.toIntExact(days);
  }
}
