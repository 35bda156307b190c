package io.statefleet.fleet.fleethealth;

import java.util.Optional;

/**
 * Flags vehicles driven too far since their last service. The gap is the latest inspection
 * reading minus the latest maintenance reading; a negative gap (service logged with a higher
 * reading) never fires.
 */
public final class OdometerGapDetector {

  private final int gapThresholdKm;

  public OdometerGapDetector(int gapThresholdKm) {
    this.gapThresholdKm = gapThresholdKm;
  }

  public Optional<HealthIssue> detect(
      InspectionRecord latestInspection, MaintenanceRecord latestMaintenance) {
    if (latestInspection == null || latestMaintenance == null) {
      return Optional.empty();
    }
    long gap = (long) latestInspection.odometerKm() - latestMaintenance.odometerKm();
    if (gap < gapThresholdKm) {
      return Optional.empty();
    }
    return Optional.of(
        HealthIssue.warning(
            "%s km driven since last service (at %s km)"
                .formatted(
                    IssueFormat.km(gap), IssueFormat.km(latestMaintenance.odometerKm()))));
  }
}
