package io.statefleet.fleet.fleethealth;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Health of a single vehicle. Exactly one of {@link NoData} (no inspections and no maintenance),
 * {@link Clear} (history exists, nothing crossed a threshold) or {@link Flagged}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = VehicleHealthResult.NoData.class, name = "NO_DATA"),
  @JsonSubTypes.Type(value = VehicleHealthResult.Clear.class, name = "CLEAR"),
  @JsonSubTypes.Type(value = VehicleHealthResult.Flagged.class, name = "FLAGGED")
})
public sealed interface VehicleHealthResult
    permits VehicleHealthResult.NoData, VehicleHealthResult.Clear, VehicleHealthResult.Flagged {

  UUID vehicleId();

  record NoData(UUID vehicleId) implements VehicleHealthResult {}

  record Clear(UUID vehicleId) implements VehicleHealthResult {}

  /**
   * A vehicle with at least one issue.
   *
   * @param status CRITICAL iff any issue is critical, otherwise WARNING
   * @param issues issues in detection order, never empty
   * @param lastInspectionAt most recent inspection, null if none
   * @param lastMaintenanceAt most recent service, null if none
   * @param daysSinceInspection whole days since the most recent inspection, null if none
   * @param daysSinceMaintenance whole days since the most recent service, null if none
   */
  record Flagged(
      UUID vehicleId,
      String vehicleCode,
      String brand,
      String model,
      HealthStatus status,
      List<HealthIssue> issues,
      Instant lastInspectionAt,
      Instant lastMaintenanceAt,
      Integer daysSinceInspection,
      Integer daysSinceMaintenance)
      implements VehicleHealthResult {

    public Flagged {
      Objects.requireNonNull(status, "status");
      if (issues == null || issues.isEmpty()) {
        throw new IllegalArgumentException("A flagged vehicle must carry at least one issue");
      }
      issues = List.copyOf(issues);
      HealthStatus derived =
          issues.stream().anyMatch(HealthIssue::isCritical)
              ? HealthStatus.CRITICAL
              : HealthStatus.WARNING;
      if (status != derived) {
        throw new IllegalArgumentException(
            "Status " + status + " does not match issues; expected " + derived);
      }
    }
  }
}
