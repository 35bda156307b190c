package io.statefleet.fleet.fleethealth;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One service event as seen by the health engine. Only the most recent record per vehicle is
 * scored.
 *
 * @param id maintenance event id
 * @param vehicleId vehicle the event belongs to
 * @param occurredAt when the service took place
 * @param odometerKm odometer reading at service, never negative
 */
public record MaintenanceRecord(UUID id, UUID vehicleId, Instant occurredAt, int odometerKm) {

  public MaintenanceRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(vehicleId, "vehicleId");
    Objects.requireNonNull(occurredAt, "occurredAt");
    if (odometerKm < 0) {
      throw new IllegalArgumentException(
          "Maintenance event " + id + " has negative odometer reading " + odometerKm);
    }
  }
}
