package io.statefleet.fleet.fleethealth;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One inspection event as seen by the health engine. The checklist keeps the caller's key order,
 * which is the order failed items are listed in issue messages.
 *
 * @param id inspection id
 * @param vehicleId vehicle the inspection belongs to
 * @param occurredAt when the inspection took place
 * @param odometerKm odometer reading, never negative
 * @param checklist checklist item key to outcome; empty when no checklist was captured, keys never
 *     null or blank
 */
public record InspectionRecord(
    UUID id,
    UUID vehicleId,
    Instant occurredAt,
    int odometerKm,
    Map<String, ChecklistItemResult> checklist) {

  public InspectionRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(vehicleId, "vehicleId");
    Objects.requireNonNull(occurredAt, "occurredAt");
    if (odometerKm < 0) {
      throw new IllegalArgumentException(
          "Inspection " + id + " has negative odometer reading " + odometerKm);
    }
    if (checklist == null) {
      checklist = Map.of();
    } else {
      for (String key : checklist.keySet()) {
        if (key == null || key.isBlank()) {
          throw new IllegalArgumentException("Inspection " + id + " has a blank checklist key");
        }
      }
      checklist = Collections.unmodifiableMap(new LinkedHashMap<>(checklist));
    }
  }
}
