package io.statefleet.fleet.fleethealth;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/** Builders for engine inputs relative to a fixed evaluation instant. */
final class HealthFixtures {

  static final Instant NOW = Instant.parse("2025-03-15T12:00:00Z");

  private HealthFixtures() {}

  static VehicleSummary vehicle(String code) {
    return new VehicleSummary(UUID.randomUUID(), code, "TOYOTA", "INNOVA CRYSTA");
  }

  static Instant daysAgo(long days) {
    return NOW.minus(Duration.ofDays(days));
  }

  static InspectionRecord inspection(VehicleSummary vehicle, long daysAgo) {
    return inspection(vehicle, daysAgo, 10_000, Map.of());
  }

  static InspectionRecord inspection(
      VehicleSummary vehicle, long daysAgo, int odometerKm, Map<String, ChecklistItemResult> items) {
    return new InspectionRecord(
        UUID.randomUUID(), vehicle.id(), daysAgo(daysAgo), odometerKm, items);
  }

  static InspectionRecord failing(VehicleSummary vehicle, long daysAgo, String... failedKeys) {
    Map<String, ChecklistItemResult> items = new LinkedHashMap<>();
    items.put("horn", ChecklistItemResult.passed());
    for (String key : failedKeys) {
      items.put(key, ChecklistItemResult.failed("needs attention"));
    }
    return inspection(vehicle, daysAgo, 10_000, items);
  }

  static MaintenanceRecord maintenance(VehicleSummary vehicle, long daysAgo) {
    return maintenance(vehicle, daysAgo, 10_000);
  }

  static MaintenanceRecord maintenance(VehicleSummary vehicle, long daysAgo, int odometerKm) {
    return new MaintenanceRecord(UUID.randomUUID(), vehicle.id(), daysAgo(daysAgo), odometerKm);
  }
}
