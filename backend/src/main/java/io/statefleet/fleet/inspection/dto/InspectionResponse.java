package io.statefleet.fleet.inspection.dto;

import io.statefleet.fleet.fleethealth.ChecklistItemResult;
import io.statefleet.fleet.inspection.Inspection;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record InspectionResponse(
    UUID id,
    UUID vehicleId,
    Instant inspectedAt,
    int odometerKm,
    String driverName,
    Map<String, ChecklistItemResult> checklist,
    long failedItems) {

  public static InspectionResponse from(Inspection inspection) {
    return new InspectionResponse(
        inspection.getId(),
        inspection.getVehicleId(),
        inspection.getInspectedAt(),
        inspection.getOdometerKm(),
        inspection.getDriverName(),
        inspection.getChecklist(),
        inspection.getChecklist().values().stream().filter(item -> !item.ok()).count());
  }
}
