package io.statefleet.fleet.inspection.dto;

import io.statefleet.fleet.fleethealth.ChecklistItemResult;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * @param inspectedAt when the inspection happened; defaults to now, may not be in the future
 * @param checklist item key to outcome
 */
public record CreateInspectionRequest(
    @NotNull UUID vehicleId,
    @NotNull @Min(0) Integer odometerKm,
    @Size(max = 200) String driverName,
    Instant inspectedAt,
    @NotNull Map<String, ChecklistItemResult> checklist) {}
