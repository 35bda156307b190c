package io.statefleet.fleet.inspection;

import io.statefleet.fleet.exception.InvalidStateException;
import io.statefleet.fleet.exception.ResourceNotFoundException;
import io.statefleet.fleet.fleethealth.ChecklistItemResult;
import io.statefleet.fleet.inspection.dto.CreateInspectionRequest;
import io.statefleet.fleet.inspection.dto.InspectionResponse;
import io.statefleet.fleet.vehicle.VehicleService;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Limit;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class InspectionService {

  private static final Logger log = LoggerFactory.getLogger(InspectionService.class);

  static final int MAX_REMARKS_LENGTH = 500;
  static final int VEHICLE_HISTORY_LIMIT = 200;

  private final InspectionRepository inspectionRepository;
  private final VehicleService vehicleService;
  private final Clock clock;

  public InspectionService(
      InspectionRepository inspectionRepository, VehicleService vehicleService, Clock clock) {
    this.inspectionRepository = inspectionRepository;
    this.vehicleService = vehicleService;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public List<InspectionResponse> listForVehicle(UUID vehicleId) {
    vehicleService.requireVehicle(vehicleId);
    return inspectionRepository
        .findByVehicleIdAndDeletedFalseOrderByInspectedAtDesc(
            vehicleId, Limit.of(VEHICLE_HISTORY_LIMIT))
        .stream()
        .map(InspectionResponse::from)
        .toList();
  }

  @Transactional
  public InspectionResponse create(CreateInspectionRequest request) {
    vehicleService.requireVehicle(request.vehicleId());
    validateChecklist(request.checklist());
    Instant now = clock.instant();
    Instant inspectedAt = request.inspectedAt() != null ? request.inspectedAt() : now;
    if (inspectedAt.isAfter(now)) {
      throw new InvalidStateException(
          "Invalid inspection date", "Inspection date " + inspectedAt + " is in the future");
    }

    var inspection =
        inspectionRepository.save(
            new Inspection(
                request.vehicleId(),
                inspectedAt,
                request.odometerKm(),
                request.driverName(),
                request.checklist(),
                now));

    log.info(
        "Recorded inspection: id={}, vehicleId={}, odometerKm={}, items={}",
        inspection.getId(),
        inspection.getVehicleId(),
        inspection.getOdometerKm(),
        inspection.getChecklist().size());
    return InspectionResponse.from(inspection);
  }

  @Transactional
  public void delete(UUID id) {
    var inspection =
        inspectionRepository
            .findById(id)
            .filter(i -> !i.isDeleted())
            .orElseThrow(() -> new ResourceNotFoundException("Inspection", id));
    inspection.markDeleted();
    inspectionRepository.save(inspection);

    log.info("Deleted inspection: id={}, vehicleId={}", id, inspection.getVehicleId());
  }

  private static void validateChecklist(Map<String, ChecklistItemResult> checklist) {
    checklist.forEach(
        (key, result) -> {
          if (key == null || key.isBlank()) {
            throw new InvalidStateException(
                "Invalid checklist", "Checklist item keys must not be blank");
          }
          if (result == null) {
            throw new InvalidStateException(
                "Invalid checklist", "Checklist item '" + key + "' has no outcome");
          }
          if (result.remarks().length() > MAX_REMARKS_LENGTH) {
            throw new InvalidStateException(
                "Invalid checklist",
                "Remarks for '" + key + "' exceed " + MAX_REMARKS_LENGTH + " characters");
          }
        });
  }
}
