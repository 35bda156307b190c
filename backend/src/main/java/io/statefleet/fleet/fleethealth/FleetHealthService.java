package io.statefleet.fleet.fleethealth;

import io.statefleet.fleet.checklist.ChecklistItemService;
import io.statefleet.fleet.exception.ResourceNotFoundException;
import io.statefleet.fleet.inspection.Inspection;
import io.statefleet.fleet.inspection.InspectionRepository;
import io.statefleet.fleet.maintenance.MaintenanceEvent;
import io.statefleet.fleet.maintenance.MaintenanceEventRepository;
import io.statefleet.fleet.vehicle.Vehicle;
import io.statefleet.fleet.vehicle.VehicleRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Limit;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Loads vehicle, inspection and maintenance history and runs the health engine over it. Results
 * are recomputed on every call and never stored.
 */
@Service
public class FleetHealthService {

  private static final Logger log = LoggerFactory.getLogger(FleetHealthService.class);

  private final VehicleRepository vehicleRepository;
  private final InspectionRepository inspectionRepository;
  private final MaintenanceEventRepository maintenanceEventRepository;
  private final ChecklistItemService checklistItemService;
  private final FleetHealthProperties properties;
  private final Clock clock;

  public FleetHealthService(
      VehicleRepository vehicleRepository,
      InspectionRepository inspectionRepository,
      MaintenanceEventRepository maintenanceEventRepository,
      ChecklistItemService checklistItemService,
      FleetHealthProperties properties,
      Clock clock) {
    this.vehicleRepository = vehicleRepository;
    this.inspectionRepository = inspectionRepository;
    this.maintenanceEventRepository = maintenanceEventRepository;
    this.checklistItemService = checklistItemService;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Computes the health report for every active vehicle. History is capped at the most recent
   * {@code fleet.health.history-limit} inspections and maintenance events fleet-wide.
   */
  @Transactional(readOnly = true)
  public FleetHealthReport getFleetHealth() {
    Instant now = clock.instant();
    var limit = Limit.of(properties.historyLimit());

    List<VehicleSummary> vehicles =
        vehicleRepository.findByActiveTrueOrderByVehicleCodeAsc().stream()
            .map(FleetHealthService::toSummary)
            .toList();
    Map<UUID, List<InspectionRecord>> inspectionsByVehicle =
        inspectionRepository.findByDeletedFalseOrderByInspectedAtDesc(limit).stream()
            .map(Inspection::toRecord)
            .collect(Collectors.groupingBy(InspectionRecord::vehicleId));
    Map<UUID, List<MaintenanceRecord>> maintenanceByVehicle =
        maintenanceEventRepository.findByDeletedFalseOrderByServicedAtDesc(limit).stream()
            .map(MaintenanceEvent::toRecord)
            .collect(Collectors.groupingBy(MaintenanceRecord::vehicleId));

    var report =
        new FleetHealthAggregator(assembler())
            .aggregate(vehicles, inspectionsByVehicle, maintenanceByVehicle, now);

    var summary = report.summary();
    log.debug(
        "Computed fleet health: active={}, critical={}, warning={}, ok={}, noData={}",
        summary.totalActive(),
        summary.critical(),
        summary.warning(),
        summary.ok(),
        summary.noData());
    return report;
  }

  /** Computes the health of one vehicle, active or not. */
  @Transactional(readOnly = true)
  public VehicleHealthResult getVehicleHealth(UUID vehicleId) {
    var vehicle =
        vehicleRepository
            .findById(vehicleId)
            .orElseThrow(() -> new ResourceNotFoundException("Vehicle", vehicleId));
    var limit = Limit.of(properties.historyLimit());

    List<InspectionRecord> inspections =
        inspectionRepository
            .findByVehicleIdAndDeletedFalseOrderByInspectedAtDesc(vehicleId, limit)
            .stream()
            .map(Inspection::toRecord)
            .toList();
    List<MaintenanceRecord> maintenance =
        maintenanceEventRepository
            .findByVehicleIdAndDeletedFalseOrderByServicedAtDesc(vehicleId, limit)
            .stream()
            .map(MaintenanceEvent::toRecord)
            .toList();

    return assembler().assess(toSummary(vehicle), inspections, maintenance, clock.instant());
  }

  private VehicleHealthAssembler assembler() {
    return new VehicleHealthAssembler(properties, checklistItemService.labelResolver());
  }

  private static VehicleSummary toSummary(Vehicle vehicle) {
    return new VehicleSummary(
        vehicle.getId(), vehicle.getVehicleCode(), vehicle.getBrand(), vehicle.getModel());
  }
}
