package io.statefleet.fleet.maintenance;

import io.statefleet.fleet.exception.InvalidStateException;
import io.statefleet.fleet.exception.ResourceNotFoundException;
import io.statefleet.fleet.maintenance.dto.CreateMaintenanceRequest;
import io.statefleet.fleet.maintenance.dto.MaintenanceResponse;
import io.statefleet.fleet.vehicle.VehicleService;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Limit;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class MaintenanceService {

  private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

  static final int VEHICLE_HISTORY_LIMIT = 200;

  private final MaintenanceEventRepository maintenanceEventRepository;
  private final VehicleService vehicleService;
  private final Clock clock;

  public MaintenanceService(
      MaintenanceEventRepository maintenanceEventRepository,
      VehicleService vehicleService,
      Clock clock) {
    this.maintenanceEventRepository = maintenanceEventRepository;
    this.vehicleService = vehicleService;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public List<MaintenanceResponse> listForVehicle(UUID vehicleId) {
    vehicleService.requireVehicle(vehicleId);
    return maintenanceEventRepository
        .findByVehicleIdAndDeletedFalseOrderByServicedAtDesc(
            vehicleId, Limit.of(VEHICLE_HISTORY_LIMIT))
        .stream()
        .map(MaintenanceResponse::from)
        .toList();
  }

  @Transactional
  public MaintenanceResponse create(CreateMaintenanceRequest request) {
    vehicleService.requireVehicle(request.vehicleId());
    Instant now = clock.instant();
    Instant servicedAt = request.servicedAt() != null ? request.servicedAt() : now;
    if (servicedAt.isAfter(now)) {
      throw new InvalidStateException(
          "Invalid service date", "Service date " + servicedAt + " is in the future");
    }

    var event =
        maintenanceEventRepository.save(
            new MaintenanceEvent(
                request.vehicleId(),
                servicedAt,
                request.odometerKm(),
                request.billNumber().trim(),
                request.supplierName().trim(),
                request.amount().setScale(2, RoundingMode.HALF_UP),
                request.remarks(),
                now));

    log.info(
        "Recorded maintenance: id={}, vehicleId={}, odometerKm={}, supplier={}",
        event.getId(),
        event.getVehicleId(),
        event.getOdometerKm(),
        event.getSupplierName());
    return MaintenanceResponse.from(event);
  }

  @Transactional
  public void delete(UUID id) {
    var event =
        maintenanceEventRepository
            .findById(id)
            .filter(e -> !e.isDeleted())
            .orElseThrow(() -> new ResourceNotFoundException("MaintenanceEvent", id));
    event.markDeleted();
    maintenanceEventRepository.save(event);

    log.info("Deleted maintenance event: id={}, vehicleId={}", id, event.getVehicleId());
  }
}
