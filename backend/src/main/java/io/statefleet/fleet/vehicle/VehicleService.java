package io.statefleet.fleet.vehicle;

import io.statefleet.fleet.exception.ResourceConflictException;
import io.statefleet.fleet.exception.ResourceNotFoundException;
import io.statefleet.fleet.vehicle.dto.VehicleRequest;
import io.statefleet.fleet.vehicle.dto.VehicleResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Vehicle register. Vehicles are deactivated rather than deleted to keep their history. */
@Service
public class VehicleService {

  private static final Logger log = LoggerFactory.getLogger(VehicleService.class);

  private final VehicleRepository vehicleRepository;
  private final Clock clock;

  public VehicleService(VehicleRepository vehicleRepository, Clock clock) {
    this.vehicleRepository = vehicleRepository;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public List<VehicleResponse> list(boolean activeOnly) {
    var vehicles =
        activeOnly
            ? vehicleRepository.findByActiveTrueOrderByVehicleCodeAsc()
            : vehicleRepository.findAllByOrderByVehicleCodeAsc();
    return vehicles.stream().map(VehicleResponse::from).toList();
  }

  @Transactional(readOnly = true)
  public VehicleResponse get(UUID id) {
    return VehicleResponse.from(requireVehicle(id));
  }

  @Transactional
  public VehicleResponse create(VehicleRequest request) {
    String code = request.vehicleCode().trim();
    vehicleRepository
        .findByVehicleCode(code)
        .ifPresent(
            existing -> {
              throw duplicateCode(code);
            });

    Instant now = clock.instant();
    var vehicle = new Vehicle(code, request.brand(), request.model(), now);
    vehicle.updateDetails(
        code, request.brand(), request.model(), request.year(), request.notes(), now);
    if (Boolean.FALSE.equals(request.active())) {
      vehicle.setActive(false, now);
    }
    vehicle = vehicleRepository.save(vehicle);

    log.info("Created vehicle: id={}, code={}", vehicle.getId(), vehicle.getVehicleCode());
    return VehicleResponse.from(vehicle);
  }

  @Transactional
  public VehicleResponse update(UUID id, VehicleRequest request) {
    var vehicle = requireVehicle(id);
    String code = request.vehicleCode().trim();
    vehicleRepository
        .findByVehicleCode(code)
        .filter(other -> !other.getId().equals(id))
        .ifPresent(
            other -> {
              throw duplicateCode(code);
            });

    Instant now = clock.instant();
    vehicle.updateDetails(
        code, request.brand(), request.model(), request.year(), request.notes(), now);
    if (request.active() != null) {
      vehicle.setActive(request.active(), now);
    }
    vehicle = vehicleRepository.save(vehicle);

    log.info("Updated vehicle: id={}, code={}", vehicle.getId(), vehicle.getVehicleCode());
    return VehicleResponse.from(vehicle);
  }

  @Transactional
  public void deactivate(UUID id) {
    var vehicle = requireVehicle(id);
    vehicle.setActive(false, clock.instant());
    vehicleRepository.save(vehicle);

    log.info("Deactivated vehicle: id={}, code={}", vehicle.getId(), vehicle.getVehicleCode());
  }

  /** Loads a vehicle or fails with 404. Shared by the inspection and maintenance logs. */
  @Transactional(readOnly = true)
  public Vehicle requireVehicle(UUID id) {
    return vehicleRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Vehicle", id));
  }

  private static ResourceConflictException duplicateCode(String code) {
    return new ResourceConflictException(
        "Duplicate vehicle code", "A vehicle with code '" + code + "' already exists");
  }
}
