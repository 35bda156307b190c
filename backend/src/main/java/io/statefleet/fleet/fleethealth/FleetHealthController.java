package io.statefleet.fleet.fleethealth;

import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for fleet-wide and per-vehicle health alerts. */
@RestController
public class FleetHealthController {

  private final FleetHealthService fleetHealthService;

  public FleetHealthController(FleetHealthService fleetHealthService) {
    this.fleetHealthService = fleetHealthService;
  }

  /**
   * Returns status counts for all active vehicles and the flagged ones, critical first, then by
   * issue count, then by vehicle code.
   */
  @GetMapping("/api/fleet/health")
  public ResponseEntity<FleetHealthReport> getFleetHealth() {
    return ResponseEntity.ok(fleetHealthService.getFleetHealth());
  }

  /** Returns NO_DATA, CLEAR or FLAGGED (with issues) for one vehicle. */
  @GetMapping("/api/vehicles/{vehicleId}/health")
  public ResponseEntity<VehicleHealthResult> getVehicleHealth(@PathVariable UUID vehicleId) {
    return ResponseEntity.ok(fleetHealthService.getVehicleHealth(vehicleId));
  }
}
