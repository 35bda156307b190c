package io.statefleet.fleet.maintenance;

import io.statefleet.fleet.maintenance.dto.CreateMaintenanceRequest;
import io.statefleet.fleet.maintenance.dto.MaintenanceResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MaintenanceController {

  private final MaintenanceService maintenanceService;

  public MaintenanceController(MaintenanceService maintenanceService) {
    this.maintenanceService = maintenanceService;
  }

  @GetMapping("/api/vehicles/{vehicleId}/maintenance")
  public ResponseEntity<List<MaintenanceResponse>> listForVehicle(@PathVariable UUID vehicleId) {
    return ResponseEntity.ok(maintenanceService.listForVehicle(vehicleId));
  }

  @PostMapping("/api/maintenance")
  public ResponseEntity<MaintenanceResponse> create(
      @Valid @RequestBody CreateMaintenanceRequest request) {
    var response = maintenanceService.create(request);
    return ResponseEntity.created(URI.create("/api/maintenance/" + response.id())).body(response);
  }

  @DeleteMapping("/api/maintenance/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    maintenanceService.delete(id);
    return ResponseEntity.noContent().build();
  }
}
