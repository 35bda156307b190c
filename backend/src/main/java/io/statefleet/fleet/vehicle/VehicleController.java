package io.statefleet.fleet.vehicle;

import io.statefleet.fleet.vehicle.dto.VehicleRequest;
import io.statefleet.fleet.vehicle.dto.VehicleResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/vehicles")
public class VehicleController {

  private final VehicleService vehicleService;

  public VehicleController(VehicleService vehicleService) {
    this.vehicleService = vehicleService;
  }

  @GetMapping
  public ResponseEntity<List<VehicleResponse>> list(
      @RequestParam(defaultValue = "false") boolean activeOnly) {
    return ResponseEntity.ok(vehicleService.list(activeOnly));
  }

  @GetMapping("/{id}")
  public ResponseEntity<VehicleResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(vehicleService.get(id));
  }

  @PostMapping
  public ResponseEntity<VehicleResponse> create(@Valid @RequestBody VehicleRequest request) {
    var response = vehicleService.create(request);
    return ResponseEntity.created(URI.create("/api/vehicles/" + response.id())).body(response);
  }

  @PutMapping("/{id}")
  public ResponseEntity<VehicleResponse> update(
      @PathVariable UUID id, @Valid @RequestBody VehicleRequest request) {
    return ResponseEntity.ok(vehicleService.update(id, request));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deactivate(@PathVariable UUID id) {
    vehicleService.deactivate(id);
    return ResponseEntity.noContent().build();
  }
}
