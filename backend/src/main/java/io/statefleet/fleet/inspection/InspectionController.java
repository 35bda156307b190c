package io.statefleet.fleet.inspection;

import io.statefleet.fleet.inspection.dto.CreateInspectionRequest;
import io.statefleet.fleet.inspection.dto.InspectionResponse;
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
public class InspectionController {

  private final InspectionService inspectionService;

  public InspectionController(InspectionService inspectionService) {
    this.inspectionService = inspectionService;
  }

  @GetMapping("/api/vehicles/{vehicleId}/inspections")
  public ResponseEntity<List<InspectionResponse>> listForVehicle(@PathVariable UUID vehicleId) {
    return ResponseEntity.ok(inspectionService.listForVehicle(vehicleId));
  }

  @PostMapping("/api/inspections")
  public ResponseEntity<InspectionResponse> create(
      @Valid @RequestBody CreateInspectionRequest request) {
    var response = inspectionService.create(request);
    return ResponseEntity.created(URI.create("/api/inspections/" + response.id())).body(response);
  }

  @DeleteMapping("/api/inspections/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    inspectionService.delete(id);
    return ResponseEntity.noContent().build();
  }
}
