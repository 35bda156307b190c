package io.statefleet.fleet.maintenance.dto;

import io.statefleet.fleet.maintenance.MaintenanceEvent;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record MaintenanceResponse(
    UUID id,
    UUID vehicleId,
    Instant servicedAt,
    int odometerKm,
    String billNumber,
    String supplierName,
    BigDecimal amount,
    String remarks) {

  public static MaintenanceResponse from(MaintenanceEvent event) {
    return new MaintenanceResponse(
        event.getId(),
        event.getVehicleId(),
        event.getServicedAt(),
        event.getOdometerKm(),
        event.getBillNumber(),
        event.getSupplierName(),
        event.getAmount(),
        event.getRemarks());
  }
}
