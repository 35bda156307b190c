package io.statefleet.fleet.maintenance;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** Flat spend row per non-deleted service event, joined to its vehicle's code. */
public interface MaintenanceSpendProjection {

  UUID getVehicleId();

  String getVehicleCode();

  String getSupplierName();

  Instant getServicedAt();

  BigDecimal getAmount();
}
