package io.statefleet.fleet.analytics.dto;

import java.math.BigDecimal;
import java.util.UUID;

/** Maintenance spend for one vehicle. {@code vehicleCode} is null if the vehicle row is gone. */
public record VehicleSpend(UUID vehicleId, String vehicleCode, BigDecimal total) {}
