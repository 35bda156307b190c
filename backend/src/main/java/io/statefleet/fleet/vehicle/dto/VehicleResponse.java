package io.statefleet.fleet.vehicle.dto;

import io.statefleet.fleet.vehicle.Vehicle;
import java.time.Instant;
import java.util.UUID;

public record VehicleResponse(
    UUID id,
    String vehicleCode,
    String brand,
    String model,
    Integer year,
    String notes,
    boolean active,
    Instant createdAt,
    Instant updatedAt) {

  public static VehicleResponse from(Vehicle vehicle) {
    return new VehicleResponse(
        vehicle.getId(),
        vehicle.getVehicleCode(),
        vehicle.getBrand(),
        vehicle.getModel(),
        vehicle.getYear(),
        vehicle.getNotes(),
        vehicle.isActive(),
        vehicle.getCreatedAt(),
        vehicle.getUpdatedAt());
  }
}
