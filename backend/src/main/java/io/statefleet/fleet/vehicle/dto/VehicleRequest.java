package io.statefleet.fleet.vehicle.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record VehicleRequest(
    @NotBlank @Size(max = 50) String vehicleCode,
    @Size(max = 100) String brand,
    @Size(max = 100) String model,
    @Min(1900) @Max(2100) Integer year,
    @Size(max = 1000) String notes,
    Boolean active) {}
