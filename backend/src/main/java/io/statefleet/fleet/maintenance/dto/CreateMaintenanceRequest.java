package io.statefleet.fleet.maintenance.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record CreateMaintenanceRequest(
    @NotNull UUID vehicleId,
    @NotNull @Min(0) Integer odometerKm,
    @NotBlank @Size(max = 100) String billNumber,
    @NotBlank @Size(max = 200) String supplierName,
    @NotNull @DecimalMin("0.00") BigDecimal amount,
    @NotBlank @Size(max = 5000) String remarks,
    Instant servicedAt) {}
