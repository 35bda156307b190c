package io.statefleet.fleet.analytics.dto;

import java.util.List;

/**
 * Maintenance spend overview.
 *
 * @param monthly spend per month, oldest first
 * @param topSuppliers highest-spend suppliers, largest first
 * @param topVehicles highest-spend vehicles, largest first
 */
public record MaintenanceAnalytics(
    List<MonthlySpend> monthly, List<SupplierSpend> topSuppliers, List<VehicleSpend> topVehicles) {}
