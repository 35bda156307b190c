package io.statefleet.fleet.fleethealth;

import java.util.List;

/**
 * Fleet-wide health report. Only flagged vehicles are listed; sorted critical first, then by issue
 * count descending, then by vehicle code.
 */
public record FleetHealthReport(
    FleetHealthSummary summary, List<VehicleHealthResult.Flagged> vehicles) {

  public FleetHealthReport {
    vehicles = List.copyOf(vehicles);
  }
}
