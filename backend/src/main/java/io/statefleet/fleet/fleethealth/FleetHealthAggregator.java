package io.statefleet.fleet.fleethealth;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Runs the vehicle assessment over a fleet, counts outcomes and orders the flagged vehicles. */
public final class FleetHealthAggregator {

  /** Critical first, then most issues, then vehicle code (case-sensitive). */
  public static final Comparator<VehicleHealthResult.Flagged> FLAGGED_ORDER =
      Comparator.comparingInt((VehicleHealthResult.Flagged f) -> f.status().severity())
          .reversed()
          .thenComparing(
              Comparator.comparingInt((VehicleHealthResult.Flagged f) -> f.issues().size())
                  .reversed())
          .thenComparing(VehicleHealthResult.Flagged::vehicleCode);

  private final VehicleHealthAssembler assembler;

  public FleetHealthAggregator(VehicleHealthAssembler assembler) {
    this.assembler = assembler;
  }

  /**
   * Builds the fleet report.
   *
   * @param vehicles active vehicles
   * @param inspectionsByVehicle inspections grouped by vehicle id; missing keys mean no history
   * @param maintenanceByVehicle maintenance grouped by vehicle id; missing keys mean no history
   * @param now the evaluation instant
   */
  public FleetHealthReport aggregate(
      List<VehicleSummary> vehicles,
      Map<UUID, List<InspectionRecord>> inspectionsByVehicle,
      Map<UUID, List<MaintenanceRecord>> maintenanceByVehicle,
      Instant now) {
    int critical = 0;
    int warning = 0;
    int ok = 0;
    int noData = 0;
    List<VehicleHealthResult.Flagged> flagged = new ArrayList<>();

    for (VehicleSummary vehicle : vehicles) {
      var result =
          assembler.assess(
              vehicle,
              inspectionsByVehicle.getOrDefault(vehicle.id(), List.of()),
              maintenanceByVehicle.getOrDefault(vehicle.id(), List.of()),
              now);
      if (result instanceof VehicleHealthResult.NoData) {
        noData++;
      } else if (result instanceof VehicleHealthResult.Clear) {
        ok++;
      } else if (result instanceof VehicleHealthResult.Flagged f) {
        if (f.status() == HealthStatus.CRITICAL) {
          critical++;
        } else {
          warning++;
        }
        flagged.add(f);
      }
    }

    flagged.sort(FLAGGED_ORDER);
    return new FleetHealthReport(
        new FleetHealthSummary(critical, warning, ok, noData, vehicles.size()), flagged);
  }
}
