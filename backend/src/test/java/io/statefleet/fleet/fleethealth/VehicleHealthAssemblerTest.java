package io.statefleet.fleet.fleethealth;

import static io.statefleet.fleet.fleethealth.HealthFixtures.NOW;
import static io.statefleet.fleet.fleethealth.HealthFixtures.daysAgo;
import static io.statefleet.fleet.fleethealth.HealthFixtures.failing;
import static io.statefleet.fleet.fleethealth.HealthFixtures.inspection;
import static io.statefleet.fleet.fleethealth.HealthFixtures.maintenance;
import static io.statefleet.fleet.fleethealth.HealthFixtures.vehicle;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class VehicleHealthAssemblerTest {

  private final VehicleSummary van = vehicle("HR38AF-4440");
  private final VehicleHealthAssembler assembler =
      new VehicleHealthAssembler(
          FleetHealthProperties.defaults(), ChecklistLabelResolver.keyFormatting());

  private VehicleHealthResult.Flagged flagged(VehicleHealthResult result) {
    assertThat(result).isInstanceOf(VehicleHealthResult.Flagged.class);
    return (VehicleHealthResult.Flagged) result;
  }

  @Test
  void noHistoryIsNoData() {
    var result = assembler.assess(van, List.of(), List.of(), NOW);
    assertThat(result).isEqualTo(new VehicleHealthResult.NoData(van.id()));
  }

  @Test
  void nullHistoriesAreTreatedAsEmpty() {
    assertThat(assembler.assess(van, null, null, NOW))
        .isInstanceOf(VehicleHealthResult.NoData.class);
  }

  @Test
  void singleOldInspectionWithoutServiceIsCritical() {
    var result = flagged(assembler.assess(van, List.of(inspection(van, 100)), List.of(), NOW));

    assertThat(result.status()).isEqualTo(HealthStatus.CRITICAL);
    assertThat(result.issues())
        .containsExactly(
            HealthIssue.critical("No inspection in 100 days"),
            HealthIssue.warning("No service record on record yet"));
    assertThat(result.daysSinceInspection()).isEqualTo(100);
    assertThat(result.daysSinceMaintenance()).isNull();
    assertThat(result.lastMaintenanceAt()).isNull();
  }

  @Test
  void adaptiveWarningCitesTypicalInterval() {
    var history =
        List.of(
            inspection(van, 110),
            inspection(van, 50),
            inspection(van, 170),
            inspection(van, 80),
            inspection(van, 140));

    var result = flagged(assembler.assess(van, history, List.of(maintenance(van, 20)), NOW));

    assertThat(result.status()).isEqualTo(HealthStatus.WARNING);
    assertThat(result.issues())
        .containsExactly(
            HealthIssue.warning(
                "Due for inspection (50 days since last, typical interval ~30 days)"));
    assertThat(result.lastInspectionAt()).isEqualTo(daysAgo(50));
  }

  @Test
  void adaptiveCriticalCitesTypicalInterval() {
    var history = List.of(inspection(van, 70), inspection(van, 100), inspection(van, 130));

    var result = flagged(assembler.assess(van, history, List.of(maintenance(van, 20)), NOW));

    assertThat(result.issues())
        .containsExactly(HealthIssue.critical("No inspection in 70 days (typically every ~30 days)"));
  }

  @Test
  void recurringSafetyFailureIsCritical() {
    var history =
        List.of(
            failing(van, 12, "brake_lights"),
            failing(van, 2, "brake_lights"),
            failing(van, 22, "brake_lights"));

    var result = flagged(assembler.assess(van, history, List.of(maintenance(van, 5)), NOW));

    assertThat(result.status()).isEqualTo(HealthStatus.CRITICAL);
    assertThat(result.issues())
        .containsExactly(
            HealthIssue.critical("Last inspection (13 Mar): 1 issue: Brake Lights"),
            HealthIssue.critical("Recurring in last 3 inspections: Brake Lights"));
  }

  @Test
  void odometerGapWarnsOnlyAboveThreshold() {
    var inspections = List.of(inspection(van, 1, 85_000, Map.of()));

    var gapped =
        flagged(assembler.assess(van, inspections, List.of(maintenance(van, 30, 79_000)), NOW));
    assertThat(gapped.issues())
        .containsExactly(HealthIssue.warning("6,000 km driven since last service (at 79,000 km)"));

    var close = assembler.assess(van, inspections, List.of(maintenance(van, 30, 81_000)), NOW);
    assertThat(close).isEqualTo(new VehicleHealthResult.Clear(van.id()));
  }

  @Test
  void maintenanceWithoutInspectionWarnsOnlyAboutMissingInspection() {
    // Service timing is not judged without inspections, even when very old
    var result = flagged(assembler.assess(van, List.of(), List.of(maintenance(van, 400)), NOW));

    assertThat(result.status()).isEqualTo(HealthStatus.WARNING);
    assertThat(result.issues()).containsExactly(HealthIssue.warning("No inspection on record yet"));
    assertThat(result.daysSinceMaintenance()).isEqualTo(400);
    assertThat(result.daysSinceInspection()).isNull();
  }

  @Test
  void overdueServiceWarnsWithDate() {
    var result =
        flagged(
            assembler.assess(
                van, List.of(inspection(van, 3)), List.of(maintenance(van, 95)), NOW));

    assertThat(result.issues())
        .containsExactly(HealthIssue.warning("Last service 95 days ago (10 Dec)"));
  }

  @Test
  void longOverdueServiceIsCritical() {
    var result =
        flagged(
            assembler.assess(
                van, List.of(inspection(van, 3)), List.of(maintenance(van, 200)), NOW));

    assertThat(result.status()).isEqualTo(HealthStatus.CRITICAL);
    assertThat(result.issues()).containsExactly(HealthIssue.critical("No service in 200 days"));
  }

  @Test
  void onlyLatestMaintenanceIsScored() {
    var maintenance = List.of(maintenance(van, 400, 1_000), maintenance(van, 10, 10_000));

    var result = assembler.assess(van, List.of(inspection(van, 2)), maintenance, NOW);

    assertThat(result).isInstanceOf(VehicleHealthResult.Clear.class);
  }

  @Test
  void recentHealthyVehicleIsClear() {
    var result =
        assembler.assess(van, List.of(inspection(van, 0)), List.of(maintenance(van, 0)), NOW);
    assertThat(result).isEqualTo(new VehicleHealthResult.Clear(van.id()));
  }

  @Test
  void sameDayHistoryDoesNotTriggerAdaptiveOverdue() {
    var history = List.of(inspection(van, 0), inspection(van, 0));
    var result = assembler.assess(van, history, List.of(maintenance(van, 1)), NOW);
    assertThat(result).isInstanceOf(VehicleHealthResult.Clear.class);
  }

  @Test
  void independentChecksAllContributeIssues() {
    var history =
        List.of(
            failing(van, 60, "clutch"),
            failing(van, 90, "clutch"),
            failing(van, 30, "clutch"));

    var result = flagged(assembler.assess(van, history, List.of(), NOW));

    // interval 30 -> warning at 42, so 30 days is not overdue; clutch recurs; no service at all
    assertThat(result.status()).isEqualTo(HealthStatus.WARNING);
    assertThat(result.issues())
        .extracting(HealthIssue::message)
        .containsExactly("Recurring in last 3 inspections: Clutch", "No service record on record yet");
  }

  @Test
  void flaggedIdentityFieldsComeFromVehicle() {
    var result = flagged(assembler.assess(van, List.of(inspection(van, 30)), List.of(), NOW));

    assertThat(result.vehicleId()).isEqualTo(van.id());
    assertThat(result.vehicleCode()).isEqualTo("HR38AF-4440");
    assertThat(result.brand()).isEqualTo("TOYOTA");
    assertThat(result.model()).isEqualTo("INNOVA CRYSTA");
  }

  @Test
  void statusIsCriticalIffAnyIssueIsCritical() {
    var cases =
        List.of(
            assembler.assess(van, List.of(inspection(van, 25)), List.of(), NOW),
            assembler.assess(van, List.of(inspection(van, 50)), List.of(), NOW),
            assembler.assess(
                van, List.of(failing(van, 1, "steering")), List.of(maintenance(van, 1)), NOW),
            assembler.assess(van, List.of(), List.of(maintenance(van, 1)), NOW));

    for (VehicleHealthResult result : cases) {
      var f = flagged(result);
      boolean anyCritical = f.issues().stream().anyMatch(HealthIssue::isCritical);
      assertThat(f.status() == HealthStatus.CRITICAL).isEqualTo(anyCritical);
    }
  }
}
