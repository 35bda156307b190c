package io.statefleet.fleet.fleethealth;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Thresholds and policy constants for the fleet health engine.
 *
 * @param inspectionAdaptiveFactor multiple of a vehicle's typical inspection interval at which an
 *     inspection becomes due (warning)
 * @param inspectionCriticalMultiplier further multiple of the warning threshold at which an
 *     overdue inspection turns critical
 * @param inspectionFallbackWarningDays warning threshold when fewer than two inspections exist
 * @param inspectionFallbackCriticalDays critical threshold when fewer than two inspections exist
 * @param maintenanceWarningDays days since last service before a warning
 * @param maintenanceCriticalDays days since last service before a critical issue
 * @param odometerGapKm km driven since last service before a warning
 * @param recurringWindowSize number of most recent inspections scanned for recurring failures
 * @param recurringMinCount failures of one item within the window that make it recurring
 * @param recentFailureWindowDays latest inspection must be at most this old for its failures to be
 *     reported
 * @param safetyCriticalKeys checklist keys whose failure always escalates to critical; defaults to
 *     {@link #DEFAULT_SAFETY_CRITICAL_KEYS} when unset
 * @param zoneId zone used to render dates in issue messages
 * @param historyLimit most recent rows per table loaded for a fleet-wide computation
 */
@ConfigurationProperties(prefix = "fleet.health")
public record FleetHealthProperties(
    @DefaultValue("1.4") double inspectionAdaptiveFactor,
    @DefaultValue("1.5") double inspectionCriticalMultiplier,
    @DefaultValue("21") int inspectionFallbackWarningDays,
    @DefaultValue("45") int inspectionFallbackCriticalDays,
    @DefaultValue("90") int maintenanceWarningDays,
    @DefaultValue("180") int maintenanceCriticalDays,
    @DefaultValue("5000") int odometerGapKm,
    @DefaultValue("3") int recurringWindowSize,
    @DefaultValue("2") int recurringMinCount,
    @DefaultValue("10") int recentFailureWindowDays,
    Set<String> safetyCriticalKeys,
    @DefaultValue("UTC") ZoneId zoneId,
    @DefaultValue("600") int historyLimit) {

  /** Used when {@code safety-critical-keys} is not configured. */
  public static final Set<String> DEFAULT_SAFETY_CRITICAL_KEYS =
      Set.of(
          "brake_lights",
          "foot_brake",
          "seat_belts",
          "dashboard_warning",
          "brake_performance",
          "steering",
          "tyres");

  public FleetHealthProperties {
    if (inspectionAdaptiveFactor <= 0 || inspectionCriticalMultiplier < 1) {
      throw new IllegalArgumentException(
          "fleet.health.inspection-adaptive-factor must be positive and"
              + " fleet.health.inspection-critical-multiplier at least 1");
    }
    requireOrdered(
        "inspection-fallback", inspectionFallbackWarningDays, inspectionFallbackCriticalDays);
    requireOrdered("maintenance", maintenanceWarningDays, maintenanceCriticalDays);
    if (recurringWindowSize < 1 || recurringMinCount < 1) {
      throw new IllegalArgumentException(
          "fleet.health.recurring-window-size and recurring-min-count must be at least 1");
    }
    if (odometerGapKm < 0 || recentFailureWindowDays < 0) {
      throw new IllegalArgumentException(
          "fleet.health.odometer-gap-km and recent-failure-window-days must not be negative");
    }
    if (historyLimit < 1) {
      throw new IllegalArgumentException("fleet.health.history-limit must be at least 1");
    }
    safetyCriticalKeys =
        safetyCriticalKeys == null
            ? DEFAULT_SAFETY_CRITICAL_KEYS
            : Set.copyOf(safetyCriticalKeys);
    zoneId = zoneId == null ? ZoneOffset.UTC : zoneId;
  }

  /** Returns the documented default policy. */
  public static FleetHealthProperties defaults() {
    return new FleetHealthProperties(
        1.4, 1.5, 21, 45, 90, 180, 5000, 3, 2, 10, null, ZoneOffset.UTC, 600);
  }

  public boolean isSafetyCritical(String checklistKey) {
    return checklistKey != null && safetyCriticalKeys.contains(checklistKey);
  }

  public FleetHealthProperties withOdometerGapKm(int km) {
    return new FleetHealthProperties(
        inspectionAdaptiveFactor,
        inspectionCriticalMultiplier,
        inspectionFallbackWarningDays,
        inspectionFallbackCriticalDays,
        maintenanceWarningDays,
        maintenanceCriticalDays,
        km,
        recurringWindowSize,
        recurringMinCount,
        recentFailureWindowDays,
        safetyCriticalKeys,
        zoneId,
        historyLimit);
  }

  public FleetHealthProperties withRecurring(int windowSize, int minCount) {
    return new FleetHealthProperties(
        inspectionAdaptiveFactor,
        inspectionCriticalMultiplier,
        inspectionFallbackWarningDays,
        inspectionFallbackCriticalDays,
        maintenanceWarningDays,
        maintenanceCriticalDays,
        odometerGapKm,
        windowSize,
        minCount,
        recentFailureWindowDays,
        safetyCriticalKeys,
        zoneId,
        historyLimit);
  }

  public FleetHealthProperties withSafetyCriticalKeys(Set<String> keys) {
    return new FleetHealthProperties(
        inspectionAdaptiveFactor,
        inspectionCriticalMultiplier,
        inspectionFallbackWarningDays,
        inspectionFallbackCriticalDays,
        maintenanceWarningDays,
        maintenanceCriticalDays,
        odometerGapKm,
        recurringWindowSize,
        recurringMinCount,
        recentFailureWindowDays,
        keys,
        zoneId,
        historyLimit);
  }

  public FleetHealthProperties withInspectionFallback(int warningDays, int criticalDays) {
    return new FleetHealthProperties(
        inspectionAdaptiveFactor,
        inspectionCriticalMultiplier,
        warningDays,
        criticalDays,
        maintenanceWarningDays,
        maintenanceCriticalDays,
        odometerGapKm,
        recurringWindowSize,
        recurringMinCount,
        recentFailureWindowDays,
        safetyCriticalKeys,
        zoneId,
        historyLimit);
  }

  private static void requireOrdered(String name, int warningDays, int criticalDays) {
    if (warningDays < 1 || criticalDays < warningDays) {
      throw new IllegalArgumentException(
          "fleet.health."
              + name
              + " thresholds must satisfy 1 <= warning ("
              + warningDays
              + ") <= critical ("
              + criticalDays
              + ")");
    }
  }
}
