package io.statefleet.fleet.fleethealth;

import java.util.Optional;

/**
 * Converts elapsed days into a severity tier. Boundaries are inclusive; zero or negative elapsed
 * days never produce an issue.
 *
 * @param warningDays elapsed days at which a warning starts
 * @param criticalDays elapsed days at which the issue turns critical
 * @param typicalIntervalDays the vehicle's own average interval for adaptive policies, null for
 *     fixed ones
 */
public record OverdueThresholdPolicy(
    long warningDays, long criticalDays, Integer typicalIntervalDays) {

  public OverdueThresholdPolicy {
    if (criticalDays < warningDays) {
      throw new IllegalArgumentException(
          "critical threshold " + criticalDays + " is below warning threshold " + warningDays);
    }
  }

  public static OverdueThresholdPolicy fixed(int warningDays, int criticalDays) {
    return new OverdueThresholdPolicy(warningDays, criticalDays, null);
  }

  /**
   * Thresholds scaled from a vehicle's own cadence: warning at {@code round(avg * factor)},
   * critical at {@code round(avg * factor * criticalMultiplier)}.
   */
  public static OverdueThresholdPolicy adaptive(
      int averageIntervalDays, double factor, double criticalMultiplier) {
    long warning = Math.round(averageIntervalDays * factor);
    long critical = Math.round(averageIntervalDays * factor * criticalMultiplier);
    return new OverdueThresholdPolicy(warning, critical, averageIntervalDays);
  }

  /** Picks the adaptive policy when an interval is known, otherwise the fixed fallback. */
  public static OverdueThresholdPolicy forInspections(
      Integer averageIntervalDays, FleetHealthProperties properties) {
    if (averageIntervalDays == null) {
      return fixed(
          properties.inspectionFallbackWarningDays(), properties.inspectionFallbackCriticalDays());
    }
    return adaptive(
        averageIntervalDays,
        properties.inspectionAdaptiveFactor(),
        properties.inspectionCriticalMultiplier());
  }

  public static OverdueThresholdPolicy forMaintenance(FleetHealthProperties properties) {
    return fixed(properties.maintenanceWarningDays(), properties.maintenanceCriticalDays());
  }

  public boolean isAdaptive() {
    return typicalIntervalDays != null;
  }

  public Optional<IssueSeverity> evaluate(long elapsedDays) {
    if (elapsedDays <= 0) {
      return Optional.empty();
    }
    if (elapsedDays >= criticalDays) {
      return Optional.of(IssueSeverity.CRITICAL);
    }
    if (elapsedDays >= warningDays) {
      return Optional.of(IssueSeverity.WARNING);
    }
    return Optional.empty();
  }
}
