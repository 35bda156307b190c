package io.statefleet.fleet.fleethealth;

/** Severity of a single detected issue. */
public enum IssueSeverity {
  WARNING,
  CRITICAL;

  /** Maps the issue severity onto the vehicle status it implies. */
  public HealthStatus toStatus() {
    return this == CRITICAL ? HealthStatus.CRITICAL : HealthStatus.WARNING;
  }

  static IssueSeverity escalatedIf(boolean critical) {
    return critical ? CRITICAL : WARNING;
  }
}
