package io.statefleet.fleet.fleethealth;

/** Status of a flagged vehicle, ordered by severity for escalation comparisons. */
public enum HealthStatus {
  WARNING,
  CRITICAL;

  /**
   * Returns a severity score for escalation comparisons. Higher values indicate worse health.
   *
   * @return severity score: WARNING=1, CRITICAL=2
   */
  public int severity() {
    return switch (this) {
      case WARNING -> 1;
      case CRITICAL -> 2;
    };
  }
}
