package io.statefleet.fleet.fleethealth;

import java.util.Objects;

/**
 * A single detected problem on a vehicle.
 *
 * @param severity warning or critical
 * @param message human-readable text with concrete numbers and dates already substituted
 */
public record HealthIssue(IssueSeverity severity, String message) {

  public HealthIssue {
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(message, "message");
  }

  public static HealthIssue warning(String message) {
    return new HealthIssue(IssueSeverity.WARNING, message);
  }

  public static HealthIssue critical(String message) {
    return new HealthIssue(IssueSeverity.CRITICAL, message);
  }

  public boolean isCritical() {
    return severity == IssueSeverity.CRITICAL;
  }
}
