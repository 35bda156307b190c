package io.statefleet.fleet.fleethealth;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity fields of a vehicle consumed by the health engine.
 *
 * @param id vehicle id
 * @param code display code, used as the final sort key in fleet reports
 * @param brand brand, null if not recorded
 * @param model model, null if not recorded
 */
public record VehicleSummary(UUID id, String code, String brand, String model) {

  public VehicleSummary {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(code, "code");
  }
}
