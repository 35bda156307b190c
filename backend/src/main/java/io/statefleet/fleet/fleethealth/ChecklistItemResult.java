package io.statefleet.fleet.fleethealth;

/**
 * Outcome of one checklist point within an inspection.
 *
 * @param ok whether the item passed
 * @param remarks free-text remarks, may be empty
 */
public record ChecklistItemResult(boolean ok, String remarks) {

  public ChecklistItemResult {
    remarks = remarks == null ? "" : remarks;
  }

  public static ChecklistItemResult passed() {
    return new ChecklistItemResult(true, "");
  }

  public static ChecklistItemResult failed(String remarks) {
    return new ChecklistItemResult(false, remarks);
  }
}
