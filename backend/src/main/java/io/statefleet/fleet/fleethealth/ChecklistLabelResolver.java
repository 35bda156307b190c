package io.statefleet.fleet.fleethealth;

/**
 * Maps a checklist item key to the label shown in issue messages. Implementations never throw;
 * unknown keys resolve to a readable rendering of the key itself.
 */
@FunctionalInterface
public interface ChecklistLabelResolver {

  String resolveLabel(String key);

  /** A resolver with an empty catalog: every key renders through the key formatting fallback. */
  static ChecklistLabelResolver keyFormatting() {
    return ChecklistLabels::humanizeKey;
  }
}
