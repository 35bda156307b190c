package io.statefleet.fleet.fleethealth;

import java.util.Map;

/**
 * Resolves labels against a snapshot of the checklist catalog. Configured labels lose any
 * parenthetical detail; keys absent from the catalog fall back to {@link
 * ChecklistLabels#humanizeKey(String)}.
 */
public final class CatalogChecklistLabelResolver implements ChecklistLabelResolver {

  private final Map<String, String> labelsByKey;

  public CatalogChecklistLabelResolver(Map<String, String> labelsByKey) {
    this.labelsByKey = Map.copyOf(labelsByKey);
  }

  @Override
  public String resolveLabel(String key) {
    String configured = key == null ? null : labelsByKey.get(key);
    if (configured == null || configured.isBlank()) {
      return ChecklistLabels.humanizeKey(key);
    }
    return ChecklistLabels.stripParenthetical(configured);
  }

  int size() {
    return labelsByKey.size();
  }
}
