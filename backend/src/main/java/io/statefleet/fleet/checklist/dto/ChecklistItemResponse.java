package io.statefleet.fleet.checklist.dto;

import io.statefleet.fleet.checklist.ChecklistItem;
import java.time.Instant;
import java.util.UUID;

public record ChecklistItemResponse(
    UUID id,
    String categoryKey,
    String categoryLabel,
    String itemKey,
    String itemLabel,
    int sortOrder,
    boolean active,
    Instant updatedAt) {

  public static ChecklistItemResponse from(ChecklistItem item) {
    return new ChecklistItemResponse(
        item.getId(),
        item.getCategoryKey(),
        item.getCategoryLabel(),
        item.getItemKey(),
        item.getItemLabel(),
        item.getSortOrder(),
        item.isActive(),
        item.getUpdatedAt());
  }
}
