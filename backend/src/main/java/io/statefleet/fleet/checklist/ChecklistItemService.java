package io.statefleet.fleet.checklist;

import io.statefleet.fleet.checklist.dto.ChecklistItemRequest;
import io.statefleet.fleet.checklist.dto.ChecklistItemResponse;
import io.statefleet.fleet.exception.InvalidStateException;
import io.statefleet.fleet.exception.ResourceConflictException;
import io.statefleet.fleet.exception.ResourceNotFoundException;
import io.statefleet.fleet.fleethealth.CatalogChecklistLabelResolver;
import io.statefleet.fleet.fleethealth.ChecklistLabelResolver;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Admin-editable inspection checklist catalog. Items are deactivated, never deleted. */
@Service
public class ChecklistItemService {

  private static final Logger log = LoggerFactory.getLogger(ChecklistItemService.class);

  private final ChecklistItemRepository checklistItemRepository;
  private final Clock clock;

  public ChecklistItemService(ChecklistItemRepository checklistItemRepository, Clock clock) {
    this.checklistItemRepository = checklistItemRepository;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public List<ChecklistItemResponse> list(boolean activeOnly) {
    var items =
        activeOnly
            ? checklistItemRepository.findByActiveTrueOrderBySortOrderAsc()
            : checklistItemRepository.findAllByOrderBySortOrderAsc();
    return items.stream().map(ChecklistItemResponse::from).toList();
  }

  @Transactional
  public ChecklistItemResponse create(ChecklistItemRequest request) {
    if (checklistItemRepository.existsByItemKey(request.itemKey())) {
      throw new ResourceConflictException(
          "Duplicate checklist item",
          "A checklist item with key '" + request.itemKey() + "' exists");
    }
    Instant now = clock.instant();
    var item =
        new ChecklistItem(
            request.categoryKey(),
            request.categoryLabel(),
            request.itemKey(),
            request.itemLabel(),
            request.sortOrder(),
            now);
    if (Boolean.FALSE.equals(request.active())) {
      item.deactivate(now);
    }
    item = checklistItemRepository.save(item);

    log.info("Created checklist item: id={}, key={}", item.getId(), item.getItemKey());
    return ChecklistItemResponse.from(item);
  }

  @Transactional
  public ChecklistItemResponse update(UUID id, ChecklistItemRequest request) {
    var item =
        checklistItemRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("ChecklistItem", id));
    if (!item.getItemKey().equals(request.itemKey())) {
      throw new InvalidStateException(
          "Checklist key is immutable",
          "Item key '" + item.getItemKey() + "' cannot be renamed; create a new item instead");
    }
    item.update(
        request.categoryKey(),
        request.categoryLabel(),
        request.itemLabel(),
        request.sortOrder(),
        request.active() == null || request.active(),
        clock.instant());
    item = checklistItemRepository.save(item);

    log.info("Updated checklist item: id={}, key={}", item.getId(), item.getItemKey());
    return ChecklistItemResponse.from(item);
  }

  /** Soft delete, so labels of historical inspections keep resolving. */
  @Transactional
  public void deactivate(UUID id) {
    var item =
        checklistItemRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("ChecklistItem", id));
    item.deactivate(clock.instant());
    checklistItemRepository.save(item);

    log.info("Deactivated checklist item: id={}, key={}", item.getId(), item.getItemKey());
  }

  /**
   * Snapshot of the whole catalog, inactive items included, as a label resolver. Load once per
   * request.
   */
  @Transactional(readOnly = true)
  public ChecklistLabelResolver labelResolver() {
    Map<String, String> labels = new HashMap<>();
    for (ChecklistItem item : checklistItemRepository.findAll()) {
      labels.put(item.getItemKey(), item.getItemLabel());
    }
    return new CatalogChecklistLabelResolver(labels);
  }
}
