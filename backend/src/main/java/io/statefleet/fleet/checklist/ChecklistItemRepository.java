package io.statefleet.fleet.checklist;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ChecklistItemRepository extends JpaRepository<ChecklistItem, UUID> {

  List<ChecklistItem> findAllByOrderBySortOrderAsc();

  List<ChecklistItem> findByActiveTrueOrderBySortOrderAsc();

  boolean existsByItemKey(String itemKey);
}
