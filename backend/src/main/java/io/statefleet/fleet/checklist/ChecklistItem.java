package io.statefleet.fleet.checklist;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** One configurable inspection checklist point, grouped under a category. */
@Entity
@Table(name = "checklist_items")
public class ChecklistItem {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "category_key", nullable = false, length = 100)
  private String categoryKey;

  @Column(name = "category_label", nullable = false, length = 200)
  private String categoryLabel;

  @Column(name = "item_key", nullable = false, unique = true, length = 100)
  private String itemKey;

  @Column(name = "item_label", nullable = false, length = 300)
  private String itemLabel;

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ChecklistItem() {}

  public ChecklistItem(
      String categoryKey,
      String categoryLabel,
      String itemKey,
      String itemLabel,
      int sortOrder,
      Instant createdAt) {
    this.categoryKey = categoryKey;
    this.categoryLabel = categoryLabel;
    this.itemKey = itemKey;
    this.itemLabel = itemLabel;
    this.sortOrder = sortOrder;
    this.active = true;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getCategoryKey() {
    return categoryKey;
  }

  public String getCategoryLabel() {
    return categoryLabel;
  }

  public String getItemKey() {
    return itemKey;
  }

  public String getItemLabel() {
    return itemLabel;
  }

  public int getSortOrder() {
    return sortOrder;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  // --- Mutations ---

  /** Item keys are immutable once inspections may reference them. */
  public void update(
      String categoryKey,
      String categoryLabel,
      String itemLabel,
      int sortOrder,
      boolean active,
      Instant now) {
    this.categoryKey = categoryKey;
    this.categoryLabel = categoryLabel;
    this.itemLabel = itemLabel;
    this.sortOrder = sortOrder;
    this.active = active;
    this.updatedAt = now;
  }

  public void deactivate(Instant now) {
    this.active = false;
    this.updatedAt = now;
  }
}
