package io.statefleet.fleet.inspection;

import io.statefleet.fleet.fleethealth.ChecklistItemResult;
import io.statefleet.fleet.fleethealth.InspectionRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "inspections")
public class Inspection {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "vehicle_id", nullable = false)
  private UUID vehicleId;

  @Column(name = "inspected_at", nullable = false)
  private Instant inspectedAt;

  @Column(name = "odometer_km", nullable = false)
  private int odometerKm;

  @Column(name = "driver_name", length = 200)
  private String driverName;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "checklist", columnDefinition = "jsonb", nullable = false)
  private Map<String, ChecklistItemResult> checklist = new LinkedHashMap<>();

  @Column(name = "is_deleted", nullable = false)
  private boolean deleted;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Inspection() {}

  public Inspection(
      UUID vehicleId,
      Instant inspectedAt,
      int odometerKm,
      String driverName,
      Map<String, ChecklistItemResult> checklist,
      Instant createdAt) {
    this.vehicleId = vehicleId;
    this.inspectedAt = inspectedAt;
    this.odometerKm = odometerKm;
    this.driverName = driverName;
    this.checklist = new LinkedHashMap<>(checklist);
    this.createdAt = createdAt;
  }

  public UUID getId() {
    return id;
  }

  public UUID getVehicleId() {
    return vehicleId;
  }

  public Instant getInspectedAt() {
    return inspectedAt;
  }

  public int getOdometerKm() {
    return odometerKm;
  }

  public String getDriverName() {
    return driverName;
  }

  public Map<String, ChecklistItemResult> getChecklist() {
    return checklist;
  }

  public boolean isDeleted() {
    return deleted;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void markDeleted() {
    this.deleted = true;
  }

  /** Projection consumed by the fleet health engine. */
  public InspectionRecord toRecord() {
    return new InspectionRecord(id, vehicleId, inspectedAt, odometerKm, checklist);
  }
}
