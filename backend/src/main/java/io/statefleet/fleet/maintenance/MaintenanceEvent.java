package io.statefleet.fleet.maintenance;

import io.statefleet.fleet.fleethealth.MaintenanceRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** A service or repair visit, with the supplier bill it produced. */
@Entity
@Table(name = "maintenance_events")
public class MaintenanceEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "vehicle_id", nullable = false)
  private UUID vehicleId;

  @Column(name = "serviced_at", nullable = false)
  private Instant servicedAt;

  @Column(name = "odometer_km", nullable = false)
  private int odometerKm;

  @Column(name = "bill_number", nullable = false, length = 100)
  private String billNumber;

  @Column(name = "supplier_name", nullable = false, length = 200)
  private String supplierName;

  @Column(name = "amount", nullable = false, precision = 12, scale = 2)
  private BigDecimal amount;

  @Column(name = "remarks", nullable = false, columnDefinition = "TEXT")
  private String remarks;

  @Column(name = "is_deleted", nullable = false)
  private boolean deleted;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected MaintenanceEvent() {}

  public MaintenanceEvent(
      UUID vehicleId,
      Instant servicedAt,
      int odometerKm,
      String billNumber,
      String supplierName,
      BigDecimal amount,
      String remarks,
      Instant createdAt) {
    this.vehicleId = vehicleId;
    this.servicedAt = servicedAt;
    this.odometerKm = odometerKm;
    this.billNumber = billNumber;
    this.supplierName = supplierName;
    this.amount = amount;
    this.remarks = remarks;
    this.createdAt = createdAt;
  }

  public UUID getId() {
    return id;
  }

  public UUID getVehicleId() {
    return vehicleId;
  }

  public Instant getServicedAt() {
    return servicedAt;
  }

  public int getOdometerKm() {
    return odometerKm;
  }

  public String getBillNumber() {
    return billNumber;
  }

  public String getSupplierName() {
    return supplierName;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public String getRemarks() {
    return remarks;
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
  public MaintenanceRecord toRecord() {
    return new MaintenanceRecord(id, vehicleId, servicedAt, odometerKm);
  }
}
