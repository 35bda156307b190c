package io.statefleet.fleet.vehicle;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "vehicles")
public class Vehicle {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "vehicle_code", nullable = false, unique = true, length = 50)
  private String vehicleCode;

  @Column(name = "brand", length = 100)
  private String brand;

  @Column(name = "model", length = 100)
  private String model;

  @Column(name = "model_year")
  private Integer year;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Vehicle() {}

  public Vehicle(String vehicleCode, String brand, String model, Instant createdAt) {
    this.vehicleCode = vehicleCode;
    this.brand = brand;
    this.model = model;
    this.active = true;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getVehicleCode() {
    return vehicleCode;
  }

  public String getBrand() {
    return brand;
  }

  public String getModel() {
    return model;
  }

  public Integer getYear() {
    return year;
  }

  public String getNotes() {
    return notes;
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

  public void updateDetails(
      String vehicleCode, String brand, String model, Integer year, String notes, Instant now) {
    this.vehicleCode = vehicleCode;
    this.brand = brand;
    this.model = model;
    this.year = year;
    this.notes = notes;
    this.updatedAt = now;
  }

  public void setActive(boolean active, Instant now) {
    this.active = active;
    this.updatedAt = now;
  }
}
