package io.statefleet.fleet.maintenance;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Limit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface MaintenanceEventRepository extends JpaRepository<MaintenanceEvent, UUID> {

  /** Most recent service events across the fleet, capped at {@code limit} rows. */
  List<MaintenanceEvent> findByDeletedFalseOrderByServicedAtDesc(Limit limit);

  List<MaintenanceEvent> findByVehicleIdAndDeletedFalseOrderByServicedAtDesc(
      UUID vehicleId, Limit limit);

  @Query(
      """
      SELECT m.vehicleId AS vehicleId, v.vehicleCode AS vehicleCode,
             m.supplierName AS supplierName, m.servicedAt AS servicedAt, m.amount AS amount
      FROM MaintenanceEvent m
      LEFT JOIN Vehicle v ON v.id = m.vehicleId
      WHERE m.deleted = false
      """)
  List<MaintenanceSpendProjection> findSpendRows();
}
