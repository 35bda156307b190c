package io.statefleet.fleet.inspection;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Limit;
import org.springframework.data.jpa.repository.JpaRepository;

public interface InspectionRepository extends JpaRepository<Inspection, UUID> {

  /** Most recent inspections across the fleet, capped at {@code limit} rows. */
  List<Inspection> findByDeletedFalseOrderByInspectedAtDesc(Limit limit);

  List<Inspection> findByVehicleIdAndDeletedFalseOrderByInspectedAtDesc(
      UUID vehicleId, Limit limit);
}
