package io.statefleet.fleet.vehicle;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface VehicleRepository extends JpaRepository<Vehicle, UUID> {

  List<Vehicle> findByActiveTrueOrderByVehicleCodeAsc();

  List<Vehicle> findAllByOrderByVehicleCodeAsc();

  Optional<Vehicle> findByVehicleCode(String vehicleCode);
}
