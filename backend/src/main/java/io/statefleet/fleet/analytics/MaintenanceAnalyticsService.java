package io.statefleet.fleet.analytics;

import io.statefleet.fleet.analytics.dto.MaintenanceAnalytics;
import io.statefleet.fleet.analytics.dto.MonthlySpend;
import io.statefleet.fleet.analytics.dto.SupplierSpend;
import io.statefleet.fleet.analytics.dto.VehicleSpend;
import io.statefleet.fleet.maintenance.MaintenanceEventRepository;
import io.statefleet.fleet.maintenance.MaintenanceSpendProjection;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Maintenance spend totals by month, supplier and vehicle, computed on every request. */
@Service
public class MaintenanceAnalyticsService {

  private static final Logger log = LoggerFactory.getLogger(MaintenanceAnalyticsService.class);

  static final int TOP_N = 10;

  private final MaintenanceEventRepository maintenanceEventRepository;

  public MaintenanceAnalyticsService(MaintenanceEventRepository maintenanceEventRepository) {
    this.maintenanceEventRepository = maintenanceEventRepository;
  }

  /**
   * Months are calendar months in UTC. Suppliers are grouped by their trimmed name; blank names
   * count toward the monthly and vehicle totals only. Ties in the top lists break by name or
   * vehicle code.
   */
  @Transactional(readOnly = true)
  public MaintenanceAnalytics getAnalytics() {
    List<MaintenanceSpendProjection> rows = maintenanceEventRepository.findSpendRows();

    Map<YearMonth, BigDecimal> byMonth = new TreeMap<>();
    Map<String, BigDecimal> bySupplier = new HashMap<>();
    Map<UUID, BigDecimal> byVehicle = new HashMap<>();
    Map<UUID, String> vehicleCodes = new HashMap<>();

    for (var row : rows) {
      BigDecimal amount = row.getAmount() == null ? BigDecimal.ZERO : row.getAmount();
      byMonth.merge(
          YearMonth.from(row.getServicedAt().atZone(ZoneOffset.UTC)), amount, BigDecimal::add);

      String supplier = row.getSupplierName() == null ? "" : row.getSupplierName().trim();
      if (!supplier.isEmpty()) {
        bySupplier.merge(supplier, amount, BigDecimal::add);
      }

      byVehicle.merge(row.getVehicleId(), amount, BigDecimal::add);
      if (row.getVehicleCode() != null) {
        vehicleCodes.put(row.getVehicleId(), row.getVehicleCode());
      }
    }

    List<MonthlySpend> monthly =
        byMonth.entrySet().stream()
            .map(e -> new MonthlySpend(e.getKey().toString(), e.getValue()))
            .toList();

    List<SupplierSpend> topSuppliers =
        bySupplier.entrySet().stream()
            .map(e -> new SupplierSpend(e.getKey(), e.getValue()))
            .sorted(
                Comparator.comparing(SupplierSpend::total)
                    .reversed()
                    .thenComparing(SupplierSpend::name))
            .limit(TOP_N)
            .toList();

    List<VehicleSpend> topVehicles =
        byVehicle.entrySet().stream()
            .map(e -> new VehicleSpend(e.getKey(), vehicleCodes.get(e.getKey()), e.getValue()))
            .sorted(
                Comparator.comparing(VehicleSpend::total)
                    .reversed()
                    .thenComparing(
                        VehicleSpend::vehicleCode, Comparator.nullsLast(Comparator.naturalOrder())))
            .limit(TOP_N)
            .toList();

    log.debug(
        "Computed maintenance analytics: events={}, months={}, suppliers={}, vehicles={}",
        rows.size(),
        monthly.size(),
        bySupplier.size(),
        byVehicle.size());
    return new MaintenanceAnalytics(monthly, topSuppliers, topVehicles);
  }
}
