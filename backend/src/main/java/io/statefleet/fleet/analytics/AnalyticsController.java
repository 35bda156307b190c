package io.statefleet.fleet.analytics;

import io.statefleet.fleet.analytics.dto.MaintenanceAnalytics;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AnalyticsController {

  private final MaintenanceAnalyticsService maintenanceAnalyticsService;

  public AnalyticsController(MaintenanceAnalyticsService maintenanceAnalyticsService) {
    this.maintenanceAnalyticsService = maintenanceAnalyticsService;
  }

  /** Monthly maintenance spend plus the top suppliers and vehicles by spend. */
  @GetMapping("/api/analytics")
  public ResponseEntity<MaintenanceAnalytics> getAnalytics() {
    return ResponseEntity.ok(maintenanceAnalyticsService.getAnalytics());
  }
}
