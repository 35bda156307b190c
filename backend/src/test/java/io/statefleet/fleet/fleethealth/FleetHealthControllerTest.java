package io.statefleet.fleet.fleethealth;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.statefleet.fleet.exception.ResourceNotFoundException;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.webmvc.test.autoconfigure.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(FleetHealthController.class)
class FleetHealthControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private FleetHealthService fleetHealthService;

  @Test
  void fleetHealth_rendersSummaryAndTaggedVehicles() throws Exception {
    var flagged =
        new VehicleHealthResult.Flagged(
            UUID.randomUUID(),
            "HR55-AH-1234",
            "TOYOTA",
            "INNOVA CRYSTA",
            HealthStatus.CRITICAL,
            List.of(HealthIssue.critical("No inspection in 60 days")),
            HealthFixtures.daysAgo(60),
            null,
            60,
            null);
    when(fleetHealthService.getFleetHealth())
        .thenReturn(
            new FleetHealthReport(new FleetHealthSummary(1, 0, 2, 0, 3), List.of(flagged)));

    mockMvc
        .perform(get("/api/fleet/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.summary.critical").value(1))
        .andExpect(jsonPath("$.summary.ok").value(2))
        .andExpect(jsonPath("$.summary.totalActive").value(3))
        .andExpect(jsonPath("$.vehicles[0].type").value("FLAGGED"))
        .andExpect(jsonPath("$.vehicles[0].vehicleCode").value("HR55-AH-1234"))
        .andExpect(jsonPath("$.vehicles[0].status").value("CRITICAL"))
        .andExpect(jsonPath("$.vehicles[0].issues[0].severity").value("CRITICAL"))
        .andExpect(jsonPath("$.vehicles[0].issues[0].message").value("No inspection in 60 days"));
  }

  @Test
  void vehicleHealth_rendersNoData() throws Exception {
    var id = UUID.randomUUID();
    when(fleetHealthService.getVehicleHealth(id)).thenReturn(new VehicleHealthResult.NoData(id));

    mockMvc
        .perform(get("/api/vehicles/{id}/health", id))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.type").value("NO_DATA"))
        .andExpect(jsonPath("$.vehicleId").value(id.toString()));
  }

  @Test
  void vehicleHealth_unknownVehicleIsProblem404() throws Exception {
    var id = UUID.randomUUID();
    when(fleetHealthService.getVehicleHealth(id))
        .thenThrow(new ResourceNotFoundException("Vehicle", id));

    mockMvc
        .perform(get("/api/vehicles/{id}/health", id))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("Vehicle not found"))
        .andExpect(jsonPath("$.status").value(404));
  }
}
