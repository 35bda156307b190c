package io.statefleet.fleet.fleethealth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FleetHealthPropertiesTest {

  @Test
  void defaultsMatchDocumentedPolicy() {
    var defaults = FleetHealthProperties.defaults();

    assertThat(defaults.inspectionAdaptiveFactor()).isEqualTo(1.4);
    assertThat(defaults.inspectionFallbackWarningDays()).isEqualTo(21);
    assertThat(defaults.inspectionFallbackCriticalDays()).isEqualTo(45);
    assertThat(defaults.maintenanceWarningDays()).isEqualTo(90);
    assertThat(defaults.maintenanceCriticalDays()).isEqualTo(180);
    assertThat(defaults.odometerGapKm()).isEqualTo(5000);
    assertThat(defaults.recurringWindowSize()).isEqualTo(3);
    assertThat(defaults.recurringMinCount()).isEqualTo(2);
    assertThat(defaults.recentFailureWindowDays()).isEqualTo(10);
    assertThat(defaults.safetyCriticalKeys())
        .containsExactlyInAnyOrder(
            "brake_lights",
            "foot_brake",
            "seat_belts",
            "dashboard_warning",
            "brake_performance",
            "steering",
            "tyres");
    assertThat(defaults.zoneId()).isEqualTo(ZoneOffset.UTC);
  }

  @Test
  void safetyCriticalLookupIsExact() {
    var defaults = FleetHealthProperties.defaults();
    assertThat(defaults.isSafetyCritical("tyres")).isTrue();
    assertThat(defaults.isSafetyCritical("Tyres")).isFalse();
    assertThat(defaults.isSafetyCritical("tyre")).isFalse();
    assertThat(defaults.isSafetyCritical(null)).isFalse();
  }

  @Test
  void unsetSafetyKeysAndZoneFallBackToDefaults() {
    var bound =
        new FleetHealthProperties(1.4, 1.5, 21, 45, 90, 180, 5000, 3, 2, 10, null, null, 600);

    assertThat(bound.safetyCriticalKeys())
        .isEqualTo(FleetHealthProperties.DEFAULT_SAFETY_CRITICAL_KEYS);
    assertThat(bound.zoneId()).isEqualTo(ZoneOffset.UTC);
  }

  @Test
  void configuredZoneIsKept() {
    var kolkata = ZoneId.of("Asia/Kolkata");
    var bound =
        new FleetHealthProperties(1.4, 1.5, 21, 45, 90, 180, 5000, 3, 2, 10, null, kolkata, 600);

    assertThat(bound.zoneId()).isSameAs(kolkata);
  }

  @Test
  void negativeOdometerGapIsRejected() {
    assertThatThrownBy(() -> FleetHealthProperties.defaults().withOdometerGapKm(-1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("odometer-gap-km");
  }

  @Test
  void negativeRecentFailureWindowIsRejected() {
    assertThatThrownBy(
            () ->
                new FleetHealthProperties(
                    1.4, 1.5, 21, 45, 90, 180, 5000, 3, 2, -1, null, ZoneOffset.UTC, 600))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("recent-failure-window-days");
  }

  @Test
  void overridesLeaveOtherValuesUntouched() {
    var custom =
        FleetHealthProperties.defaults().withOdometerGapKm(1000).withSafetyCriticalKeys(Set.of());

    assertThat(custom.odometerGapKm()).isEqualTo(1000);
    assertThat(custom.safetyCriticalKeys()).isEmpty();
    assertThat(custom.maintenanceWarningDays()).isEqualTo(90);
  }

  @Test
  void invertedThresholdsAreRejected() {
    assertThatThrownBy(() -> FleetHealthProperties.defaults().withInspectionFallback(45, 21))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("inspection-fallback");
  }

  @Test
  void emptyRecurringWindowIsRejected() {
    assertThatThrownBy(() -> FleetHealthProperties.defaults().withRecurring(0, 2))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
