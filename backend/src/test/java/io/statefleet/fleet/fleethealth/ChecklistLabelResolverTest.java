package io.statefleet.fleet.fleethealth;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ChecklistLabelResolverTest {

  private final ChecklistLabelResolver resolver =
      new CatalogChecklistLabelResolver(
          Map.of(
              "tyres", "Tyres (tread depth, condition)",
              "brake_lights", "Brake lights",
              "mirrors", "Mirrors (side & rearview)"));

  @Test
  void configuredLabelIsReturned() {
    assertThat(resolver.resolveLabel("brake_lights")).isEqualTo("Brake lights");
  }

  @Test
  void parentheticalDetailIsStripped() {
    assertThat(resolver.resolveLabel("tyres")).isEqualTo("Tyres");
    assertThat(resolver.resolveLabel("mirrors")).isEqualTo("Mirrors");
  }

  @Test
  void unknownKeyFallsBackToTitleCase() {
    assertThat(resolver.resolveLabel("wheel_alignment")).isEqualTo("Wheel Alignment");
  }

  @Test
  void legacySingleWordKeyIsCapitalised() {
    assertThat(resolver.resolveLabel("alignment")).isEqualTo("Alignment");
  }

  @Test
  void nullAndBlankKeysNeverThrow() {
    assertThat(resolver.resolveLabel(null)).isEmpty();
    assertThat(resolver.resolveLabel("  ")).isEmpty();
  }

  @Test
  void repeatedUnderscoresCollapse() {
    assertThat(ChecklistLabels.humanizeKey("ac__heater_")).isEqualTo("Ac Heater");
  }

  @Test
  void keyFormattingResolverIgnoresAnyCatalog() {
    assertThat(ChecklistLabelResolver.keyFormatting().resolveLabel("brake_lights"))
        .isEqualTo("Brake Lights");
  }

  @Test
  void labelWithoutParentheticalIsUnchanged() {
    assertThat(ChecklistLabels.stripParenthetical("Headlights / Tail lights / Indicators"))
        .isEqualTo("Headlights / Tail lights / Indicators");
  }
}
