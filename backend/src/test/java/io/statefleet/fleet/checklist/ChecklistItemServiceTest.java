package io.statefleet.fleet.checklist;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.statefleet.fleet.checklist.dto.ChecklistItemRequest;
import io.statefleet.fleet.exception.InvalidStateException;
import io.statefleet.fleet.exception.ResourceConflictException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChecklistItemServiceTest {

  private static final Instant NOW = Instant.parse("2025-03-15T12:00:00Z");
  private static final Instant CREATED = NOW.minusSeconds(86_400);

  @Mock private ChecklistItemRepository checklistItemRepository;

  private ChecklistItemService service;

  @BeforeEach
  void setUp() {
    service = new ChecklistItemService(checklistItemRepository, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void labelResolver_stripsParentheticalDetail() {
    var active =
        new ChecklistItem("brakes", "Brakes", "foot_brake", "Foot brake (pedal feel)", 1, CREATED);
    var retired =
        new ChecklistItem("lights", "Lights", "fog_lamps", "Fog lamps (front)", 9, CREATED);
    retired.deactivate(CREATED);
    when(checklistItemRepository.findAll()).thenReturn(List.of(active, retired));

    var resolver = service.labelResolver();

    assertThat(resolver.resolveLabel("foot_brake")).isEqualTo("Foot brake");
    assertThat(resolver.resolveLabel("fog_lamps")).isEqualTo("Fog lamps");
    assertThat(resolver.resolveLabel("wiper_blades")).isEqualTo("Wiper Blades");
  }

  @Test
  void create_duplicateKeyIsConflict() {
    when(checklistItemRepository.existsByItemKey("horn")).thenReturn(true);

    assertThatThrownBy(() -> service.create(request("horn", "Horn", null)))
        .isInstanceOf(ResourceConflictException.class);
    verify(checklistItemRepository, never()).save(any());
  }

  @Test
  void create_savesInactiveWhenRequested() {
    when(checklistItemRepository.existsByItemKey("horn")).thenReturn(false);
    when(checklistItemRepository.save(any(ChecklistItem.class)))
        .thenAnswer(inv -> inv.getArgument(0));

    var response = service.create(request("horn", "Horn", false));

    assertThat(response.itemKey()).isEqualTo("horn");
    assertThat(response.active()).isFalse();
    assertThat(response.updatedAt()).isEqualTo(NOW);
  }

  @Test
  void update_renamingKeyIsRejected() {
    var id = UUID.randomUUID();
    when(checklistItemRepository.findById(id))
        .thenReturn(Optional.of(new ChecklistItem("misc", "Misc", "horn", "Horn", 1, CREATED)));

    assertThatThrownBy(() -> service.update(id, request("hooter", "Hooter", null)))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void update_changesLabelAndKeepsKey() {
    var id = UUID.randomUUID();
    var item = new ChecklistItem("misc", "Misc", "horn", "Horn", 1, CREATED);
    when(checklistItemRepository.findById(id)).thenReturn(Optional.of(item));
    when(checklistItemRepository.save(item)).thenReturn(item);

    var response = service.update(id, request("horn", "Horn (audible at 50 m)", null));

    assertThat(response.itemKey()).isEqualTo("horn");
    assertThat(response.itemLabel()).isEqualTo("Horn (audible at 50 m)");
    assertThat(response.active()).isTrue();
    assertThat(response.updatedAt()).isEqualTo(NOW);
    assertThat(item.getCreatedAt()).isEqualTo(CREATED);
  }

  @Test
  void deactivate_softDeletes() {
    var id = UUID.randomUUID();
    var item = new ChecklistItem("misc", "Misc", "horn", "Horn", 1, CREATED);
    when(checklistItemRepository.findById(id)).thenReturn(Optional.of(item));

    service.deactivate(id);

    assertThat(item.isActive()).isFalse();
    verify(checklistItemRepository).save(item);
  }

  private static ChecklistItemRequest request(String key, String label, Boolean active) {
    return new ChecklistItemRequest("misc", "Misc", key, label, 1, active);
  }
}
