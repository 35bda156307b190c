package io.statefleet.fleet.checklist;

import io.statefleet.fleet.checklist.dto.ChecklistItemRequest;
import io.statefleet.fleet.checklist.dto.ChecklistItemResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/checklist-items")
public class ChecklistItemController {

  private final ChecklistItemService checklistItemService;

  public ChecklistItemController(ChecklistItemService checklistItemService) {
    this.checklistItemService = checklistItemService;
  }

  @GetMapping
  public ResponseEntity<List<ChecklistItemResponse>> list(
      @RequestParam(defaultValue = "false") boolean activeOnly) {
    return ResponseEntity.ok(checklistItemService.list(activeOnly));
  }

  @PostMapping
  public ResponseEntity<ChecklistItemResponse> create(
      @Valid @RequestBody ChecklistItemRequest request) {
    var response = checklistItemService.create(request);
    return ResponseEntity.created(URI.create("/api/checklist-items/" + response.id()))
        .body(response);
  }

  @PutMapping("/{id}")
  public ResponseEntity<ChecklistItemResponse> update(
      @PathVariable UUID id, @Valid @RequestBody ChecklistItemRequest request) {
    return ResponseEntity.ok(checklistItemService.update(id, request));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deactivate(@PathVariable UUID id) {
    checklistItemService.deactivate(id);
    return ResponseEntity.noContent().build();
  }
}
