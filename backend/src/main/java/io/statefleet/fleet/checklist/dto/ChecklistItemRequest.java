package io.statefleet.fleet.checklist.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record ChecklistItemRequest(
    @NotBlank @Size(max = 100) String categoryKey,
    @NotBlank @Size(max = 200) String categoryLabel,
    @NotBlank
        @Size(max = 100)
        @Pattern(regexp = "[a-z0-9_]+", message = "must be lower_snake_case")
        String itemKey,
    @NotBlank @Size(max = 300) String itemLabel,
    int sortOrder,
    Boolean active) {}
