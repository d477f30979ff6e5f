package com.priceradar.api.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * New fallback order. Unknown names are ignored; registered providers left out are appended.
 */
public record PriorityUpdateRequest(@NotEmpty(message = "INVALID_PRIORITY") List<String> priority) {
}
