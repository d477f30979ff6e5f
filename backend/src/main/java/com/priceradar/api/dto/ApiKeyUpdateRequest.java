package com.priceradar.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ApiKeyUpdateRequest(@NotBlank(message = "INVALID_API_KEY") String apiKey) {
}
