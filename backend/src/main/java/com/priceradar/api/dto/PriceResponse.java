package com.priceradar.api.dto;

import java.math.BigDecimal;

public record PriceResponse(String asset, String currency, BigDecimal price) {
}
