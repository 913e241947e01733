package com.amot.backend.dto;

import java.math.BigDecimal;

public record ShareAmountDTO(String userId, BigDecimal amount, BigDecimal percentage) {
}
