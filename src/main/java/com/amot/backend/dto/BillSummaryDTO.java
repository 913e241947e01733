package com.amot.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BillSummaryDTO {

    private BigDecimal totalOwed;
    private BigDecimal totalOwing;
    private BigDecimal totalSettled;
    private BigDecimal balance;
    private int billCount;
}
