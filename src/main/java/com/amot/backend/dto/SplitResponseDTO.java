package com.amot.backend.dto;

import com.amot.backend.enums.PaymentStatus;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
public class SplitResponseDTO {

    private String userId;
    private BigDecimal amount;
    private BigDecimal percentage;

    private PaymentStatus paymentStatus;
    private LocalDateTime markedPaidAt;
    private LocalDateTime confirmedAt;

    // derived from paymentStatus
    private boolean settled;
    private LocalDateTime settledAt;

    private Long version;
}
