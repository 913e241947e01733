package com.amot.backend.dto;

import com.amot.backend.enums.PaymentStatus;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
public class PaymentEdgeDTO {

    private String fromUserId;
    private String toUserId;
    private BigDecimal amount;

    private PaymentStatus paymentStatus;
    private boolean paid;
    private LocalDateTime paidAt;
    private LocalDateTime markedPaidAt;
}
