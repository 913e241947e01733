package com.amot.backend.dto;

import com.amot.backend.enums.PaymentStatus;
import com.amot.backend.enums.SettlementAction;
import lombok.Data;

import java.time.LocalDateTime;

@Data
public class SettlementEventDTO {

    private SettlementAction action;
    private String actorUserId;
    private PaymentStatus fromStatus;
    private PaymentStatus toStatus;
    private LocalDateTime occurredAt;
}
