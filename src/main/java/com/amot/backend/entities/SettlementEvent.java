package com.amot.backend.entities;

import com.amot.backend.enums.PaymentStatus;
import com.amot.backend.enums.SettlementAction;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;
import java.time.LocalDateTime;

@Entity
@Table(
        name = "settlement_events",
        indexes = {
                @Index(name = "idx_settlement_event_edge", columnList = "bill_id, debtor_user_id, occurred_at")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SettlementEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "bill_id", nullable = false)
    private UUID billId;

    @Column(name = "debtor_user_id", nullable = false)
    private String debtorUserId;

    @Column(name = "actor_user_id", nullable = false)
    private String actorUserId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private SettlementAction action;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", nullable = false, length = 32)
    private PaymentStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false, length = 32)
    private PaymentStatus toStatus;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime occurredAt;
}
