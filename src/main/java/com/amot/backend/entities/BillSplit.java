package com.amot.backend.entities;

import com.amot.backend.enums.PaymentStatus;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A participant's share of a bill together with the settlement state of the edge derived from it.
 */
@Entity
@Table(
        name = "bill_splits",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_bill_split_user", columnNames = {"bill_id", "user_id"})
        },
        indexes = {
                @Index(name = "idx_bill_split_user", columnList = "user_id"),
                @Index(name = "idx_bill_split_status", columnList = "payment_status")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BillSplit {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "bill_id", nullable = false)
    private Bill bill;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "split_order", nullable = false)
    private int position;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(precision = 7, scale = 4)
    private BigDecimal percentage;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 32)
    @Builder.Default
    private PaymentStatus paymentStatus = PaymentStatus.UNPAID;

    @Column(name = "marked_paid_at")
    private LocalDateTime markedPaidAt;

    @Column(name = "confirmed_at")
    private LocalDateTime confirmedAt;

    @Version
    private Long version;

    public boolean isSettled() {
        return paymentStatus != null && paymentStatus.isSettled();
    }
}
