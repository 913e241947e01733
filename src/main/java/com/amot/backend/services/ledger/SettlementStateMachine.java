package com.amot.backend.services.ledger;

import java.time.LocalDateTime;

import org.springframework.stereotype.Component;

import com.amot.backend.enums.ParticipantRole;
import com.amot.backend.enums.PaymentStatus;
import com.amot.backend.enums.SettlementAction;
import com.amot.backend.enums.TransitionOutcome;

/**
 * Lifecycle of a payment edge:
 * <pre>
 *   UNPAID --MARK_PAID(debtor)--> PENDING_CONFIRMATION --CONFIRM(creditor)--> CONFIRMED
 *   PENDING_CONFIRMATION --CANCEL_PAYMENT(debtor)--> UNPAID
 *   CONFIRMED --UNDO_CONFIRMATION(creditor)--> PENDING_CONFIRMATION
 * </pre>
 * Requests that land on the state the edge is already in are accepted as no-ops.
 * Business rejections are reported in the {@link TransitionResult}; nothing here throws for them.
 */
@Component
public class SettlementStateMachine {

    public TransitionResult apply(
            SettlementSnapshot current,
            SettlementAction action,
            ParticipantRole role,
            LocalDateTime now
    ) {
        SettlementSnapshot snapshot = current != null ? current : SettlementSnapshot.unpaid();

        if (role != action.getAuthority()) {
            return new TransitionResult(
                    TransitionOutcome.UNAUTHORIZED,
                    snapshot,
                    "Only the " + describe(action.getAuthority()) + " can " + onThisPayment(action)
            );
        }

        if (snapshot.status() == action.getTarget()) {
            return new TransitionResult(TransitionOutcome.NO_OP, snapshot, "Payment is already " + describe(snapshot.status()));
        }

        if (snapshot.status() != action.getSource()) {
            return new TransitionResult(
                    TransitionOutcome.ILLEGAL_TRANSITION,
                    snapshot,
                    "Cannot " + describe(action) + " a payment that is " + describe(snapshot.status())
            );
        }

        return new TransitionResult(TransitionOutcome.APPLIED, next(snapshot, action, now), null);
    }

    private SettlementSnapshot next(SettlementSnapshot current, SettlementAction action, LocalDateTime now) {
        return switch (action) {
            case MARK_PAID -> new SettlementSnapshot(PaymentStatus.PENDING_CONFIRMATION, now, current.confirmedAt());
            case CANCEL_PAYMENT -> new SettlementSnapshot(PaymentStatus.UNPAID, null, null);
            case CONFIRM -> new SettlementSnapshot(PaymentStatus.CONFIRMED, current.markedPaidAt(), now);
            case UNDO_CONFIRMATION -> new SettlementSnapshot(PaymentStatus.PENDING_CONFIRMATION, current.markedPaidAt(), null);
        };
    }

    private static String describe(ParticipantRole role) {
        return role == ParticipantRole.CREDITOR ? "payer" : "debtor";
    }

    private static String describe(SettlementAction action) {
        return switch (action) {
            case MARK_PAID -> "mark as paid";
            case CANCEL_PAYMENT -> "cancel";
            case CONFIRM -> "confirm";
            case UNDO_CONFIRMATION -> "undo the confirmation of";
        };
    }

    private static String onThisPayment(SettlementAction action) {
        return switch (action) {
            case MARK_PAID -> "mark this payment as paid";
            case CANCEL_PAYMENT -> "cancel this payment";
            case CONFIRM -> "confirm this payment";
            case UNDO_CONFIRMATION -> "undo the confirmation of this payment";
        };
    }

    private static String describe(PaymentStatus status) {
        return switch (status) {
            case UNPAID -> "unpaid";
            case PENDING_CONFIRMATION -> "pending confirmation";
            case CONFIRMED -> "confirmed";
        };
    }
}
