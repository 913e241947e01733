package com.amot.backend.services.ledger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.time.LocalDateTime;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.amot.backend.enums.ParticipantRole;
import com.amot.backend.enums.PaymentStatus;
import com.amot.backend.enums.SettlementAction;
import com.amot.backend.enums.TransitionOutcome;

class SettlementStateMachineTest {

    private static final LocalDateTime T1 = LocalDateTime.of(2024, 5, 10, 12, 0);
    private static final LocalDateTime T2 = LocalDateTime.of(2024, 5, 11, 8, 15);

    private final SettlementStateMachine machine = new SettlementStateMachine();

    @Test
    void markPaid_byDebtor_movesToPendingAndStampsTime() {
        TransitionResult result = machine.apply(SettlementSnapshot.unpaid(), SettlementAction.MARK_PAID, ParticipantRole.DEBTOR, T1);

        assertEquals(TransitionOutcome.APPLIED, result.outcome());
        assertEquals(PaymentStatus.PENDING_CONFIRMATION, result.snapshot().status());
        assertEquals(T1, result.snapshot().markedPaidAt());
        assertNull(result.snapshot().confirmedAt());
    }

    @Test
    void confirm_byCreditor_movesToConfirmed() {
        SettlementSnapshot pending = new SettlementSnapshot(PaymentStatus.PENDING_CONFIRMATION, T1, null);

        TransitionResult result = machine.apply(pending, SettlementAction.CONFIRM, ParticipantRole.CREDITOR, T2);

        assertEquals(TransitionOutcome.APPLIED, result.outcome());
        assertEquals(PaymentStatus.CONFIRMED, result.snapshot().status());
        assertEquals(T1, result.snapshot().markedPaidAt());
        assertEquals(T2, result.snapshot().confirmedAt());
    }

    @Test
    void cancel_byDebtor_returnsToUnpaidAndClearsTimes() {
        SettlementSnapshot pending = new SettlementSnapshot(PaymentStatus.PENDING_CONFIRMATION, T1, null);

        TransitionResult result = machine.apply(pending, SettlementAction.CANCEL_PAYMENT, ParticipantRole.DEBTOR, T2);

        assertEquals(TransitionOutcome.APPLIED, result.outcome());
        assertEquals(SettlementSnapshot.unpaid(), result.snapshot());
    }

    @Test
    void undoConfirmation_byCreditor_keepsMarkedPaidAt() {
        SettlementSnapshot confirmed = new SettlementSnapshot(PaymentStatus.CONFIRMED, T1, T2);

        TransitionResult result = machine.apply(confirmed, SettlementAction.UNDO_CONFIRMATION, ParticipantRole.CREDITOR, T2);

        assertEquals(TransitionOutcome.APPLIED, result.outcome());
        assertEquals(PaymentStatus.PENDING_CONFIRMATION, result.snapshot().status());
        assertEquals(T1, result.snapshot().markedPaidAt());
        assertNull(result.snapshot().confirmedAt());
    }

    @Test
    void confirm_whenAlreadyConfirmed_isNoOpAndKeepsFirstTimestamp() {
        SettlementSnapshot confirmed = new SettlementSnapshot(PaymentStatus.CONFIRMED, T1, T1);

        TransitionResult result = machine.apply(confirmed, SettlementAction.CONFIRM, ParticipantRole.CREDITOR, T2);

        assertEquals(TransitionOutcome.NO_OP, result.outcome());
        assertSame(confirmed, result.snapshot());
        assertEquals(T1, result.snapshot().confirmedAt());
    }

    @Test
    void confirm_fromUnpaid_isIllegal() {
        TransitionResult result = machine.apply(SettlementSnapshot.unpaid(), SettlementAction.CONFIRM, ParticipantRole.CREDITOR, T1);

        assertEquals(TransitionOutcome.ILLEGAL_TRANSITION, result.outcome());
        assertEquals(PaymentStatus.UNPAID, result.snapshot().status());
        assertEquals("Cannot confirm a payment that is unpaid", result.message());
    }

    @Test
    void markPaid_byCreditor_isUnauthorized() {
        TransitionResult result = machine.apply(SettlementSnapshot.unpaid(), SettlementAction.MARK_PAID, ParticipantRole.CREDITOR, T1);

        assertEquals(TransitionOutcome.UNAUTHORIZED, result.outcome());
        assertEquals("Only the debtor can mark this payment as paid", result.message());
    }

    @Test
    void noOp_stillRequiresAuthority() {
        SettlementSnapshot confirmed = new SettlementSnapshot(PaymentStatus.CONFIRMED, T1, T1);

        TransitionResult result = machine.apply(confirmed, SettlementAction.CONFIRM, ParticipantRole.DEBTOR, T2);

        assertEquals(TransitionOutcome.UNAUTHORIZED, result.outcome());
        assertEquals(PaymentStatus.CONFIRMED, result.snapshot().status());
    }

    @ParameterizedTest
    @CsvSource({
            "UNPAID, MARK_PAID, DEBTOR, APPLIED",
            "UNPAID, CANCEL_PAYMENT, DEBTOR, NO_OP",
            "UNPAID, CONFIRM, CREDITOR, ILLEGAL_TRANSITION",
            "UNPAID, UNDO_CONFIRMATION, CREDITOR, ILLEGAL_TRANSITION",
            "PENDING_CONFIRMATION, MARK_PAID, DEBTOR, NO_OP",
            "PENDING_CONFIRMATION, CANCEL_PAYMENT, DEBTOR, APPLIED",
            "PENDING_CONFIRMATION, CONFIRM, CREDITOR, APPLIED",
            "PENDING_CONFIRMATION, UNDO_CONFIRMATION, CREDITOR, NO_OP",
            "CONFIRMED, MARK_PAID, DEBTOR, ILLEGAL_TRANSITION",
            "CONFIRMED, CANCEL_PAYMENT, DEBTOR, ILLEGAL_TRANSITION",
            "CONFIRMED, CONFIRM, CREDITOR, NO_OP",
            "CONFIRMED, UNDO_CONFIRMATION, CREDITOR, APPLIED",
            "UNPAID, MARK_PAID, NONE, UNAUTHORIZED",
            "PENDING_CONFIRMATION, CONFIRM, NONE, UNAUTHORIZED",
            "PENDING_CONFIRMATION, CONFIRM, DEBTOR, UNAUTHORIZED",
            "PENDING_CONFIRMATION, CANCEL_PAYMENT, CREDITOR, UNAUTHORIZED"
    })
    void transitionTable(PaymentStatus from, SettlementAction action, ParticipantRole role, TransitionOutcome expected) {
        SettlementSnapshot current = new SettlementSnapshot(from, null, null);

        TransitionResult result = machine.apply(current, action, role, T1);

        assertEquals(expected, result.outcome());
        PaymentStatus expectedStatus = expected == TransitionOutcome.APPLIED ? action.getTarget() : from;
        assertEquals(expectedStatus, result.snapshot().status());
    }
}
