package com.amot.backend.services;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.amot.backend.config.LedgerProperties;
import com.amot.backend.dto.BillResponseDTO;
import com.amot.backend.dto.SettlementEventDTO;
import com.amot.backend.dto.SettlementRequestDTO;
import com.amot.backend.entities.Bill;
import com.amot.backend.entities.BillSplit;
import com.amot.backend.entities.PaymentRecord;
import com.amot.backend.entities.SettlementEvent;
import com.amot.backend.enums.ParticipantRole;
import com.amot.backend.enums.SettlementAction;
import com.amot.backend.exceptions.ConflictException;
import com.amot.backend.exceptions.ForbiddenOperationException;
import com.amot.backend.exceptions.ResourceNotFoundException;
import com.amot.backend.mappers.BillMapper;
import com.amot.backend.repositories.BillSplitRepository;
import com.amot.backend.repositories.PaymentRecordRepository;
import com.amot.backend.repositories.SettlementEventRepository;
import com.amot.backend.services.ledger.MoneyUtils;
import com.amot.backend.services.ledger.SettlementSnapshot;
import com.amot.backend.services.ledger.SettlementStateMachine;
import com.amot.backend.services.ledger.TransitionResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies settlement transitions to the share behind a payment edge.
 *
 * <p>Each call is one read-validate-write transaction. The share's version guards against a
 * concurrent transition on the same edge: callers may pass the version they last read, and
 * a stale write fails at commit with an optimistic-lock error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementService {

    private final BillService billService;
    private final BillSplitRepository billSplitRepository;
    private final PaymentRecordRepository paymentRecordRepository;
    private final SettlementEventRepository settlementEventRepository;
    private final SettlementStateMachine stateMachine;
    private final LedgerProperties ledgerProperties;

    @Transactional
    public BillResponseDTO markPaid(UUID billId, String debtorUserId, String actingUserId, SettlementRequestDTO request) {
        return transition(billId, debtorUserId, actingUserId, SettlementAction.MARK_PAID, request);
    }

    @Transactional
    public BillResponseDTO cancelPayment(UUID billId, String debtorUserId, String actingUserId, SettlementRequestDTO request) {
        return transition(billId, debtorUserId, actingUserId, SettlementAction.CANCEL_PAYMENT, request);
    }

    @Transactional
    public BillResponseDTO confirm(UUID billId, String debtorUserId, String actingUserId, SettlementRequestDTO request) {
        return transition(billId, debtorUserId, actingUserId, SettlementAction.CONFIRM, request);
    }

    @Transactional
    public BillResponseDTO undoConfirmation(UUID billId, String debtorUserId, String actingUserId, SettlementRequestDTO request) {
        return transition(billId, debtorUserId, actingUserId, SettlementAction.UNDO_CONFIRMATION, request);
    }

    @Transactional(readOnly = true)
    public List<SettlementEventDTO> history(UUID billId, String debtorUserId) {
        findEdgeShare(billService.getBill(billId), debtorUserId);
        return settlementEventRepository.findByBillIdAndDebtorUserIdOrderByOccurredAtAsc(billId, debtorUserId)
                .stream()
                .map(BillMapper::toEventDTO)
                .toList();
    }

    private BillResponseDTO transition(
            UUID billId,
            String debtorUserId,
            String actingUserId,
            SettlementAction action,
            SettlementRequestDTO request
    ) {
        BillService.requireActingUser(actingUserId);
        Bill bill = billService.getBill(billId);
        BillSplit split = findEdgeShare(bill, debtorUserId);

        if (request != null && request.getExpectedVersion() != null
                && !request.getExpectedVersion().equals(split.getVersion())) {
            throw new ConflictException("Payment was changed by someone else, reload the bill and try again");
        }

        ParticipantRole role = roleOf(actingUserId, debtorUserId, bill.getPaidBy());
        SettlementSnapshot before = BillMapper.toSnapshot(split);
        LocalDateTime now = LocalDateTime.now();
        TransitionResult result = stateMachine.apply(before, action, role, now);

        switch (result.outcome()) {
            case UNAUTHORIZED -> {
                log.warn("Rejected {} on bill {} edge {} -> {} by {}: {}",
                        action, billId, debtorUserId, bill.getPaidBy(), actingUserId, result.message());
                throw new ForbiddenOperationException(result.message());
            }
            case ILLEGAL_TRANSITION -> {
                log.warn("Rejected {} on bill {} edge {} -> {}: {}", action, billId, debtorUserId, bill.getPaidBy(), result.message());
                throw new ConflictException(result.message());
            }
            case NO_OP -> log.debug("{} on bill {} edge {} -> {} left it {}", action, billId, debtorUserId, bill.getPaidBy(), before.status());
            case APPLIED -> applyTransition(bill, split, actingUserId, action, request, before, result.snapshot(), now);
        }

        return billService.toResponse(bill);
    }

    private void applyTransition(
            Bill bill,
            BillSplit split,
            String actingUserId,
            SettlementAction action,
            SettlementRequestDTO request,
            SettlementSnapshot before,
            SettlementSnapshot after,
            LocalDateTime now
    ) {
        split.setPaymentStatus(after.status());
        split.setMarkedPaidAt(after.markedPaidAt());
        split.setConfirmedAt(after.confirmedAt());
        billSplitRepository.saveAndFlush(split);

        settlementEventRepository.save(SettlementEvent.builder()
                .billId(bill.getId())
                .debtorUserId(split.getUserId())
                .actorUserId(actingUserId)
                .action(action)
                .fromStatus(before.status())
                .toStatus(after.status())
                .occurredAt(now)
                .build());

        if (action == SettlementAction.MARK_PAID) {
            paymentRecordRepository.save(PaymentRecord.builder()
                    .billId(bill.getId())
                    .fromUserId(split.getUserId())
                    .toUserId(bill.getPaidBy())
                    .amount(MoneyUtils.round(split.getAmount()))
                    .paymentMethod(paymentMethodOf(request))
                    .referenceNumber(request != null ? request.getReferenceNumber() : null)
                    .note(request != null && request.getNote() != null ? request.getNote() : "Payment for " + bill.getTitle())
                    .build());
        }

        log.info("{} on bill {}: {} -> {} is now {} (acting user {})",
                action, bill.getId(), split.getUserId(), bill.getPaidBy(), after.status(), actingUserId);
    }

    // a payment edge exists only for a non-payer share with a positive amount
    private BillSplit findEdgeShare(Bill bill, String debtorUserId) {
        if (debtorUserId == null || debtorUserId.equals(bill.getPaidBy())) {
            throw new ResourceNotFoundException("Payment not found");
        }
        BillSplit split = billSplitRepository.findByBillIdAndUserId(bill.getId(), debtorUserId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment not found"));
        if (!MoneyUtils.isPositive(split.getAmount())) {
            throw new ResourceNotFoundException("Payment not found");
        }
        return split;
    }

    private ParticipantRole roleOf(String actingUserId, String debtorUserId, String paidBy) {
        if (actingUserId.equals(debtorUserId)) {
            return ParticipantRole.DEBTOR;
        }
        if (actingUserId.equals(paidBy)) {
            return ParticipantRole.CREDITOR;
        }
        return ParticipantRole.NONE;
    }

    private String paymentMethodOf(SettlementRequestDTO request) {
        if (request == null || request.getPaymentMethod() == null || request.getPaymentMethod().isBlank()) {
            return ledgerProperties.defaultPaymentMethod();
        }
        return request.getPaymentMethod();
    }
}
