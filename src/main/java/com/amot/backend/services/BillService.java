package com.amot.backend.services;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.amot.backend.config.LedgerProperties;
import com.amot.backend.dto.BillResponseDTO;
import com.amot.backend.dto.CreateBillRequestDTO;
import com.amot.backend.dto.PaymentEdgeDTO;
import com.amot.backend.entities.Bill;
import com.amot.backend.entities.BillSplit;
import com.amot.backend.enums.PaymentStatus;
import com.amot.backend.exceptions.BadRequestException;
import com.amot.backend.exceptions.ForbiddenOperationException;
import com.amot.backend.exceptions.ResourceNotFoundException;
import com.amot.backend.mappers.BillMapper;
import com.amot.backend.repositories.BillRepository;
import com.amot.backend.repositories.BillSplitRepository;
import com.amot.backend.repositories.PaymentRecordRepository;
import com.amot.backend.repositories.SettlementEventRepository;
import com.amot.backend.services.ledger.BillItem;
import com.amot.backend.services.ledger.PaymentEdge;
import com.amot.backend.services.ledger.PaymentGraphBuilder;
import com.amot.backend.services.ledger.Share;
import com.amot.backend.services.ledger.SplitOutcome;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class BillService {

    private final BillRepository billRepository;
    private final BillSplitRepository billSplitRepository;
    private final PaymentRecordRepository paymentRecordRepository;
    private final SettlementEventRepository settlementEventRepository;
    private final SplitService splitService;
    private final PaymentGraphBuilder paymentGraphBuilder;
    private final LedgerProperties ledgerProperties;

    /**
     * Creates the bill and all of its shares, or nothing: when the shares cannot be stored
     * the bill row written just before is removed again and the failure is rethrown.
     */
    @Transactional
    public BillResponseDTO create(CreateBillRequestDTO dto, String actingUserId) {
        requireActingUser(actingUserId);
        List<Share> shares = resolveShares(dto);

        Bill bill = Bill.builder()
                .title(dto.getTitle().trim())
                .description(dto.getDescription())
                .totalAmount(dto.getTotalAmount())
                .currency(ledgerProperties.currency())
                .paidBy(dto.getPaidBy())
                .createdBy(actingUserId)
                .splitMethod(dto.getSplitMethod())
                .category(dto.getCategory() != null ? dto.getCategory() : ledgerProperties.defaultCategory())
                .groupId(dto.getGroupId())
                .build();

        bill = billRepository.save(bill);

        List<BillSplit> splits = toSplitEntities(bill, shares);
        try {
            splits = billSplitRepository.saveAllAndFlush(splits);
        } catch (RuntimeException e) {
            log.error("Failed to store splits of bill {}, removing the bill", bill.getId(), e);
            billRepository.delete(bill);
            throw e;
        }
        bill.getSplits().addAll(splits);

        log.info("Bill {} created by {}: total={} method={} participants={}",
                bill.getId(), actingUserId, bill.getTotalAmount(), bill.getSplitMethod(), shares.size());

        return toResponse(bill);
    }

    @Transactional(readOnly = true)
    public BillResponseDTO findById(UUID id) {
        return toResponse(getBill(id));
    }

    @Transactional(readOnly = true)
    public List<BillResponseDTO> findByUser(String userId) {
        return billRepository.findInvolvingUser(userId)
                .stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<BillResponseDTO> findByGroup(String groupId) {
        return billRepository.findByGroupIdOrderByCreatedAtDesc(groupId)
                .stream()
                .map(this::toResponse)
                .toList();
    }

    /**
     * Bills of the group with an edge to or from the member that is not confirmed yet.
     * An empty result means the member can leave the group.
     */
    @Transactional(readOnly = true)
    public List<BillResponseDTO> findUnsettledForMemberInGroup(String groupId, String userId) {
        return billRepository.findByGroupWithOpenShareFor(groupId, userId, PaymentStatus.CONFIRMED)
                .stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<PaymentEdgeDTO> findPayments(UUID billId) {
        return edgesOf(getBill(billId))
                .stream()
                .map(BillMapper::toPaymentEdgeDTO)
                .toList();
    }

    /**
     * Replaces the bill's data and all of its shares. Settlement progress on the old shares is discarded.
     */
    @Transactional
    public BillResponseDTO update(UUID id, CreateBillRequestDTO dto, String actingUserId) {
        requireActingUser(actingUserId);
        Bill bill = getBill(id);
        requireCreator(bill, actingUserId, "edit");

        List<Share> shares = resolveShares(dto);

        bill.setTitle(dto.getTitle().trim());
        bill.setDescription(dto.getDescription());
        bill.setTotalAmount(dto.getTotalAmount());
        bill.setPaidBy(dto.getPaidBy());
        bill.setSplitMethod(dto.getSplitMethod());
        bill.setCategory(dto.getCategory() != null ? dto.getCategory() : ledgerProperties.defaultCategory());
        if (dto.getGroupId() != null) {
            bill.setGroupId(dto.getGroupId());
        }

        // the new shares start UNPAID, so the old settlement trail goes with the old shares
        paymentRecordRepository.deleteByBillId(id);
        settlementEventRepository.deleteByBillId(id);

        // old rows must be gone before shares for the same users are inserted again
        bill.getSplits().clear();
        bill = billRepository.saveAndFlush(bill);

        bill.getSplits().addAll(toSplitEntities(bill, shares));
        bill = billRepository.saveAndFlush(bill);

        log.info("Bill {} updated by {}: total={} method={}", id, actingUserId, bill.getTotalAmount(), bill.getSplitMethod());
        return toResponse(bill);
    }

    @Transactional
    public void delete(UUID id, String actingUserId) {
        requireActingUser(actingUserId);
        Bill bill = getBill(id);
        requireCreator(bill, actingUserId, "delete");

        paymentRecordRepository.deleteByBillId(id);
        settlementEventRepository.deleteByBillId(id);
        billRepository.delete(bill);

        log.info("Bill {} deleted by {}", id, actingUserId);
    }

    Bill getBill(UUID id) {
        return billRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Bill not found"));
    }

    BillResponseDTO toResponse(Bill bill) {
        return BillMapper.toResponseDTO(bill, edgesOf(bill));
    }

    private List<PaymentEdge> edgesOf(Bill bill) {
        return paymentGraphBuilder.buildPaymentEdges(bill.getPaidBy(), BillMapper.toShares(bill));
    }

    private List<Share> resolveShares(CreateBillRequestDTO dto) {
        if (dto.getTitle() == null || dto.getTitle().isBlank()) {
            throw new BadRequestException("title is required");
        }

        List<String> participants = dto.getParticipants() == null ? List.of() : dto.getParticipants();
        if (dto.getPaidBy() == null || !participants.contains(dto.getPaidBy())) {
            throw new BadRequestException("The payer must be one of the participants");
        }

        List<Share> requested = dto.getSplits() == null ? List.of()
                : dto.getSplits().stream().map(BillMapper::toShare).toList();
        List<BillItem> items = dto.getItems() == null ? List.of()
                : dto.getItems().stream().map(BillMapper::toBillItem).toList();

        SplitOutcome outcome = splitService.calculate(
                dto.getSplitMethod(), dto.getTotalAmount(), participants, requested, items);

        if (!outcome.isValid()) {
            throw new BadRequestException(outcome.validation().error());
        }
        return outcome.shares();
    }

    private List<BillSplit> toSplitEntities(Bill bill, List<Share> shares) {
        List<BillSplit> splits = new ArrayList<>(shares.size());
        for (int i = 0; i < shares.size(); i++) {
            Share share = shares.get(i);
            splits.add(BillSplit.builder()
                    .bill(bill)
                    .userId(share.userId())
                    .position(i)
                    .amount(share.amount())
                    .percentage(share.percentage())
                    .paymentStatus(PaymentStatus.UNPAID)
                    .build());
        }
        return splits;
    }

    private void requireCreator(Bill bill, String actingUserId, String operation) {
        if (!actingUserId.equals(bill.getCreatedBy())) {
            log.warn("User {} tried to {} bill {} created by {}", actingUserId, operation, bill.getId(), bill.getCreatedBy());
            throw new ForbiddenOperationException("Only the creator of the bill can " + operation + " it");
        }
    }

    static void requireActingUser(String actingUserId) {
        if (actingUserId == null || actingUserId.isBlank()) {
            throw new BadRequestException("Acting user is required");
        }
    }
}
