package com.amot.backend.mappers;

import com.amot.backend.dto.BillItemDTO;
import com.amot.backend.dto.BillResponseDTO;
import com.amot.backend.dto.BillSummaryDTO;
import com.amot.backend.dto.FriendBalanceDTO;
import com.amot.backend.dto.PaymentEdgeDTO;
import com.amot.backend.dto.SettlementEventDTO;
import com.amot.backend.dto.ShareAmountDTO;
import com.amot.backend.dto.SplitRequestDTO;
import com.amot.backend.dto.SplitResponseDTO;
import com.amot.backend.entities.Bill;
import com.amot.backend.entities.BillSplit;
import com.amot.backend.entities.SettlementEvent;
import com.amot.backend.services.ledger.BillItem;
import com.amot.backend.services.ledger.BillSummary;
import com.amot.backend.services.ledger.FriendBalance;
import com.amot.backend.services.ledger.LedgerBill;
import com.amot.backend.services.ledger.PaymentEdge;
import com.amot.backend.services.ledger.SettlementSnapshot;
import com.amot.backend.services.ledger.Share;

import java.util.List;

public class BillMapper {
    private BillMapper() {}

    // =========================
    // entity -> ledger
    // =========================

    public static Share toShare(BillSplit split) {
        if (split == null) return null;

        return new Share(
                split.getUserId(),
                split.getAmount(),
                split.getPercentage(),
                split.getPaymentStatus(),
                split.getMarkedPaidAt(),
                split.getConfirmedAt()
        );
    }

    public static List<Share> toShares(Bill bill) {
        return bill.getSplits().stream()
                .map(BillMapper::toShare)
                .toList();
    }

    public static LedgerBill toLedgerBill(Bill bill) {
        if (bill == null) return null;

        return new LedgerBill(
                bill.getId() != null ? bill.getId().toString() : null,
                bill.getPaidBy(),
                toShares(bill),
                bill.getUpdatedAt() != null ? bill.getUpdatedAt() : bill.getCreatedAt()
        );
    }

    public static SettlementSnapshot toSnapshot(BillSplit split) {
        return new SettlementSnapshot(split.getPaymentStatus(), split.getMarkedPaidAt(), split.getConfirmedAt());
    }

    // =========================
    // request -> ledger
    // =========================

    public static Share toShare(SplitRequestDTO dto) {
        if (dto == null) return null;

        return new Share(dto.getUserId(), dto.getAmount(), dto.getPercentage(), null, null, null);
    }

    public static BillItem toBillItem(BillItemDTO dto) {
        if (dto == null) return null;

        return new BillItem(dto.getId(), dto.getName(), dto.getPrice(), dto.getAssignedTo());
    }

    // =========================
    // -> response
    // =========================

    public static BillResponseDTO toResponseDTO(Bill bill, List<PaymentEdge> payments) {
        if (bill == null) return null;

        BillResponseDTO dto = new BillResponseDTO();

        dto.setId(bill.getId().toString());
        dto.setTitle(bill.getTitle());
        dto.setDescription(bill.getDescription());
        dto.setTotalAmount(bill.getTotalAmount());
        dto.setCurrency(bill.getCurrency());

        dto.setPaidBy(bill.getPaidBy());
        dto.setCreatedBy(bill.getCreatedBy());
        dto.setParticipants(bill.getParticipants());

        dto.setSplitMethod(bill.getSplitMethod());
        dto.setCategory(bill.getCategory());
        dto.setGroupId(bill.getGroupId());

        dto.setSplits(bill.getSplits().stream().map(BillMapper::toSplitResponseDTO).toList());
        dto.setPayments(payments.stream().map(BillMapper::toPaymentEdgeDTO).toList());

        dto.setCreatedAt(bill.getCreatedAt());
        dto.setUpdatedAt(bill.getUpdatedAt() != null ? bill.getUpdatedAt() : bill.getCreatedAt());

        return dto;
    }

    public static SplitResponseDTO toSplitResponseDTO(BillSplit split) {
        SplitResponseDTO dto = new SplitResponseDTO();

        dto.setUserId(split.getUserId());
        dto.setAmount(split.getAmount());
        dto.setPercentage(split.getPercentage());

        dto.setPaymentStatus(split.getPaymentStatus());
        dto.setMarkedPaidAt(split.getMarkedPaidAt());
        dto.setConfirmedAt(split.getConfirmedAt());
        dto.setSettled(split.isSettled());
        dto.setSettledAt(split.isSettled() ? split.getConfirmedAt() : null);

        dto.setVersion(split.getVersion());

        return dto;
    }

    public static PaymentEdgeDTO toPaymentEdgeDTO(PaymentEdge edge) {
        PaymentEdgeDTO dto = new PaymentEdgeDTO();

        dto.setFromUserId(edge.fromUserId());
        dto.setToUserId(edge.toUserId());
        dto.setAmount(edge.amount());

        dto.setPaymentStatus(edge.status());
        dto.setPaid(edge.isSettled());
        dto.setPaidAt(edge.settledAt());
        dto.setMarkedPaidAt(edge.markedPaidAt());

        return dto;
    }

    public static ShareAmountDTO toShareAmountDTO(Share share) {
        return new ShareAmountDTO(share.userId(), share.amount(), share.percentage());
    }

    public static SettlementEventDTO toEventDTO(SettlementEvent event) {
        SettlementEventDTO dto = new SettlementEventDTO();

        dto.setAction(event.getAction());
        dto.setActorUserId(event.getActorUserId());
        dto.setFromStatus(event.getFromStatus());
        dto.setToStatus(event.getToStatus());
        dto.setOccurredAt(event.getOccurredAt());

        return dto;
    }

    public static BillSummaryDTO toSummaryDTO(BillSummary summary) {
        return BillSummaryDTO.builder()
                .totalOwed(summary.totalOwed())
                .totalOwing(summary.totalOwing())
                .totalSettled(summary.totalSettled())
                .balance(summary.balance())
                .billCount(summary.billCount())
                .build();
    }

    public static FriendBalanceDTO toFriendBalanceDTO(FriendBalance balance) {
        return new FriendBalanceDTO(
                balance.friendId(),
                balance.balance(),
                balance.billCount(),
                balance.lastActivityAt()
        );
    }
}
