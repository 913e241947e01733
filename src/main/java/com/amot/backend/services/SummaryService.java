package com.amot.backend.services;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.amot.backend.dto.BillSummaryDTO;
import com.amot.backend.dto.FriendBalanceDTO;
import com.amot.backend.exceptions.BadRequestException;
import com.amot.backend.mappers.BillMapper;
import com.amot.backend.repositories.BillRepository;
import com.amot.backend.services.ledger.BillLedger;
import com.amot.backend.services.ledger.LedgerBill;

import lombok.RequiredArgsConstructor;

/**
 * Dashboard figures, recomputed from the user's bills on every call.
 */
@Service
@RequiredArgsConstructor
public class SummaryService {

    private final BillRepository billRepository;
    private final BillLedger billLedger;

    @Transactional(readOnly = true)
    public BillSummaryDTO summarize(String userId) {
        return BillMapper.toSummaryDTO(billLedger.summarize(userId, ledgerBillsOf(userId)));
    }

    @Transactional(readOnly = true)
    public List<FriendBalanceDTO> friendBalances(String userId) {
        return billLedger.friendBalances(userId, ledgerBillsOf(userId))
                .stream()
                .map(BillMapper::toFriendBalanceDTO)
                .toList();
    }

    private List<LedgerBill> ledgerBillsOf(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new BadRequestException("userId is required");
        }
        return billRepository.findInvolvingUser(userId)
                .stream()
                .map(BillMapper::toLedgerBill)
                .toList();
    }
}
