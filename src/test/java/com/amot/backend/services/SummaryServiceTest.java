package com.amot.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import com.amot.backend.dto.BillSummaryDTO;
import com.amot.backend.dto.FriendBalanceDTO;
import com.amot.backend.entities.Bill;
import com.amot.backend.entities.BillSplit;
import com.amot.backend.enums.BillCategory;
import com.amot.backend.enums.PaymentStatus;
import com.amot.backend.enums.SplitMethod;
import com.amot.backend.exceptions.BadRequestException;
import com.amot.backend.repositories.BillRepository;
import com.amot.backend.services.ledger.BillLedger;

@ExtendWith(MockitoExtension.class)
class SummaryServiceTest {

    @Mock
    private BillRepository billRepository;

    @Spy
    private BillLedger billLedger = new BillLedger();

    @InjectMocks
    private SummaryService summaryService;

    private static Bill bill(String paidBy, String... sharesAndStatuses) {
        Bill bill = Bill.builder()
                .id(UUID.randomUUID())
                .title("t")
                .totalAmount(BigDecimal.TEN)
                .currency("PHP")
                .paidBy(paidBy)
                .createdBy(paidBy)
                .splitMethod(SplitMethod.CUSTOM)
                .category(BillCategory.OTHER)
                .splits(new ArrayList<>())
                .createdAt(LocalDateTime.of(2024, 4, 1, 12, 0))
                .build();
        for (int i = 0; i < sharesAndStatuses.length; i += 3) {
            bill.getSplits().add(BillSplit.builder()
                    .bill(bill)
                    .userId(sharesAndStatuses[i])
                    .amount(new BigDecimal(sharesAndStatuses[i + 1]))
                    .paymentStatus(PaymentStatus.valueOf(sharesAndStatuses[i + 2]))
                    .build());
        }
        return bill;
    }

    @Test
    void summarize_aggregatesBillsOfUser() {
        when(billRepository.findInvolvingUser("a")).thenReturn(List.of(
                bill("a", "a", "30", "UNPAID", "b", "30", "UNPAID"),
                bill("b", "a", "12.5", "PENDING_CONFIRMATION", "b", "12.5", "UNPAID")));

        BillSummaryDTO summary = summaryService.summarize("a");

        assertEquals(new BigDecimal("30.00"), summary.getTotalOwed());
        assertEquals(new BigDecimal("12.50"), summary.getTotalOwing());
        assertEquals(new BigDecimal("17.50"), summary.getBalance());
        assertEquals(2, summary.getBillCount());
    }

    @Test
    void friendBalances_usesCreatedAtWhenNeverUpdated() {
        when(billRepository.findInvolvingUser("a")).thenReturn(List.of(
                bill("a", "a", "30", "UNPAID", "b", "30", "UNPAID")));

        List<FriendBalanceDTO> balances = summaryService.friendBalances("a");

        assertEquals(1, balances.size());
        assertEquals("b", balances.get(0).friendId());
        assertEquals(new BigDecimal("30.00"), balances.get(0).balance());
        assertEquals(LocalDateTime.of(2024, 4, 1, 12, 0), balances.get(0).lastActivityAt());
    }

    @Test
    void summarize_blankUser_isRejected() {
        assertThrows(BadRequestException.class, () -> summaryService.summarize(" "));
    }
}
