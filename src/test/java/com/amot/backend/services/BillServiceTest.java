package com.amot.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import com.amot.backend.config.LedgerProperties;
import com.amot.backend.dto.BillResponseDTO;
import com.amot.backend.dto.CreateBillRequestDTO;
import com.amot.backend.dto.SplitRequestDTO;
import com.amot.backend.entities.Bill;
import com.amot.backend.entities.BillSplit;
import com.amot.backend.enums.BillCategory;
import com.amot.backend.enums.PaymentStatus;
import com.amot.backend.enums.SplitMethod;
import com.amot.backend.exceptions.BadRequestException;
import com.amot.backend.exceptions.ForbiddenOperationException;
import com.amot.backend.exceptions.ResourceNotFoundException;
import com.amot.backend.repositories.BillRepository;
import com.amot.backend.repositories.BillSplitRepository;
import com.amot.backend.repositories.PaymentRecordRepository;
import com.amot.backend.repositories.SettlementEventRepository;
import com.amot.backend.services.ledger.PaymentGraphBuilder;
import com.amot.backend.services.ledger.SplitCalculator;

@ExtendWith(MockitoExtension.class)
class BillServiceTest {

    @Mock
    private BillRepository billRepository;

    @Mock
    private BillSplitRepository billSplitRepository;

    @Mock
    private PaymentRecordRepository paymentRecordRepository;

    @Mock
    private SettlementEventRepository settlementEventRepository;

    private BillService billService;

    @BeforeEach
    void setUp() {
        billService = new BillService(
                billRepository,
                billSplitRepository,
                paymentRecordRepository,
                settlementEventRepository,
                new SplitService(new SplitCalculator()),
                new PaymentGraphBuilder(),
                new LedgerProperties("PHP", BillCategory.OTHER, "manual")
        );
    }

    private static CreateBillRequestDTO equalRequest(String total, String paidBy, String... participants) {
        CreateBillRequestDTO dto = new CreateBillRequestDTO();
        dto.setTitle("Dinner");
        dto.setTotalAmount(new BigDecimal(total));
        dto.setPaidBy(paidBy);
        dto.setParticipants(List.of(participants));
        dto.setSplitMethod(SplitMethod.EQUAL);
        return dto;
    }

    private void stubSaves() {
        when(billRepository.save(any(Bill.class))).thenAnswer(inv -> {
            Bill b = inv.getArgument(0);
            if (b.getId() == null) b.setId(UUID.randomUUID());
            b.setCreatedAt(LocalDateTime.now());
            return b;
        });
    }

    @Test
    void create_equalSplit_storesSharesAndDerivesEdges() {
        stubSaves();
        when(billSplitRepository.saveAllAndFlush(anyList())).thenAnswer(inv -> inv.getArgument(0));

        BillResponseDTO resp = billService.create(equalRequest("120", "a", "a", "b", "c"), "a");

        assertEquals("PHP", resp.getCurrency());
        assertEquals(BillCategory.OTHER, resp.getCategory());
        assertEquals("a", resp.getCreatedBy());
        assertEquals(List.of("a", "b", "c"), resp.getParticipants());
        assertEquals(3, resp.getSplits().size());
        resp.getSplits().forEach(s -> {
            assertEquals(new BigDecimal("40.00"), s.getAmount());
            assertEquals(PaymentStatus.UNPAID, s.getPaymentStatus());
        });
        assertEquals(2, resp.getPayments().size());
        resp.getPayments().forEach(p -> assertEquals("a", p.getToUserId()));
    }

    @Test
    void create_payerNotParticipant_isRejected() {
        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> billService.create(equalRequest("50", "z", "a", "b"), "a"));

        assertEquals("The payer must be one of the participants", ex.getMessage());
        verify(billRepository, never()).save(any());
    }

    @Test
    void create_invalidCustomSplit_isRejectedBeforeAnyWrite() {
        CreateBillRequestDTO dto = equalRequest("100", "a", "a", "b");
        dto.setSplitMethod(SplitMethod.CUSTOM);
        dto.setSplits(List.of(
                new SplitRequestDTO("a", new BigDecimal("40"), null),
                new SplitRequestDTO("b", new BigDecimal("50"), null)));

        BadRequestException ex = assertThrows(BadRequestException.class, () -> billService.create(dto, "a"));

        assertEquals("Total must equal 100. Current total: 90", ex.getMessage());
        verify(billRepository, never()).save(any());
    }

    @Test
    void create_totalWithMoreThanTwoDecimals_isRejectedBeforeAnyWrite() {
        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> billService.create(equalRequest("100.005", "a", "a", "b", "c"), "a"));

        assertEquals("totalAmount must have at most 2 decimal places", ex.getMessage());
        verify(billRepository, never()).save(any());
    }

    @Test
    void create_withoutActingUser_isRejected() {
        assertThrows(BadRequestException.class, () -> billService.create(equalRequest("10", "a", "a"), " "));
    }

    @Test
    void create_splitWriteFails_removesBillAndRethrows() {
        stubSaves();
        DataIntegrityViolationException failure = new DataIntegrityViolationException("boom");
        when(billSplitRepository.saveAllAndFlush(anyList())).thenThrow(failure);

        DataIntegrityViolationException thrown = assertThrows(DataIntegrityViolationException.class,
                () -> billService.create(equalRequest("30", "a", "a", "b"), "a"));

        assertSame(failure, thrown);
        verify(billRepository).delete(any(Bill.class));
    }

    @Test
    void findById_unknown_throwsNotFound() {
        UUID id = UUID.randomUUID();
        when(billRepository.findById(id)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> billService.findById(id));
    }

    @Test
    void update_byNonCreator_isForbidden() {
        Bill bill = storedBill("a");
        when(billRepository.findById(bill.getId())).thenReturn(Optional.of(bill));

        ForbiddenOperationException ex = assertThrows(ForbiddenOperationException.class,
                () -> billService.update(bill.getId(), equalRequest("60", "a", "a", "b"), "b"));

        assertEquals("Only the creator of the bill can edit it", ex.getMessage());
    }

    @Test
    void update_replacesSharesAndResetsSettlement() {
        Bill bill = storedBill("a");
        bill.getSplits().get(1).setPaymentStatus(PaymentStatus.CONFIRMED);
        when(billRepository.findById(bill.getId())).thenReturn(Optional.of(bill));
        when(billRepository.saveAndFlush(any(Bill.class))).thenAnswer(inv -> inv.getArgument(0));

        BillResponseDTO resp = billService.update(bill.getId(), equalRequest("90", "a", "a", "b", "c"), "a");

        assertEquals(new BigDecimal("90"), resp.getTotalAmount());
        assertEquals(3, resp.getSplits().size());
        resp.getSplits().forEach(s -> {
            assertEquals(new BigDecimal("30.00"), s.getAmount());
            assertEquals(PaymentStatus.UNPAID, s.getPaymentStatus());
        });
        verify(paymentRecordRepository).deleteByBillId(bill.getId());
        verify(settlementEventRepository).deleteByBillId(bill.getId());
    }

    @Test
    void delete_byCreator_removesTraceAndBill() {
        Bill bill = storedBill("a");
        when(billRepository.findById(bill.getId())).thenReturn(Optional.of(bill));

        billService.delete(bill.getId(), "a");

        verify(paymentRecordRepository).deleteByBillId(bill.getId());
        verify(settlementEventRepository).deleteByBillId(bill.getId());
        verify(billRepository).delete(bill);
    }

    @Test
    void delete_byNonCreator_isForbidden() {
        Bill bill = storedBill("a");
        when(billRepository.findById(bill.getId())).thenReturn(Optional.of(bill));

        assertThrows(ForbiddenOperationException.class, () -> billService.delete(bill.getId(), "b"));
        verify(billRepository, never()).delete(any(Bill.class));
    }

    private static Bill storedBill(String creator) {
        Bill bill = Bill.builder()
                .id(UUID.randomUUID())
                .title("Groceries")
                .totalAmount(new BigDecimal("60"))
                .currency("PHP")
                .paidBy(creator)
                .createdBy(creator)
                .splitMethod(SplitMethod.EQUAL)
                .category(BillCategory.FOOD)
                .splits(new ArrayList<>())
                .createdAt(LocalDateTime.now())
                .build();
        bill.getSplits().add(BillSplit.builder().bill(bill).userId(creator).position(0).amount(new BigDecimal("30.00")).build());
        bill.getSplits().add(BillSplit.builder().bill(bill).userId("b").position(1).amount(new BigDecimal("30.00")).build());
        return bill;
    }
}
