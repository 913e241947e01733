package com.amot.backend.controllers;

import com.amot.backend.config.OpenApiConfig;
import com.amot.backend.dto.ApiResponse;
import com.amot.backend.dto.BillResponseDTO;
import com.amot.backend.dto.SettlementEventDTO;
import com.amot.backend.dto.SettlementRequestDTO;
import com.amot.backend.services.SettlementService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Settlement of one debtor → payer edge. Every call returns the bill as it is after the change.
 */
@RestController
@RequestMapping("/api/bills/{billId}/payments/{debtorUserId}")
@RequiredArgsConstructor
public class SettlementController {

    private final SettlementService settlementService;

    @PostMapping("/mark-paid")
    public ResponseEntity<ApiResponse<BillResponseDTO>> markPaid(
            @PathVariable UUID billId,
            @PathVariable String debtorUserId,
            @RequestHeader(OpenApiConfig.ACTING_USER_HEADER) String actingUserId,
            @Valid @RequestBody(required = false) SettlementRequestDTO request
    ) {
        BillResponseDTO bill = settlementService.markPaid(billId, debtorUserId, actingUserId, request);
        return ResponseEntity.ok(ApiResponse.success(bill, "Payment marked as paid, waiting for confirmation"));
    }

    @PostMapping("/cancel")
    public ResponseEntity<ApiResponse<BillResponseDTO>> cancel(
            @PathVariable UUID billId,
            @PathVariable String debtorUserId,
            @RequestHeader(OpenApiConfig.ACTING_USER_HEADER) String actingUserId,
            @Valid @RequestBody(required = false) SettlementRequestDTO request
    ) {
        BillResponseDTO bill = settlementService.cancelPayment(billId, debtorUserId, actingUserId, request);
        return ResponseEntity.ok(ApiResponse.success(bill, "Payment cancelled"));
    }

    @PostMapping("/confirm")
    public ResponseEntity<ApiResponse<BillResponseDTO>> confirm(
            @PathVariable UUID billId,
            @PathVariable String debtorUserId,
            @RequestHeader(OpenApiConfig.ACTING_USER_HEADER) String actingUserId,
            @Valid @RequestBody(required = false) SettlementRequestDTO request
    ) {
        BillResponseDTO bill = settlementService.confirm(billId, debtorUserId, actingUserId, request);
        return ResponseEntity.ok(ApiResponse.success(bill, "Payment confirmed"));
    }

    @PostMapping("/undo-confirm")
    public ResponseEntity<ApiResponse<BillResponseDTO>> undoConfirm(
            @PathVariable UUID billId,
            @PathVariable String debtorUserId,
            @RequestHeader(OpenApiConfig.ACTING_USER_HEADER) String actingUserId,
            @Valid @RequestBody(required = false) SettlementRequestDTO request
    ) {
        BillResponseDTO bill = settlementService.undoConfirmation(billId, debtorUserId, actingUserId, request);
        return ResponseEntity.ok(ApiResponse.success(bill, "Confirmation undone"));
    }

    @GetMapping("/history")
    public ResponseEntity<ApiResponse<List<SettlementEventDTO>>> history(
            @PathVariable UUID billId,
            @PathVariable String debtorUserId
    ) {
        return ResponseEntity.ok(ApiResponse.success(settlementService.history(billId, debtorUserId), "History loaded"));
    }
}
