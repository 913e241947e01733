package com.amot.backend.controllers;

import com.amot.backend.config.OpenApiConfig;
import com.amot.backend.dto.ApiResponse;
import com.amot.backend.dto.BillResponseDTO;
import com.amot.backend.dto.CreateBillRequestDTO;
import com.amot.backend.dto.PaymentEdgeDTO;
import com.amot.backend.services.BillService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/bills")
@RequiredArgsConstructor
public class BillController {

    private final BillService billService;

    @PostMapping
    public ResponseEntity<ApiResponse<BillResponseDTO>> create(
            @RequestHeader(OpenApiConfig.ACTING_USER_HEADER) String actingUserId,
            @Valid @RequestBody CreateBillRequestDTO dto
    ) {
        BillResponseDTO created = billService.create(dto, actingUserId);
        return ResponseEntity
                .status(201)
                .body(ApiResponse.success(created, "Bill created"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<BillResponseDTO>> findById(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(billService.findById(id), "Bill found"));
    }

    @GetMapping("/user/{userId}")
    public ResponseEntity<ApiResponse<List<BillResponseDTO>>> findByUser(@PathVariable String userId) {
        return ResponseEntity.ok(ApiResponse.success(billService.findByUser(userId), "Bills loaded"));
    }

    @GetMapping("/group/{groupId}")
    public ResponseEntity<ApiResponse<List<BillResponseDTO>>> findByGroup(@PathVariable String groupId) {
        return ResponseEntity.ok(ApiResponse.success(billService.findByGroup(groupId), "Bills loaded"));
    }

    @GetMapping("/group/{groupId}/unsettled/{userId}")
    public ResponseEntity<ApiResponse<List<BillResponseDTO>>> findUnsettledForMember(
            @PathVariable String groupId,
            @PathVariable String userId
    ) {
        List<BillResponseDTO> bills = billService.findUnsettledForMemberInGroup(groupId, userId);
        return ResponseEntity.ok(ApiResponse.success(bills, "Unsettled bills loaded"));
    }

    @GetMapping("/{id}/payments")
    public ResponseEntity<ApiResponse<List<PaymentEdgeDTO>>> findPayments(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(billService.findPayments(id), "Payments loaded"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<BillResponseDTO>> update(
            @PathVariable UUID id,
            @RequestHeader(OpenApiConfig.ACTING_USER_HEADER) String actingUserId,
            @Valid @RequestBody CreateBillRequestDTO dto
    ) {
        BillResponseDTO updated = billService.update(id, dto, actingUserId);
        return ResponseEntity.ok(ApiResponse.success(updated, "Bill updated"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(
            @PathVariable UUID id,
            @RequestHeader(OpenApiConfig.ACTING_USER_HEADER) String actingUserId
    ) {
        billService.delete(id, actingUserId);
        return ResponseEntity.ok(ApiResponse.success(null, "Bill deleted"));
    }
}
