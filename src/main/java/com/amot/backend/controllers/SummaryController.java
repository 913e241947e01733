package com.amot.backend.controllers;

import com.amot.backend.dto.ApiResponse;
import com.amot.backend.dto.BillSummaryDTO;
import com.amot.backend.dto.FriendBalanceDTO;
import com.amot.backend.services.SummaryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/users/{userId}")
@RequiredArgsConstructor
public class SummaryController {

    private final SummaryService summaryService;

    @GetMapping("/summary")
    public ResponseEntity<ApiResponse<BillSummaryDTO>> summary(@PathVariable String userId) {
        return ResponseEntity.ok(ApiResponse.success(summaryService.summarize(userId), "Summary loaded"));
    }

    @GetMapping("/balances")
    public ResponseEntity<ApiResponse<List<FriendBalanceDTO>>> balances(@PathVariable String userId) {
        return ResponseEntity.ok(ApiResponse.success(summaryService.friendBalances(userId), "Balances loaded"));
    }
}
