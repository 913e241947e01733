package com.amot.backend.controllers;

import com.amot.backend.dto.ApiResponse;
import com.amot.backend.dto.SplitPreviewRequestDTO;
import com.amot.backend.dto.SplitPreviewResponseDTO;
import com.amot.backend.services.SplitService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/splits")
@RequiredArgsConstructor
public class SplitController {

    private final SplitService splitService;

    // preview only, nothing is stored; an invalid split still answers 200 with valid=false
    @PostMapping("/calculate")
    public ResponseEntity<ApiResponse<SplitPreviewResponseDTO>> calculate(@Valid @RequestBody SplitPreviewRequestDTO dto) {
        SplitPreviewResponseDTO preview = splitService.preview(dto);
        String message = preview.isValid() ? "Split calculated" : preview.getError();
        return ResponseEntity.ok(ApiResponse.success(preview, message));
    }
}
