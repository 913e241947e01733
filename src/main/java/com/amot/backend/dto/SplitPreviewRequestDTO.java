package com.amot.backend.dto;

import com.amot.backend.enums.SplitMethod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
public class SplitPreviewRequestDTO {

    @NotNull(message = "splitMethod is required")
    private SplitMethod splitMethod;

    @NotNull(message = "totalAmount is required")
    @DecimalMin(value = "0.00", message = "totalAmount cannot be negative")
    @Digits(integer = 17, fraction = 2, message = "totalAmount must have at most 2 decimal places")
    private BigDecimal totalAmount;

    private List<String> participants = new ArrayList<>();

    @Valid
    private List<SplitRequestDTO> splits = new ArrayList<>();

    @Valid
    private List<BillItemDTO> items = new ArrayList<>();
}
