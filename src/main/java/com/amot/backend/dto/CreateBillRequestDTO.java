package com.amot.backend.dto;

import com.amot.backend.enums.BillCategory;
import com.amot.backend.enums.SplitMethod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Payload for creating a bill and, unchanged, for editing one (an edit replaces every share).
 */
@Data
public class CreateBillRequestDTO {

    @NotBlank(message = "title is required")
    private String title;

    @Size(max = 1000, message = "description must have at most 1000 characters")
    private String description;

    @NotNull(message = "totalAmount is required")
    @DecimalMin(value = "0.01", message = "totalAmount must be greater than zero")
    @Digits(integer = 17, fraction = 2, message = "totalAmount must have at most 2 decimal places")
    private BigDecimal totalAmount;

    @NotBlank(message = "paidBy is required")
    private String paidBy;

    @NotEmpty(message = "at least one participant is required")
    private List<String> participants = new ArrayList<>();

    @NotNull(message = "splitMethod is required")
    private SplitMethod splitMethod;

    // amounts for CUSTOM, percentages for PERCENTAGE; ignored for EQUAL
    @Valid
    private List<SplitRequestDTO> splits = new ArrayList<>();

    // only read for ITEM_BASED
    @Valid
    private List<BillItemDTO> items = new ArrayList<>();

    private BillCategory category;
    private String groupId;
}
