package com.amot.backend.dto;

import com.amot.backend.enums.SplitMethod;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
public class SplitPreviewResponseDTO {

    private SplitMethod splitMethod;
    private boolean valid;
    private String error;

    private BigDecimal totalAmount;
    private BigDecimal splitsTotal;

    private List<ShareAmountDTO> splits;
}
