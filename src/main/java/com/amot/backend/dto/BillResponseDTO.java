package com.amot.backend.dto;

import com.amot.backend.enums.BillCategory;
import com.amot.backend.enums.SplitMethod;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Data
public class BillResponseDTO {

    private String id;
    private String title;
    private String description;

    private BigDecimal totalAmount;
    private String currency;

    private String paidBy;
    private String createdBy;
    private List<String> participants;

    private SplitMethod splitMethod;
    private BillCategory category;
    private String groupId;

    private List<SplitResponseDTO> splits;
    private List<PaymentEdgeDTO> payments;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
