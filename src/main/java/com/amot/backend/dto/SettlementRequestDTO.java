package com.amot.backend.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Optional body of the settlement endpoints.
 */
@Data
public class SettlementRequestDTO {

    // version of the share the caller last read; a mismatch is rejected with 409
    private Long expectedVersion;

    @Size(max = 255)
    private String paymentMethod;

    @Size(max = 255)
    private String referenceNumber;

    @Size(max = 255)
    private String note;
}
