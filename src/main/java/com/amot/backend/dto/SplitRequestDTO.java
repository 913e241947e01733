package com.amot.backend.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SplitRequestDTO {

    @NotBlank(message = "userId is required")
    private String userId;

    @DecimalMin(value = "0.00", message = "amount cannot be negative")
    @Digits(integer = 17, fraction = 2, message = "amount must have at most 2 decimal places")
    private BigDecimal amount;

    @DecimalMin(value = "0.00", message = "percentage cannot be negative")
    @DecimalMax(value = "100.00", message = "percentage cannot exceed 100")
    @Digits(integer = 3, fraction = 4, message = "percentage must have at most 4 decimal places")
    private BigDecimal percentage;
}
