package com.amot.backend.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BillItemDTO {

    private String id;

    @NotBlank(message = "item name is required")
    private String name;

    @NotNull(message = "item price is required")
    @DecimalMin(value = "0.00", message = "item price cannot be negative")
    @Digits(integer = 17, fraction = 2, message = "item price must have at most 2 decimal places")
    private BigDecimal price;

    private List<@NotBlank(message = "assignee id cannot be blank") String> assignedTo = new ArrayList<>();
}
