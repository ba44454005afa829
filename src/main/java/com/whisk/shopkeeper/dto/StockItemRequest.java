package com.whisk.shopkeeper.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class StockItemRequest {

    @NotBlank(message = "name is required")
    private String name;

    @NotBlank(message = "category is required")
    private String category;

    @NotNull(message = "quantity is required")
    @PositiveOrZero(message = "quantity cannot be negative")
    private BigDecimal quantity;

    @NotBlank(message = "unit is required")
    private String unit;

    @NotNull(message = "costPerUnit is required")
    @PositiveOrZero(message = "costPerUnit cannot be negative")
    private BigDecimal costPerUnit;

    @NotNull(message = "lowStockThreshold is required")
    @PositiveOrZero(message = "lowStockThreshold cannot be negative")
    private BigDecimal lowStockThreshold;

    @PositiveOrZero(message = "sellingPrice cannot be negative")
    private BigDecimal sellingPrice; // optional
}
