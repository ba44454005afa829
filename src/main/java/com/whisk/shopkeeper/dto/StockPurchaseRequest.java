package com.whisk.shopkeeper.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A delivery of stock. Non-positive quantities are accepted and change nothing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StockPurchaseRequest {

    @NotNull(message = "quantity_added is required")
    @JsonProperty("quantity_added")
    private BigDecimal quantityAdded;

    @NotNull(message = "cost_per_unit_of_purchase is required")
    @JsonProperty("cost_per_unit_of_purchase")
    private BigDecimal costPerUnitOfPurchase;
}
