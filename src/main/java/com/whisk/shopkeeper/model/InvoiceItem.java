package com.whisk.shopkeeper.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceItem {

    // Weak reference to a stock item, not checked
    @NotBlank(message = "productId is required")
    private String productId;

    @NotBlank(message = "productName is required")
    private String productName;

    @NotNull(message = "quantity is required")
    @Positive(message = "quantity must be a positive integer")
    private Integer quantity;

    @NotNull(message = "price is required")
    @Column(precision = 19, scale = 2)
    private BigDecimal price;

    @NotNull(message = "discount is required")
    @Column(precision = 9, scale = 2)
    private BigDecimal discount; // percentage

    @NotNull(message = "gst is required")
    @Column(precision = 9, scale = 2)
    private BigDecimal gst; // percentage
}
