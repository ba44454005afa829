package com.whisk.shopkeeper.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;

@Entity
@Table(name = "stock_items")
@Data
public class StockItem {
    public static final String CATEGORY_INGREDIENT = "Ingredient";
    public static final String CATEGORY_FINISHED_PRODUCT = "Finished Product";
    public static final String CATEGORY_PACKAGING = "Packaging";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    // Free text, usually one of the CATEGORY_* values
    @Column(nullable = false)
    private String category;

    @Column(precision = 19, scale = 4, nullable = false)
    private BigDecimal quantity = BigDecimal.ZERO;

    private String unit; // kg, pcs, l

    // Weighted average of every purchase, not the latest price
    @Column(precision = 19, scale = 6, nullable = false)
    private BigDecimal costPerUnit = BigDecimal.ZERO;

    @Column(precision = 19, scale = 4)
    private BigDecimal lowStockThreshold;

    @Column(precision = 19, scale = 2)
    private BigDecimal sellingPrice;
}
