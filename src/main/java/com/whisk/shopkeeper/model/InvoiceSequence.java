package com.whisk.shopkeeper.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;

/**
 * Counter row used only when invoice numbering runs in "counter" mode.
 */
@Entity
@Table(name = "invoice_sequences")
@Data
public class InvoiceSequence {
    @Id
    private String name;

    @Column(nullable = false)
    private long lastValue;

    public InvoiceSequence() {
    }

    public InvoiceSequence(String name, long lastValue) {
        this.name = name;
        this.lastValue = lastValue;
    }
}
