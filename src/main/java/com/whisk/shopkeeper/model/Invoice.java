package com.whisk.shopkeeper.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "invoices")
@Data
public class Invoice {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Assigned once at creation, carried over unchanged by every revision.
    // Not unique: concurrent creations may share a number.
    private String invoiceNumber;

    // Reference only, the customer row may be gone
    private Long customerId;

    private String customerName; // snapshot at issue time

    @Column(name = "invoice_date", nullable = false)
    private LocalDate date;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "invoice_items", joinColumns = @JoinColumn(name = "invoice_id"))
    @OrderColumn(name = "line_no")
    private List<InvoiceItem> items = new ArrayList<>();

    @Column(precision = 19, scale = 2)
    private BigDecimal subtotal;

    @Column(precision = 9, scale = 2)
    private BigDecimal discount;

    @Column(precision = 9, scale = 2)
    private BigDecimal gst;

    @Column(precision = 19, scale = 2)
    private BigDecimal total;

    private String paymentStatus; // Paid, Pending, Overdue
    private String orderType; // Online, In-Store, Takeaway, Delivery

    @Column(length = 1000)
    private String notes;

    @Column(precision = 19, scale = 2)
    private BigDecimal amountPaid;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (amountPaid == null)
            amountPaid = BigDecimal.ZERO;
    }
}
