package com.whisk.shopkeeper.dto;

import com.whisk.shopkeeper.model.InvoiceItem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Body of invoice create and revise calls. Either {@code customerId} names an
 * existing customer, or the inline customer fields describe a new one.
 */
@Data
public class InvoiceDraft {

    private String customerId;

    private String customerName;
    private String customerEmail;
    private String customerPhone;
    // Older clients send the phone number under this name
    private String phone;
    private String customerAddress;
    private String customerBirthday;
    private String customerAnniversary;

    @NotNull(message = "date is required")
    private LocalDate date;

    @Valid
    @NotNull(message = "items are required")
    private List<InvoiceItem> items = new ArrayList<>();

    @NotNull(message = "subtotal is required")
    private BigDecimal subtotal;

    @NotNull(message = "discount is required")
    private BigDecimal discount;

    @NotNull(message = "gst is required")
    private BigDecimal gst;

    @NotNull(message = "total is required")
    private BigDecimal total;

    @NotBlank(message = "paymentStatus is required")
    private String paymentStatus;

    @NotBlank(message = "orderType is required")
    private String orderType;

    private String notes;

    @NotNull(message = "amountPaid is required")
    private BigDecimal amountPaid;

    public String resolvePhone() {
        return customerPhone != null && !customerPhone.isBlank() ? customerPhone : phone;
    }
}
