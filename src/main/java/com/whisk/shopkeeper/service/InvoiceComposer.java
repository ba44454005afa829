package com.whisk.shopkeeper.service;

import com.whisk.shopkeeper.dto.InvoiceDraft;
import com.whisk.shopkeeper.dto.PageResponse;
import com.whisk.shopkeeper.dto.ResolvedCustomer;
import com.whisk.shopkeeper.exception.NotFoundException;
import com.whisk.shopkeeper.model.Invoice;
import com.whisk.shopkeeper.repository.InvoiceRepository;
import com.whisk.shopkeeper.util.PageParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Optional;

/**
 * Issues and revises invoices.
 * <p>
 * Neither operation runs in a single transaction. A customer created by the
 * resolver stays in place even when the invoice write that follows fails.
 */
@Service
@Slf4j
public class InvoiceComposer {

    private final InvoiceRepository invoiceRepository;
    private final CustomerResolver customerResolver;
    private final InvoiceNumberAllocator numberAllocator;
    private final AuditService auditService;

    public InvoiceComposer(InvoiceRepository invoiceRepository, CustomerResolver customerResolver,
            InvoiceNumberAllocator numberAllocator, AuditService auditService) {
        this.invoiceRepository = invoiceRepository;
        this.customerResolver = customerResolver;
        this.numberAllocator = numberAllocator;
        this.auditService = auditService;
    }

    public Invoice create(InvoiceDraft draft) {
        ResolvedCustomer customer = customerResolver.resolve(draft);
        String invoiceNumber = numberAllocator.nextInvoiceNumber();

        Invoice invoice = new Invoice();
        invoice.setInvoiceNumber(invoiceNumber);
        apply(draft, customer, invoice);

        Invoice saved = invoiceRepository.save(invoice);
        log.info("Invoice {} created: id={}, customer={}, total={}",
                invoiceNumber, saved.getId(), customer.getId(), saved.getTotal());
        auditService.log("CREATE_INVOICE", "Invoice: " + invoiceNumber + ", Customer: " + customer.getId()
                + ", Total: " + saved.getTotal());
        return saved;
    }

    public Invoice revise(Long invoiceId, InvoiceDraft draft) {
        ResolvedCustomer customer = customerResolver.resolve(draft);

        Optional<Invoice> existing = invoiceRepository.findById(invoiceId);
        String invoiceNumber = existing.map(Invoice::getInvoiceNumber).orElse("");
        Invoice invoice = existing.orElseThrow(() -> new NotFoundException("Invoice not found"));

        // Everything but id and number is replaced, items included
        invoice.setInvoiceNumber(invoiceNumber);
        apply(draft, customer, invoice);

        Invoice saved = invoiceRepository.save(invoice);
        log.info("Invoice {} revised: id={}, customer={}, total={}",
                invoiceNumber, invoiceId, customer.getId(), saved.getTotal());
        auditService.log("REVISE_INVOICE", "Invoice: " + invoiceNumber + ", Id: " + invoiceId
                + ", Total: " + saved.getTotal());
        return saved;
    }

    public PageResponse<Invoice> list(int skip, int limit) {
        Pageable pageable = PageParams.of(skip, limit,
                Sort.by(Sort.Order.desc("date"), Sort.Order.desc("id")));
        return PageResponse.from(invoiceRepository.findAll(pageable));
    }

    private void apply(InvoiceDraft draft, ResolvedCustomer customer, Invoice invoice) {
        invoice.setCustomerId(customer.getId());
        invoice.setCustomerName(customer.getName());
        invoice.setDate(draft.getDate());
        // Lines are stored exactly as sent, totals are not recomputed
        invoice.setItems(new ArrayList<>(draft.getItems()));
        invoice.setSubtotal(draft.getSubtotal());
        invoice.setDiscount(draft.getDiscount());
        invoice.setGst(draft.getGst());
        invoice.setTotal(draft.getTotal());
        invoice.setPaymentStatus(draft.getPaymentStatus());
        invoice.setOrderType(draft.getOrderType());
        invoice.setNotes(draft.getNotes());
        invoice.setAmountPaid(draft.getAmountPaid());
    }
}
