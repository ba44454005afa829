package com.whisk.shopkeeper.controller;

import com.whisk.shopkeeper.dto.InvoiceDraft;
import com.whisk.shopkeeper.dto.PageResponse;
import com.whisk.shopkeeper.model.Invoice;
import com.whisk.shopkeeper.service.InvoiceComposer;
import com.whisk.shopkeeper.util.PageParams;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/invoices")
public class InvoiceController {

    private final InvoiceComposer invoiceComposer;

    public InvoiceController(InvoiceComposer invoiceComposer) {
        this.invoiceComposer = invoiceComposer;
    }

    @GetMapping
    public PageResponse<Invoice> list(@RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "10") int limit) {
        PageParams.check(skip, limit, 100);
        return invoiceComposer.list(skip, limit);
    }

    @PostMapping
    public ResponseEntity<Invoice> create(@Valid @RequestBody InvoiceDraft draft) {
        return ResponseEntity.status(HttpStatus.CREATED).body(invoiceComposer.create(draft));
    }

    @PutMapping("/{invoiceId}")
    public Invoice revise(@PathVariable Long invoiceId, @Valid @RequestBody InvoiceDraft draft) {
        return invoiceComposer.revise(invoiceId, draft);
    }
}
