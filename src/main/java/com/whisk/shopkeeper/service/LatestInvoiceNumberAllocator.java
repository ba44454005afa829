package com.whisk.shopkeeper.service;

import com.whisk.shopkeeper.config.ShopProperties;
import com.whisk.shopkeeper.model.Invoice;
import com.whisk.shopkeeper.repository.InvoiceRepository;
import com.whisk.shopkeeper.util.InvoiceNumbers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Derives the next number from the newest numbered invoice (Max + 1).
 * <p>
 * There is no counter behind this, so two invoices created at the same time
 * can read the same latest invoice and receive the same number. Switch
 * {@code shop.invoice.numbering} to {@code counter} to avoid that.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "shop.invoice.numbering", havingValue = "latest-invoice", matchIfMissing = true)
public class LatestInvoiceNumberAllocator implements InvoiceNumberAllocator {

    private final InvoiceRepository invoiceRepository;
    private final ShopProperties properties;

    public LatestInvoiceNumberAllocator(InvoiceRepository invoiceRepository, ShopProperties properties) {
        this.invoiceRepository = invoiceRepository;
        this.properties = properties;
    }

    @Override
    public String nextInvoiceNumber() {
        BigInteger last = invoiceRepository.findTopByInvoiceNumberNotOrderByIdDesc("")
                .map(Invoice::getInvoiceNumber)
                .map(InvoiceNumbers::lastSequence)
                .orElse(BigInteger.ZERO);
        String next = InvoiceNumbers.format(properties.getInvoice().getPrefix(), last.add(BigInteger.ONE));
        log.debug("Allocated invoice number {} (last sequence {})", next, last);
        return next;
    }
}
