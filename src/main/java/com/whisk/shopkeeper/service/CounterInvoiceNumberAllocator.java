package com.whisk.shopkeeper.service;

import com.whisk.shopkeeper.config.ShopProperties;
import com.whisk.shopkeeper.model.Invoice;
import com.whisk.shopkeeper.model.InvoiceSequence;
import com.whisk.shopkeeper.repository.InvoiceRepository;
import com.whisk.shopkeeper.repository.InvoiceSequenceRepository;
import com.whisk.shopkeeper.util.InvoiceNumbers;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;

/**
 * Numbers invoices from a database counter that is incremented in a single
 * UPDATE, so concurrent creations never share a number.
 * <p>
 * The counter row is created once at startup, starting after the newest
 * invoice number already in the store. Requests only ever increment it.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "shop.invoice.numbering", havingValue = "counter")
public class CounterInvoiceNumberAllocator implements InvoiceNumberAllocator {

    static final String SEQUENCE_NAME = "invoice";

    private final InvoiceSequenceRepository sequenceRepository;
    private final InvoiceRepository invoiceRepository;
    private final ShopProperties properties;

    public CounterInvoiceNumberAllocator(InvoiceSequenceRepository sequenceRepository,
            InvoiceRepository invoiceRepository, ShopProperties properties) {
        this.sequenceRepository = sequenceRepository;
        this.invoiceRepository = invoiceRepository;
        this.properties = properties;
    }

    @PostConstruct
    public void initialiseCounter() {
        if (sequenceRepository.existsById(SEQUENCE_NAME)) {
            return;
        }
        BigInteger last = invoiceRepository.findTopByInvoiceNumberNotOrderByIdDesc("")
                .map(Invoice::getInvoiceNumber)
                .map(InvoiceNumbers::lastSequence)
                .orElse(BigInteger.ZERO);
        long start;
        try {
            start = last.longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalStateException("Latest invoice number " + last + " does not fit the invoice counter", e);
        }
        sequenceRepository.saveAndFlush(new InvoiceSequence(SEQUENCE_NAME, start));
        log.info("Invoice counter initialised after {}", start);
    }

    @Override
    @Transactional
    public String nextInvoiceNumber() {
        if (sequenceRepository.increment(SEQUENCE_NAME) == 0) {
            throw new IllegalStateException("Invoice counter '" + SEQUENCE_NAME + "' is missing");
        }
        long next = sequenceRepository.findById(SEQUENCE_NAME)
                .map(InvoiceSequence::getLastValue)
                .orElseThrow(() -> new IllegalStateException("Invoice counter disappeared"));
        return InvoiceNumbers.format(properties.getInvoice().getPrefix(), BigInteger.valueOf(next));
    }
}
