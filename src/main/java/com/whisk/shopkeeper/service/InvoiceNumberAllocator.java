package com.whisk.shopkeeper.service;

/**
 * Hands out the externally visible number of a new invoice.
 */
public interface InvoiceNumberAllocator {

    String nextInvoiceNumber();
}
