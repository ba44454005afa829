package com.whisk.shopkeeper.util;

import java.math.BigInteger;

/**
 * Formatting and parsing of invoice numbers such as {@code WHISK-07}.
 */
public final class InvoiceNumbers {

    private InvoiceNumbers() {
    }

    /**
     * Numeric part after the last '-', or 0 when missing or not a number.
     * Suffixes of any length are read in full, so a very large number never
     * restarts the sequence.
     */
    public static BigInteger lastSequence(String invoiceNumber) {
        if (invoiceNumber == null) {
            return BigInteger.ZERO;
        }
        String suffix = invoiceNumber.substring(invoiceNumber.lastIndexOf('-') + 1).trim();
        try {
            return new BigInteger(suffix);
        } catch (NumberFormatException e) {
            return BigInteger.ZERO;
        }
    }

    // At least two digits; 100 and up simply widen
    public static String format(String prefix, BigInteger sequence) {
        return String.format("%s-%02d", prefix, sequence);
    }
}
