package com.bank.merchanttwin.exception;

/**
 * Raised when a merchant snapshot breaks a sensor invariant, which means the
 * upstream data is corrupt. Values are never coerced into range.
 */
public class InvalidMerchantStateException extends RuntimeException {

    private final String merchantId;

    public InvalidMerchantStateException(String merchantId, String message) {
        super("Merchant " + merchantId + ": " + message);
        this.merchantId = merchantId;
    }

    public String getMerchantId() {
        return merchantId;
    }
}
