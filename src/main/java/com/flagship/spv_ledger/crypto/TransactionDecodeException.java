package com.flagship.spv_ledger.crypto;

/**
 * Thrown when a stored transaction payload cannot be decoded.
 */
public class TransactionDecodeException extends RuntimeException {

    public TransactionDecodeException(String message) {
        super(message);
    }

    public TransactionDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
