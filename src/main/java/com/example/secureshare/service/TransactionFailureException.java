package com.example.secureshare.service;

/**
 * A multi-statement write was aborted part way and rolled back. No partial state
 * survives; the cause carries the failing statement's error.
 */
public class TransactionFailureException extends RuntimeException {

    public TransactionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
