package com.snuffles.lotledger.service.exception;

/**
 * A transaction that can never be applied as submitted: bad quantity, price, side, date or limits.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
