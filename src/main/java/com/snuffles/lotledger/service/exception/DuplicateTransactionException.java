package com.snuffles.lotledger.service.exception;

import lombok.Getter;

/**
 * The external id is already booked for the account with a different payload.
 * An identical resubmission is a replay and does not raise this.
 */
@Getter
public class DuplicateTransactionException extends RuntimeException {

    private final String externalId;
    private final Long existingTransactionId;

    public DuplicateTransactionException(String externalId, Long existingTransactionId) {
        super("External id " + externalId + " already recorded as transaction " + existingTransactionId
            + " with a different payload");
        this.externalId = externalId;
        this.existingTransactionId = existingTransactionId;
    }
}
