package com.snuffles.lotledger.seeding;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.snuffles.lotledger.web.dto.TransactionRequest;

import java.math.BigDecimal;

public record SeedTransactionRecord(
    @JsonProperty("account_id") String accountId,
    @JsonProperty("external_id") String externalId,
    String symbol,
    String side,
    BigDecimal quantity,
    BigDecimal price,
    BigDecimal commission,
    @JsonProperty("transaction_date") String transactionDate,
    String notes
) {

    TransactionRequest toRequest() {
        return TransactionRequest.builder()
            .externalId(externalId)
            .symbol(symbol)
            .side(side)
            .quantity(quantity)
            .price(price)
            .commission(commission)
            .transactionDate(transactionDate)
            .notes(notes)
            .build();
    }
}
