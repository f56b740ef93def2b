package com.snuffles.lotledger.web.dto;

import com.snuffles.lotledger.domain.LedgerTransaction;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Data
public class TransactionDto {
    private Long id;
    private String accountId;
    private String externalId;
    private String symbol;
    private LedgerTransaction.TransactionType transactionType;
    private BigDecimal quantity;
    private BigDecimal price;
    private BigDecimal commission;
    private LocalDate transactionDate;
    private Long lotId;
    private String notes;
    private Instant createdAt;
    private Instant updatedAt;
}
