package com.snuffles.lotledger.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One executed trade as it was accepted by the ingestion gate. Rows are insert-only:
 * corrections are booked as new transactions, never as updates.
 */
@Getter
@Setter
@Entity
@Table(
    name = "transactions",
    uniqueConstraints = @UniqueConstraint(name = "uk_transactions_account_external_id", columnNames = {"account_id", "external_id"}),
    indexes = @Index(name = "idx_transactions_account_symbol_date", columnList = "account_id, symbol, transaction_date")
)
public class LedgerTransaction extends BaseEntity {

    @Column(name = "account_id", nullable = false, length = 100)
    private String accountId;

    @Column(name = "external_id")
    private String externalId;

    @Column(nullable = false, length = 20)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, length = 4)
    private TransactionType transactionType;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal quantity;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal price;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal commission = BigDecimal.ZERO;

    @Column(name = "transaction_date", nullable = false)
    private LocalDate transactionDate;

    // Lot opened by a BUY; sells spread over several lots and leave this empty.
    @Column(name = "lot_id")
    private Long lotId;

    @Column(length = 500)
    private String notes;

    public boolean isBuy() {
        return transactionType == TransactionType.BUY;
    }

    public enum TransactionType {
        BUY, SELL
    }
}
