package com.snuffles.lotledger.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Aggregate of the lots held for one account and symbol. Derived data: it is
 * rewritten after every transaction on the symbol and kept once flat, because
 * realized P&amp;L history hangs off it.
 */
@Getter
@Setter
@Entity
@Table(
    name = "positions",
    uniqueConstraints = @UniqueConstraint(name = "uk_positions_account_symbol", columnNames = {"account_id", "symbol"})
)
public class Position extends BaseEntity {

    @Column(name = "account_id", nullable = false, length = 100)
    private String accountId;

    @Column(nullable = false, length = 20)
    private String symbol;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal quantity = BigDecimal.ZERO;

    @Column(name = "avg_cost", nullable = false, precision = 19, scale = 8)
    private BigDecimal avgCost = BigDecimal.ZERO;

    @Column(name = "total_cost", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalCost = BigDecimal.ZERO;

    @Column(name = "first_buy_date")
    private LocalDate firstBuyDate;

    @Column(name = "last_transaction_date")
    private LocalDate lastTransactionDate;

    @Column(name = "is_active", nullable = false)
    private boolean active;
}
