package com.snuffles.lotledger.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;

@Getter
@Setter
@Entity
@Table(
    name = "daily_pnl",
    uniqueConstraints = @UniqueConstraint(name = "uk_daily_pnl_account_symbol_date", columnNames = {"account_id", "symbol", "valuation_date"})
)
public class DailyPnlSnapshot extends BaseEntity {

    @Column(name = "account_id", nullable = false, length = 100)
    private String accountId;

    @Column(nullable = false, length = 20)
    private String symbol;

    @Column(name = "valuation_date", nullable = false)
    private LocalDate valuationDate;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal quantity;

    @Column(name = "avg_cost", nullable = false, precision = 19, scale = 8)
    private BigDecimal avgCost;

    @Column(name = "market_price", nullable = false, precision = 19, scale = 4)
    private BigDecimal marketPrice;

    @Column(name = "market_value", nullable = false, precision = 19, scale = 4)
    private BigDecimal marketValue;

    @Column(name = "unrealized_pnl", nullable = false, precision = 19, scale = 4)
    private BigDecimal unrealizedPnl;

    @Column(name = "unrealized_pnl_pct", nullable = false, precision = 19, scale = 4)
    private BigDecimal unrealizedPnlPct;

    @Column(name = "realized_pnl", nullable = false, precision = 19, scale = 4)
    private BigDecimal realizedPnl;

    @Column(name = "realized_pnl_pct", nullable = false, precision = 19, scale = 4)
    private BigDecimal realizedPnlPct;

    @Column(name = "total_cost", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalCost;

    @Column(name = "price_date", nullable = false)
    private LocalDate priceDate;

    @Column(name = "is_stale_price", nullable = false)
    private boolean stalePrice;
}
