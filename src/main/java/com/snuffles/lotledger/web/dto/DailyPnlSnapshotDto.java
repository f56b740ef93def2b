package com.snuffles.lotledger.web.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class DailyPnlSnapshotDto {
    private Long id;
    private String accountId;
    private String symbol;
    private LocalDate valuationDate;
    private BigDecimal quantity;
    private BigDecimal avgCost;
    private BigDecimal marketPrice;
    private BigDecimal marketValue;
    private BigDecimal unrealizedPnl;
    private BigDecimal unrealizedPnlPct;
    private BigDecimal realizedPnl;
    private BigDecimal realizedPnlPct;
    private BigDecimal totalCost;
    private LocalDate priceDate;
    private boolean stalePrice;
}
