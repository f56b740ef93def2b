package com.snuffles.lotledger.web.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class PositionDto {
    private Long id;
    private String accountId;
    private String symbol;
    private BigDecimal quantity;
    private BigDecimal avgCost;
    private BigDecimal totalCost;
    private LocalDate firstBuyDate;
    private LocalDate lastTransactionDate;
    private boolean active;
}
