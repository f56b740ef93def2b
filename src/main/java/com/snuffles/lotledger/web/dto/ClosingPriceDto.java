package com.snuffles.lotledger.web.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Data
public class ClosingPriceDto {
    private String symbol;
    private LocalDate priceDate;
    private BigDecimal closePrice;
    private String source;
    private Instant updatedAt;
}
