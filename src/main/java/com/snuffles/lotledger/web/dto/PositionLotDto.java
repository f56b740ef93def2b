package com.snuffles.lotledger.web.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class PositionLotDto {
    private Long id;
    private String accountId;
    private String symbol;
    private Long transactionId;
    private BigDecimal originalQuantity;
    private BigDecimal remainingQuantity;
    private BigDecimal costBasis;
    private LocalDate purchaseDate;
    private boolean closed;
}
