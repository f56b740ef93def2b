package com.snuffles.lotledger.web.dto;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class SaleAllocationDto {
    private Long id;
    private Long saleTransactionId;
    private Long lotId;
    private BigDecimal quantitySold;
    private BigDecimal costBasis;
    private BigDecimal salePrice;
    private BigDecimal commissionAllocated;
    private BigDecimal realizedPnl;
}
