package com.snuffles.lotledger.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Quantity one SELL took out of one lot, with the P&amp;L realized on that slice.
 */
@Getter
@Setter
@Entity
@Table(
    name = "sale_allocations",
    indexes = {
        @Index(name = "idx_sale_allocations_transaction", columnList = "sale_transaction_id"),
        @Index(name = "idx_sale_allocations_lot", columnList = "lot_id")
    }
)
public class SaleAllocation extends BaseEntity {

    @Column(name = "sale_transaction_id", nullable = false, updatable = false)
    private Long saleTransactionId;

    @Column(name = "lot_id", nullable = false, updatable = false)
    private Long lotId;

    @Column(name = "quantity_sold", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal quantitySold;

    @Column(name = "cost_basis", nullable = false, updatable = false, precision = 19, scale = 8)
    private BigDecimal costBasis;

    @Column(name = "sale_price", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal salePrice;

    @Column(name = "commission_allocated", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal commissionAllocated;

    @Column(name = "realized_pnl", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal realizedPnl;
}
