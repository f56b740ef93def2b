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
    name = "position_lots",
    indexes = {
        @Index(name = "idx_position_lots_fifo", columnList = "account_id, symbol, is_closed, purchase_date, id"),
        @Index(name = "idx_position_lots_transaction", columnList = "transaction_id")
    }
)
public class PositionLot extends BaseEntity {

    @Column(name = "account_id", nullable = false, length = 100)
    private String accountId;

    @Column(nullable = false, length = 20)
    private String symbol;

    @Column(name = "transaction_id", nullable = false)
    private Long transactionId;

    @Column(name = "original_quantity", nullable = false, precision = 19, scale = 4)
    private BigDecimal originalQuantity;

    @Column(name = "remaining_quantity", nullable = false, precision = 19, scale = 4)
    private BigDecimal remainingQuantity;

    // Per unit, commission included.
    @Column(name = "cost_basis", nullable = false, precision = 19, scale = 8)
    private BigDecimal costBasis;

    @Column(name = "purchase_date", nullable = false)
    private LocalDate purchaseDate;

    @Column(name = "is_closed", nullable = false)
    private boolean closed;

    public boolean isOpen() {
        return !closed && remainingQuantity.signum() > 0;
    }

    /**
     * Takes {@code quantity} out of the lot and closes it once nothing remains.
     * Remaining quantity only ever goes down.
     */
    public void consume(BigDecimal quantity) {
        if (quantity.signum() <= 0 || quantity.compareTo(remainingQuantity) > 0) {
            throw new IllegalArgumentException(
                "Cannot consume " + quantity + " from lot " + getId() + " with remaining " + remainingQuantity);
        }
        remainingQuantity = remainingQuantity.subtract(quantity);
        closed = remainingQuantity.signum() == 0;
    }
}
