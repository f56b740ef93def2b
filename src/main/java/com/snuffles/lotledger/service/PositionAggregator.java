package com.snuffles.lotledger.service;

import com.snuffles.lotledger.domain.PositionLot;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import static com.snuffles.lotledger.service.allocation.LotAllocationEngine.MONEY_SCALE;
import static com.snuffles.lotledger.service.allocation.LotAllocationEngine.ROUNDING;
import static com.snuffles.lotledger.service.allocation.LotAllocationEngine.UNIT_COST_SCALE;

/**
 * Derives position figures from a symbol's lots. Holds no state and touches no repository.
 */
@Component
public class PositionAggregator {

    public Aggregate aggregate(List<PositionLot> lots, LocalDate lastTransactionDate) {
        return aggregate(lots, lot -> lot.isOpen() ? lot.getRemainingQuantity() : BigDecimal.ZERO, lastTransactionDate);
    }

    /**
     * Holdings as they stood on a past date: each lot's original quantity less what sales up to
     * that date took from it. Callers pass only lots purchased by then.
     */
    public Aggregate aggregateAsOf(List<PositionLot> lots, Map<Long, BigDecimal> soldByLot, LocalDate lastTransactionDate) {
        return aggregate(
            lots,
            lot -> lot.getOriginalQuantity().subtract(soldByLot.getOrDefault(lot.getId(), BigDecimal.ZERO)).max(BigDecimal.ZERO),
            lastTransactionDate
        );
    }

    private Aggregate aggregate(List<PositionLot> lots, Function<PositionLot, BigDecimal> heldQuantity, LocalDate lastTransactionDate) {
        BigDecimal quantity = BigDecimal.ZERO;
        BigDecimal cost = BigDecimal.ZERO;
        for (PositionLot lot : lots) {
            BigDecimal held = heldQuantity.apply(lot);
            if (held.signum() <= 0) {
                continue;
            }
            quantity = quantity.add(held);
            cost = cost.add(held.multiply(lot.getCostBasis()));
        }

        BigDecimal avgCost = quantity.signum() == 0
            ? BigDecimal.ZERO.setScale(UNIT_COST_SCALE)
            : cost.divide(quantity, UNIT_COST_SCALE, ROUNDING);

        LocalDate firstBuyDate = lots.stream()
            .map(PositionLot::getPurchaseDate)
            .filter(Objects::nonNull)
            .min(Comparator.naturalOrder())
            .orElse(null);

        return new Aggregate(
            quantity.setScale(MONEY_SCALE, ROUNDING),
            avgCost,
            cost.setScale(MONEY_SCALE, ROUNDING),
            firstBuyDate,
            lastTransactionDate,
            quantity.signum() > 0
        );
    }

    public record Aggregate(
        BigDecimal quantity,
        BigDecimal avgCost,
        BigDecimal totalCost,
        LocalDate firstBuyDate,
        LocalDate lastTransactionDate,
        boolean active
    ) {
    }
}
