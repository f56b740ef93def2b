package com.snuffles.lotledger.service.allocation;

import com.snuffles.lotledger.domain.LedgerTransaction;
import com.snuffles.lotledger.domain.PositionLot;
import com.snuffles.lotledger.domain.SaleAllocation;
import com.snuffles.lotledger.service.exception.InsufficientLotsException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Opens lots for buys and draws them down for sells.
 *
 * <p>A sale is handled in two steps. {@link #planSale} works out every slice and fails with
 * {@link InsufficientLotsException} before anything is touched; {@link #applySale} then mutates
 * the lots and produces the allocation records. Callers persist the result inside one database
 * transaction so a failure rolls back the lot mutations as well.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LotAllocationEngine {

    public static final int MONEY_SCALE = 4;
    public static final int UNIT_COST_SCALE = 8;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final LotSelectionPolicy lotSelectionPolicy;

    public PositionLot openLot(LedgerTransaction buy) {
        if (!buy.isBuy()) {
            throw new IllegalArgumentException("Only BUY transactions open lots, got " + buy.getTransactionType());
        }
        PositionLot lot = new PositionLot();
        lot.setAccountId(buy.getAccountId());
        lot.setSymbol(buy.getSymbol());
        lot.setTransactionId(buy.getId());
        lot.setOriginalQuantity(buy.getQuantity());
        lot.setRemainingQuantity(buy.getQuantity());
        lot.setCostBasis(costBasis(buy.getPrice(), buy.getQuantity(), buy.getCommission()));
        lot.setPurchaseDate(buy.getTransactionDate());
        lot.setClosed(false);
        log.debug(
            "Opening lot for transaction {} {} {}@{} costBasis={}",
            buy.getId(),
            buy.getSymbol(),
            buy.getQuantity(),
            buy.getPrice(),
            lot.getCostBasis()
        );
        return lot;
    }

    public List<LotSlice> planSale(LedgerTransaction sell, List<PositionLot> openLots) {
        BigDecimal toSell = sell.getQuantity();
        BigDecimal available = openLots.stream()
            .filter(PositionLot::isOpen)
            .map(PositionLot::getRemainingQuantity)
            .reduce(BigDecimal.ZERO, BigDecimal::add);

        if (available.compareTo(toSell) < 0) {
            log.info(
                "Rejecting sale of {} {} for account {}: only {} open across {} lots",
                toSell,
                sell.getSymbol(),
                sell.getAccountId(),
                available,
                openLots.size()
            );
            throw new InsufficientLotsException(sell.getSymbol(), toSell, available);
        }

        List<PositionLot> ordered = lotSelectionPolicy.order(openLots);
        List<BigDecimal> quantities = new ArrayList<>();
        List<PositionLot> touched = new ArrayList<>();
        BigDecimal remaining = toSell;
        for (PositionLot lot : ordered) {
            if (remaining.signum() == 0) {
                break;
            }
            if (!lot.isOpen()) {
                continue;
            }
            BigDecimal take = remaining.min(lot.getRemainingQuantity());
            touched.add(lot);
            quantities.add(take);
            remaining = remaining.subtract(take);
        }

        BigDecimal commission = sell.getCommission() == null ? BigDecimal.ZERO : sell.getCommission();
        List<BigDecimal> shares = splitCommission(commission, quantities, toSell);

        List<LotSlice> plan = new ArrayList<>(touched.size());
        for (int i = 0; i < touched.size(); i++) {
            PositionLot lot = touched.get(i);
            BigDecimal quantity = quantities.get(i);
            BigDecimal share = shares.get(i);
            BigDecimal realized = sell.getPrice().subtract(lot.getCostBasis())
                .multiply(quantity)
                .subtract(share)
                .setScale(MONEY_SCALE, ROUNDING);
            plan.add(new LotSlice(lot, quantity, share, realized));
        }
        log.debug("Planned sale {} of {} {} across {} lots using {}", sell.getId(), toSell, sell.getSymbol(), plan.size(), lotSelectionPolicy.name());
        return plan;
    }

    public List<SaleAllocation> applySale(LedgerTransaction sell, List<LotSlice> plan) {
        List<SaleAllocation> allocations = new ArrayList<>(plan.size());
        for (LotSlice slice : plan) {
            PositionLot lot = slice.lot();
            lot.consume(slice.quantity());

            SaleAllocation allocation = new SaleAllocation();
            allocation.setSaleTransactionId(sell.getId());
            allocation.setLotId(lot.getId());
            allocation.setQuantitySold(slice.quantity());
            allocation.setCostBasis(lot.getCostBasis());
            allocation.setSalePrice(sell.getPrice());
            allocation.setCommissionAllocated(slice.commissionShare());
            allocation.setRealizedPnl(slice.realizedPnl());
            allocations.add(allocation);

            log.debug(
                "Lot {} gave {} at costBasis={} (remaining={}, closed={}) realizedPnl={}",
                lot.getId(),
                slice.quantity(),
                lot.getCostBasis(),
                lot.getRemainingQuantity(),
                lot.isClosed(),
                slice.realizedPnl()
            );
        }
        return allocations;
    }

    public static BigDecimal costBasis(BigDecimal price, BigDecimal quantity, BigDecimal commission) {
        BigDecimal fees = commission == null ? BigDecimal.ZERO : commission;
        return price.multiply(quantity)
            .add(fees)
            .divide(quantity, UNIT_COST_SCALE, ROUNDING);
    }

    // Pro-rata by quantity. Earlier shares round down so the last slice, which takes the rest,
    // never goes negative and the shares add up to the commission exactly.
    static List<BigDecimal> splitCommission(BigDecimal commission, List<BigDecimal> quantities, BigDecimal total) {
        List<BigDecimal> shares = new ArrayList<>(quantities.size());
        BigDecimal assigned = BigDecimal.ZERO;
        for (int i = 0; i < quantities.size(); i++) {
            BigDecimal share;
            if (i == quantities.size() - 1) {
                share = commission.subtract(assigned).setScale(MONEY_SCALE, ROUNDING);
            } else {
                share = commission.multiply(quantities.get(i)).divide(total, MONEY_SCALE, RoundingMode.DOWN);
                assigned = assigned.add(share);
            }
            shares.add(share);
        }
        return shares;
    }
}
