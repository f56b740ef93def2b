package com.snuffles.lotledger.service.allocation;

import com.snuffles.lotledger.domain.PositionLot;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Oldest purchase first. Lots bought on the same day keep the order they were booked in.
 */
@Component
public class FifoLotSelectionPolicy implements LotSelectionPolicy {

    static final Comparator<PositionLot> FIFO_ORDER = Comparator
        .comparing(PositionLot::getPurchaseDate)
        .thenComparing(PositionLot::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    @Override
    public String name() {
        return "FIFO";
    }

    @Override
    public List<PositionLot> order(List<PositionLot> openLots) {
        return openLots.stream()
            .sorted(FIFO_ORDER)
            .toList();
    }
}
