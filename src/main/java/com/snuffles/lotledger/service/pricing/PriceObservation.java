package com.snuffles.lotledger.service.pricing;

import java.math.BigDecimal;
import java.time.LocalDate;

public record PriceObservation(BigDecimal price, LocalDate observedDate) {

    public boolean isStaleFor(LocalDate valuationDate) {
        return !observedDate.equals(valuationDate);
    }
}
