package com.snuffles.lotledger.service.pricing;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Source of closing prices for valuation. Implementations may answer with an observation from
 * an earlier date when the requested day has none.
 */
public interface PriceFeed {

    Optional<PriceObservation> priceFor(String symbol, LocalDate date);
}
