package com.snuffles.lotledger.service.pricing;

import com.snuffles.lotledger.repository.ClosingPriceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Answers from recorded closing prices, falling back to the latest close on or before the
 * requested date.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StoredClosingPriceFeed implements PriceFeed {

    private final ClosingPriceRepository closingPriceRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<PriceObservation> priceFor(String symbol, LocalDate date) {
        Optional<PriceObservation> observation = closingPriceRepository
            .findFirstBySymbolAndPriceDateLessThanEqualOrderByPriceDateDesc(symbol, date)
            .map(close -> new PriceObservation(close.getClosePrice(), close.getPriceDate()));
        observation.ifPresentOrElse(
            found -> log.debug("Price for {} on {}: {} observed {}", symbol, date, found.price(), found.observedDate()),
            () -> log.debug("No stored close for {} on or before {}", symbol, date)
        );
        return observation;
    }
}
