package com.snuffles.lotledger.service.pricing;

import com.snuffles.lotledger.domain.ClosingPrice;
import com.snuffles.lotledger.repository.ClosingPriceRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class StoredClosingPriceFeedTest {

    @Mock
    private ClosingPriceRepository closingPriceRepository;

    @InjectMocks
    private StoredClosingPriceFeed priceFeed;

    @Test
    void returnsLatestCloseOnOrBeforeDate() {
        ClosingPrice close = new ClosingPrice();
        close.setSymbol("ABC");
        close.setPriceDate(LocalDate.of(2023, 3, 30));
        close.setClosePrice(new BigDecimal("55"));
        given(closingPriceRepository.findFirstBySymbolAndPriceDateLessThanEqualOrderByPriceDateDesc("ABC", LocalDate.of(2023, 4, 1)))
            .willReturn(Optional.of(close));

        Optional<PriceObservation> observation = priceFeed.priceFor("ABC", LocalDate.of(2023, 4, 1));

        assertThat(observation).isPresent();
        assertThat(observation.get().price()).isEqualByComparingTo("55");
        assertThat(observation.get().isStaleFor(LocalDate.of(2023, 4, 1))).isTrue();
        assertThat(observation.get().isStaleFor(LocalDate.of(2023, 3, 30))).isFalse();
    }

    @Test
    void emptyWhenNothingRecorded() {
        given(closingPriceRepository.findFirstBySymbolAndPriceDateLessThanEqualOrderByPriceDateDesc("ABC", LocalDate.of(2023, 4, 1)))
            .willReturn(Optional.empty());

        assertThat(priceFeed.priceFor("ABC", LocalDate.of(2023, 4, 1))).isEmpty();
    }
}
