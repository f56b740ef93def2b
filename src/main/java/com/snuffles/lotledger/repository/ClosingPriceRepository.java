package com.snuffles.lotledger.repository;

import com.snuffles.lotledger.domain.ClosingPrice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface ClosingPriceRepository extends JpaRepository<ClosingPrice, Long> {

    Optional<ClosingPrice> findBySymbolAndPriceDate(String symbol, LocalDate priceDate);

    Optional<ClosingPrice> findFirstBySymbolAndPriceDateLessThanEqualOrderByPriceDateDesc(String symbol, LocalDate priceDate);
}
