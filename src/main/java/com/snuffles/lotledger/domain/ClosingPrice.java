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
    name = "closing_prices",
    uniqueConstraints = @UniqueConstraint(name = "uk_closing_prices_symbol_date", columnNames = {"symbol", "price_date"})
)
public class ClosingPrice extends BaseEntity {

    @Column(nullable = false, length = 20)
    private String symbol;

    @Column(name = "price_date", nullable = false)
    private LocalDate priceDate;

    @Column(name = "close_price", nullable = false, precision = 19, scale = 4)
    private BigDecimal closePrice;

    @Column(length = 50)
    private String source;
}
