package com.snuffles.lotledger.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValuationRequest {

    @NotBlank
    private String symbol;

    @NotNull
    private LocalDate valuationDate;

    @NotNull
    @Positive
    private BigDecimal marketPrice;

    // Date the price was observed; defaults to the valuation date.
    private LocalDate priceDate;
}
