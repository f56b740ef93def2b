package com.snuffles.lotledger.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClosingPriceRequest {

    @NotNull
    @Positive
    private BigDecimal closePrice;

    @Size(max = 50)
    private String source;
}
