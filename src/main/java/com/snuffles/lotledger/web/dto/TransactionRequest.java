package com.snuffles.lotledger.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Candidate transaction as submitted by a caller. Side and date stay textual so the
 * ingestion gate can reject bad values with a proper reason.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionRequest {

    @Size(max = 255)
    private String externalId;

    @NotBlank
    private String symbol;

    @NotBlank
    private String side;

    @NotNull
    @Positive
    private BigDecimal quantity;

    @NotNull
    @Positive
    private BigDecimal price;

    @PositiveOrZero
    private BigDecimal commission;

    @NotBlank
    private String transactionDate;

    @Size(max = 500)
    private String notes;
}
