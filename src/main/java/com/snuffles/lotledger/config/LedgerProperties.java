package com.snuffles.lotledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "ledger")
@Data
@Validated
public class LedgerProperties {

    @Valid
    private Validation validation = new Validation();

    @Valid
    private Seed seed = new Seed();

    @Valid
    private Cors cors = new Cors();

    @Valid
    private Locking locking = new Locking();

    /**
     * Limits applied by the ingestion gate on top of the basic sign checks.
     */
    @Data
    public static class Validation {

        @Min(1)
        private int maxAccountIdLength = 100;

        @Min(1)
        private int maxSymbolLength = 20;

        @Min(1)
        @Max(255)
        private int maxExternalIdLength = 255;

        @Min(1)
        @Max(500)
        private int maxNotesLength = 500;

        @NotNull
        @Positive
        private BigDecimal maxQuantity = new BigDecimal("10000000");

        @NotNull
        @Positive
        private BigDecimal maxPrice = new BigDecimal("1000000");

        // Commission as a fraction of quantity * price.
        @NotNull
        @DecimalMin("0")
        private BigDecimal maxCommissionRate = new BigDecimal("0.1");

        // Longest date range a single valuation backfill may cover.
        @Min(1)
        private int maxBackfillDays = 366;
    }

    @Data
    public static class Seed {

        private boolean enabled = false;

        @NotBlank
        private String location = "classpath:seed-transactions.json";
    }

    @Data
    public static class Cors {

        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3001", "http://127.0.0.1:3001"));
    }

    @Data
    public static class Locking {

        // Lock stripes shared by all (account, symbol) pairs.
        @Min(1)
        private int stripes = 64;
    }
}
