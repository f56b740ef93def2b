package com.snuffles.lotledger.seeding;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.snuffles.lotledger.config.LedgerProperties;
import com.snuffles.lotledger.service.TransactionIngestionService;
import com.snuffles.lotledger.service.exception.DuplicateTransactionException;
import com.snuffles.lotledger.service.exception.InsufficientLotsException;
import com.snuffles.lotledger.service.exception.ValidationException;
import com.snuffles.lotledger.web.dto.TransactionResultDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Loads demo transactions at startup through the regular ingestion path. Every row carries an
 * external id, so restarting against a seeded database books nothing twice.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DataSeedingService implements ApplicationRunner {

    private final LedgerProperties ledgerProperties;
    private final TransactionIngestionService ingestionService;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        LedgerProperties.Seed seed = ledgerProperties.getSeed();
        if (!seed.isEnabled()) {
            log.debug("Seeding disabled");
            return;
        }

        Resource resource = resourceLoader.getResource(seed.getLocation());
        if (!resource.exists()) {
            log.warn("Seed file {} not found. Skipping.", seed.getLocation());
            return;
        }

        log.info("Seeding ledger from {}", seed.getLocation());
        List<SeedTransactionRecord> records = read(resource);

        int applied = 0;
        int skipped = 0;
        List<SeedTransactionRecord> valid = records.stream()
            .filter(Objects::nonNull)
            .filter(this::isValidRecord)
            .sorted(Comparator.comparing((SeedTransactionRecord record) -> LocalDate.parse(record.transactionDate()))
                .thenComparing(record -> "SELL".equalsIgnoreCase(record.side())))
            .toList();

        for (SeedTransactionRecord record : valid) {
            try {
                TransactionResultDto result = ingestionService.recordTransaction(record.accountId(), record.toRequest());
                if (result.getStatus() == TransactionResultDto.Status.APPLIED) {
                    applied++;
                }
            } catch (ValidationException | InsufficientLotsException | DuplicateTransactionException ex) {
                skipped++;
                log.warn("Skipping seed row {}: {}", record.externalId(), ex.getMessage());
            }
        }

        log.info(
            "Seeding completed: {} rows read, {} applied, {} skipped, {} already present",
            records.size(),
            applied,
            skipped + (records.size() - valid.size()),
            valid.size() - applied - skipped
        );
    }

    List<SeedTransactionRecord> read(Resource resource) throws IOException {
        try (InputStream inputStream = resource.getInputStream()) {
            return objectMapper.readValue(inputStream, new TypeReference<List<SeedTransactionRecord>>() {});
        }
    }

    private boolean isValidRecord(SeedTransactionRecord record) {
        if (record.accountId() == null || record.accountId().isBlank()) {
            log.warn("Skipping seed row without account_id: {}", record);
            return false;
        }

        if (record.externalId() == null || record.externalId().isBlank()) {
            log.warn("Skipping seed row without external_id: {}", record);
            return false;
        }

        if (record.transactionDate() == null || record.transactionDate().isBlank()) {
            log.warn("Skipping seed row without transaction_date: {}", record);
            return false;
        }

        try {
            LocalDate.parse(record.transactionDate());
        } catch (DateTimeParseException ex) {
            log.warn("Skipping seed row with invalid date '{}': {}", record.transactionDate(), record);
            return false;
        }

        return true;
    }
}
