package com.snuffles.lotledger.web.controller;

import com.snuffles.lotledger.repository.LedgerTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final LedgerTransactionRepository transactionRepository;

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("service", "lotledger", "status", "ok");
    }

    /**
     * Reports UP only while the ledger store answers a trivial query.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        try {
            transactionRepository.count();
            return ResponseEntity.ok(Map.of("status", "UP", "storage", "UP"));
        } catch (DataAccessException ex) {
            log.error("Ledger storage health probe failed", ex);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("status", "DOWN", "storage", "DOWN"));
        }
    }
}
