package com.snuffles.lotledger.service;

import com.snuffles.lotledger.domain.LedgerTransaction;
import com.snuffles.lotledger.repository.LedgerTransactionRepository;
import com.snuffles.lotledger.service.exception.DuplicateTransactionException;
import com.snuffles.lotledger.service.exception.InsufficientLotsException;
import com.snuffles.lotledger.service.exception.StorageException;
import com.snuffles.lotledger.service.exception.ValidationException;
import com.snuffles.lotledger.web.dto.BatchResultDto;
import com.snuffles.lotledger.web.dto.TransactionRequest;
import com.snuffles.lotledger.web.dto.TransactionResultDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for new transactions. Validates, short-circuits replays of a known external id
 * and hands everything else to {@link LedgerPostingService} under the pair's lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionIngestionService {

    private final TransactionValidator transactionValidator;
    private final LedgerLockRegistry lockRegistry;
    private final LedgerPostingService postingService;
    private final LedgerQueryService queryService;
    private final LedgerTransactionRepository transactionRepository;

    public TransactionResultDto recordTransaction(String accountId, TransactionRequest request) {
        LedgerTransaction candidate = transactionValidator.validate(accountId, request);

        Optional<TransactionResultDto> replay = findReplay(candidate);
        if (replay.isPresent()) {
            return replay.get();
        }

        return lockRegistry.withLock(candidate.getAccountId(), candidate.getSymbol(), () -> post(candidate));
    }

    /**
     * Records each request in order. Rejections are reported per item and do not stop the
     * batch; a storage failure does.
     */
    public BatchResultDto recordBatch(String accountId, List<TransactionRequest> requests) {
        List<TransactionResultDto> results = new ArrayList<>(requests.size());
        for (TransactionRequest request : requests) {
            try {
                results.add(recordTransaction(accountId, request));
            } catch (ValidationException | InsufficientLotsException | DuplicateTransactionException ex) {
                log.info("Rejected batch item {} for account {}: {}", request != null ? request.getExternalId() : null, accountId, ex.getMessage());
                results.add(TransactionResultDto.rejected(ex.getMessage()));
            }
        }
        BatchResultDto batch = BatchResultDto.of(results);
        log.info(
            "Batch for account {} done: applied={}, alreadyApplied={}, rejected={}",
            accountId,
            batch.getApplied(),
            batch.getAlreadyApplied(),
            batch.getRejected()
        );
        return batch;
    }

    private TransactionResultDto post(LedgerTransaction candidate) {
        // Another request for the same pair may have booked this external id while we waited.
        Optional<TransactionResultDto> replay = findReplay(candidate);
        if (replay.isPresent()) {
            return replay.get();
        }

        try {
            return postingService.post(candidate);
        } catch (DataIntegrityViolationException ex) {
            if (candidate.getExternalId() != null) {
                Optional<TransactionResultDto> raced = findReplay(candidate);
                if (raced.isPresent()) {
                    log.info("External id {} for account {} was booked concurrently", candidate.getExternalId(), candidate.getAccountId());
                    return raced.get();
                }
            }
            log.error("Integrity violation while posting {} for account {}", candidate.getSymbol(), candidate.getAccountId(), ex);
            throw new StorageException("Failed to store transaction for " + candidate.getSymbol(), ex);
        } catch (DataAccessException ex) {
            log.error("Storage failure while posting {} for account {}", candidate.getSymbol(), candidate.getAccountId(), ex);
            throw new StorageException("Failed to store transaction for " + candidate.getSymbol(), ex);
        }
    }

    private Optional<TransactionResultDto> findReplay(LedgerTransaction candidate) {
        if (candidate.getExternalId() == null) {
            return Optional.empty();
        }
        Optional<LedgerTransaction> existing;
        try {
            existing = transactionRepository.findByAccountIdAndExternalId(candidate.getAccountId(), candidate.getExternalId());
        } catch (DataAccessException ex) {
            log.error("Storage failure looking up external id {} for account {}", candidate.getExternalId(), candidate.getAccountId(), ex);
            throw new StorageException("Failed to look up external id " + candidate.getExternalId(), ex);
        }
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        LedgerTransaction stored = existing.get();
        if (!samePayload(stored, candidate)) {
            log.warn(
                "External id {} for account {} resubmitted with a different payload (existing transaction {})",
                candidate.getExternalId(),
                candidate.getAccountId(),
                stored.getId()
            );
            throw new DuplicateTransactionException(candidate.getExternalId(), stored.getId());
        }

        log.info("Replay of external id {} for account {} matched transaction {}", candidate.getExternalId(), candidate.getAccountId(), stored.getId());
        return Optional.of(queryService.storedResult(stored));
    }

    static boolean samePayload(LedgerTransaction stored, LedgerTransaction candidate) {
        return Objects.equals(stored.getSymbol(), candidate.getSymbol())
            && stored.getTransactionType() == candidate.getTransactionType()
            && stored.getQuantity().compareTo(candidate.getQuantity()) == 0
            && stored.getPrice().compareTo(candidate.getPrice()) == 0
            && stored.getCommission().compareTo(candidate.getCommission()) == 0
            && Objects.equals(stored.getTransactionDate(), candidate.getTransactionDate());
    }
}
