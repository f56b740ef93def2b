package com.snuffles.lotledger.service;

import com.snuffles.lotledger.domain.LedgerTransaction;
import com.snuffles.lotledger.domain.PositionLot;
import com.snuffles.lotledger.domain.SaleAllocation;
import com.snuffles.lotledger.repository.LedgerTransactionRepository;
import com.snuffles.lotledger.repository.PositionLotRepository;
import com.snuffles.lotledger.repository.PositionRepository;
import com.snuffles.lotledger.repository.SaleAllocationRepository;
import com.snuffles.lotledger.service.exception.ResourceNotFoundException;
import com.snuffles.lotledger.service.exception.ValidationException;
import com.snuffles.lotledger.web.dto.PositionLotDto;
import com.snuffles.lotledger.web.dto.SaleAllocationDto;
import com.snuffles.lotledger.web.dto.TransactionDto;
import com.snuffles.lotledger.web.dto.TransactionResultDto;
import com.snuffles.lotledger.web.mapper.PositionLotMapper;
import com.snuffles.lotledger.web.mapper.PositionMapper;
import com.snuffles.lotledger.web.mapper.SaleAllocationMapper;
import com.snuffles.lotledger.web.mapper.TransactionMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * Read side of the ledger: transactions, allocations and lots as stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerQueryService {

    static final LocalDate EARLIEST = LocalDate.of(1900, 1, 1);
    static final LocalDate LATEST = LocalDate.of(9999, 12, 31);

    private final LedgerTransactionRepository transactionRepository;
    private final PositionLotRepository lotRepository;
    private final SaleAllocationRepository allocationRepository;
    private final PositionRepository positionRepository;
    private final TransactionMapper transactionMapper;
    private final PositionLotMapper lotMapper;
    private final SaleAllocationMapper allocationMapper;
    private final PositionMapper positionMapper;

    @Transactional(readOnly = true)
    public List<TransactionDto> getTransactions(String accountId, String symbol, LocalDate from, LocalDate to) {
        LocalDate start = from != null ? from : EARLIEST;
        LocalDate end = to != null ? to : LATEST;
        if (start.isAfter(end)) {
            throw new ValidationException("'from' must not be after 'to'");
        }

        List<LedgerTransaction> transactions = symbol == null || symbol.isBlank()
            ? transactionRepository.findByAccountIdAndTransactionDateBetweenOrderByTransactionDateAscIdAsc(accountId, start, end)
            : transactionRepository.findByAccountIdAndSymbolAndTransactionDateBetweenOrderByTransactionDateAscIdAsc(
                accountId, PositionService.normalize(symbol), start, end);
        log.debug("Fetched {} transactions for account {} (symbol={}, from={}, to={})", transactions.size(), accountId, symbol, from, to);
        return transactions.stream()
            .map(transactionMapper::toDto)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<SaleAllocationDto> getAllocations(String accountId, Long transactionId) {
        LedgerTransaction transaction = transactionRepository.findByIdAndAccountId(transactionId, accountId)
            .orElseThrow(() -> new ResourceNotFoundException("Transaction " + transactionId + " not found in account " + accountId));
        return allocationMapper.toDtos(allocationRepository.findBySaleTransactionIdOrderByIdAsc(transaction.getId()));
    }

    @Transactional(readOnly = true)
    public List<PositionLotDto> getLots(String accountId, String symbol, boolean openOnly) {
        String normalizedSymbol = PositionService.normalize(symbol);
        List<PositionLot> lots = openOnly
            ? lotRepository.findByAccountIdAndSymbolAndClosedFalseOrderByPurchaseDateAscIdAsc(accountId, normalizedSymbol)
            : lotRepository.findByAccountIdAndSymbolOrderByPurchaseDateAscIdAsc(accountId, normalizedSymbol);
        return lotMapper.toDtos(lots);
    }

    /**
     * Rebuilds the result of an already booked transaction, as returned for a replayed
     * external id.
     */
    @Transactional(readOnly = true)
    public TransactionResultDto storedResult(LedgerTransaction transaction) {
        List<SaleAllocation> allocations = transaction.isBuy()
            ? List.of()
            : allocationRepository.findBySaleTransactionIdOrderByIdAsc(transaction.getId());
        List<PositionLot> lots = transaction.isBuy()
            ? lotRepository.findByTransactionId(transaction.getId()).map(List::of).orElse(List.of())
            : lotRepository.findByIdIn(allocations.stream().map(SaleAllocation::getLotId).toList());

        return TransactionResultDto.builder()
            .status(TransactionResultDto.Status.ALREADY_APPLIED)
            .transaction(transactionMapper.toDto(transaction))
            .position(positionRepository.findByAccountIdAndSymbol(transaction.getAccountId(), transaction.getSymbol())
                .map(positionMapper::toDto)
                .orElse(null))
            .lotsTouched(lotMapper.toDtos(lots))
            .allocations(allocationMapper.toDtos(allocations))
            .build();
    }
}
