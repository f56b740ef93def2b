package com.snuffles.lotledger.service;

import com.snuffles.lotledger.domain.LedgerTransaction;
import com.snuffles.lotledger.domain.Position;
import com.snuffles.lotledger.domain.PositionLot;
import com.snuffles.lotledger.domain.SaleAllocation;
import com.snuffles.lotledger.repository.LedgerTransactionRepository;
import com.snuffles.lotledger.repository.PositionLotRepository;
import com.snuffles.lotledger.repository.PositionRepository;
import com.snuffles.lotledger.repository.SaleAllocationRepository;
import com.snuffles.lotledger.web.dto.ConsistencyReportDto;
import com.snuffles.lotledger.web.dto.ConsistencyReportDto.IssueDto;
import com.snuffles.lotledger.web.dto.ConsistencyReportDto.SymbolStatisticsDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cross-checks transactions, lots, allocations and positions of an account and reports
 * whatever does not add up. Read-only: nothing is repaired here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerConsistencyService {

    public static final String LOT_COUNT_MISMATCH = "LOT_COUNT_MISMATCH";
    public static final String ALLOCATION_MISMATCH = "ALLOCATION_MISMATCH";
    public static final String POSITION_MISMATCH = "POSITION_MISMATCH";
    public static final String LOT_OUT_OF_BOUNDS = "LOT_OUT_OF_BOUNDS";
    public static final String LOT_STATE_MISMATCH = "LOT_STATE_MISMATCH";

    private final LedgerTransactionRepository transactionRepository;
    private final PositionLotRepository lotRepository;
    private final SaleAllocationRepository allocationRepository;
    private final PositionRepository positionRepository;

    @Transactional(readOnly = true)
    public ConsistencyReportDto check(String accountId) {
        List<String> symbols = transactionRepository.findSymbolsByAccountId(accountId);
        List<IssueDto> issues = new ArrayList<>();
        Map<String, SymbolStatisticsDto> statistics = new LinkedHashMap<>();

        for (String symbol : symbols) {
            statistics.put(symbol, checkSymbol(accountId, symbol, issues));
        }

        if (issues.isEmpty()) {
            log.info("Ledger for account {} is consistent across {} symbols", accountId, symbols.size());
        } else {
            log.warn("Ledger for account {} has {} consistency issues across {} symbols", accountId, issues.size(), symbols.size());
        }
        return new ConsistencyReportDto(accountId, symbols.size(), issues, statistics);
    }

    private SymbolStatisticsDto checkSymbol(String accountId, String symbol, List<IssueDto> issues) {
        List<LedgerTransaction> buys = transactionRepository.findByAccountIdAndSymbolAndTransactionTypeOrderByIdAsc(
            accountId, symbol, LedgerTransaction.TransactionType.BUY);
        List<LedgerTransaction> sells = transactionRepository.findByAccountIdAndSymbolAndTransactionTypeOrderByIdAsc(
            accountId, symbol, LedgerTransaction.TransactionType.SELL);
        List<PositionLot> lots = lotRepository.findByAccountIdAndSymbolOrderByPurchaseDateAscIdAsc(accountId, symbol);

        if (buys.size() != lots.size()) {
            issues.add(new IssueDto(
                LOT_COUNT_MISMATCH,
                symbol,
                null,
                buys.size() + " BUY transactions but " + lots.size() + " lots"
            ));
        }

        for (LedgerTransaction sell : sells) {
            BigDecimal allocated = allocationRepository.findBySaleTransactionIdOrderByIdAsc(sell.getId()).stream()
                .map(SaleAllocation::getQuantitySold)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
            if (allocated.compareTo(sell.getQuantity()) != 0) {
                issues.add(new IssueDto(
                    ALLOCATION_MISMATCH,
                    symbol,
                    sell.getId(),
                    "SELL of " + sell.getQuantity().toPlainString() + " has " + allocated.toPlainString() + " allocated"
                ));
            }
        }

        BigDecimal openRemaining = BigDecimal.ZERO;
        int openLots = 0;
        for (PositionLot lot : lots) {
            BigDecimal remaining = lot.getRemainingQuantity();
            if (remaining.signum() < 0 || remaining.compareTo(lot.getOriginalQuantity()) > 0) {
                issues.add(new IssueDto(
                    LOT_OUT_OF_BOUNDS,
                    symbol,
                    lot.getId(),
                    "Remaining " + remaining.toPlainString() + " outside [0, " + lot.getOriginalQuantity().toPlainString() + "]"
                ));
            }
            if (lot.isClosed() != (remaining.signum() == 0)) {
                issues.add(new IssueDto(
                    LOT_STATE_MISMATCH,
                    symbol,
                    lot.getId(),
                    "Closed flag is " + lot.isClosed() + " with remaining " + remaining.toPlainString()
                ));
            }
            if (!lot.isClosed()) {
                openLots++;
                openRemaining = openRemaining.add(remaining);
            }
        }

        Optional<Position> position = positionRepository.findByAccountIdAndSymbol(accountId, symbol);
        BigDecimal positionQuantity = position.map(Position::getQuantity).orElse(BigDecimal.ZERO);
        if (position.isEmpty() && !lots.isEmpty()) {
            issues.add(new IssueDto(POSITION_MISMATCH, symbol, null, "No position row for a symbol with lots"));
        } else if (positionQuantity.compareTo(openRemaining) != 0) {
            issues.add(new IssueDto(
                POSITION_MISMATCH,
                symbol,
                position.map(Position::getId).orElse(null),
                "Position quantity " + positionQuantity.toPlainString() + " but open lots hold " + openRemaining.toPlainString()
            ));
        }

        return new SymbolStatisticsDto(buys.size(), sells.size(), openLots, lots.size() - openLots);
    }
}
