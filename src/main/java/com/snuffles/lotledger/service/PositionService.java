package com.snuffles.lotledger.service;

import com.snuffles.lotledger.domain.Position;
import com.snuffles.lotledger.domain.PositionLot;
import com.snuffles.lotledger.repository.LedgerTransactionRepository;
import com.snuffles.lotledger.repository.PositionLotRepository;
import com.snuffles.lotledger.repository.PositionRepository;
import com.snuffles.lotledger.repository.SaleAllocationRepository;
import com.snuffles.lotledger.service.exception.ResourceNotFoundException;
import com.snuffles.lotledger.web.dto.PositionDto;
import com.snuffles.lotledger.web.mapper.PositionMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class PositionService {

    private final PositionRepository positionRepository;
    private final PositionLotRepository lotRepository;
    private final LedgerTransactionRepository transactionRepository;
    private final SaleAllocationRepository allocationRepository;
    private final PositionAggregator positionAggregator;
    private final PositionMapper positionMapper;

    /**
     * Recomputes the position for the pair from its lots and upserts it. A position that drops
     * to zero stays in place as inactive.
     */
    @Transactional
    public Position refresh(String accountId, String symbol) {
        Position position = positionRepository.findByAccountIdAndSymbol(accountId, symbol)
            .orElseGet(() -> newPosition(accountId, symbol));
        apply(position, accountId, symbol);
        Position saved = positionRepository.save(position);
        log.debug(
            "Refreshed position {} {}: quantity={}, avgCost={}, totalCost={}, active={}",
            accountId,
            symbol,
            saved.getQuantity(),
            saved.getAvgCost(),
            saved.getTotalCost(),
            saved.isActive()
        );
        return saved;
    }

    @Transactional
    public PositionDto rebuild(String accountId, String symbol) {
        String normalizedSymbol = normalize(symbol);
        if (transactionRepository.findLastTransactionDate(accountId, normalizedSymbol).isEmpty()) {
            throw new ResourceNotFoundException("No transactions for " + normalizedSymbol + " in account " + accountId);
        }

        Position position = positionRepository.findByAccountIdAndSymbol(accountId, normalizedSymbol)
            .orElseGet(() -> newPosition(accountId, normalizedSymbol));
        BigDecimal previousQuantity = position.getQuantity();
        resetPosition(position);
        apply(position, accountId, normalizedSymbol);
        Position saved = positionRepository.save(position);

        if (previousQuantity.compareTo(saved.getQuantity()) != 0) {
            log.warn(
                "Rebuild of {} {} changed quantity from {} to {}",
                accountId,
                normalizedSymbol,
                previousQuantity,
                saved.getQuantity()
            );
        }
        log.info("Rebuilt position {} {} (quantity={}, active={})", accountId, normalizedSymbol, saved.getQuantity(), saved.isActive());
        return positionMapper.toDto(saved);
    }

    @Transactional(readOnly = true)
    public PositionDto getPosition(String accountId, String symbol) {
        String normalizedSymbol = normalize(symbol);
        return positionRepository.findByAccountIdAndSymbol(accountId, normalizedSymbol)
            .map(positionMapper::toDto)
            .orElseThrow(() -> new ResourceNotFoundException("Position not found for " + normalizedSymbol + " in account " + accountId));
    }

    @Transactional(readOnly = true)
    public List<PositionDto> getPositions(String accountId, boolean activeOnly) {
        List<Position> positions = activeOnly
            ? positionRepository.findByAccountIdAndActiveTrueOrderBySymbolAsc(accountId)
            : positionRepository.findByAccountIdOrderBySymbolAsc(accountId);
        log.debug("Fetched {} positions for account {} (activeOnly={})", positions.size(), accountId, activeOnly);
        return positions.stream()
            .map(positionMapper::toDto)
            .toList();
    }

    /**
     * Holdings of the pair at the close of {@code asOf}, rebuilt from lots bought and sales booked
     * on or before that date. The stored position row is not consulted.
     */
    @Transactional(readOnly = true)
    public PositionAggregator.Aggregate holdingsAsOf(String accountId, String symbol, LocalDate asOf) {
        List<PositionLot> lots = lotRepository
            .findByAccountIdAndSymbolAndPurchaseDateLessThanEqualOrderByPurchaseDateAscIdAsc(accountId, symbol, asOf);
        Map<Long, BigDecimal> soldByLot = allocationRepository.sumSoldByLot(accountId, symbol, asOf).stream()
            .collect(Collectors.toMap(
                SaleAllocationRepository.LotSoldQuantity::getLotId,
                SaleAllocationRepository.LotSoldQuantity::getQuantitySold
            ));
        LocalDate lastTransactionDate = transactionRepository.findLastTransactionDateAsOf(accountId, symbol, asOf).orElse(null);
        return positionAggregator.aggregateAsOf(lots, soldByLot, lastTransactionDate);
    }

    static String normalize(String symbol) {
        return symbol == null ? null : symbol.trim().toUpperCase(Locale.ROOT);
    }

    private void apply(Position position, String accountId, String symbol) {
        List<PositionLot> lots = lotRepository.findByAccountIdAndSymbolOrderByPurchaseDateAscIdAsc(accountId, symbol);
        LocalDate lastTransactionDate = transactionRepository.findLastTransactionDate(accountId, symbol).orElse(null);
        PositionAggregator.Aggregate aggregate = positionAggregator.aggregate(lots, lastTransactionDate);

        position.setQuantity(aggregate.quantity());
        position.setAvgCost(aggregate.avgCost());
        position.setTotalCost(aggregate.totalCost());
        position.setFirstBuyDate(aggregate.firstBuyDate());
        position.setLastTransactionDate(aggregate.lastTransactionDate());
        position.setActive(aggregate.active());
    }

    private Position newPosition(String accountId, String symbol) {
        Position position = new Position();
        position.setAccountId(accountId);
        position.setSymbol(symbol);
        return position;
    }

    private void resetPosition(Position position) {
        log.trace("Resetting position {} {} before rebuild", position.getAccountId(), position.getSymbol());
        position.setQuantity(BigDecimal.ZERO);
        position.setAvgCost(BigDecimal.ZERO);
        position.setTotalCost(BigDecimal.ZERO);
        position.setFirstBuyDate(null);
        position.setLastTransactionDate(null);
        position.setActive(false);
    }
}
