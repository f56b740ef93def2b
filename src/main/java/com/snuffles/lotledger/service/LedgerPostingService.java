package com.snuffles.lotledger.service;

import com.snuffles.lotledger.domain.LedgerTransaction;
import com.snuffles.lotledger.domain.Position;
import com.snuffles.lotledger.domain.PositionLot;
import com.snuffles.lotledger.domain.SaleAllocation;
import com.snuffles.lotledger.repository.LedgerTransactionRepository;
import com.snuffles.lotledger.repository.PositionLotRepository;
import com.snuffles.lotledger.repository.SaleAllocationRepository;
import com.snuffles.lotledger.service.allocation.LotAllocationEngine;
import com.snuffles.lotledger.service.allocation.LotSlice;
import com.snuffles.lotledger.web.dto.TransactionResultDto;
import com.snuffles.lotledger.web.mapper.PositionLotMapper;
import com.snuffles.lotledger.web.mapper.PositionMapper;
import com.snuffles.lotledger.web.mapper.SaleAllocationMapper;
import com.snuffles.lotledger.web.mapper.TransactionMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Books one validated transaction: inserts it, runs the allocation engine, persists lots and
 * allocations and refreshes the position, all in a single database transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerPostingService {

    private final LedgerTransactionRepository transactionRepository;
    private final PositionLotRepository lotRepository;
    private final SaleAllocationRepository allocationRepository;
    private final LotAllocationEngine allocationEngine;
    private final PositionService positionService;
    private final TransactionMapper transactionMapper;
    private final PositionLotMapper lotMapper;
    private final SaleAllocationMapper allocationMapper;
    private final PositionMapper positionMapper;

    @Transactional
    public TransactionResultDto post(LedgerTransaction transaction) {
        return transaction.isBuy() ? postBuy(transaction) : postSell(transaction);
    }

    private TransactionResultDto postBuy(LedgerTransaction buy) {
        LedgerTransaction saved = transactionRepository.save(buy);
        PositionLot lot = lotRepository.save(allocationEngine.openLot(saved));
        saved.setLotId(lot.getId());
        transactionRepository.save(saved);

        Position position = positionService.refresh(saved.getAccountId(), saved.getSymbol());
        log.info(
            "Applied BUY {} {} {}@{} for account {} (lot={}, position={})",
            saved.getId(),
            saved.getSymbol(),
            saved.getQuantity(),
            saved.getPrice(),
            saved.getAccountId(),
            lot.getId(),
            position.getQuantity()
        );
        return result(saved, position, List.of(lot), List.of());
    }

    private TransactionResultDto postSell(LedgerTransaction sell) {
        List<PositionLot> openLots = lotRepository.findOpenLotsForUpdate(sell.getAccountId(), sell.getSymbol());
        List<LotSlice> plan = allocationEngine.planSale(sell, openLots);

        LedgerTransaction saved = transactionRepository.save(sell);
        List<SaleAllocation> allocations = allocationEngine.applySale(saved, plan);
        List<PositionLot> touched = plan.stream()
            .map(LotSlice::lot)
            .toList();
        lotRepository.saveAll(touched);
        List<SaleAllocation> savedAllocations = allocationRepository.saveAll(allocations);

        Position position = positionService.refresh(saved.getAccountId(), saved.getSymbol());
        log.info(
            "Applied SELL {} {} {}@{} for account {} across {} lots (position={})",
            saved.getId(),
            saved.getSymbol(),
            saved.getQuantity(),
            saved.getPrice(),
            saved.getAccountId(),
            touched.size(),
            position.getQuantity()
        );
        return result(saved, position, touched, savedAllocations);
    }

    private TransactionResultDto result(
        LedgerTransaction transaction,
        Position position,
        List<PositionLot> lots,
        List<SaleAllocation> allocations
    ) {
        return TransactionResultDto.builder()
            .status(TransactionResultDto.Status.APPLIED)
            .transaction(transactionMapper.toDto(transaction))
            .position(positionMapper.toDto(position))
            .lotsTouched(lotMapper.toDtos(lots))
            .allocations(allocationMapper.toDtos(allocations))
            .build();
    }
}
