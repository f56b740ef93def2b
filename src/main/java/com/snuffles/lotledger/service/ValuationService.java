package com.snuffles.lotledger.service;

import com.snuffles.lotledger.config.LedgerProperties;
import com.snuffles.lotledger.domain.DailyPnlSnapshot;
import com.snuffles.lotledger.domain.Position;
import com.snuffles.lotledger.repository.DailyPnlSnapshotRepository;
import com.snuffles.lotledger.repository.PositionRepository;
import com.snuffles.lotledger.repository.SaleAllocationRepository;
import com.snuffles.lotledger.service.exception.PriceNotFoundException;
import com.snuffles.lotledger.service.exception.ResourceNotFoundException;
import com.snuffles.lotledger.service.exception.ValidationException;
import com.snuffles.lotledger.service.pricing.PriceFeed;
import com.snuffles.lotledger.service.pricing.PriceObservation;
import com.snuffles.lotledger.web.dto.DailyPnlSnapshotDto;
import com.snuffles.lotledger.web.mapper.DailyPnlSnapshotMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.snuffles.lotledger.service.allocation.LotAllocationEngine.MONEY_SCALE;
import static com.snuffles.lotledger.service.allocation.LotAllocationEngine.ROUNDING;
import static com.snuffles.lotledger.service.allocation.LotAllocationEngine.UNIT_COST_SCALE;

/**
 * Marks positions to market and keeps one P&amp;L row per account, symbol and day.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ValuationService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PositionRepository positionRepository;
    private final PositionService positionService;
    private final SaleAllocationRepository allocationRepository;
    private final DailyPnlSnapshotRepository snapshotRepository;
    private final PriceFeed priceFeed;
    private final DailyPnlSnapshotMapper snapshotMapper;
    private final LedgerProperties ledgerProperties;

    /**
     * Values the pair as it stood at the close of {@code valuationDate}: lots bought and sales
     * booked after that date are left out.
     */
    @Transactional
    public DailyPnlSnapshotDto snapshot(
        String accountId,
        String symbol,
        LocalDate valuationDate,
        BigDecimal marketPrice,
        LocalDate priceDate
    ) {
        if (valuationDate == null) {
            throw new ValidationException("Valuation date is required");
        }
        if (marketPrice == null || marketPrice.signum() <= 0) {
            throw new ValidationException("Market price must be positive");
        }
        LocalDate observedOn = priceDate != null ? priceDate : valuationDate;
        if (observedOn.isAfter(valuationDate)) {
            throw new ValidationException("Price date " + observedOn + " is after valuation date " + valuationDate);
        }

        String normalizedSymbol = PositionService.normalize(symbol);
        if (positionRepository.findByAccountIdAndSymbol(accountId, normalizedSymbol).isEmpty()) {
            throw new ResourceNotFoundException("Position not found for " + normalizedSymbol + " in account " + accountId);
        }

        PositionAggregator.Aggregate holdings = positionService.holdingsAsOf(accountId, normalizedSymbol, valuationDate);
        return store(accountId, normalizedSymbol, valuationDate, marketPrice, observedOn, holdings);
    }

    @Transactional
    public DailyPnlSnapshotDto snapshotFromFeed(String accountId, String symbol, LocalDate valuationDate) {
        String normalizedSymbol = PositionService.normalize(symbol);
        PriceObservation observation = priceFeed.priceFor(normalizedSymbol, valuationDate)
            .orElseThrow(() -> new PriceNotFoundException("No price for " + normalizedSymbol + " on or before " + valuationDate));
        return snapshot(accountId, normalizedSymbol, valuationDate, observation.price(), observation.observedDate());
    }

    /**
     * Values every symbol the account held on {@code valuationDate} from the price feed. Symbols
     * the feed has no price for are left out.
     */
    @Transactional
    public List<DailyPnlSnapshotDto> snapshotAccount(String accountId, LocalDate valuationDate) {
        return valueAccount(accountId, valuationDate, false);
    }

    /**
     * Backfills snapshots for every day in {@code [from, to]}. With {@code tradingDaysOnly} a
     * symbol is valued only on days that have their own close, so weekends and holidays are
     * skipped instead of stored with a stale price.
     */
    @Transactional
    public List<DailyPnlSnapshotDto> snapshotRange(String accountId, LocalDate from, LocalDate to, boolean tradingDaysOnly) {
        if (from == null || to == null) {
            throw new ValidationException("Both 'from' and 'to' are required");
        }
        if (from.isAfter(to)) {
            throw new ValidationException("'from' must not be after 'to'");
        }
        int maxDays = ledgerProperties.getValidation().getMaxBackfillDays();
        long days = ChronoUnit.DAYS.between(from, to) + 1;
        if (days > maxDays) {
            throw new ValidationException("Backfill covers " + days + " days, maximum is " + maxDays);
        }

        List<DailyPnlSnapshotDto> snapshots = new ArrayList<>();
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            snapshots.addAll(valueAccount(accountId, date, tradingDaysOnly));
        }
        log.info("Backfilled {} snapshots for account {} from {} to {} (tradingDaysOnly={})", snapshots.size(), accountId, from, to, tradingDaysOnly);
        return snapshots;
    }

    @Transactional(readOnly = true)
    public List<DailyPnlSnapshotDto> getSnapshots(String accountId, String symbol, LocalDate from, LocalDate to) {
        LocalDate start = from != null ? from : LedgerQueryService.EARLIEST;
        LocalDate end = to != null ? to : LedgerQueryService.LATEST;
        if (start.isAfter(end)) {
            throw new ValidationException("'from' must not be after 'to'");
        }
        List<DailyPnlSnapshot> snapshots = symbol == null || symbol.isBlank()
            ? snapshotRepository.findByAccountIdAndValuationDateBetweenOrderByValuationDateAscSymbolAsc(accountId, start, end)
            : snapshotRepository.findByAccountIdAndSymbolAndValuationDateBetweenOrderByValuationDateAsc(
                accountId, PositionService.normalize(symbol), start, end);
        return snapshots.stream()
            .map(snapshotMapper::toDto)
            .toList();
    }

    private List<DailyPnlSnapshotDto> valueAccount(String accountId, LocalDate valuationDate, boolean freshPricesOnly) {
        List<Position> positions = positionRepository.findByAccountIdOrderBySymbolAsc(accountId);
        List<DailyPnlSnapshotDto> snapshots = new ArrayList<>(positions.size());
        for (Position position : positions) {
            String symbol = position.getSymbol();
            PositionAggregator.Aggregate holdings = positionService.holdingsAsOf(accountId, symbol, valuationDate);
            if (holdings.quantity().signum() == 0) {
                log.debug("Skipping {} {} on {}: nothing held", accountId, symbol, valuationDate);
                continue;
            }
            Optional<PriceObservation> observation = priceFeed.priceFor(symbol, valuationDate);
            if (observation.isEmpty()) {
                log.warn("Skipping {} {} on {}: no price available", accountId, symbol, valuationDate);
                continue;
            }
            if (freshPricesOnly && observation.get().isStaleFor(valuationDate)) {
                log.debug("Skipping {} {} on {}: no close for that day", accountId, symbol, valuationDate);
                continue;
            }
            snapshots.add(store(
                accountId,
                symbol,
                valuationDate,
                observation.get().price(),
                observation.get().observedDate(),
                holdings
            ));
        }
        log.info("Valued {} of {} positions for account {} on {}", snapshots.size(), positions.size(), accountId, valuationDate);
        return snapshots;
    }

    private DailyPnlSnapshotDto store(
        String accountId,
        String symbol,
        LocalDate valuationDate,
        BigDecimal marketPrice,
        LocalDate observedOn,
        PositionAggregator.Aggregate holdings
    ) {
        BigDecimal price = marketPrice.setScale(MONEY_SCALE, ROUNDING);
        BigDecimal quantity = holdings.quantity();
        BigDecimal totalCost = holdings.totalCost().setScale(MONEY_SCALE, ROUNDING);
        BigDecimal marketValue = quantity.multiply(price).setScale(MONEY_SCALE, ROUNDING);
        BigDecimal unrealizedPnl = marketValue.subtract(totalCost);
        BigDecimal realizedPnl = allocationRepository.sumRealizedPnl(accountId, symbol, valuationDate)
            .setScale(MONEY_SCALE, ROUNDING);
        BigDecimal soldCost = allocationRepository.sumSoldCost(accountId, symbol, valuationDate);
        boolean stale = !observedOn.equals(valuationDate);

        DailyPnlSnapshot snapshot = snapshotRepository
            .findByAccountIdAndSymbolAndValuationDate(accountId, symbol, valuationDate)
            .orElseGet(() -> {
                DailyPnlSnapshot created = new DailyPnlSnapshot();
                created.setAccountId(accountId);
                created.setSymbol(symbol);
                created.setValuationDate(valuationDate);
                return created;
            });
        boolean overwrite = snapshot.getId() != null;

        snapshot.setQuantity(quantity);
        snapshot.setAvgCost(holdings.avgCost().setScale(UNIT_COST_SCALE, ROUNDING));
        snapshot.setMarketPrice(price);
        snapshot.setMarketValue(marketValue);
        snapshot.setTotalCost(totalCost);
        snapshot.setUnrealizedPnl(unrealizedPnl);
        snapshot.setUnrealizedPnlPct(percentOf(unrealizedPnl, totalCost));
        snapshot.setRealizedPnl(realizedPnl);
        snapshot.setRealizedPnlPct(percentOf(realizedPnl, soldCost));
        snapshot.setPriceDate(observedOn);
        snapshot.setStalePrice(stale);

        if (stale) {
            log.warn("Valuing {} {} on {} with stale price from {}", accountId, symbol, valuationDate, observedOn);
        }

        DailyPnlSnapshot saved = snapshotRepository.save(snapshot);
        log.info(
            "{} snapshot {} {} on {}: marketValue={}, unrealized={}, realized={}",
            overwrite ? "Overwrote" : "Stored",
            accountId,
            symbol,
            valuationDate,
            saved.getMarketValue(),
            saved.getUnrealizedPnl(),
            saved.getRealizedPnl()
        );
        return snapshotMapper.toDto(saved);
    }

    static BigDecimal percentOf(BigDecimal amount, BigDecimal base) {
        if (base == null || base.signum() == 0) {
            return BigDecimal.ZERO.setScale(MONEY_SCALE);
        }
        return amount.multiply(HUNDRED).divide(base, MONEY_SCALE, ROUNDING);
    }
}
