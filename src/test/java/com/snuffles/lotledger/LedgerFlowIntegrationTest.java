package com.snuffles.lotledger;

import com.snuffles.lotledger.domain.LedgerTransaction;
import com.snuffles.lotledger.domain.PositionLot;
import com.snuffles.lotledger.domain.SaleAllocation;
import com.snuffles.lotledger.repository.DailyPnlSnapshotRepository;
import com.snuffles.lotledger.repository.LedgerTransactionRepository;
import com.snuffles.lotledger.repository.PositionLotRepository;
import com.snuffles.lotledger.repository.SaleAllocationRepository;
import com.snuffles.lotledger.service.ClosingPriceService;
import com.snuffles.lotledger.service.LedgerConsistencyService;
import com.snuffles.lotledger.service.LedgerQueryService;
import com.snuffles.lotledger.service.PositionService;
import com.snuffles.lotledger.service.TransactionIngestionService;
import com.snuffles.lotledger.service.ValuationService;
import com.snuffles.lotledger.service.exception.DuplicateTransactionException;
import com.snuffles.lotledger.service.exception.InsufficientLotsException;
import com.snuffles.lotledger.service.exception.ResourceNotFoundException;
import com.snuffles.lotledger.web.dto.ClosingPriceRequest;
import com.snuffles.lotledger.web.dto.ConsistencyReportDto;
import com.snuffles.lotledger.web.dto.DailyPnlSnapshotDto;
import com.snuffles.lotledger.web.dto.PositionDto;
import com.snuffles.lotledger.web.dto.PositionLotDto;
import com.snuffles.lotledger.web.dto.SaleAllocationDto;
import com.snuffles.lotledger.web.dto.TransactionRequest;
import com.snuffles.lotledger.web.dto.TransactionResultDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class LedgerFlowIntegrationTest {

    @Autowired
    private TransactionIngestionService ingestionService;

    @Autowired
    private PositionService positionService;

    @Autowired
    private LedgerQueryService queryService;

    @Autowired
    private ValuationService valuationService;

    @Autowired
    private ClosingPriceService closingPriceService;

    @Autowired
    private LedgerConsistencyService consistencyService;

    @Autowired
    private LedgerTransactionRepository transactionRepository;

    @Autowired
    private PositionLotRepository lotRepository;

    @Autowired
    private SaleAllocationRepository allocationRepository;

    @Autowired
    private DailyPnlSnapshotRepository snapshotRepository;

    private String accountId;

    @BeforeEach
    void setUp() {
        accountId = "it-" + UUID.randomUUID();
    }

    @Test
    void fifoSaleRealizesPnlAcrossTwoLots() {
        record(buy("b1", "10", "100", "2023-01-01"));
        record(buy("b2", "10", "110", "2023-01-02"));

        TransactionResultDto sale = record(sell("s1", "15", "120", "2023-01-03"));

        assertThat(sale.getStatus()).isEqualTo(TransactionResultDto.Status.APPLIED);
        assertThat(sale.getAllocations()).extracting(SaleAllocationDto::getQuantitySold)
            .usingElementComparator(BigDecimal::compareTo)
            .containsExactly(new BigDecimal("10"), new BigDecimal("5"));
        assertThat(sale.getAllocations().stream().map(SaleAllocationDto::getRealizedPnl).reduce(BigDecimal.ZERO, BigDecimal::add))
            .isEqualByComparingTo("250");
        assertThat(sale.getPosition().getQuantity()).isEqualByComparingTo("5");
        assertThat(sale.getPosition().getAvgCost()).isEqualByComparingTo("110");

        assertPositionMatchesOpenLots("ABC");
        assertThat(consistencyService.check(accountId).isConsistent()).isTrue();
    }

    @Test
    void fifoOrderDoesNotDependOnSubmissionOrder() {
        record(buy("b2", "10", "110", "2023-01-02"));
        record(buy("b1", "10", "100", "2023-01-01"));

        TransactionResultDto sale = record(sell("s1", "15", "120", "2023-01-03"));

        List<PositionLotDto> lots = queryService.getLots(accountId, "ABC", false);
        PositionLotDto firstLot = lots.get(0);
        PositionLotDto secondLot = lots.get(1);
        assertThat(firstLot.getPurchaseDate()).isEqualTo(LocalDate.of(2023, 1, 1));
        assertThat(firstLot.isClosed()).isTrue();
        assertThat(secondLot.getRemainingQuantity()).isEqualByComparingTo("5");
        assertThat(sale.getAllocations()).extracting(SaleAllocationDto::getLotId)
            .containsExactly(firstLot.getId(), secondLot.getId());
        assertThat(sale.getAllocations().stream().map(SaleAllocationDto::getRealizedPnl).reduce(BigDecimal.ZERO, BigDecimal::add))
            .isEqualByComparingTo("250");
    }

    @Test
    void replayingExternalIdIsNoOp() {
        TransactionResultDto first = record(buy("b1", "10", "100", "2023-01-01"));
        record(buy("b2", "10", "110", "2023-01-02"));
        TransactionResultDto sale = record(sell("s1", "15", "120", "2023-01-03"));

        TransactionResultDto buyReplay = record(buy("b1", "10", "100", "2023-01-01"));
        TransactionResultDto saleReplay = record(sell("s1", "15.0000", "120", "2023-01-03"));

        assertThat(buyReplay.getStatus()).isEqualTo(TransactionResultDto.Status.ALREADY_APPLIED);
        assertThat(buyReplay.getTransaction().getId()).isEqualTo(first.getTransaction().getId());
        assertThat(buyReplay.getLotsTouched()).hasSize(1);
        assertThat(saleReplay.getStatus()).isEqualTo(TransactionResultDto.Status.ALREADY_APPLIED);
        assertThat(saleReplay.getAllocations()).hasSize(2);
        assertThat(saleReplay.getTransaction().getId()).isEqualTo(sale.getTransaction().getId());

        assertThat(queryService.getTransactions(accountId, null, null, null)).hasSize(3);
        assertThat(queryService.getLots(accountId, "ABC", false)).hasSize(2);
        assertThat(queryService.getAllocations(accountId, sale.getTransaction().getId())).hasSize(2);
        assertPositionMatchesOpenLots("ABC");
    }

    @Test
    void conflictingReplayIsRejected() {
        record(buy("b1", "10", "100", "2023-01-01"));

        assertThatThrownBy(() -> record(buy("b1", "10", "101", "2023-01-01")))
            .isInstanceOf(DuplicateTransactionException.class);
        assertThat(queryService.getTransactions(accountId, "ABC", null, null)).hasSize(1);
    }

    @Test
    void oversizedSaleLeavesLedgerUntouched() {
        record(buy("b1", "10", "100", "2023-01-01"));
        record(buy("b2", "10", "110", "2023-01-02"));
        List<PositionLotDto> before = queryService.getLots(accountId, "ABC", false);
        PositionDto positionBefore = positionService.getPosition(accountId, "ABC");

        assertThatThrownBy(() -> record(sell("s1", "25", "120", "2023-01-03")))
            .isInstanceOf(InsufficientLotsException.class);

        assertThat(queryService.getLots(accountId, "ABC", false)).isEqualTo(before);
        assertThat(positionService.getPosition(accountId, "ABC").getQuantity()).isEqualByComparingTo(positionBefore.getQuantity());
        assertThat(queryService.getTransactions(accountId, null, null, null)).hasSize(2);
        assertThat(transactionRepository.findByAccountIdAndExternalId(accountId, "s1")).isEmpty();
    }

    @Test
    void positionTracksOpenLotsAfterEveryStep() {
        record(buy("b1", "5", "10", "2023-01-01"));
        assertPositionMatchesOpenLots("ABC");
        record(buy("b2", "7.5", "12", "2023-01-05"));
        assertPositionMatchesOpenLots("ABC");
        record(sell("s1", "6", "15", "2023-01-06", "1.20"));
        assertPositionMatchesOpenLots("ABC");
        record(buy("b3", "1", "11", "2023-01-03"));
        assertPositionMatchesOpenLots("ABC");
        record(sell("s2", "7.5", "9", "2023-01-09", "0.75"));
        assertPositionMatchesOpenLots("ABC");

        PositionDto position = positionService.getPosition(accountId, "abc");
        assertThat(position.getQuantity()).isEqualByComparingTo("0");
        assertThat(position.isActive()).isFalse();
        assertThat(position.getFirstBuyDate()).isEqualTo(LocalDate.of(2023, 1, 1));
        assertThat(position.getLastTransactionDate()).isEqualTo(LocalDate.of(2023, 1, 9));
        assertThat(positionService.getPositions(accountId, true)).isEmpty();
        assertThat(positionService.getPositions(accountId, false)).hasSize(1);

        PositionDto rebuilt = positionService.rebuild(accountId, "ABC");
        assertThat(rebuilt.getQuantity()).isEqualByComparingTo(position.getQuantity());
        assertThat(rebuilt.getTotalCost()).isEqualByComparingTo(position.getTotalCost());
        assertThat(consistencyService.check(accountId).isConsistent()).isTrue();
    }

    @Test
    void snapshotRerunKeepsOneRowWithLatestValues() {
        record(buy("b1", "10", "100", "2023-01-01"));
        record(buy("b2", "10", "110", "2023-01-02"));
        record(sell("s1", "15", "120", "2023-01-03"));
        LocalDate valuationDate = LocalDate.of(2023, 1, 31);

        valuationService.snapshot(accountId, "ABC", valuationDate, new BigDecimal("125"), null);
        DailyPnlSnapshotDto latest = valuationService.snapshot(accountId, "ABC", valuationDate, new BigDecimal("130"), null);

        List<DailyPnlSnapshotDto> stored = valuationService.getSnapshots(accountId, "ABC", null, null);
        assertThat(stored).hasSize(1);
        assertThat(stored.get(0).getId()).isEqualTo(latest.getId());
        assertThat(stored.get(0).getMarketPrice()).isEqualByComparingTo("130");
        assertThat(latest.getMarketValue()).isEqualByComparingTo("650");
        assertThat(latest.getUnrealizedPnl()).isEqualByComparingTo("100");
        assertThat(latest.getRealizedPnl()).isEqualByComparingTo("250");
        assertThat(latest.isStalePrice()).isFalse();
        assertThat(snapshotRepository.findByAccountIdAndSymbolAndValuationDate(accountId, "ABC", valuationDate)).isPresent();
    }

    @Test
    void realizedPnlOnlyCountsSalesUpToValuationDate() {
        record(buy("b1", "10", "100", "2023-01-01"));
        record(sell("s1", "5", "120", "2023-02-01"));

        DailyPnlSnapshotDto beforeSale = valuationService.snapshot(accountId, "ABC", LocalDate.of(2023, 1, 15), new BigDecimal("105"), null);
        DailyPnlSnapshotDto afterSale = valuationService.snapshot(accountId, "ABC", LocalDate.of(2023, 2, 15), new BigDecimal("105"), null);

        assertThat(beforeSale.getRealizedPnl()).isEqualByComparingTo("0");
        assertThat(afterSale.getRealizedPnl()).isEqualByComparingTo("100");
        assertThat(afterSale.getRealizedPnlPct()).isEqualByComparingTo("20");
    }

    @Test
    void flatPositionSnapshotHasZeroPercentages() {
        record(buy("b1", "10", "100", "2023-01-01"));
        record(sell("s1", "10", "90", "2023-01-02"));

        DailyPnlSnapshotDto snapshot = valuationService.snapshot(accountId, "ABC", LocalDate.of(2023, 1, 3), new BigDecimal("95"), null);

        assertThat(snapshot.getQuantity()).isEqualByComparingTo("0");
        assertThat(snapshot.getTotalCost()).isEqualByComparingTo("0");
        assertThat(snapshot.getMarketValue()).isEqualByComparingTo("0");
        assertThat(snapshot.getUnrealizedPnlPct()).isEqualByComparingTo("0");
        assertThat(snapshot.getRealizedPnl()).isEqualByComparingTo("-100");
    }

    @Test
    void snapshotWithoutPositionIsNotFound() {
        assertThatThrownBy(() -> valuationService.snapshot(accountId, "NONE", LocalDate.of(2023, 1, 3), BigDecimal.TEN, null))
            .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void feedSnapshotFallsBackToEarlierClose() {
        String symbol = "F" + accountId.substring(3, 9).toUpperCase();
        record(TransactionRequest.builder()
            .externalId("b1").symbol(symbol).side("BUY").quantity(new BigDecimal("4")).price(new BigDecimal("50"))
            .transactionDate("2023-03-01").build());
        closingPriceService.recordClose(symbol, LocalDate.of(2023, 3, 30), new ClosingPriceRequest(new BigDecimal("55"), "manual"));

        List<DailyPnlSnapshotDto> snapshots = valuationService.snapshotAccount(accountId, LocalDate.of(2023, 3, 31));

        assertThat(snapshots).hasSize(1);
        assertThat(snapshots.get(0).getPriceDate()).isEqualTo(LocalDate.of(2023, 3, 30));
        assertThat(snapshots.get(0).isStalePrice()).isTrue();
        assertThat(snapshots.get(0).getMarketValue()).isEqualByComparingTo("220");
    }

    @Test
    void pastSnapshotValuesHoldingsOfThatDay() {
        record(buy("b1", "10", "100", "2023-01-01"));
        record(buy("b2", "10", "110", "2023-03-01"));
        record(sell("s1", "15", "120", "2023-03-15"));

        DailyPnlSnapshotDto february = valuationService.snapshot(accountId, "ABC", LocalDate.of(2023, 2, 1), new BigDecimal("105"), null);
        DailyPnlSnapshotDto beforeSale = valuationService.snapshot(accountId, "ABC", LocalDate.of(2023, 3, 10), new BigDecimal("115"), null);
        DailyPnlSnapshotDto afterSale = valuationService.snapshot(accountId, "ABC", LocalDate.of(2023, 3, 20), new BigDecimal("115"), null);

        assertThat(february.getQuantity()).isEqualByComparingTo("10");
        assertThat(february.getTotalCost()).isEqualByComparingTo("1000");
        assertThat(february.getUnrealizedPnl()).isEqualByComparingTo("50");
        assertThat(february.getRealizedPnl()).isEqualByComparingTo("0");

        assertThat(beforeSale.getQuantity()).isEqualByComparingTo("20");
        assertThat(beforeSale.getTotalCost()).isEqualByComparingTo("2100");
        assertThat(beforeSale.getRealizedPnl()).isEqualByComparingTo("0");

        assertThat(afterSale.getQuantity()).isEqualByComparingTo("5");
        assertThat(afterSale.getTotalCost()).isEqualByComparingTo("550");
        assertThat(afterSale.getRealizedPnl()).isEqualByComparingTo("250");
    }

    @Test
    void backfillValuesEachTradingDayWithItsHoldings() {
        String symbol = "H" + accountId.substring(3, 9).toUpperCase();
        record(TransactionRequest.builder()
            .externalId("b1").symbol(symbol).side("BUY").quantity(new BigDecimal("10")).price(new BigDecimal("100"))
            .transactionDate("2023-03-02").build());
        record(TransactionRequest.builder()
            .externalId("b2").symbol(symbol).side("BUY").quantity(new BigDecimal("10")).price(new BigDecimal("110"))
            .transactionDate("2023-03-03").build());
        closingPriceService.recordClose(symbol, LocalDate.of(2023, 3, 1), new ClosingPriceRequest(new BigDecimal("99"), "manual"));
        closingPriceService.recordClose(symbol, LocalDate.of(2023, 3, 2), new ClosingPriceRequest(new BigDecimal("101"), "manual"));
        closingPriceService.recordClose(symbol, LocalDate.of(2023, 3, 3), new ClosingPriceRequest(new BigDecimal("112"), "manual"));

        List<DailyPnlSnapshotDto> snapshots = valuationService.snapshotRange(accountId, LocalDate.of(2023, 3, 1), LocalDate.of(2023, 3, 5), true);

        assertThat(snapshots).extracting(DailyPnlSnapshotDto::getValuationDate)
            .containsExactly(LocalDate.of(2023, 3, 2), LocalDate.of(2023, 3, 3));
        assertThat(snapshots.get(0).getQuantity()).isEqualByComparingTo("10");
        assertThat(snapshots.get(0).getMarketValue()).isEqualByComparingTo("1010");
        assertThat(snapshots.get(1).getQuantity()).isEqualByComparingTo("20");
        assertThat(snapshots.get(1).getMarketValue()).isEqualByComparingTo("2240");
        assertThat(valuationService.getSnapshots(accountId, symbol, null, null)).hasSize(2);
    }

    @Test
    void concurrentSalesNeverOversell() throws Exception {
        record(buy("b1", "10", "100", "2023-01-01"));

        ExecutorService executor = Executors.newFixedThreadPool(4);
        List<Future<Boolean>> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                String externalId = "s" + i;
                outcomes.add(executor.submit(() -> {
                    try {
                        record(sell(externalId, "4", "120", "2023-01-02"));
                        return true;
                    } catch (InsufficientLotsException ex) {
                        return false;
                    }
                }));
            }
            int applied = 0;
            for (Future<Boolean> outcome : outcomes) {
                if (outcome.get(30, TimeUnit.SECONDS)) {
                    applied++;
                }
            }
            assertThat(applied).isEqualTo(2);
        } finally {
            executor.shutdownNow();
        }

        assertThat(positionService.getPosition(accountId, "ABC").getQuantity()).isEqualByComparingTo("2");
        assertPositionMatchesOpenLots("ABC");
        ConsistencyReportDto report = consistencyService.check(accountId);
        assertThat(report.isConsistent()).isTrue();
        assertThat(report.getStatistics().get("ABC").getSellTransactions()).isEqualTo(2);
    }

    private void assertPositionMatchesOpenLots(String symbol) {
        BigDecimal open = lotRepository.findByAccountIdAndSymbolOrderByPurchaseDateAscIdAsc(accountId, symbol).stream()
            .filter(PositionLot::isOpen)
            .map(PositionLot::getRemainingQuantity)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(positionService.getPosition(accountId, symbol).getQuantity()).isEqualByComparingTo(open);
        lotRepository.findByAccountIdAndSymbolOrderByPurchaseDateAscIdAsc(accountId, symbol).forEach(lot -> {
            assertThat(lot.getRemainingQuantity()).isBetween(BigDecimal.ZERO, lot.getOriginalQuantity());
            assertThat(lot.isClosed()).isEqualTo(lot.getRemainingQuantity().signum() == 0);
        });
        transactionRepository.findByAccountIdAndSymbolAndTransactionTypeOrderByIdAsc(
            accountId, symbol, LedgerTransaction.TransactionType.SELL).forEach(sale ->
            assertThat(allocationRepository.findBySaleTransactionIdOrderByIdAsc(sale.getId()).stream()
                .map(SaleAllocation::getQuantitySold)
                .reduce(BigDecimal.ZERO, BigDecimal::add))
                .isEqualByComparingTo(sale.getQuantity()));
    }

    private TransactionResultDto record(TransactionRequest request) {
        return ingestionService.recordTransaction(accountId, request);
    }

    private TransactionRequest buy(String externalId, String quantity, String price, String date) {
        return TransactionRequest.builder()
            .externalId(externalId)
            .symbol("ABC")
            .side("BUY")
            .quantity(new BigDecimal(quantity))
            .price(new BigDecimal(price))
            .transactionDate(date)
            .build();
    }

    private TransactionRequest sell(String externalId, String quantity, String price, String date) {
        return sell(externalId, quantity, price, date, "0");
    }

    private TransactionRequest sell(String externalId, String quantity, String price, String date, String commission) {
        return TransactionRequest.builder()
            .externalId(externalId)
            .symbol("ABC")
            .side("SELL")
            .quantity(new BigDecimal(quantity))
            .price(new BigDecimal(price))
            .commission(new BigDecimal(commission))
            .transactionDate(date)
            .build();
    }
}
